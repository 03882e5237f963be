package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.InvalidParameterException;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Turns the loosely typed {@code {operation, params}} pairs of a batch request into typed {@link
 * ImageOperation} values.
 */
@Component
public class OperationParser {

  /**
   * Parses one operation.
   *
   * @param operation wire name, e.g. {@code brightness}
   * @param params parameters as decoded from JSON; may be null for parameterless kinds
   * @throws com.flamingo.imagelab.exception.UnknownOperationException for an unknown name
   * @throws InvalidParameterException for a missing, mistyped or out-of-range parameter
   */
  public ImageOperation parse(String operation, Map<String, Object> params) {
    OperationType type = OperationType.fromWireName(operation);
    Map<String, Object> p = params == null ? Collections.emptyMap() : params;

    return switch (type) {
      case BRIGHTNESS -> new ImageOperation.Brightness(requireDouble(p, "factor"));
      case LOG_CONTRAST -> new ImageOperation.LogContrast(requireDouble(p, "k"));
      case EXP_CONTRAST -> new ImageOperation.ExpContrast(requireDouble(p, "k"));
      case INVERT -> new ImageOperation.Invert();
      case GRAYSCALE_AVERAGE -> new ImageOperation.Grayscale(GrayscaleMethod.AVERAGE);
      case GRAYSCALE_LUMINOSITY -> new ImageOperation.Grayscale(GrayscaleMethod.LUMINOSITY);
      case GRAYSCALE_MIDGRAY -> new ImageOperation.Grayscale(GrayscaleMethod.MIDGRAY);
      case BINARIZE -> new ImageOperation.Binarize(requireDouble(p, "threshold"));
      case CHANNEL_RED -> channel(ColorChannel.RED, p);
      case CHANNEL_GREEN -> channel(ColorChannel.GREEN, p);
      case CHANNEL_BLUE -> channel(ColorChannel.BLUE, p);
      case CHANNEL_CYAN -> channel(ColorChannel.CYAN, p);
      case CHANNEL_MAGENTA -> channel(ColorChannel.MAGENTA, p);
      case CHANNEL_YELLOW -> channel(ColorChannel.YELLOW, p);
      case TRANSLATE -> new ImageOperation.Translate(requireInt(p, "dx"), requireInt(p, "dy"));
      case ROTATE -> new ImageOperation.Rotate(requireDouble(p, "angle"));
      case CROP ->
          new ImageOperation.Crop(
              requireInt(p, "x_start"),
              requireInt(p, "x_end"),
              requireInt(p, "y_start"),
              requireInt(p, "y_end"));
      case REDUCE_RESOLUTION -> new ImageOperation.ReduceResolution(requireInt(p, "factor"));
      case ENLARGE_REGION ->
          new ImageOperation.EnlargeRegion(
              requireInt(p, "x_start"),
              requireInt(p, "x_end"),
              requireInt(p, "y_start"),
              requireInt(p, "y_end"),
              requireInt(p, p.containsKey("zoom_factor") ? "zoom_factor" : "factor"));
      case MERGE_IMAGES ->
          new ImageOperation.MergeImages(
              requireUuid(p, "other_image_id"), requireDouble(p, "transparency"));
    };
  }

  private ImageOperation channel(ColorChannel channel, Map<String, Object> params) {
    return new ImageOperation.ChannelToggle(channel, requireBoolean(params, "enabled"));
  }

  private static Object require(Map<String, Object> params, String name) {
    Object value = params.get(name);
    if (value == null) {
      throw new InvalidParameterException(name, name + " is required");
    }
    return value;
  }

  static double requireDouble(Map<String, Object> params, String name) {
    Object value = require(params, name);
    if (!(value instanceof Number number)) {
      throw new InvalidParameterException(name, name + " must be a number");
    }
    double d = number.doubleValue();
    if (!Double.isFinite(d)) {
      throw new InvalidParameterException(name, name + " must be a finite number");
    }
    return d;
  }

  static int requireInt(Map<String, Object> params, String name) {
    double d = requireDouble(params, name);
    if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
      throw new InvalidParameterException(name, name + " must be an integer");
    }
    return (int) d;
  }

  static boolean requireBoolean(Map<String, Object> params, String name) {
    Object value = require(params, name);
    if (!(value instanceof Boolean bool)) {
      throw new InvalidParameterException(name, name + " must be true or false");
    }
    return bool;
  }

  static UUID requireUuid(Map<String, Object> params, String name) {
    Object value = require(params, name);
    try {
      return UUID.fromString(value.toString());
    } catch (IllegalArgumentException e) {
      throw new InvalidParameterException(name, name + " must be an image id");
    }
  }
}
