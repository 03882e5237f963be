package com.flamingo.imagelab.processing;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.imagelab.exception.UnknownOperationException;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** The closed set of operation kinds, keyed by the name clients use on the wire. */
public enum OperationType {
  BRIGHTNESS("brightness"),
  LOG_CONTRAST("log_contrast"),
  EXP_CONTRAST("exp_contrast"),
  INVERT("invert"),
  GRAYSCALE_AVERAGE("grayscale_average"),
  GRAYSCALE_LUMINOSITY("grayscale_luminosity"),
  GRAYSCALE_MIDGRAY("grayscale_midgray"),
  BINARIZE("binarize"),
  CHANNEL_RED("channel_red"),
  CHANNEL_GREEN("channel_green"),
  CHANNEL_BLUE("channel_blue"),
  CHANNEL_CYAN("channel_cyan"),
  CHANNEL_MAGENTA("channel_magenta"),
  CHANNEL_YELLOW("channel_yellow"),
  TRANSLATE("translate"),
  ROTATE("rotate"),
  CROP("crop"),
  REDUCE_RESOLUTION("reduce_resolution"),
  ENLARGE_REGION("enlarge_region"),
  MERGE_IMAGES("merge_images");

  private static final Map<String, OperationType> BY_WIRE_NAME =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(OperationType::wireName, Function.identity()));

  private final String wireName;

  OperationType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Looks up an operation kind by its wire name.
   *
   * @throws UnknownOperationException if no kind has that name
   */
  public static OperationType fromWireName(String name) {
    OperationType type = name == null ? null : BY_WIRE_NAME.get(name);
    if (type == null) {
      throw new UnknownOperationException(name);
    }
    return type;
  }
}
