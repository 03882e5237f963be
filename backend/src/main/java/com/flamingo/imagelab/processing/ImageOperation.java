package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.InvalidParameterException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One transformation and its parameters. The set of variants is closed; {@link Visitor} has one
 * method per variant, so adding a kind without handling it everywhere does not compile.
 *
 * <p>Ranges that do not depend on the image (factor &gt; 0, threshold in [0, 1], ...) are checked
 * when the value is constructed. Ranges that do depend on it (crop bounds) are checked when the
 * operation is applied.
 */
public sealed interface ImageOperation
    permits ImageOperation.Brightness,
        ImageOperation.LogContrast,
        ImageOperation.ExpContrast,
        ImageOperation.Invert,
        ImageOperation.Grayscale,
        ImageOperation.Binarize,
        ImageOperation.ChannelToggle,
        ImageOperation.Translate,
        ImageOperation.Rotate,
        ImageOperation.Crop,
        ImageOperation.ReduceResolution,
        ImageOperation.EnlargeRegion,
        ImageOperation.MergeImages {

  double MAX_BRIGHTNESS_FACTOR = 10.0;
  double MAX_CONTRAST_INTENSITY = 100.0;
  int MIN_REDUCTION_FACTOR = 2;
  int MAX_SCALE_FACTOR = 10;

  OperationType type();

  /** Parameters keyed by their wire names, in a stable order. */
  Map<String, Object> parameters();

  <R> R accept(Visitor<R> visitor);

  /** Double dispatch over the operation variants. */
  interface Visitor<R> {
    R visitBrightness(Brightness op);

    R visitLogContrast(LogContrast op);

    R visitExpContrast(ExpContrast op);

    R visitInvert(Invert op);

    R visitGrayscale(Grayscale op);

    R visitBinarize(Binarize op);

    R visitChannelToggle(ChannelToggle op);

    R visitTranslate(Translate op);

    R visitRotate(Rotate op);

    R visitCrop(Crop op);

    R visitReduceResolution(ReduceResolution op);

    R visitEnlargeRegion(EnlargeRegion op);

    R visitMergeImages(MergeImages op);
  }

  /** Multiplies every sample by {@code factor}. */
  record Brightness(double factor) implements ImageOperation {
    public Brightness {
      requireFinite("factor", factor);
      if (factor <= 0 || factor > MAX_BRIGHTNESS_FACTOR) {
        throw new InvalidParameterException(
            "factor", "factor must be greater than 0 and at most " + MAX_BRIGHTNESS_FACTOR);
      }
    }

    @Override
    public OperationType type() {
      return OperationType.BRIGHTNESS;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("factor", factor);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBrightness(this);
    }
  }

  /** Logarithmic contrast curve; compresses highlights. */
  record LogContrast(double k) implements ImageOperation {
    public LogContrast {
      requireIntensity(k);
    }

    @Override
    public OperationType type() {
      return OperationType.LOG_CONTRAST;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("k", k);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLogContrast(this);
    }
  }

  /** Exponential contrast curve; expands highlights. */
  record ExpContrast(double k) implements ImageOperation {
    public ExpContrast {
      requireIntensity(k);
    }

    @Override
    public OperationType type() {
      return OperationType.EXP_CONTRAST;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("k", k);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitExpContrast(this);
    }
  }

  /** Photographic negative. */
  record Invert() implements ImageOperation {
    @Override
    public OperationType type() {
      return OperationType.INVERT;
    }

    @Override
    public Map<String, Object> parameters() {
      return new LinkedHashMap<>();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInvert(this);
    }
  }

  record Grayscale(GrayscaleMethod method) implements ImageOperation {
    public Grayscale {
      Objects.requireNonNull(method, "method");
    }

    @Override
    public OperationType type() {
      return method.operationType();
    }

    @Override
    public Map<String, Object> parameters() {
      return new LinkedHashMap<>();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGrayscale(this);
    }
  }

  /** Black or white per pixel, split at {@code threshold} on the normalized luma. */
  record Binarize(double threshold) implements ImageOperation {
    public Binarize {
      requireFinite("threshold", threshold);
      if (threshold < 0 || threshold > 1) {
        throw new InvalidParameterException("threshold", "threshold must be between 0 and 1");
      }
    }

    @Override
    public OperationType type() {
      return OperationType.BINARIZE;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("threshold", threshold);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinarize(this);
    }
  }

  record ChannelToggle(ColorChannel channel, boolean enabled) implements ImageOperation {
    public ChannelToggle {
      Objects.requireNonNull(channel, "channel");
    }

    @Override
    public OperationType type() {
      return channel.operationType();
    }

    @Override
    public Map<String, Object> parameters() {
      return params("enabled", enabled);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitChannelToggle(this);
    }
  }

  /** Shifts content right by {@code dx} and down by {@code dy}; the canvas keeps its size. */
  record Translate(int dx, int dy) implements ImageOperation {
    @Override
    public OperationType type() {
      return OperationType.TRANSLATE;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("dx", dx, "dy", dy);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTranslate(this);
    }
  }

  /** Counter-clockwise rotation in degrees about the image center. */
  record Rotate(double angle) implements ImageOperation {
    public Rotate {
      requireFinite("angle", angle);
    }

    @Override
    public OperationType type() {
      return OperationType.ROTATE;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("angle", angle);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRotate(this);
    }
  }

  /** Keeps columns {@code [xStart, xEnd)} and rows {@code [yStart, yEnd)}. */
  record Crop(int xStart, int xEnd, int yStart, int yEnd) implements ImageOperation {
    public Crop {
      requireOrderedBounds(xStart, xEnd, yStart, yEnd);
    }

    @Override
    public OperationType type() {
      return OperationType.CROP;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("x_start", xStart, "x_end", xEnd, "y_start", yStart, "y_end", yEnd);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCrop(this);
    }
  }

  record ReduceResolution(int factor) implements ImageOperation {
    public ReduceResolution {
      if (factor < MIN_REDUCTION_FACTOR || factor > MAX_SCALE_FACTOR) {
        throw new InvalidParameterException(
            "factor",
            "factor must be between " + MIN_REDUCTION_FACTOR + " and " + MAX_SCALE_FACTOR);
      }
    }

    @Override
    public OperationType type() {
      return OperationType.REDUCE_RESOLUTION;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("factor", factor);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReduceResolution(this);
    }
  }

  /** Crops a region and scales it up by an integer factor. */
  record EnlargeRegion(int xStart, int xEnd, int yStart, int yEnd, int factor)
      implements ImageOperation {
    public EnlargeRegion {
      requireOrderedBounds(xStart, xEnd, yStart, yEnd);
      if (factor < 1 || factor > MAX_SCALE_FACTOR) {
        throw new InvalidParameterException(
            "factor", "factor must be between 1 and " + MAX_SCALE_FACTOR);
      }
    }

    @Override
    public OperationType type() {
      return OperationType.ENLARGE_REGION;
    }

    @Override
    public Map<String, Object> parameters() {
      return params(
          "x_start", xStart, "x_end", xEnd, "y_start", yStart, "y_end", yEnd, "factor", factor);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEnlargeRegion(this);
    }
  }

  /** Blends another stored image over the current one. */
  record MergeImages(UUID otherImageId, double transparency) implements ImageOperation {
    public MergeImages {
      if (otherImageId == null) {
        throw new InvalidParameterException("other_image_id", "other_image_id is required");
      }
      requireFinite("transparency", transparency);
      if (transparency < 0 || transparency > 1) {
        throw new InvalidParameterException(
            "transparency", "transparency must be between 0 and 1");
      }
    }

    @Override
    public OperationType type() {
      return OperationType.MERGE_IMAGES;
    }

    @Override
    public Map<String, Object> parameters() {
      return params("other_image_id", otherImageId.toString(), "transparency", transparency);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitMergeImages(this);
    }
  }

  private static Map<String, Object> params(Object... keysAndValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return map;
  }

  private static void requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new InvalidParameterException(name, name + " must be a finite number");
    }
  }

  private static void requireIntensity(double k) {
    requireFinite("k", k);
    if (k <= 0 || k > MAX_CONTRAST_INTENSITY) {
      throw new InvalidParameterException(
          "k", "k must be greater than 0 and at most " + MAX_CONTRAST_INTENSITY);
    }
  }

  private static void requireOrderedBounds(int xStart, int xEnd, int yStart, int yEnd) {
    if (xStart < 0 || yStart < 0) {
      throw new InvalidParameterException(
          xStart < 0 ? "x_start" : "y_start", "region start must not be negative");
    }
    if (xStart >= xEnd) {
      throw new InvalidParameterException("x_end", "x_end must be greater than x_start");
    }
    if (yStart >= yEnd) {
      throw new InvalidParameterException("y_end", "y_end must be greater than y_start");
    }
  }
}
