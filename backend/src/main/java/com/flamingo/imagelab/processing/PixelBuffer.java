package com.flamingo.imagelab.processing;

import java.util.Arrays;

/**
 * Decoded 8-bit image: {@code width * height} pixels stored row-major with {@code channels}
 * interleaved samples per pixel. A buffer has either one channel (grayscale) or three (RGB).
 *
 * <p>Instances are never modified after construction. Transforms allocate a fresh sample array
 * and wrap it, so a buffer can be shared with any number of readers.
 */
public final class PixelBuffer {

  public static final int GRAY = 1;
  public static final int RGB = 3;

  /** Largest pixel count a buffer may hold. An RGB buffer of this size still fits one array. */
  public static final int MAX_PIXELS = 1 << 26;

  private final int width;
  private final int height;
  private final int channels;
  private final byte[] samples;

  private PixelBuffer(int width, int height, int channels, byte[] samples) {
    this.width = width;
    this.height = height;
    this.channels = channels;
    this.samples = samples;
  }

  /**
   * Creates a buffer from a copy of the given samples.
   *
   * @throws IllegalArgumentException if the dimensions, channel count or sample length disagree
   */
  public static PixelBuffer of(int width, int height, int channels, byte[] samples) {
    checkShape(width, height, channels);
    if (samples.length != width * height * channels) {
      throw new IllegalArgumentException(
          "Expected " + (width * height * channels) + " samples, got " + samples.length);
    }
    return new PixelBuffer(width, height, channels, samples.clone());
  }

  /** Creates a buffer filled with zeros (black). */
  public static PixelBuffer blank(int width, int height, int channels) {
    checkShape(width, height, channels);
    return new PixelBuffer(width, height, channels, new byte[width * height * channels]);
  }

  /** Wraps an array the caller has just filled and will not touch again. */
  static PixelBuffer wrap(int width, int height, int channels, byte[] samples) {
    return new PixelBuffer(width, height, channels, samples);
  }

  /** Returns whether a {@code width x height} image is positive in size and within the limit. */
  public static boolean withinPixelLimit(int width, int height) {
    return width > 0 && height > 0 && Math.multiplyExact((long) width, height) <= MAX_PIXELS;
  }

  private static void checkShape(int width, int height, int channels) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Dimensions must be positive: " + width + "x" + height);
    }
    if (!withinPixelLimit(width, height)) {
      throw new IllegalArgumentException(
          width + "x" + height + " exceeds the limit of " + MAX_PIXELS + " pixels");
    }
    if (channels != GRAY && channels != RGB) {
      throw new IllegalArgumentException("Unsupported channel count: " + channels);
    }
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int channels() {
    return channels;
  }

  public boolean isGrayscale() {
    return channels == GRAY;
  }

  public int pixelCount() {
    return width * height;
  }

  /** Returns the sample at the given position as a value in [0, 255]. */
  public int sample(int x, int y, int channel) {
    return samples[(y * width + x) * channels + channel] & 0xFF;
  }

  /** Returns the sample at a flat index into the interleaved array. */
  int sampleAt(int index) {
    return samples[index] & 0xFF;
  }

  int sampleCount() {
    return samples.length;
  }

  /** Returns a copy of the interleaved samples. */
  public byte[] toByteArray() {
    return samples.clone();
  }

  /** Returns this buffer when it is already RGB, otherwise a copy with the gray value tripled. */
  public PixelBuffer toRgb() {
    if (channels == RGB) {
      return this;
    }
    byte[] out = new byte[samples.length * RGB];
    for (int i = 0; i < samples.length; i++) {
      out[i * 3] = samples[i];
      out[i * 3 + 1] = samples[i];
      out[i * 3 + 2] = samples[i];
    }
    return new PixelBuffer(width, height, RGB, out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelBuffer other)) {
      return false;
    }
    return width == other.width
        && height == other.height
        && channels == other.channels
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    int result = 31 * width + height;
    result = 31 * result + channels;
    return 31 * result + Arrays.hashCode(samples);
  }

  @Override
  public String toString() {
    return "PixelBuffer[" + width + "x" + height + ", channels=" + channels + "]";
  }
}
