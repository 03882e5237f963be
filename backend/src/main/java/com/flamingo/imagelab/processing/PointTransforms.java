package com.flamingo.imagelab.processing;

/**
 * Transforms where each output pixel depends only on the input pixel at the same position.
 *
 * <p>Per-sample curves are evaluated once into a 256-entry lookup table and then mapped over
 * the buffer.
 */
final class PointTransforms {

  private PointTransforms() {}

  static PixelBuffer brightness(PixelBuffer in, double factor) {
    int[] lut = new int[256];
    for (int v = 0; v < 256; v++) {
      lut[v] = Samples.toSample(v * factor);
    }
    return applyLut(in, lut);
  }

  /** {@code out = 255 * log(1 + k*in/255) / log(1 + k)}. */
  static PixelBuffer logContrast(PixelBuffer in, double k) {
    double norm = Math.log1p(k);
    int[] lut = new int[256];
    for (int v = 0; v < 256; v++) {
      lut[v] = Samples.toSample(255.0 * Math.log1p(k * v / 255.0) / norm);
    }
    return applyLut(in, lut);
  }

  /** {@code out = 255 * ((1 + k)^(in/255) - 1) / k}. */
  static PixelBuffer expContrast(PixelBuffer in, double k) {
    int[] lut = new int[256];
    for (int v = 0; v < 256; v++) {
      lut[v] = Samples.toSample(255.0 * (Math.pow(1 + k, v / 255.0) - 1) / k);
    }
    return applyLut(in, lut);
  }

  static PixelBuffer invert(PixelBuffer in) {
    int[] lut = new int[256];
    for (int v = 0; v < 256; v++) {
      lut[v] = 255 - v;
    }
    return applyLut(in, lut);
  }

  /** Collapses to one channel. A buffer that is already gray is returned unchanged. */
  static PixelBuffer grayscale(PixelBuffer in, GrayscaleMethod method) {
    if (in.isGrayscale()) {
      return in;
    }
    byte[] out = new byte[in.pixelCount()];
    for (int p = 0, i = 0; p < out.length; p++, i += 3) {
      int r = in.sampleAt(i);
      int g = in.sampleAt(i + 1);
      int b = in.sampleAt(i + 2);
      int gray =
          switch (method) {
            case AVERAGE -> Samples.toSample((r + g + b) / 3.0);
            case LUMINOSITY -> Samples.toSample(Samples.luma(r, g, b));
            case MIDGRAY -> (Math.max(r, Math.max(g, b)) + Math.min(r, Math.min(g, b)) + 1) / 2;
          };
      out[p] = (byte) gray;
    }
    return PixelBuffer.wrap(in.width(), in.height(), PixelBuffer.GRAY, out);
  }

  /** White where {@code luma / 255 > threshold}, black elsewhere; one channel. */
  static PixelBuffer binarize(PixelBuffer in, double threshold) {
    byte[] out = new byte[in.pixelCount()];
    int channels = in.channels();
    for (int p = 0; p < out.length; p++) {
      int i = p * channels;
      double luma =
          in.isGrayscale()
              ? in.sampleAt(i)
              : Samples.luma(in.sampleAt(i), in.sampleAt(i + 1), in.sampleAt(i + 2));
      out[p] = (byte) (luma / 255.0 > threshold ? 255 : 0);
    }
    return PixelBuffer.wrap(in.width(), in.height(), PixelBuffer.GRAY, out);
  }

  /**
   * Switches a channel on or off. Switching on leaves the image as it is; switching off forces
   * the channel's RGB sample to its disabled value, promoting gray input to RGB first.
   */
  static PixelBuffer channel(PixelBuffer in, ColorChannel channel, boolean enabled) {
    if (enabled) {
      return in;
    }
    PixelBuffer rgb = in.toRgb();
    byte[] out = rgb.toByteArray();
    byte value = (byte) channel.disabledValue();
    for (int i = channel.sampleIndex(); i < out.length; i += 3) {
      out[i] = value;
    }
    return PixelBuffer.wrap(rgb.width(), rgb.height(), PixelBuffer.RGB, out);
  }

  private static PixelBuffer applyLut(PixelBuffer in, int[] lut) {
    byte[] out = new byte[in.sampleCount()];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) lut[in.sampleAt(i)];
    }
    return PixelBuffer.wrap(in.width(), in.height(), in.channels(), out);
  }
}
