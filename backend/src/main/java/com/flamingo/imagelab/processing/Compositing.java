package com.flamingo.imagelab.processing;

/** Blending of two buffers. */
final class Compositing {

  private Compositing() {}

  /**
   * Computes {@code base * (1 - transparency) + overlay * transparency} per sample.
   *
   * <p>The result always has the base's dimensions: an overlay of another size is first
   * resampled to match. If either side is RGB, both are blended as RGB.
   */
  static PixelBuffer merge(PixelBuffer base, PixelBuffer overlay, double transparency) {
    PixelBuffer fitted = GeometricTransforms.resize(overlay, base.width(), base.height());
    PixelBuffer bottom = base;
    if (base.channels() != fitted.channels()) {
      bottom = base.toRgb();
      fitted = fitted.toRgb();
    }
    double keep = 1 - transparency;
    byte[] out = new byte[bottom.sampleCount()];
    for (int i = 0; i < out.length; i++) {
      out[i] =
          (byte) Samples.toSample(bottom.sampleAt(i) * keep + fitted.sampleAt(i) * transparency);
    }
    return PixelBuffer.wrap(bottom.width(), bottom.height(), bottom.channels(), out);
  }
}
