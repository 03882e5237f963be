package com.flamingo.imagelab.processing;

/** Sample arithmetic shared by the transforms. */
final class Samples {

  private Samples() {}

  /** Rounds half-up and clamps to [0, 255]. */
  static int toSample(double value) {
    if (!(value > 0)) {
      return 0;
    }
    long rounded = (long) Math.floor(value + 0.5);
    return rounded > 255 ? 255 : (int) rounded;
  }

  static double luma(int r, int g, int b) {
    return 0.299 * r + 0.587 * g + 0.114 * b;
  }
}
