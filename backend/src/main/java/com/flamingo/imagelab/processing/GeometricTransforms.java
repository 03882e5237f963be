package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.InvalidParameterException;

/** Transforms that move, resample or cut pixels. Uncovered areas are filled with black. */
final class GeometricTransforms {

  private static final double SNAP_EPSILON = 1e-10;

  private GeometricTransforms() {}

  static PixelBuffer translate(PixelBuffer in, int dx, int dy) {
    int w = in.width();
    int h = in.height();
    int c = in.channels();
    byte[] out = new byte[in.sampleCount()];
    int xFrom = Math.max(0, dx);
    int xTo = Math.min(w, w + dx);
    int yFrom = Math.max(0, dy);
    int yTo = Math.min(h, h + dy);
    if (xFrom < xTo && yFrom < yTo) {
      byte[] src = in.toByteArray();
      int rowLength = (xTo - xFrom) * c;
      for (int y = yFrom; y < yTo; y++) {
        int srcOffset = ((y - dy) * w + (xFrom - dx)) * c;
        int dstOffset = (y * w + xFrom) * c;
        System.arraycopy(src, srcOffset, out, dstOffset, rowLength);
      }
    }
    return PixelBuffer.wrap(w, h, c, out);
  }

  /**
   * Rotates counter-clockwise by {@code degrees} about the center. The output canvas is the
   * bounding box of the rotated input; each output pixel takes the nearest input sample.
   */
  static PixelBuffer rotate(PixelBuffer in, double degrees) {
    double radians = Math.toRadians(degrees);
    double cos = snap(Math.cos(radians));
    double sin = snap(Math.sin(radians));
    int w = in.width();
    int h = in.height();
    int c = in.channels();

    int outW = Math.max(1, (int) Math.ceil(Math.abs(w * cos) + Math.abs(h * sin) - 1e-9));
    int outH = Math.max(1, (int) Math.ceil(Math.abs(w * sin) + Math.abs(h * cos) - 1e-9));

    checkOutputSize("angle", outW, outH);

    double cxIn = w / 2.0;
    double cyIn = h / 2.0;
    double cxOut = outW / 2.0;
    double cyOut = outH / 2.0;

    byte[] out = new byte[outW * outH * c];
    for (int oy = 0; oy < outH; oy++) {
      double dy = oy + 0.5 - cyOut;
      for (int ox = 0; ox < outW; ox++) {
        double dx = ox + 0.5 - cxOut;
        int sx = (int) Math.floor(dx * cos - dy * sin + cxIn);
        int sy = (int) Math.floor(dx * sin + dy * cos + cyIn);
        if (sx < 0 || sy < 0 || sx >= w || sy >= h) {
          continue;
        }
        int dst = (oy * outW + ox) * c;
        int src = (sy * w + sx) * c;
        for (int ch = 0; ch < c; ch++) {
          out[dst + ch] = (byte) in.sampleAt(src + ch);
        }
      }
    }
    return PixelBuffer.wrap(outW, outH, c, out);
  }

  /**
   * Extracts columns {@code [xStart, xEnd)} and rows {@code [yStart, yEnd)}.
   *
   * @throws InvalidParameterException if the region is inverted or leaves the image
   */
  static PixelBuffer crop(PixelBuffer in, int xStart, int xEnd, int yStart, int yEnd) {
    checkRegion(in, xStart, xEnd, yStart, yEnd);
    int c = in.channels();
    int outW = xEnd - xStart;
    int outH = yEnd - yStart;
    byte[] src = in.toByteArray();
    byte[] out = new byte[outW * outH * c];
    for (int y = 0; y < outH; y++) {
      System.arraycopy(
          src, ((yStart + y) * in.width() + xStart) * c, out, y * outW * c, outW * c);
    }
    return PixelBuffer.wrap(outW, outH, c, out);
  }

  /** Averages each {@code factor x factor} block; trailing rows and columns are dropped. */
  static PixelBuffer reduceResolution(PixelBuffer in, int factor) {
    int outW = in.width() / factor;
    int outH = in.height() / factor;
    if (outW == 0 || outH == 0) {
      throw new InvalidParameterException(
          "factor",
          "factor "
              + factor
              + " is too large for a "
              + in.width()
              + "x"
              + in.height()
              + " image");
    }
    int c = in.channels();
    int w = in.width();
    double area = (double) factor * factor;
    byte[] out = new byte[outW * outH * c];
    for (int oy = 0; oy < outH; oy++) {
      for (int ox = 0; ox < outW; ox++) {
        for (int ch = 0; ch < c; ch++) {
          long sum = 0;
          for (int y = oy * factor; y < (oy + 1) * factor; y++) {
            int row = y * w;
            for (int x = ox * factor; x < (ox + 1) * factor; x++) {
              sum += in.sampleAt((row + x) * c + ch);
            }
          }
          out[(oy * outW + ox) * c + ch] = (byte) Samples.toSample(sum / area);
        }
      }
    }
    return PixelBuffer.wrap(outW, outH, c, out);
  }

  /** Crops the region and repeats every pixel {@code factor} times in each direction. */
  static PixelBuffer enlargeRegion(
      PixelBuffer in, int xStart, int xEnd, int yStart, int yEnd, int factor) {
    PixelBuffer region = crop(in, xStart, xEnd, yStart, yEnd);
    if (factor == 1) {
      return region;
    }
    int c = region.channels();
    int outW = region.width() * factor;
    int outH = region.height() * factor;
    checkOutputSize("factor", outW, outH);
    byte[] out = new byte[outW * outH * c];
    for (int oy = 0; oy < outH; oy++) {
      int sy = oy / factor;
      for (int ox = 0; ox < outW; ox++) {
        int src = (sy * region.width() + ox / factor) * c;
        int dst = (oy * outW + ox) * c;
        for (int ch = 0; ch < c; ch++) {
          out[dst + ch] = (byte) region.sampleAt(src + ch);
        }
      }
    }
    return PixelBuffer.wrap(outW, outH, c, out);
  }

  /** Bilinear resample to an exact size, sampling at pixel centers. */
  static PixelBuffer resize(PixelBuffer in, int outW, int outH) {
    if (in.width() == outW && in.height() == outH) {
      return in;
    }
    int w = in.width();
    int h = in.height();
    int c = in.channels();
    double scaleX = (double) w / outW;
    double scaleY = (double) h / outH;
    byte[] out = new byte[outW * outH * c];
    for (int oy = 0; oy < outH; oy++) {
      double sy = clamp((oy + 0.5) * scaleY - 0.5, h - 1);
      int y0 = (int) Math.floor(sy);
      int y1 = Math.min(y0 + 1, h - 1);
      double fy = sy - y0;
      for (int ox = 0; ox < outW; ox++) {
        double sx = clamp((ox + 0.5) * scaleX - 0.5, w - 1);
        int x0 = (int) Math.floor(sx);
        int x1 = Math.min(x0 + 1, w - 1);
        double fx = sx - x0;
        for (int ch = 0; ch < c; ch++) {
          double top =
              in.sampleAt((y0 * w + x0) * c + ch) * (1 - fx)
                  + in.sampleAt((y0 * w + x1) * c + ch) * fx;
          double bottom =
              in.sampleAt((y1 * w + x0) * c + ch) * (1 - fx)
                  + in.sampleAt((y1 * w + x1) * c + ch) * fx;
          out[(oy * outW + ox) * c + ch] = (byte) Samples.toSample(top * (1 - fy) + bottom * fy);
        }
      }
    }
    return PixelBuffer.wrap(outW, outH, c, out);
  }

  private static void checkRegion(PixelBuffer in, int xStart, int xEnd, int yStart, int yEnd) {
    if (xStart < 0 || xStart >= xEnd) {
      throw new InvalidParameterException("x_start", "x_start must be >= 0 and less than x_end");
    }
    if (yStart < 0 || yStart >= yEnd) {
      throw new InvalidParameterException("y_start", "y_start must be >= 0 and less than y_end");
    }
    if (xEnd > in.width()) {
      throw new InvalidParameterException(
          "x_end", "x_end " + xEnd + " exceeds image width " + in.width());
    }
    if (yEnd > in.height()) {
      throw new InvalidParameterException(
          "y_end", "y_end " + yEnd + " exceeds image height " + in.height());
    }
  }

  private static void checkOutputSize(String parameter, int outW, int outH) {
    if (!PixelBuffer.withinPixelLimit(outW, outH)) {
      throw new InvalidParameterException(
          parameter,
          "result of "
              + outW
              + "x"
              + outH
              + " pixels exceeds the limit of "
              + PixelBuffer.MAX_PIXELS
              + " pixels");
    }
  }

  private static double clamp(double value, int max) {
    return Math.max(0, Math.min(max, value));
  }

  private static double snap(double value) {
    double nearest = Math.rint(value);
    return Math.abs(value - nearest) < SNAP_EPSILON ? nearest : value;
  }
}
