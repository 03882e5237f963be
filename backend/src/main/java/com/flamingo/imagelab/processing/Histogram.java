package com.flamingo.imagelab.processing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-channel intensity counts: one 256-bin series for a gray image, or red, green and blue
 * series for an RGB image.
 */
public final class Histogram {

  public static final int BINS = 256;

  private final Map<String, int[]> series;

  private Histogram(Map<String, int[]> series) {
    this.series = Collections.unmodifiableMap(series);
  }

  /** Counts every sample of the buffer in a single pass. */
  public static Histogram of(PixelBuffer buffer) {
    int channels = buffer.channels();
    int[][] bins = new int[channels][BINS];
    int count = buffer.sampleCount();
    for (int i = 0; i < count; i += channels) {
      for (int ch = 0; ch < channels; ch++) {
        bins[ch][buffer.sampleAt(i + ch)]++;
      }
    }
    Map<String, int[]> series = new LinkedHashMap<>();
    if (buffer.isGrayscale()) {
      series.put("gray", bins[0]);
    } else {
      series.put("red", bins[0]);
      series.put("green", bins[1]);
      series.put("blue", bins[2]);
    }
    return new Histogram(series);
  }

  public boolean isGrayscale() {
    return series.containsKey("gray");
  }

  /** Channel name to a copy of its 256 counts. */
  public Map<String, int[]> series() {
    Map<String, int[]> copy = new LinkedHashMap<>();
    series.forEach((name, bins) -> copy.put(name, bins.clone()));
    return copy;
  }

  public int[] bins(String channel) {
    int[] bins = series.get(channel);
    if (bins == null) {
      throw new IllegalArgumentException("No such channel: " + channel);
    }
    return bins.clone();
  }
}
