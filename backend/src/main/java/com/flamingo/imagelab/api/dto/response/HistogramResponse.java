package com.flamingo.imagelab.api.dto.response;

import com.flamingo.imagelab.processing.Histogram;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO wrapping either {@code {gray}} or {@code {red, green, blue}} bin arrays. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistogramResponse {
  private Map<String, int[]> histogram;

  public static HistogramResponse from(Histogram histogram) {
    return new HistogramResponse(histogram.series());
  }
}
