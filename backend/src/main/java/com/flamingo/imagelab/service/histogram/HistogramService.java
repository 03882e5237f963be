package com.flamingo.imagelab.service.histogram;

import com.flamingo.imagelab.processing.Histogram;
import java.util.UUID;

/** Service interface for per-channel intensity histograms. */
public interface HistogramService {

  /**
   * Computes the histogram of an image's stored pixels.
   *
   * @param ownerId the caller
   * @param imageId the image
   * @return one gray series or red, green and blue series
   * @throws com.flamingo.imagelab.exception.ImageNotFoundException if the image does not exist
   * @throws com.flamingo.imagelab.exception.ImageAccessDeniedException if another owner has it
   */
  Histogram getHistogram(UUID ownerId, UUID imageId);
}
