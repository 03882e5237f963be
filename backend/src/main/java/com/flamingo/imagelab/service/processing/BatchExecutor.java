package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.processing.ImageOperation;
import java.util.List;
import java.util.UUID;

/**
 * Applies ordered operations to the root of an image's chain and records exactly one derived image
 * and one history entry per call, or nothing at all.
 */
public interface BatchExecutor {

  /**
   * Executes a batch.
   *
   * @param ownerId the caller
   * @param anchorImageId any image of the caller's chain; the batch is applied to its root
   * @param operations one or more operations, applied left to right
   * @return the derived image and its history entry
   * @throws com.flamingo.imagelab.exception.InvalidParameterException if the list is empty, too
   *     long, or an operation does not fit the image
   * @throws com.flamingo.imagelab.exception.ImageNotFoundException if the anchor, its root or a
   *     merge overlay is missing
   * @throws com.flamingo.imagelab.exception.ImageAccessDeniedException if any of them belongs to
   *     another owner
   * @throws com.flamingo.imagelab.exception.ProcessingTimeoutException if the fold exceeds the
   *     batch budget
   * @throws com.flamingo.imagelab.exception.PersistenceFailureException if the result cannot be
   *     stored
   */
  BatchResult execute(UUID ownerId, UUID anchorImageId, List<ImageOperation> operations);

  /** Writes a new derived image whose pixels equal the root's, recorded as {@code reset}. */
  BatchResult resetToOriginal(UUID ownerId, UUID imageId);
}
