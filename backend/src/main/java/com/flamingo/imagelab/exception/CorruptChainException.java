package com.flamingo.imagelab.exception;

import java.util.UUID;

/**
 * Exception thrown when walking an image's parent links does not reach a root, either because
 * the links form a cycle or because the walk exceeds the configured depth bound.
 */
public class CorruptChainException extends RuntimeException {

  private final UUID imageId;

  public CorruptChainException(UUID imageId, String message) {
    super(message);
    this.imageId = imageId;
  }

  public UUID getImageId() {
    return imageId;
  }
}
