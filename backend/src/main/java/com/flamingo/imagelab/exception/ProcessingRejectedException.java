package com.flamingo.imagelab.exception;

import java.util.UUID;

/** Exception thrown when the processing pool has no capacity left for another batch. */
public class ProcessingRejectedException extends RuntimeException {

  private final UUID imageId;

  public ProcessingRejectedException(UUID imageId, Throwable cause) {
    super("Processing pool is saturated; batch on image " + imageId + " was not started", cause);
    this.imageId = imageId;
  }

  public UUID getImageId() {
    return imageId;
  }
}
