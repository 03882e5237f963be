package com.flamingo.imagelab.exception;

import java.util.UUID;

/** Exception thrown when a batch does not finish within the configured time budget. */
public class ProcessingTimeoutException extends RuntimeException {

  private final UUID imageId;
  private final long timeoutMs;

  public ProcessingTimeoutException(UUID imageId, long timeoutMs) {
    super(String.format("Batch on image %s exceeded %d ms", imageId, timeoutMs));
    this.imageId = imageId;
    this.timeoutMs = timeoutMs;
  }

  public UUID getImageId() {
    return imageId;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}
