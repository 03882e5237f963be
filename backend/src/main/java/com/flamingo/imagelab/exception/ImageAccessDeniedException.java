package com.flamingo.imagelab.exception;

import java.util.UUID;

/** Exception thrown when attempting to use an image that belongs to another owner. */
public class ImageAccessDeniedException extends RuntimeException {

  private final UUID imageId;
  private final UUID ownerId;

  public ImageAccessDeniedException(UUID imageId, UUID ownerId) {
    super(String.format("Image %s does not belong to owner %s", imageId, ownerId));
    this.imageId = imageId;
    this.ownerId = ownerId;
  }

  public UUID getImageId() {
    return imageId;
  }

  public UUID getOwnerId() {
    return ownerId;
  }
}
