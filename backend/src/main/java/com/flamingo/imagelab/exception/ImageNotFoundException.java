package com.flamingo.imagelab.exception;

import java.util.UUID;

/** Exception thrown when an image is not found. */
public class ImageNotFoundException extends RuntimeException {

  private final UUID imageId;

  public ImageNotFoundException(UUID imageId) {
    super("Image not found: " + imageId);
    this.imageId = imageId;
  }

  public UUID getImageId() {
    return imageId;
  }
}
