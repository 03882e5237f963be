package com.flamingo.imagelab.exception;

/** Exception thrown when uploaded bytes are not an image this service can decode. */
public class UnsupportedImageException extends RuntimeException {

  private final String userMessage;

  public UnsupportedImageException(String message) {
    super(message);
    this.userMessage = message;
  }

  public UnsupportedImageException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The uploaded file could not be read as an image";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
