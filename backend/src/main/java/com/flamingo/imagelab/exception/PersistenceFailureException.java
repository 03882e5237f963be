package com.flamingo.imagelab.exception;

/** Exception thrown when image bytes or ledger rows cannot be written or read. */
public class PersistenceFailureException extends RuntimeException {

  private final String userMessage;

  public PersistenceFailureException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Storage is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
