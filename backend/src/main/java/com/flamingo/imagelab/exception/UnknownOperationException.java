package com.flamingo.imagelab.exception;

/** Exception thrown when a batch names an operation kind outside the supported set. */
public class UnknownOperationException extends RuntimeException {

  private final String operation;

  public UnknownOperationException(String operation) {
    super("Unknown operation: " + operation);
    this.operation = operation;
  }

  public String getOperation() {
    return operation;
  }
}
