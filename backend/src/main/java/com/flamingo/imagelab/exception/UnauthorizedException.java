package com.flamingo.imagelab.exception;

/** Exception thrown when the request carries no usable owner identity. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
