package com.flamingo.imagelab.api.dto.response;

/** Response body for deletes. */
public record OkResponse(boolean ok) {

  public static OkResponse success() {
    return new OkResponse(true);
  }
}
