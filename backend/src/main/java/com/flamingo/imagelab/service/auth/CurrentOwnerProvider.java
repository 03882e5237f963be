package com.flamingo.imagelab.service.auth;

import java.util.UUID;

/** Supplies the id of the authenticated owner of the current request. */
public interface CurrentOwnerProvider {

  /**
   * Returns the current owner's id.
   *
   * @return the owner id
   * @throws com.flamingo.imagelab.exception.UnauthorizedException if the request is anonymous
   */
  UUID getCurrentOwnerId();
}
