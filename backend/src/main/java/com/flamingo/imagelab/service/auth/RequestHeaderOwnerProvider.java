package com.flamingo.imagelab.service.auth;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads the owner id from a request header. Token validation happens in the gateway in front of
 * this service, which forwards the verified user id in the configured header.
 */
@Component
@RequiredArgsConstructor
public class RequestHeaderOwnerProvider implements CurrentOwnerProvider {

  private final ImageLabConfig imageLabConfig;

  @Override
  public UUID getCurrentOwnerId() {
    RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
    if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
      throw new UnauthorizedException("No request bound to the current thread");
    }
    HttpServletRequest request = servletAttributes.getRequest();
    String header = imageLabConfig.getAuth().getOwnerHeader();
    String value = request.getHeader(header);
    if (value == null || value.isBlank()) {
      throw new UnauthorizedException("Missing " + header + " header");
    }
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException e) {
      throw new UnauthorizedException("Malformed " + header + " header");
    }
  }
}
