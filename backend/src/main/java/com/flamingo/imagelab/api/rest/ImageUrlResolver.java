package com.flamingo.imagelab.api.rest;

import com.flamingo.imagelab.config.ImageLabConfig;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the download URL clients use to fetch an image's bytes. */
@Component
@RequiredArgsConstructor
public class ImageUrlResolver {

  private final ImageLabConfig imageLabConfig;

  public String downloadUrl(UUID imageId) {
    String base = imageLabConfig.getStorage().getPublicBaseUrl();
    if (base == null) {
      base = "";
    }
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/images/" + imageId + "/download";
  }
}
