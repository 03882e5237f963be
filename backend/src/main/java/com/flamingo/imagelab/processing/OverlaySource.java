package com.flamingo.imagelab.processing;

import java.util.UUID;

/** Supplies the pixels of a second image referenced by a merge operation. */
@FunctionalInterface
public interface OverlaySource {

  /** A source that knows no images; any merge against it fails. */
  OverlaySource NONE =
      imageId -> {
        throw new IllegalStateException("No overlay loaded for image " + imageId);
      };

  PixelBuffer overlay(UUID imageId);
}
