package com.flamingo.imagelab.service.processing;

import java.util.UUID;

/** Finds the root upload of any image's derivation chain. */
public interface DerivationResolver {

  /**
   * Resolves an image to its root.
   *
   * @param ownerId owner every image on the chain must belong to
   * @param imageId any image on the chain
   * @return the anchor and its root
   * @throws com.flamingo.imagelab.exception.ImageNotFoundException if the anchor or a link is
   *     missing
   * @throws com.flamingo.imagelab.exception.ImageAccessDeniedException if an image on the chain
   *     belongs to someone else
   * @throws com.flamingo.imagelab.exception.CorruptChainException if the links cycle or exceed
   *     the depth bound
   */
  ResolvedChain resolve(UUID ownerId, UUID imageId);
}
