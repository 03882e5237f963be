package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import com.flamingo.imagelab.exception.CorruptChainException;
import com.flamingo.imagelab.exception.ImageAccessDeniedException;
import com.flamingo.imagelab.exception.ImageNotFoundException;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves roots by following {@code originalId}. Images written by this service point at their
 * root directly, so a lookup takes at most one hop; longer chains (rows imported from a store
 * that recorded immediate parents) are still followed, up to the configured depth.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DerivationResolverImpl implements DerivationResolver {

  private final ImageRepository imageRepository;
  private final ImageLabConfig imageLabConfig;

  @Override
  @Transactional(readOnly = true)
  public ResolvedChain resolve(UUID ownerId, UUID imageId) {
    Image anchor = loadOwned(ownerId, imageId);
    int maxDepth = imageLabConfig.getProcessing().getMaxChainDepth();

    Set<UUID> visited = new HashSet<>();
    visited.add(anchor.getId());
    Image current = anchor;
    int depth = 0;

    while (!current.isRoot()) {
      if (depth >= maxDepth) {
        throw new CorruptChainException(
            imageId, "Chain of image " + imageId + " exceeds depth " + maxDepth);
      }
      UUID parentId = current.getOriginalId();
      if (!visited.add(parentId)) {
        throw new CorruptChainException(
            imageId, "Chain of image " + imageId + " cycles through " + parentId);
      }
      current = loadOwned(ownerId, parentId);
      depth++;
    }

    if (depth > 1) {
      log.warn("Image {} reached its root {} through {} links", imageId, current.getId(), depth);
    }
    return new ResolvedChain(anchor, current, depth);
  }

  private Image loadOwned(UUID ownerId, UUID imageId) {
    Image image =
        imageRepository.findById(imageId).orElseThrow(() -> new ImageNotFoundException(imageId));
    if (!image.isOwnedBy(ownerId)) {
      throw new ImageAccessDeniedException(imageId, ownerId);
    }
    return image;
  }
}
