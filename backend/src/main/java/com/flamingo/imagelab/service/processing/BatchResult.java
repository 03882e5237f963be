package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.processing.ImageOperation;
import java.util.List;

/**
 * Outcome of a successful batch.
 *
 * @param image the derived image, a direct child of {@code chain.root()}
 * @param chain the anchor the client named and the root it resolved to
 * @param operations the operations applied, in order; empty for a reset
 * @param historyEntry the ledger row written with the image
 */
public record BatchResult(
    Image image, ResolvedChain chain, List<ImageOperation> operations, HistoryEntry historyEntry) {}
