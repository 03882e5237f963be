package com.flamingo.imagelab.service.history;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;

/**
 * A ledger entry with the image it produced.
 *
 * @param entry the ledger row
 * @param image the produced image, or null once that image has been deleted
 */
public record HistoryItem(HistoryEntry entry, Image image) {}
