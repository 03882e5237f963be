package com.flamingo.imagelab.service.history;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import java.util.UUID;

/** Append-only ledger of executed batches. */
public interface HistoryService {

  /**
   * Appends an entry. Joins the caller's transaction so the entry commits or rolls back together
   * with the image it describes.
   *
   * @param entry the entry to store
   * @return the stored entry
   */
  HistoryEntry append(HistoryEntry entry);

  /**
   * Lists an owner's entries, newest first.
   *
   * @param ownerId the owner
   * @param imageId optional filter: entries that produced this image or were derived from it
   * @param limit page size, clamped to [1, 100]
   * @param offset rows to skip
   * @return the page and the total number of matching entries
   */
  HistoryPage listHistory(UUID ownerId, UUID imageId, int limit, int offset);

  /**
   * Removes a ledger row. The image the entry produced is not touched.
   *
   * @throws com.flamingo.imagelab.exception.HistoryEntryNotFoundException if the entry does not
   *     exist or belongs to another owner
   */
  void deleteEntry(UUID ownerId, UUID entryId);
}
