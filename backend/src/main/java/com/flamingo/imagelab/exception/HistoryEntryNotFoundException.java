package com.flamingo.imagelab.exception;

import java.util.UUID;

/** Exception thrown when a history entry is not found. */
public class HistoryEntryNotFoundException extends RuntimeException {

  private final UUID entryId;

  public HistoryEntryNotFoundException(UUID entryId) {
    super("History entry not found: " + entryId);
    this.entryId = entryId;
  }

  public UUID getEntryId() {
    return entryId;
  }
}
