package com.flamingo.imagelab.service.history;

import java.util.List;

/** One page of history, newest first, plus the number of matching entries. */
public record HistoryPage(List<HistoryItem> items, long total, int limit, int offset) {}
