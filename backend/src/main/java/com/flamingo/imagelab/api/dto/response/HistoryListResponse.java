package com.flamingo.imagelab.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one page of history. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryListResponse {
  private List<HistoryEntryResponse> history;
  private long total;
}
