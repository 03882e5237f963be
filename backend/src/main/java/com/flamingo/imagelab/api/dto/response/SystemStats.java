package com.flamingo.imagelab.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalImages;
  private long totalOriginals;
  private long totalHistoryEntries;
  private LocalDateTime timestamp;
}
