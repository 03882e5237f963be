package com.flamingo.imagelab.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a history entry and, while it still exists, the image it produced. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HistoryEntryResponse {
  private UUID id;
  private UUID userId;
  private UUID imageId;
  private String operation;
  private Map<String, Object> params;
  private LocalDateTime createdAt;
  private ImageMetadataResponse image;
}
