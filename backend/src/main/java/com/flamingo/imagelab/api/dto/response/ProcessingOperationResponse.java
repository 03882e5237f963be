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

/** Response DTO for a single-operation edit; {@code original_image_id} is the root. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessingOperationResponse {
  private UUID id;
  private String url;
  private int width;
  private int height;
  private String mimeType;
  private String operation;
  private Map<String, Object> parameters;
  private UUID originalImageId;
  private LocalDateTime createdAt;
}
