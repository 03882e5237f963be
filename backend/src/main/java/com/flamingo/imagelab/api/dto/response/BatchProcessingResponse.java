package com.flamingo.imagelab.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a batch. {@code original_image_id} is the anchor as submitted and {@code
 * root_image_id} the root the batch was applied to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchProcessingResponse {
  private UUID id;
  private String url;
  private int width;
  private int height;
  private String mimeType;
  private List<OperationDescriptor> operationsApplied;
  private UUID originalImageId;
  private UUID rootImageId;
  private LocalDateTime createdAt;
}
