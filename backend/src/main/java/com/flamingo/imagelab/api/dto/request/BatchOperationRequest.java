package com.flamingo.imagelab.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One {@code {operation, params}} element of a batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchOperationRequest {

  @NotBlank(message = "operation is required")
  private String operation;

  /** Parameters keyed by wire name; numbers arrive as decoded by Jackson. */
  private Map<String, Object> params;
}
