package com.flamingo.imagelab.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for cropping a region and upsampling it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EnlargeRegionRequest {

  @NotNull(message = "image_id is required")
  private UUID imageId;

  @JsonProperty("x_start")
  private Number xStart;

  @JsonProperty("x_end")
  private Number xEnd;

  @JsonProperty("y_start")
  private Number yStart;

  @JsonProperty("y_end")
  private Number yEnd;

  private Number zoomFactor;
}
