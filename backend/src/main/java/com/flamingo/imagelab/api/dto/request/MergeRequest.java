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

/**
 * Request DTO for blending two images. {@code image1_id} is the base whose root the result
 * derives from; {@code image2_id} is the overlay, used as it currently is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MergeRequest {

  @NotNull(message = "image1_id is required")
  @JsonProperty("image1_id")
  private UUID image1Id;

  @NotNull(message = "image2_id is required")
  @JsonProperty("image2_id")
  private UUID image2Id;

  private Number transparency;
}
