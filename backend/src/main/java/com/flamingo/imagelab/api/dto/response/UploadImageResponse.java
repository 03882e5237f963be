package com.flamingo.imagelab.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed upload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadImageResponse {
  private ImageMetadataResponse image;
}
