package com.flamingo.imagelab.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one page of images. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageListResponse {
  private List<ImageMetadataResponse> images;
  private long total;
  private int limit;
  private int offset;
}
