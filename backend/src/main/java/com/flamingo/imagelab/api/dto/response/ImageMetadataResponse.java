package com.flamingo.imagelab.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.imagelab.domain.entity.Image;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for image metadata. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ImageMetadataResponse {

  private UUID id;
  private UUID userId;
  private String path;
  private int width;
  private int height;
  private String mimeType;
  private LocalDateTime createdAt;
  private UUID originalId;
  private String originalFilename;
  private Long fileSize;
  private String url;

  /** Creates a response from an Image entity and its download URL. */
  public static ImageMetadataResponse fromEntity(Image image, String url) {
    return ImageMetadataResponse.builder()
        .id(image.getId())
        .userId(image.getOwnerId())
        .path(image.getFilePath())
        .width(image.getWidth())
        .height(image.getHeight())
        .mimeType(image.getMimeType())
        .createdAt(image.getCreatedAt())
        .originalId(image.getOriginalId())
        .originalFilename(image.getOriginalFilename())
        .fileSize(image.getFileSize())
        .url(url)
        .build();
  }
}
