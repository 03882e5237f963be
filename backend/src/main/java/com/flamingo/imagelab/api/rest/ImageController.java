package com.flamingo.imagelab.api.rest;

import com.flamingo.imagelab.api.dto.response.ImageListResponse;
import com.flamingo.imagelab.api.dto.response.ImageMetadataResponse;
import com.flamingo.imagelab.api.dto.response.OkResponse;
import com.flamingo.imagelab.api.dto.response.UploadImageResponse;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.service.auth.CurrentOwnerProvider;
import com.flamingo.imagelab.service.image.ImagePage;
import com.flamingo.imagelab.service.image.ImageService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for the caller's images: upload, listing, metadata, bytes and deletion.
 *
 * <p>Every endpoint resolves the caller first and only serves images that caller owns.
 */
@RestController
@RequestMapping("/images")
@RequiredArgsConstructor
@Slf4j
public class ImageController {

  private final ImageService imageService;
  private final CurrentOwnerProvider currentOwnerProvider;
  private final ImageUrlResolver imageUrlResolver;

  /** Uploads a new original image. */
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadImageResponse> uploadImage(
      @RequestParam("file") MultipartFile file) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    Image image = imageService.uploadImage(ownerId, file);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new UploadImageResponse(toResponse(image)));
  }

  /** Lists the caller's images, newest first unless {@code sort=created_at_asc}. */
  @GetMapping
  public ResponseEntity<ImageListResponse> listImages(
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(defaultValue = "-created_at") String sort) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    ImagePage page = imageService.listImages(ownerId, limit, offset, sort);
    return ResponseEntity.ok(
        ImageListResponse.builder()
            .images(page.images().stream().map(this::toResponse).toList())
            .total(page.total())
            .limit(page.limit())
            .offset(page.offset())
            .build());
  }

  /** Gets an image's metadata. */
  @GetMapping("/{imageId}")
  public ResponseEntity<ImageMetadataResponse> getImage(@PathVariable UUID imageId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    return ResponseEntity.ok(toResponse(imageService.getImage(ownerId, imageId)));
  }

  /**
   * Serves an image as binary data.
   *
   * @param imageId UUID of the {@link Image}
   * @return image bytes with the stored Content-Type
   */
  @GetMapping("/{imageId}/download")
  public ResponseEntity<byte[]> downloadImage(@PathVariable UUID imageId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    Image image = imageService.getImage(ownerId, imageId);
    byte[] bytes = imageService.getImageBytes(ownerId, imageId);
    return ResponseEntity.ok().contentType(parseMediaType(image.getMimeType())).body(bytes);
  }

  /** Deletes an image and its file; history entries are kept. */
  @DeleteMapping("/{imageId}")
  public ResponseEntity<OkResponse> deleteImage(@PathVariable UUID imageId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    imageService.deleteImage(ownerId, imageId);
    return ResponseEntity.ok(OkResponse.success());
  }

  private ImageMetadataResponse toResponse(Image image) {
    return ImageMetadataResponse.fromEntity(image, imageUrlResolver.downloadUrl(image.getId()));
  }

  private MediaType parseMediaType(String mimeType) {
    try {
      return MediaType.parseMediaType(mimeType);
    } catch (Exception e) {
      log.debug("Unparseable stored MIME type {}, serving as PNG", mimeType);
      return MediaType.IMAGE_PNG;
    }
  }
}
