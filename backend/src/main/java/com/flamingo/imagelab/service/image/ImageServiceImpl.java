package com.flamingo.imagelab.service.image;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import com.flamingo.imagelab.domain.repository.OffsetLimitPageable;
import com.flamingo.imagelab.exception.ImageAccessDeniedException;
import com.flamingo.imagelab.exception.ImageNotFoundException;
import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.exception.PersistenceFailureException;
import com.flamingo.imagelab.exception.UnsupportedImageException;
import com.flamingo.imagelab.processing.PixelBuffer;
import com.flamingo.imagelab.processing.PixelBufferCodec;
import com.flamingo.imagelab.storage.ImageFileStorage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the ImageService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageServiceImpl implements ImageService {

  static final int MAX_PAGE_SIZE = 100;

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of("image/png", "image/jpeg", "image/jpg", "image/bmp", "image/gif");

  private final ImageRepository imageRepository;
  private final ImageFileStorage imageFileStorage;
  private final PixelBufferCodec pixelBufferCodec;
  private final ImageLabConfig imageLabConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "image.upload", description = "Time to upload an image")
  public Image uploadImage(UUID ownerId, MultipartFile file) {
    log.info("Uploading image {} for owner {}", file.getOriginalFilename(), ownerId);

    validateFile(file);

    byte[] bytes;
    try {
      bytes = file.getBytes();
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to read uploaded file", e);
    }
    PixelBuffer pixels = pixelBufferCodec.decode(bytes);

    String mimeType = normalizeMimeType(file.getContentType());
    String filePath = imageFileStorage.write(ownerId, bytes, mimeType);
    imageFileStorage.deleteOnRollback(filePath);

    Image image =
        Image.builder()
            .ownerId(ownerId)
            .filePath(filePath)
            .width(pixels.width())
            .height(pixels.height())
            .mimeType(mimeType)
            .originalFilename(file.getOriginalFilename())
            .fileSize((long) bytes.length)
            .build();

    Image saved = imageRepository.save(image);
    meterRegistry.counter("image.uploaded", "type", mimeType).increment();

    log.info(
        "Image {} uploaded with ID: {} ({}x{})",
        file.getOriginalFilename(),
        saved.getId(),
        saved.getWidth(),
        saved.getHeight());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "image.list", description = "Time to list images")
  public ImagePage listImages(UUID ownerId, int limit, int offset, String sort) {
    int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
    int skip = Math.max(0, offset);
    Page<Image> page =
        imageRepository.findByOwnerId(
            ownerId, OffsetLimitPageable.of(skip, pageSize, parseSort(sort)));
    return new ImagePage(page.getContent(), page.getTotalElements(), pageSize, skip);
  }

  @Override
  @Transactional(readOnly = true)
  public Image getImage(UUID ownerId, UUID imageId) {
    Image image =
        imageRepository.findById(imageId).orElseThrow(() -> new ImageNotFoundException(imageId));
    if (!image.isOwnedBy(ownerId)) {
      throw new ImageAccessDeniedException(imageId, ownerId);
    }
    return image;
  }

  @Override
  @Transactional(readOnly = true)
  public byte[] getImageBytes(UUID ownerId, UUID imageId) {
    return imageFileStorage.read(getImage(ownerId, imageId).getFilePath());
  }

  @Override
  @Timed(value = "image.decode", description = "Time to load and decode image pixels")
  public PixelBuffer loadPixels(Image image) {
    return pixelBufferCodec.decode(imageFileStorage.read(image.getFilePath()));
  }

  @Override
  @Transactional
  @Timed(value = "image.delete", description = "Time to delete an image")
  public void deleteImage(UUID ownerId, UUID imageId) {
    Image image = getImage(ownerId, imageId);

    if (image.isRoot()) {
      long derived = imageRepository.countByOriginalId(imageId);
      if (derived > 0) {
        log.info("Deleting root image {} that still has {} derived images", imageId, derived);
      }
    }

    imageRepository.delete(image);
    imageFileStorage.deleteAfterCommit(image.getFilePath());

    log.info("Deleted image: {}", imageId);
    meterRegistry.counter("image.deleted").increment();
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new InvalidParameterException("file", "file is required");
    }
    long maxBytes = imageLabConfig.getStorage().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new InvalidParameterException(
          "file", "file exceeds the maximum size of " + maxBytes + " bytes");
    }
    String mimeType = normalizeMimeType(file.getContentType());
    if (!SUPPORTED_MIME_TYPES.contains(mimeType)) {
      throw new UnsupportedImageException("Unsupported image type: " + file.getContentType());
    }
  }

  private String normalizeMimeType(String contentType) {
    if (contentType == null) {
      return "application/octet-stream";
    }
    String mimeType = contentType.toLowerCase(Locale.ROOT).trim();
    return "image/jpg".equals(mimeType) ? "image/jpeg" : mimeType;
  }

  private Sort parseSort(String sort) {
    if (sort == null || sort.isBlank() || "created_at".equals(sort) || "-created_at".equals(sort)) {
      return Sort.by(Sort.Direction.DESC, "createdAt");
    }
    if ("created_at_asc".equals(sort)) {
      return Sort.by(Sort.Direction.ASC, "createdAt");
    }
    throw new InvalidParameterException(
        "sort", "sort must be one of created_at, -created_at, created_at_asc");
  }
}
