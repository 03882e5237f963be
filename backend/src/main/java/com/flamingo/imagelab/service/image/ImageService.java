package com.flamingo.imagelab.service.image;

import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.processing.PixelBuffer;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for the image store: uploads, lookups, bytes and deletion. */
public interface ImageService {

  /**
   * Stores an uploaded file as a new root image.
   *
   * @param ownerId the uploading owner
   * @param file the uploaded file
   * @return the persisted image
   * @throws com.flamingo.imagelab.exception.UnsupportedImageException if the file is not a
   *     supported image
   */
  Image uploadImage(UUID ownerId, MultipartFile file);

  /**
   * Lists an owner's images.
   *
   * @param ownerId the owner
   * @param limit page size, clamped to [1, 100]
   * @param offset rows to skip
   * @param sort {@code created_at}, {@code -created_at} or {@code created_at_asc}
   * @return the page
   */
  ImagePage listImages(UUID ownerId, int limit, int offset, String sort);

  /**
   * Gets an image owned by the caller.
   *
   * @throws com.flamingo.imagelab.exception.ImageNotFoundException if it does not exist
   * @throws com.flamingo.imagelab.exception.ImageAccessDeniedException if another owner has it
   */
  Image getImage(UUID ownerId, UUID imageId);

  /** Reads the encoded bytes of an image owned by the caller. */
  byte[] getImageBytes(UUID ownerId, UUID imageId);

  /** Decodes the stored bytes of an image the caller has already been checked against. */
  PixelBuffer loadPixels(Image image);

  /**
   * Deletes an image row and its file. History entries are left alone.
   *
   * @param ownerId the owner
   * @param imageId the image
   */
  void deleteImage(UUID ownerId, UUID imageId);
}
