package com.flamingo.imagelab.storage;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.exception.PersistenceFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Stores encoded image files on disk.
 *
 * <p>Files are stored at: {@code {imagelab.storage.base-path}/{ownerId}/{uuid}.{ext}}. A file name
 * is chosen before the owning database row exists, so every write gets a fresh random name and
 * concurrent writers never collide.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageFileStorage {

  private final ImageLabConfig imageLabConfig;

  /**
   * Writes bytes to a new file.
   *
   * @return absolute path of the written file
   * @throws PersistenceFailureException if the file cannot be written
   */
  public String write(UUID ownerId, byte[] data, String mimeType) {
    Path dir = Path.of(imageLabConfig.getStorage().getBasePath(), ownerId.toString());
    Path filePath = dir.resolve(UUID.randomUUID() + "." + extensionForMimeType(mimeType));
    try {
      Files.createDirectories(dir);
      Files.write(filePath, data);
      log.debug("Stored {} bytes for owner {} at {}", data.length, ownerId, filePath);
      return filePath.toAbsolutePath().toString();
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to write image file " + filePath, e);
    }
  }

  /**
   * Reads a stored file.
   *
   * @throws PersistenceFailureException if the file is missing or unreadable
   */
  public byte[] read(String filePath) {
    try {
      return Files.readAllBytes(Path.of(filePath));
    } catch (NoSuchFileException e) {
      throw new PersistenceFailureException("Image file missing on disk: " + filePath, e);
    } catch (IOException e) {
      throw new PersistenceFailureException("Failed to read image file " + filePath, e);
    }
  }

  /**
   * Deletes a stored file if it exists.
   *
   * @return true if a file was removed
   */
  public boolean delete(String filePath) {
    try {
      boolean deleted = Files.deleteIfExists(Path.of(filePath));
      if (deleted) {
        log.debug("Deleted image file {}", filePath);
      }
      return deleted;
    } catch (IOException e) {
      log.warn("Failed to delete image file {}: {}", filePath, e.getMessage());
      return false;
    }
  }

  /**
   * Deletes a freshly written file if the surrounding transaction rolls back, so that a failed
   * insert leaves no orphaned bytes behind. Outside a transaction this does nothing.
   */
  public void deleteOnRollback(String filePath) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            if (status != STATUS_COMMITTED) {
              log.info("Transaction did not commit, removing orphaned file {}", filePath);
              delete(filePath);
            }
          }
        });
  }

  /**
   * Deletes a file once the surrounding transaction commits, or immediately when there is no
   * transaction.
   */
  public void deleteAfterCommit(String filePath) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      delete(filePath);
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            delete(filePath);
          }
        });
  }

  public String extensionForMimeType(String mimeType) {
    if (mimeType == null) {
      return "png";
    }
    return switch (mimeType.toLowerCase()) {
      case "image/jpeg", "image/jpg" -> "jpg";
      case "image/gif" -> "gif";
      case "image/bmp" -> "bmp";
      default -> "png";
    };
  }
}
