package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import com.flamingo.imagelab.service.history.HistoryService;
import com.flamingo.imagelab.storage.ImageFileStorage;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores a batch result: the encoded file, the image row and the history row commit together. A
 * file written before a failed commit is removed again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DerivedImageWriter {

  private final ImageRepository imageRepository;
  private final ImageFileStorage imageFileStorage;
  private final HistoryService historyService;

  /** Result of {@link #write}. */
  public record Written(Image image, HistoryEntry historyEntry) {}

  @Transactional
  public Written write(
      UUID ownerId,
      Image root,
      EncodedImage encoded,
      String operationLabel,
      Map<String, Object> params) {
    String filePath = imageFileStorage.write(ownerId, encoded.bytes(), encoded.mimeType());
    imageFileStorage.deleteOnRollback(filePath);

    Image image =
        imageRepository.save(
            Image.builder()
                .ownerId(ownerId)
                .filePath(filePath)
                .width(encoded.width())
                .height(encoded.height())
                .mimeType(encoded.mimeType())
                .originalId(root.getId())
                .fileSize((long) encoded.bytes().length)
                .build());

    HistoryEntry entry =
        historyService.append(
            HistoryEntry.builder()
                .ownerId(ownerId)
                .imageId(image.getId())
                .rootImageId(root.getId())
                .operation(operationLabel)
                .params(params)
                .build());

    log.debug(
        "Wrote derived image {} of root {} ({})", image.getId(), root.getId(), operationLabel);
    return new Written(image, entry);
  }

  /** Encoded pixels ready to be stored. */
  public record EncodedImage(byte[] bytes, String mimeType, int width, int height) {}
}
