package com.flamingo.imagelab.service.history;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.domain.repository.HistoryEntryRepository;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import com.flamingo.imagelab.domain.repository.OffsetLimitPageable;
import com.flamingo.imagelab.exception.HistoryEntryNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the HistoryService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryServiceImpl implements HistoryService {

  static final int MAX_PAGE_SIZE = 100;

  private final HistoryEntryRepository historyEntryRepository;
  private final ImageRepository imageRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public HistoryEntry append(HistoryEntry entry) {
    HistoryEntry saved = historyEntryRepository.save(entry);
    log.debug(
        "Recorded history entry {} ({}) for image {}",
        saved.getId(),
        saved.getOperation(),
        saved.getImageId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "history.list", description = "Time to list edit history")
  public HistoryPage listHistory(UUID ownerId, UUID imageId, int limit, int offset) {
    int pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
    int skip = Math.max(0, offset);
    OffsetLimitPageable pageable = OffsetLimitPageable.of(skip, pageSize);

    Page<HistoryEntry> page =
        imageId == null
            ? historyEntryRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, pageable)
            : historyEntryRepository.findByOwnerIdAndImage(ownerId, imageId, pageable);

    List<UUID> imageIds = page.getContent().stream().map(HistoryEntry::getImageId).toList();
    Map<UUID, Image> images =
        imageRepository.findAllById(imageIds).stream()
            .collect(Collectors.toMap(Image::getId, Function.identity()));

    List<HistoryItem> items =
        page.getContent().stream()
            .map(entry -> new HistoryItem(entry, images.get(entry.getImageId())))
            .toList();
    return new HistoryPage(items, page.getTotalElements(), pageSize, skip);
  }

  @Override
  @Transactional
  @Timed(value = "history.delete", description = "Time to delete a history entry")
  public void deleteEntry(UUID ownerId, UUID entryId) {
    HistoryEntry entry =
        historyEntryRepository
            .findById(entryId)
            .filter(e -> e.getOwnerId().equals(ownerId))
            .orElseThrow(() -> new HistoryEntryNotFoundException(entryId));

    historyEntryRepository.delete(entry);

    log.info("Deleted history entry {} (image {} kept)", entryId, entry.getImageId());
    meterRegistry.counter("history.deleted").increment();
  }
}
