package com.flamingo.imagelab.api.rest;

import com.flamingo.imagelab.api.dto.response.HistoryEntryResponse;
import com.flamingo.imagelab.api.dto.response.HistoryListResponse;
import com.flamingo.imagelab.api.dto.response.ImageMetadataResponse;
import com.flamingo.imagelab.api.dto.response.OkResponse;
import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.service.auth.CurrentOwnerProvider;
import com.flamingo.imagelab.service.history.HistoryItem;
import com.flamingo.imagelab.service.history.HistoryPage;
import com.flamingo.imagelab.service.history.HistoryService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the edit history ledger. */
@RestController
@RequestMapping("/history")
@RequiredArgsConstructor
public class HistoryController {

  private final HistoryService historyService;
  private final CurrentOwnerProvider currentOwnerProvider;
  private final ImageUrlResolver imageUrlResolver;

  /** Lists the caller's history, newest first, optionally for one image and its derivations. */
  @GetMapping
  public ResponseEntity<HistoryListResponse> listHistory(
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(name = "image_id", required = false) UUID imageId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    HistoryPage page = historyService.listHistory(ownerId, imageId, limit, offset);
    return ResponseEntity.ok(toResponse(page));
  }

  @GetMapping("/{imageId}")
  public ResponseEntity<HistoryListResponse> imageHistory(
      @PathVariable UUID imageId,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    HistoryPage page = historyService.listHistory(ownerId, imageId, limit, offset);
    return ResponseEntity.ok(toResponse(page));
  }

  /** Deletes a ledger entry. The image it produced is kept. */
  @DeleteMapping("/{entryId}")
  public ResponseEntity<OkResponse> deleteEntry(@PathVariable UUID entryId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    historyService.deleteEntry(ownerId, entryId);
    return ResponseEntity.ok(OkResponse.success());
  }

  private HistoryListResponse toResponse(HistoryPage page) {
    return HistoryListResponse.builder()
        .history(page.items().stream().map(this::toResponse).toList())
        .total(page.total())
        .build();
  }

  private HistoryEntryResponse toResponse(HistoryItem item) {
    HistoryEntry entry = item.entry();
    return HistoryEntryResponse.builder()
        .id(entry.getId())
        .userId(entry.getOwnerId())
        .imageId(entry.getImageId())
        .operation(entry.getOperation())
        .params(entry.getParams())
        .createdAt(entry.getCreatedAt())
        .image(
            item.image() == null
                ? null
                : ImageMetadataResponse.fromEntity(
                    item.image(), imageUrlResolver.downloadUrl(item.image().getId())))
        .build();
  }
}
