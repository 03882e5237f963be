package com.flamingo.imagelab.domain.repository;

import com.flamingo.imagelab.domain.entity.HistoryEntry;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for HistoryEntry entities. */
@Repository
public interface HistoryEntryRepository extends JpaRepository<HistoryEntry, UUID> {

  /** Finds an owner's history, newest first. */
  Page<HistoryEntry> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);

  /**
   * Finds an owner's history for one image, newest first. Matches entries that produced the
   * image and, when the image is a root, every entry derived from it.
   */
  @Query(
      value =
          "SELECT h FROM HistoryEntry h WHERE h.ownerId = :ownerId "
              + "AND (h.imageId = :imageId OR h.rootImageId = :imageId) "
              + "ORDER BY h.createdAt DESC",
      countQuery =
          "SELECT COUNT(h) FROM HistoryEntry h WHERE h.ownerId = :ownerId "
              + "AND (h.imageId = :imageId OR h.rootImageId = :imageId)")
  Page<HistoryEntry> findByOwnerIdAndImage(
      @Param("ownerId") UUID ownerId, @Param("imageId") UUID imageId, Pageable pageable);
}
