package com.flamingo.imagelab.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One version of an owner's picture: either an upload (a root) or the result of a batch applied
 * to a root.
 *
 * <p>{@link #originalId} is null exactly for roots. A derived image points at the root of its
 * chain directly, never at the image the client happened to be looking at, so every chain is one
 * hop deep. Rows are never updated after insert.
 */
@Entity
@Table(
    name = "images",
    indexes = {
      @Index(name = "idx_images_owner_created", columnList = "ownerId, createdAt"),
      @Index(name = "idx_images_original", columnList = "originalId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Image {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, updatable = false)
  private UUID ownerId;

  /** Absolute file-system path to the encoded image file. */
  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String filePath;

  @Column(nullable = false, updatable = false)
  private int width;

  @Column(nullable = false, updatable = false)
  private int height;

  /** MIME type of the stored file (e.g. {@code image/png}). */
  @Column(nullable = false, updatable = false)
  private String mimeType;

  /** Root of the derivation chain; null for uploads. */
  @Column(updatable = false)
  private UUID originalId;

  /** Client-side file name for uploads; null for derived images. */
  private String originalFilename;

  private Long fileSize;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public boolean isRoot() {
    return originalId == null;
  }

  public boolean isOwnedBy(UUID candidateOwnerId) {
    return ownerId != null && ownerId.equals(candidateOwnerId);
  }
}
