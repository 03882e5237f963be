package com.flamingo.imagelab.domain.entity;

import com.flamingo.imagelab.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Audit record of one executed batch. Append-only. */
@Entity
@Table(
    name = "edit_history",
    indexes = {
      @Index(name = "idx_history_owner_created", columnList = "ownerId, createdAt"),
      @Index(name = "idx_history_image", columnList = "imageId"),
      @Index(name = "idx_history_root", columnList = "rootImageId")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryEntry {

  public static final String OPERATION_BATCH = "batch";
  public static final String OPERATION_RESET = "reset";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, updatable = false)
  private UUID ownerId;

  /** The derived image this batch produced. */
  @Column(nullable = false, updatable = false)
  private UUID imageId;

  /** Root the batch was applied to. */
  @Column(nullable = false, updatable = false)
  private UUID rootImageId;

  /** Operation name for a single operation, {@code batch} or {@code reset} otherwise. */
  @Column(nullable = false, updatable = false)
  private String operation;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT", updatable = false)
  @Builder.Default
  private Map<String, Object> params = new LinkedHashMap<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
