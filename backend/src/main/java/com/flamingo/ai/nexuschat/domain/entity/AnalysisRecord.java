package com.flamingo.ai.nexuschat.domain.entity;

import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/** Derived analysis of an uploaded item. Rows are only ever inserted or deleted with the item. */
@Entity
@Table(
    name = "analysis_records",
    indexes = {
      @Index(name = "idx_analysis_item", columnList = "itemId"),
      @Index(name = "idx_analysis_session", columnList = "sessionId")
    })
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, updatable = false)
  private UUID itemId;

  @Column(nullable = false, updatable = false)
  private UUID sessionId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false)
  private AnalysisKind kind;

  @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
  private String summary;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
