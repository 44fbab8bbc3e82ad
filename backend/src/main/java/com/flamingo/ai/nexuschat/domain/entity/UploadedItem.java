package com.flamingo.ai.nexuschat.domain.entity;

import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One uploaded file scoped to a session.
 *
 * <p>The extracted text is fixed at construction. Re-analysis appends an {@link AnalysisRecord}
 * and never touches the item.
 */
@Entity
@Table(name = "uploaded_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UploadedItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "session_id", nullable = false)
  private Session session;

  @Column(nullable = false)
  private String userId;

  @Column(nullable = false)
  private String fileName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ItemKind kind;

  private long fileSize;

  private String mimeType;

  @Lob
  @Column(nullable = false)
  private byte[] content;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String extractedText;

  @Column(nullable = false, updatable = false)
  private LocalDateTime uploadedAt;

  @Builder
  private UploadedItem(
      UUID id,
      Session session,
      String userId,
      String fileName,
      ItemKind kind,
      String mimeType,
      byte[] content,
      String extractedText) {
    this.id = id;
    this.session = session;
    this.userId = userId;
    this.fileName = fileName;
    this.kind = kind;
    this.mimeType = mimeType;
    this.content = content;
    this.fileSize = content == null ? 0 : content.length;
    this.extractedText = extractedText == null ? "" : extractedText;
  }

  @PrePersist
  protected void onCreate() {
    uploadedAt = LocalDateTime.now();
  }
}
