package com.flamingo.ai.nexuschat.api.dto.response;

import com.flamingo.ai.nexuschat.domain.entity.Session;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

  private UUID id;
  private String title;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime lastAccessedAt;

  /** Creates a SessionResponse from a Session entity. */
  public static SessionResponse fromEntity(Session session) {
    return SessionResponse.builder()
        .id(session.getId())
        .title(session.getTitle())
        .createdAt(session.getCreatedAt())
        .updatedAt(session.getUpdatedAt())
        .lastAccessedAt(session.getLastAccessedAt())
        .build();
  }
}
