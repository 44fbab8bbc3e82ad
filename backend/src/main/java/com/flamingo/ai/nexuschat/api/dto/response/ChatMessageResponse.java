package com.flamingo.ai.nexuschat.api.dto.response;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for chat message data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;

  /** Sender name, {@code user} or {@code assistant}. */
  private String sender;

  private String content;
  private LocalDateTime createdAt;

  /** Creates a ChatMessageResponse from a ChatMessage entity. */
  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .sender(message.getRole().senderName())
        .content(message.getContent())
        .createdAt(message.getCreatedAt())
        .build();
  }
}
