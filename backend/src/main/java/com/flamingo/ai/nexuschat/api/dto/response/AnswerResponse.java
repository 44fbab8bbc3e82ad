package com.flamingo.ai.nexuschat.api.dto.response;

import com.flamingo.ai.nexuschat.domain.enums.ContextMode;
import com.flamingo.ai.nexuschat.service.chat.AnswerResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

  private ChatMessageResponse userMessage;
  private ChatMessageResponse assistantMessage;
  private String answer;
  private ContextMode mode;

  public static AnswerResponse fromResult(AnswerResult result) {
    return AnswerResponse.builder()
        .userMessage(ChatMessageResponse.fromEntity(result.userMessage()))
        .assistantMessage(ChatMessageResponse.fromEntity(result.assistantMessage()))
        .answer(result.answer())
        .mode(result.mode())
        .build();
  }
}
