package com.flamingo.ai.nexuschat.service.chat;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import com.flamingo.ai.nexuschat.domain.enums.ContextMode;

/**
 * Result of one question/answer cycle.
 *
 * @param userMessage the stored question
 * @param assistantMessage the stored reply
 * @param mode how the context was assembled
 */
public record AnswerResult(
    ChatMessage userMessage, ChatMessage assistantMessage, ContextMode mode) {

  public String answer() {
    return assistantMessage.getContent();
  }
}
