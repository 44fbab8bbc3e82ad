package com.flamingo.ai.nexuschat.service.chat;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;

/** Service interface for answering questions within a session. */
public interface ChatService {

  /**
   * Answers a question grounded in the session's files, or in recent history when the session
   * has no usable file content. Model failures are returned as the answer text.
   *
   * @throws com.flamingo.ai.nexuschat.exception.SessionNotFoundException if the session is not
   *     the user's
   */
  AnswerResult answer(UUID sessionId, String userId, String question);

  /**
   * Returns up to {@code limit} of the session's latest messages in chronological order.
   */
  List<ChatMessage> history(UUID sessionId, String userId, int limit);
}
