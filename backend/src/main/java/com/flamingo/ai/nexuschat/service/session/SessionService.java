package com.flamingo.ai.nexuschat.service.session;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.enums.MessageRole;
import java.util.List;
import java.util.UUID;

/** Service interface for sessions and their message history. */
public interface SessionService {

  /**
   * Creates a new session for a user.
   *
   * @param userId owning user
   * @param title session title; a default is used when blank
   * @return the created session
   */
  Session createSession(String userId, String title);

  /**
   * Gets a session owned by the given user.
   *
   * @throws com.flamingo.ai.nexuschat.exception.SessionNotFoundException if absent or not owned
   */
  Session getOwnedSession(UUID sessionId, String userId);

  /**
   * Appends a message to a session's history.
   *
   * @return the stored message
   */
  ChatMessage appendMessage(Session session, MessageRole role, String content);

  /**
   * Returns up to {@code limit} messages of a session, newest first.
   */
  List<ChatMessage> recentMessages(UUID sessionId, int limit);

  /**
   * Refreshes the session's updated and last accessed timestamps.
   *
   * @param sessionId the session ID
   * @return the updated session
   */
  Session touchSession(UUID sessionId);
}
