package com.flamingo.ai.nexuschat.service.context;

import java.util.UUID;

/** Builds the bounded prompt context for a question. */
public interface ContextComposer {

  /**
   * Composes the context from the session's items, their latest vision records and recent
   * messages. Must be called before the question itself is stored.
   *
   * @param sessionId the session
   * @param question the user's question
   * @return file-grounded context when any item has text or a vision summary, otherwise
   *     conversational history
   */
  ComposedContext compose(UUID sessionId, String question);
}
