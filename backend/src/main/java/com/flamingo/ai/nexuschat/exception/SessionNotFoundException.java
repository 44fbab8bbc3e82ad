package com.flamingo.ai.nexuschat.exception;

import java.util.UUID;

/** Exception thrown when a session does not exist or is not owned by the caller. */
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SessionNotFoundException(UUID sessionId) {
    super("Session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
