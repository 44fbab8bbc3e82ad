package com.flamingo.ai.nexuschat.domain.enums;

import java.util.Locale;

/** Defines who wrote a chat message. */
public enum MessageRole {
  /** Message from the user. */
  USER,

  /** Reply produced by the model. */
  ASSISTANT;

  /** Lower-case sender name used when rendering conversation history. */
  public String senderName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
