package com.flamingo.ai.nexuschat.domain.enums;

/** How the prompt context for an answer was assembled. */
public enum ContextMode {
  /** Answer restricted to content of the session's uploaded files. */
  FILE_GROUNDED,

  /** Answer based on recent chat history only. */
  CONVERSATIONAL
}
