package com.flamingo.ai.nexuschat.service.context;

import com.flamingo.ai.nexuschat.domain.enums.ContextMode;

/**
 * Prompt context assembled for one answer.
 *
 * @param mode whether the text is a file-grounded prompt or conversation history
 * @param text the assembled text; empty is valid in conversational mode
 */
public record ComposedContext(ContextMode mode, String text) {

  public boolean isFileGrounded() {
    return mode == ContextMode.FILE_GROUNDED;
  }
}
