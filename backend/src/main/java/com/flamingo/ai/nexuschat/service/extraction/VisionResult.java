package com.flamingo.ai.nexuschat.service.extraction;

/**
 * Outcome of a visual-description call.
 *
 * @param succeeded whether the model returned a non-empty description
 * @param description the description, or a user-facing failure sentence
 * @param instruction the caller instruction embedded in the prompt
 */
public record VisionResult(boolean succeeded, String description, String instruction) {

  static final String FAILURE_PREFIX = "Unable to analyze the image visually. Error: ";

  public static VisionResult success(String description, String instruction) {
    return new VisionResult(true, description, instruction);
  }

  public static VisionResult failure(String diagnostic, String instruction) {
    return new VisionResult(false, FAILURE_PREFIX + diagnostic, instruction);
  }
}
