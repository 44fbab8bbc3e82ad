package com.flamingo.ai.nexuschat.service.responder;

import java.util.List;
import java.util.Locale;

/**
 * Classification of model-call failures into user-facing sentences.
 *
 * <p>Categories are matched in declaration order against the lower-cased failure message.
 */
public enum ModelFailureCategory {
  CONFIGURATION(
      List.of("not found", "404"),
      "I apologize, but I'm having trouble connecting to the AI service: Model not found. "
          + "Please check the API configuration."),
  PERMISSION(
      List.of("permission", "403"),
      "I apologize, but there's an API permission issue. Please check your API key."),
  RATE_LIMIT(
      List.of("quota", "limit"),
      "I apologize, but the API quota has been exceeded. Please try again later."),
  CREDENTIALS(
      List.of("key", "auth"),
      "I apologize, but there's an authentication issue with the AI service."),
  GENERIC(List.of(), "I apologize, but I'm having trouble connecting to the AI service: ");

  private final List<String> markers;
  private final String sentence;

  ModelFailureCategory(List<String> markers, String sentence) {
    this.markers = markers;
    this.sentence = sentence;
  }

  /** Picks the first category whose markers occur in the message. */
  public static ModelFailureCategory classify(String failureMessage) {
    String lower = failureMessage == null ? "" : failureMessage.toLowerCase(Locale.ROOT);
    for (ModelFailureCategory category : values()) {
      if (category.markers.stream().anyMatch(lower::contains)) {
        return category;
      }
    }
    return GENERIC;
  }

  /**
   * User-facing sentence for this category.
   *
   * @param diagnostic raw failure message, appended only for GENERIC
   * @param maxDiagnosticChars cut applied to the appended diagnostic
   */
  public String sentence(String diagnostic, int maxDiagnosticChars) {
    if (this != GENERIC) {
      return sentence;
    }
    String raw = diagnostic == null ? "" : diagnostic;
    String cut = raw.length() > maxDiagnosticChars ? raw.substring(0, maxDiagnosticChars) : raw;
    return sentence + cut;
  }
}
