package com.flamingo.ai.nexuschat.service.extraction;

/**
 * Outcome of a text extraction attempt.
 *
 * <p>A failed extraction carries empty text and a diagnostic; it is never thrown.
 *
 * @param text extracted text, never null
 * @param succeeded whether the backend completed without error
 * @param diagnostic failure description, null on success
 */
public record ExtractionResult(String text, boolean succeeded, String diagnostic) {

  public ExtractionResult {
    text = text == null ? "" : text;
  }

  public static ExtractionResult ok(String text) {
    return new ExtractionResult(text == null ? "" : text.trim(), true, null);
  }

  public static ExtractionResult failed(String diagnostic) {
    return new ExtractionResult("", false, diagnostic);
  }

  public boolean hasText() {
    return !text.isEmpty();
  }
}
