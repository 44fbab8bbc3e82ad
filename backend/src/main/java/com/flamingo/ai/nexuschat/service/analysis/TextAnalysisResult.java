package com.flamingo.ai.nexuschat.service.analysis;

/**
 * Outcome of summarising extracted text.
 *
 * @param summary the summary, or the fallback sentence when the agent failed
 * @param succeeded whether the agent returned a summary
 * @param diagnostic failure description, null on success
 */
public record TextAnalysisResult(String summary, boolean succeeded, String diagnostic) {

  public static TextAnalysisResult success(String summary) {
    return new TextAnalysisResult(summary == null ? "" : summary, true, null);
  }

  public static TextAnalysisResult failure(String fallback, String diagnostic) {
    return new TextAnalysisResult(fallback, false, diagnostic);
  }
}
