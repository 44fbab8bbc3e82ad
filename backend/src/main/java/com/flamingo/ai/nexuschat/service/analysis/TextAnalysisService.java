package com.flamingo.ai.nexuschat.service.analysis;

import com.flamingo.ai.nexuschat.agent.TextAnalysisAgent;
import com.flamingo.ai.nexuschat.config.NexusConfig;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Writes the model summary stored as an item's text analysis. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextAnalysisService {

  static final String FALLBACK = "Unable to analyze the content at this time.";

  private final TextAnalysisAgent textAnalysisAgent;
  private final NexusConfig nexusConfig;

  /**
   * Summarises extracted text. Agent failures yield a failed result carrying a fixed fallback
   * sentence.
   *
   * @param fileName filename, for logging
   * @param extractedText non-empty extracted text
   */
  @Timed(value = "analysis.text", description = "Time to summarise extracted text")
  public TextAnalysisResult analyze(String fileName, String extractedText) {
    int limit = nexusConfig.getTextAnalysis().getMaxInputChars();
    String truncated =
        extractedText.length() > limit ? extractedText.substring(0, limit) : extractedText;
    try {
      log.debug(
          "Analysing '{}' (input {} chars, truncated to {})",
          fileName,
          extractedText.length(),
          truncated.length());
      return TextAnalysisResult.success(textAnalysisAgent.analyze(truncated));
    } catch (Exception e) {
      log.warn("Text analysis failed for '{}': {}", fileName, e.getMessage());
      return TextAnalysisResult.failure(FALLBACK, String.valueOf(e.getMessage()));
    }
  }
}
