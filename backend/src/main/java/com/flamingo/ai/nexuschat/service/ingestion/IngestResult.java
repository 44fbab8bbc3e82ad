package com.flamingo.ai.nexuschat.service.ingestion;

import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import java.util.List;
import java.util.UUID;

/**
 * Result of ingesting one upload.
 *
 * @param itemId id of the stored item
 * @param fileName original filename
 * @param kind declared item kind
 * @param extractedTextPreview leading part of the extracted text, null when there is none
 * @param visionPreview leading part of the visual description, null unless it succeeded
 * @param analyses analyses produced, in the order they ran
 */
public record IngestResult(
    UUID itemId,
    String fileName,
    ItemKind kind,
    String extractedTextPreview,
    String visionPreview,
    List<AnalysisOutcome> analyses) {

  public boolean analysisAvailable() {
    return !analyses.isEmpty();
  }
}
