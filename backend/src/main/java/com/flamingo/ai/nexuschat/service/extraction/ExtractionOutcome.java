package com.flamingo.ai.nexuschat.service.extraction;

import com.flamingo.ai.nexuschat.domain.enums.ItemKind;

/**
 * Everything extraction learned about one upload.
 *
 * @param kind declared item kind
 * @param textResult text extraction outcome
 * @param vision visual-description outcome, null when the upload is not an image
 */
public record ExtractionOutcome(ItemKind kind, ExtractionResult textResult, VisionResult vision) {

  public String text() {
    return textResult.text();
  }

  public boolean visualSucceeded() {
    return vision != null && vision.succeeded();
  }
}
