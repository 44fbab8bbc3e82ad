package com.flamingo.ai.nexuschat.service.extraction;

import java.nio.file.Path;

/** Best-effort optical character recognition over an image file. */
public interface OcrEngine {

  /**
   * Recognises the text in an image.
   *
   * @param imageFile image on disk
   * @return the recognised text, or a failed result; never throws
   */
  ExtractionResult recognize(Path imageFile);
}
