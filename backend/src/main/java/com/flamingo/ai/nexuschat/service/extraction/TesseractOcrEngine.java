package com.flamingo.ai.nexuschat.service.extraction;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

/**
 * {@link OcrEngine} backed by Tesseract through Tess4J.
 *
 * <p>A new {@link Tesseract} instance is created per call since instances are not thread-safe.
 * A missing native library surfaces as a failed result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  private final NexusConfig nexusConfig;

  @Override
  public ExtractionResult recognize(Path imageFile) {
    try {
      String text = newTesseract().doOCR(imageFile.toFile());
      log.debug("OCR recognised {} chars in {}", text == null ? 0 : text.length(), imageFile);
      return ExtractionResult.ok(text);
    } catch (TesseractException | RuntimeException | LinkageError e) {
      log.warn("OCR failed for {}: {}", imageFile.getFileName(), e.getMessage());
      return ExtractionResult.failed("OCR failed: " + e.getMessage());
    }
  }

  private ITesseract newTesseract() {
    NexusConfig.Ocr ocr = nexusConfig.getOcr();
    Tesseract tesseract = new Tesseract();
    if (ocr.getDatapath() != null && !ocr.getDatapath().isBlank()) {
      tesseract.setDatapath(ocr.getDatapath());
    }
    tesseract.setLanguage(ocr.getLanguage());
    return tesseract;
  }
}
