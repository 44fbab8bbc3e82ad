package com.flamingo.ai.nexuschat.service.extraction;

import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts the text layer of a PDF with Apache PDFBox 3.x. */
@Component
@Slf4j
public class PdfTextExtractor {

  /**
   * Extracts the text of every page, in page order.
   *
   * @param pdfFile PDF on disk
   * @return the trimmed text, or a failed result for corrupt, encrypted or unreadable files
   */
  public ExtractionResult extract(Path pdfFile) {
    try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      String text = stripper.getText(document);
      log.debug("Extracted {} chars from {} PDF pages", text.length(), document.getNumberOfPages());
      return ExtractionResult.ok(text);
    } catch (IOException | RuntimeException e) {
      log.warn("PDF text extraction failed for {}: {}", pdfFile.getFileName(), e.getMessage());
      return ExtractionResult.failed("PDF extraction failed: " + e.getMessage());
    }
  }
}
