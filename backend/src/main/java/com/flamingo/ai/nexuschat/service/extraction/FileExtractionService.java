package com.flamingo.ai.nexuschat.service.extraction;

import com.flamingo.ai.nexuschat.domain.enums.UploadType;
import com.flamingo.ai.nexuschat.exception.UnsupportedFileTypeException;
import com.flamingo.ai.nexuschat.service.tempfile.TempFiles;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Dispatches an upload to the extraction backends for its {@link UploadType}.
 *
 * <p>Each call uses at most one temporary file. OCR and the visual description are independent:
 * an OCR failure never prevents the description call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FileExtractionService {

  private final TempFiles tempFiles;
  private final PdfTextExtractor pdfTextExtractor;
  private final OcrEngine ocrEngine;
  private final VisionAnalysisService visionAnalysisService;

  /**
   * Extracts text and, for images, a visual description.
   *
   * @param bytes upload content
   * @param uploadType type resolved from the filename
   * @param fileName original filename, used for the temp file suffix and diagnostics
   * @param mimeType MIME type passed to the vision model
   * @param instruction optional vision instruction
   * @throws UnsupportedFileTypeException for {@link UploadType#UNSUPPORTED}
   */
  @Timed(value = "extraction.extract", description = "Time to extract an upload")
  public ExtractionOutcome extract(
      byte[] bytes, UploadType uploadType, String fileName, String mimeType, String instruction) {
    String suffix = "." + UploadType.extensionOf(fileName);
    return switch (uploadType) {
      case DOCUMENT -> new ExtractionOutcome(
          uploadType.itemKind(),
          extractWithTempFile(bytes, suffix, fileName, pdfTextExtractor::extract),
          null);
      case IMAGE -> {
        ExtractionResult ocr = extractWithTempFile(bytes, suffix, fileName, ocrEngine::recognize);
        VisionResult vision = visionAnalysisService.describe(bytes, mimeType, instruction);
        if (!vision.succeeded()) {
          log.warn("Vision analysis failed for '{}'", fileName);
        }
        yield new ExtractionOutcome(uploadType.itemKind(), ocr, vision);
      }
      case PLAIN_TEXT -> new ExtractionOutcome(
          uploadType.itemKind(),
          ExtractionResult.ok(new String(bytes, StandardCharsets.UTF_8)),
          null);
      case UNSUPPORTED -> throw new UnsupportedFileTypeException(fileName);
    };
  }

  private ExtractionResult extractWithTempFile(
      byte[] bytes, String suffix, String fileName, Function<Path, ExtractionResult> backend) {
    try {
      ExtractionResult result = tempFiles.withTempFile(bytes, suffix, backend);
      if (!result.succeeded()) {
        log.warn("Extraction degraded for '{}': {}", fileName, result.diagnostic());
      }
      return result;
    } catch (IOException e) {
      log.warn("Could not stage '{}' for extraction: {}", fileName, e.getMessage());
      return ExtractionResult.failed("Could not write temporary file: " + e.getMessage());
    }
  }
}
