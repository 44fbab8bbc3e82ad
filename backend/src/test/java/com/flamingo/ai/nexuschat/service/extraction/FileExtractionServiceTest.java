package com.flamingo.ai.nexuschat.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import com.flamingo.ai.nexuschat.domain.enums.UploadType;
import com.flamingo.ai.nexuschat.exception.UnsupportedFileTypeException;
import com.flamingo.ai.nexuschat.service.tempfile.TempFiles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FileExtractionServiceTest {

  private static final byte[] BYTES = {1, 2, 3, 4};

  @Mock private PdfTextExtractor pdfTextExtractor;

  @Mock private OcrEngine ocrEngine;

  @Mock private VisionAnalysisService visionAnalysisService;

  private final List<Path> stagedFiles = new ArrayList<>();

  private FileExtractionService fileExtractionService;

  @BeforeEach
  void setUp() {
    NexusConfig config = new NexusConfig();
    config.getTempFiles().setDeleteInitialDelay(Duration.ofMillis(1));
    fileExtractionService =
        new FileExtractionService(
            new TempFiles(config), pdfTextExtractor, ocrEngine, visionAnalysisService);
    when(pdfTextExtractor.extract(any(Path.class)))
        .thenAnswer(
            invocation -> {
              Path path = invocation.getArgument(0);
              stagedFiles.add(path);
              assertThat(Files.readAllBytes(path)).isEqualTo(BYTES);
              return ExtractionResult.ok("  Invoice total: 42 EUR \n");
            });
  }

  @Test
  void shouldExtractPdfText_throughOneTempFile() {
    // When
    ExtractionOutcome outcome =
        fileExtractionService.extract(
            BYTES, UploadType.DOCUMENT, "invoice.pdf", "application/pdf", null);

    // Then
    assertThat(outcome.kind()).isEqualTo(ItemKind.PDF);
    assertThat(outcome.text()).isEqualTo("Invoice total: 42 EUR");
    assertThat(outcome.vision()).isNull();
    assertThat(outcome.visualSucceeded()).isFalse();
    assertThat(stagedFiles).hasSize(1);
    assertThat(stagedFiles.get(0).getFileName().toString()).endsWith(".pdf");
    assertThat(stagedFiles.get(0)).doesNotExist();
    verifyNoInteractions(ocrEngine, visionAnalysisService);
  }

  @Test
  void shouldStillDescribeImage_whenOcrFails() {
    // Given
    when(ocrEngine.recognize(any(Path.class)))
        .thenReturn(ExtractionResult.failed("OCR failed: no tessdata"));
    when(visionAnalysisService.describe(eq(BYTES), eq("image/png"), any()))
        .thenReturn(VisionResult.success("A receipt on a table.", "Describe"));

    // When
    ExtractionOutcome outcome =
        fileExtractionService.extract(BYTES, UploadType.IMAGE, "receipt.png", "image/png", null);

    // Then
    assertThat(outcome.kind()).isEqualTo(ItemKind.IMAGE);
    assertThat(outcome.text()).isEmpty();
    assertThat(outcome.textResult().succeeded()).isFalse();
    assertThat(outcome.textResult().diagnostic()).contains("no tessdata");
    assertThat(outcome.visualSucceeded()).isTrue();
    assertThat(outcome.vision().description()).isEqualTo("A receipt on a table.");
  }

  @Test
  void shouldKeepOcrText_whenVisionFails() {
    // Given
    when(ocrEngine.recognize(any(Path.class))).thenReturn(ExtractionResult.ok("TOTAL 12.50"));
    when(visionAnalysisService.describe(any(byte[].class), anyString(), any()))
        .thenReturn(VisionResult.failure("timeout", "Describe"));

    // When
    ExtractionOutcome outcome =
        fileExtractionService.extract(BYTES, UploadType.IMAGE, "receipt.jpg", "image/jpeg", null);

    // Then
    assertThat(outcome.text()).isEqualTo("TOTAL 12.50");
    assertThat(outcome.visualSucceeded()).isFalse();
    assertThat(outcome.vision().description())
        .isEqualTo("Unable to analyze the image visually. Error: timeout");
  }

  @Test
  void shouldDecodePlainText_withoutTempFile() {
    // Given
    byte[] text = "  Meeting notes: ship on Friday  ".getBytes(StandardCharsets.UTF_8);

    // When
    ExtractionOutcome outcome =
        fileExtractionService.extract(text, UploadType.PLAIN_TEXT, "notes.txt", "text/plain", null);

    // Then
    assertThat(outcome.kind()).isEqualTo(ItemKind.OTHER);
    assertThat(outcome.text()).isEqualTo("Meeting notes: ship on Friday");
    verify(pdfTextExtractor, never()).extract(any(Path.class));
    verifyNoInteractions(ocrEngine, visionAnalysisService);
  }

  @Test
  void shouldRejectUnsupportedType() {
    assertThatThrownBy(
            () ->
                fileExtractionService.extract(
                    BYTES, UploadType.UNSUPPORTED, "archive.zip", "application/zip", null))
        .isInstanceOf(UnsupportedFileTypeException.class);
    verifyNoInteractions(ocrEngine, visionAnalysisService);
  }

  @Test
  void shouldReturnDegradedResult_whenBackendReportsFailure() {
    // Given
    PdfTextExtractor failing = mock(PdfTextExtractor.class);
    when(failing.extract(any(Path.class)))
        .thenReturn(ExtractionResult.failed("PDF extraction failed: encrypted"));
    FileExtractionService service =
        new FileExtractionService(
            new TempFiles(new NexusConfig()), failing, ocrEngine, visionAnalysisService);

    // When
    ExtractionOutcome outcome =
        service.extract(BYTES, UploadType.DOCUMENT, "locked.pdf", "application/pdf", null);

    // Then
    assertThat(outcome.text()).isEmpty();
    assertThat(outcome.textResult().succeeded()).isFalse();
    assertThat(outcome.textResult().diagnostic()).contains("encrypted");
  }
}
