package com.flamingo.ai.nexuschat.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import com.flamingo.ai.nexuschat.domain.enums.UploadType;
import com.flamingo.ai.nexuschat.exception.SessionNotFoundException;
import com.flamingo.ai.nexuschat.exception.UnsupportedFileTypeException;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisStore;
import com.flamingo.ai.nexuschat.service.analysis.TextAnalysisResult;
import com.flamingo.ai.nexuschat.service.analysis.TextAnalysisService;
import com.flamingo.ai.nexuschat.service.extraction.ExtractionOutcome;
import com.flamingo.ai.nexuschat.service.extraction.ExtractionResult;
import com.flamingo.ai.nexuschat.service.extraction.FileExtractionService;
import com.flamingo.ai.nexuschat.service.extraction.VisionAnalysisService;
import com.flamingo.ai.nexuschat.service.extraction.VisionResult;
import com.flamingo.ai.nexuschat.service.item.ItemService;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionServiceImplTest {

  private static final String USER = "u1";
  private static final String DEFAULT_INSTRUCTION = "Describe what you see in this image";

  @Mock private SessionService sessionService;

  @Mock private ItemService itemService;

  @Mock private AnalysisStore analysisStore;

  @Mock private FileExtractionService fileExtractionService;

  @Mock private VisionAnalysisService visionAnalysisService;

  @Mock private TextAnalysisService textAnalysisService;

  @Mock private MeterRegistry meterRegistry;

  @Mock private Counter counter;

  @Mock private PlatformTransactionManager transactionManager;

  private NexusConfig nexusConfig;
  private IngestionServiceImpl ingestionService;
  private Session session;
  private UUID itemId;

  @BeforeEach
  void setUp() {
    nexusConfig = new NexusConfig();
    ingestionService =
        new IngestionServiceImpl(
            sessionService,
            itemService,
            analysisStore,
            fileExtractionService,
            visionAnalysisService,
            textAnalysisService,
            nexusConfig,
            meterRegistry,
            transactionManager);

    session = Session.builder().id(UUID.randomUUID()).userId(USER).title("t").build();
    itemId = UUID.randomUUID();

    when(sessionService.getOwnedSession(session.getId(), USER)).thenReturn(session);
    when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    when(meterRegistry.counter(any(String.class), any(String.class), any(String.class)))
        .thenReturn(counter);
    when(itemService.insertItem(
            eq(session), eq(USER), anyString(), any(ItemKind.class), anyString(), any(), any()))
        .thenAnswer(
            inv ->
                UploadedItem.builder()
                    .id(itemId)
                    .session(session)
                    .userId(USER)
                    .fileName(inv.getArgument(2))
                    .kind(inv.getArgument(3))
                    .mimeType(inv.getArgument(4))
                    .content(inv.getArgument(5))
                    .extractedText(inv.getArgument(6))
                    .build());
    when(analysisStore.record(any(), any(), any(), any())).thenAnswer(inv -> UUID.randomUUID());
  }

  @Test
  void shouldStoreTextRecordAndPreview_whenPdfHasText() {
    // Given
    String text = "Total due: 42 EUR. ".repeat(40);
    byte[] bytes = "%PDF-1.4".getBytes(StandardCharsets.US_ASCII);
    when(fileExtractionService.extract(
            bytes, UploadType.DOCUMENT, "invoice.pdf", "application/pdf", null))
        .thenReturn(new ExtractionOutcome(ItemKind.PDF, ExtractionResult.ok(text), null));
    when(textAnalysisService.analyze(eq("invoice.pdf"), anyString()))
        .thenReturn(TextAnalysisResult.success("An invoice."));

    // When
    IngestResult result = ingestionService.ingest(session.getId(), USER, "invoice.pdf", bytes);

    // Then
    assertThat(result.itemId()).isEqualTo(itemId);
    assertThat(result.kind()).isEqualTo(ItemKind.PDF);
    assertThat(result.extractedTextPreview()).hasSize(500);
    assertThat(text.trim()).startsWith(result.extractedTextPreview());
    assertThat(result.visionPreview()).isNull();
    assertThat(result.analyses())
        .singleElement()
        .satisfies(
            a -> {
              assertThat(a.kind()).isEqualTo(AnalysisKind.TEXT_ANALYSIS);
              assertThat(a.content()).isEqualTo("An invoice.");
              assertThat(a.success()).isTrue();
              assertThat(a.recordId()).isNotNull();
            });
    assertThat(result.analysisAvailable()).isTrue();
    verify(analysisStore)
        .record(itemId, session.getId(), AnalysisKind.TEXT_ANALYSIS, "An invoice.");
    verify(sessionService).touchSession(session.getId());
  }

  @Test
  void shouldSkipVisionRecord_whenImageDescriptionFails() {
    // Given
    byte[] bytes = new byte[] {(byte) 0x89, 'P', 'N', 'G'};
    VisionResult failed = VisionResult.failure("HTTP 500", DEFAULT_INSTRUCTION);
    when(fileExtractionService.extract(bytes, UploadType.IMAGE, "scan.png", "image/png", null))
        .thenReturn(
            new ExtractionOutcome(ItemKind.IMAGE, ExtractionResult.failed("OCR failed"), failed));

    // When
    IngestResult result = ingestionService.ingest(session.getId(), USER, "scan.png", bytes);

    // Then
    assertThat(result.kind()).isEqualTo(ItemKind.IMAGE);
    assertThat(result.extractedTextPreview()).isNull();
    assertThat(result.visionPreview()).isNull();
    assertThat(result.analyses())
        .singleElement()
        .satisfies(
            a -> {
              assertThat(a.kind()).isEqualTo(AnalysisKind.VISION_ANALYSIS);
              assertThat(a.success()).isFalse();
              assertThat(a.content()).contains("HTTP 500");
              assertThat(a.recordId()).isNull();
            });
    verifyNoInteractions(analysisStore);
    verifyNoInteractions(textAnalysisService);
  }

  @Test
  void shouldStoreTextAndVisionRecords_whenImageFullyAnalysed() {
    // Given
    byte[] bytes = new byte[] {1, 2, 3};
    String description = "A receipt on a wooden table. ".repeat(20);
    when(fileExtractionService.extract(bytes, UploadType.IMAGE, "receipt.jpg", "image/jpeg", null))
        .thenReturn(
            new ExtractionOutcome(
                ItemKind.IMAGE,
                ExtractionResult.ok("TOTAL 12.00"),
                VisionResult.success(description, DEFAULT_INSTRUCTION)));
    when(textAnalysisService.analyze("receipt.jpg", "TOTAL 12.00"))
        .thenReturn(TextAnalysisResult.success("A receipt."));

    // When
    IngestResult result = ingestionService.ingest(session.getId(), USER, "receipt.jpg", bytes);

    // Then
    assertThat(result.extractedTextPreview()).isEqualTo("TOTAL 12.00");
    assertThat(result.visionPreview()).isEqualTo(description.substring(0, 300));
    assertThat(result.analyses())
        .extracting(AnalysisOutcome::kind)
        .containsExactly(AnalysisKind.TEXT_ANALYSIS, AnalysisKind.VISION_ANALYSIS);
    verify(analysisStore)
        .record(itemId, session.getId(), AnalysisKind.VISION_ANALYSIS, description);
  }

  @Test
  void shouldReportFailedTextAnalysis_whenSummariserFails() {
    // Given
    byte[] bytes = "meeting notes".getBytes(StandardCharsets.UTF_8);
    when(fileExtractionService.extract(
            bytes, UploadType.PLAIN_TEXT, "notes.txt", "text/plain", null))
        .thenReturn(
            new ExtractionOutcome(ItemKind.OTHER, ExtractionResult.ok("meeting notes"), null));
    when(textAnalysisService.analyze("notes.txt", "meeting notes"))
        .thenReturn(
            TextAnalysisResult.failure(
                "Unable to analyze the content at this time.", "HTTP 429 quota exceeded"));

    // When
    IngestResult result = ingestionService.ingest(session.getId(), USER, "notes.txt", bytes);

    // Then
    assertThat(result.extractedTextPreview()).isEqualTo("meeting notes");
    assertThat(result.analyses())
        .singleElement()
        .satisfies(
            a -> {
              assertThat(a.kind()).isEqualTo(AnalysisKind.TEXT_ANALYSIS);
              assertThat(a.success()).isFalse();
              assertThat(a.content()).isEqualTo("Unable to analyze the content at this time.");
              assertThat(a.recordId()).isNull();
            });
    verifyNoInteractions(analysisStore);
    verify(itemService)
        .insertItem(
            eq(session), eq(USER), eq("notes.txt"), eq(ItemKind.OTHER), anyString(), any(), any());
  }

  @Test
  void shouldRejectUpload_whenExtensionNotAllowed() {
    // When / Then
    assertThatThrownBy(
            () -> ingestionService.ingest(session.getId(), USER, "macro.docx", new byte[] {1}))
        .isInstanceOf(UnsupportedFileTypeException.class);
    verifyNoInteractions(fileExtractionService, itemService);
  }

  @Test
  void shouldRejectUpload_whenExtensionRemovedFromAllowList() {
    // Given
    nexusConfig.getUpload().setAllowedExtensions(Set.of("pdf"));

    // When / Then
    assertThatThrownBy(
            () -> ingestionService.ingest(session.getId(), USER, "notes.txt", new byte[] {1}))
        .isInstanceOf(UnsupportedFileTypeException.class);
  }

  @Test
  void shouldRejectUpload_whenFileEmpty() {
    // When / Then
    assertThatThrownBy(
            () -> ingestionService.ingest(session.getId(), USER, "notes.txt", new byte[0]))
        .isInstanceOf(UnsupportedFileTypeException.class)
        .hasMessageContaining("Empty upload");
    verifyNoInteractions(fileExtractionService);
  }

  @Test
  void shouldRejectUpload_whenSessionNotOwned() {
    // Given
    UUID foreign = UUID.randomUUID();
    when(sessionService.getOwnedSession(foreign, USER))
        .thenThrow(new SessionNotFoundException(foreign));

    // When / Then
    assertThatThrownBy(() -> ingestionService.ingest(foreign, USER, "a.txt", new byte[] {1}))
        .isInstanceOf(SessionNotFoundException.class);
    verifyNoInteractions(fileExtractionService, itemService);
  }

  @Test
  void shouldAppendCustomRecord_whenReanalysisSucceeds() {
    // Given
    UploadedItem image = storedImage();
    when(itemService.getOwnedImage(itemId, USER)).thenReturn(image);
    when(visionAnalysisService.resolveInstruction("Count the cats")).thenReturn("Count the cats");
    when(visionAnalysisService.describe(image.getContent(), "image/png", "Count the cats"))
        .thenReturn(VisionResult.success("Three cats.", "Count the cats"));

    // When
    ReanalysisResult result = ingestionService.reanalyzeImage(itemId, USER, "Count the cats");

    // Then
    assertThat(result.success()).isTrue();
    assertThat(result.description()).isEqualTo("Three cats.");
    assertThat(result.promptUsed()).isEqualTo("Count the cats");
    assertThat(result.fileName()).isEqualTo("cats.png");
    assertThat(result.recordId()).isNotNull();
    verify(analysisStore)
        .record(itemId, session.getId(), AnalysisKind.VISION_CUSTOM, "Three cats.");
    verify(analysisStore, never()).deleteForItem(any());
  }

  @Test
  void shouldUseDefaultInstruction_whenReanalysisPromptBlank() {
    // Given
    UploadedItem image = storedImage();
    when(itemService.getOwnedImage(itemId, USER)).thenReturn(image);
    when(visionAnalysisService.resolveInstruction(isNull())).thenReturn(DEFAULT_INSTRUCTION);
    when(visionAnalysisService.describe(any(), anyString(), eq(DEFAULT_INSTRUCTION)))
        .thenReturn(VisionResult.success("A cat.", DEFAULT_INSTRUCTION));

    // When
    ReanalysisResult result = ingestionService.reanalyzeImage(itemId, USER, null);

    // Then
    assertThat(result.promptUsed()).isEqualTo(DEFAULT_INSTRUCTION);
  }

  @Test
  void shouldStoreNothing_whenReanalysisFails() {
    // Given
    UploadedItem image = storedImage();
    when(itemService.getOwnedImage(itemId, USER)).thenReturn(image);
    when(visionAnalysisService.resolveInstruction("again")).thenReturn("again");
    when(visionAnalysisService.describe(any(), anyString(), eq("again")))
        .thenReturn(VisionResult.failure("timeout", "again"));

    // When
    ReanalysisResult result = ingestionService.reanalyzeImage(itemId, USER, "again");

    // Then
    assertThat(result.success()).isFalse();
    assertThat(result.recordId()).isNull();
    assertThat(result.description()).contains("timeout");
    verifyNoInteractions(analysisStore);
  }

  @Test
  void shouldCheckOwnership_beforeListingAnalyses() {
    // When
    ingestionService.listAnalyses(session.getId(), USER);

    // Then
    verify(sessionService).getOwnedSession(session.getId(), USER);
    verify(analysisStore).listForSession(session.getId());
  }

  private UploadedItem storedImage() {
    return UploadedItem.builder()
        .id(itemId)
        .session(session)
        .userId(USER)
        .fileName("cats.png")
        .kind(ItemKind.IMAGE)
        .mimeType("image/png")
        .content(new byte[] {9, 9})
        .build();
  }
}
