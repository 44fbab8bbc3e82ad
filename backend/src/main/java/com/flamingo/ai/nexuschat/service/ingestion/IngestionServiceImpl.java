package com.flamingo.ai.nexuschat.service.ingestion;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import com.flamingo.ai.nexuschat.domain.enums.UploadType;
import com.flamingo.ai.nexuschat.exception.UnsupportedFileTypeException;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisStore;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisView;
import com.flamingo.ai.nexuschat.service.analysis.TextAnalysisResult;
import com.flamingo.ai.nexuschat.service.analysis.TextAnalysisService;
import com.flamingo.ai.nexuschat.service.extraction.ExtractionOutcome;
import com.flamingo.ai.nexuschat.service.extraction.FileExtractionService;
import com.flamingo.ai.nexuschat.service.extraction.VisionAnalysisService;
import com.flamingo.ai.nexuschat.service.extraction.VisionResult;
import com.flamingo.ai.nexuschat.service.item.ItemService;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Implementation of the IngestionService.
 *
 * <p>Extraction and model calls run outside any transaction. The item, its records and the
 * session touch are then written in one transaction.
 */
@Service
@Slf4j
public class IngestionServiceImpl implements IngestionService {

  private static final Tika TIKA = new Tika();
  private static final String FALLBACK_MIME_TYPE = "application/octet-stream";

  private final SessionService sessionService;
  private final ItemService itemService;
  private final AnalysisStore analysisStore;
  private final FileExtractionService fileExtractionService;
  private final VisionAnalysisService visionAnalysisService;
  private final TextAnalysisService textAnalysisService;
  private final NexusConfig nexusConfig;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate storeTx;

  public IngestionServiceImpl(
      SessionService sessionService,
      ItemService itemService,
      AnalysisStore analysisStore,
      FileExtractionService fileExtractionService,
      VisionAnalysisService visionAnalysisService,
      TextAnalysisService textAnalysisService,
      NexusConfig nexusConfig,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.sessionService = sessionService;
    this.itemService = itemService;
    this.analysisStore = analysisStore;
    this.fileExtractionService = fileExtractionService;
    this.visionAnalysisService = visionAnalysisService;
    this.textAnalysisService = textAnalysisService;
    this.nexusConfig = nexusConfig;
    this.meterRegistry = meterRegistry;
    this.storeTx = new TransactionTemplate(transactionManager);
  }

  @Override
  @Timed(value = "ingestion.ingest", description = "Time to ingest an upload")
  public IngestResult ingest(UUID sessionId, String userId, String fileName, byte[] bytes) {
    Session session = sessionService.getOwnedSession(sessionId, userId);
    UploadType uploadType = resolveUploadType(fileName);
    if (bytes == null || bytes.length == 0) {
      throw new UnsupportedFileTypeException(
          fileName, "Empty upload: " + fileName, "Uploaded file is empty");
    }

    log.info(
        "Ingesting '{}' ({} bytes, {}) into session {}",
        fileName,
        bytes.length,
        uploadType,
        sessionId);
    String mimeType = detectMimeType(fileName);
    ExtractionOutcome outcome =
        fileExtractionService.extract(bytes, uploadType, fileName, mimeType, null);

    TextAnalysisResult textAnalysis =
        outcome.text().isEmpty() ? null : textAnalysisService.analyze(fileName, outcome.text());

    IngestResult result =
        storeTx.execute(
            status -> store(session, userId, fileName, mimeType, bytes, outcome, textAnalysis));

    meterRegistry.counter("ingestion.uploads", "kind", outcome.kind().getWireName()).increment();
    log.info(
        "Stored item {} for '{}' with {} analyses",
        result.itemId(),
        fileName,
        result.analyses().size());
    return result;
  }

  private IngestResult store(
      Session session,
      String userId,
      String fileName,
      String mimeType,
      byte[] bytes,
      ExtractionOutcome outcome,
      TextAnalysisResult textAnalysis) {
    UploadedItem item =
        itemService.insertItem(
            session, userId, fileName, outcome.kind(), mimeType, bytes, outcome.text());

    List<AnalysisOutcome> analyses = new ArrayList<>();
    if (textAnalysis != null) {
      UUID recordId = null;
      if (textAnalysis.succeeded()) {
        recordId =
            analysisStore.record(
                item.getId(), session.getId(), AnalysisKind.TEXT_ANALYSIS, textAnalysis.summary());
      }
      analyses.add(
          new AnalysisOutcome(
              AnalysisKind.TEXT_ANALYSIS,
              textAnalysis.summary(),
              textAnalysis.succeeded(),
              recordId));
    }

    String visionPreview = null;
    VisionResult vision = outcome.vision();
    if (vision != null) {
      UUID recordId = null;
      if (vision.succeeded()) {
        recordId =
            analysisStore.record(
                item.getId(), session.getId(), AnalysisKind.VISION_ANALYSIS, vision.description());
        visionPreview =
            preview(vision.description(), nexusConfig.getUpload().getVisionPreviewChars());
      }
      analyses.add(
          new AnalysisOutcome(
              AnalysisKind.VISION_ANALYSIS, vision.description(), vision.succeeded(), recordId));
    }

    sessionService.touchSession(session.getId());

    String textPreview =
        outcome.text().isEmpty()
            ? null
            : preview(outcome.text(), nexusConfig.getUpload().getTextPreviewChars());
    return new IngestResult(
        item.getId(), fileName, outcome.kind(), textPreview, visionPreview, List.copyOf(analyses));
  }

  @Override
  @Timed(value = "ingestion.reanalyze", description = "Time to re-describe an image")
  public ReanalysisResult reanalyzeImage(UUID itemId, String userId, String instruction) {
    UploadedItem item = itemService.getOwnedImage(itemId, userId);
    String promptUsed = visionAnalysisService.resolveInstruction(instruction);
    log.info("Re-analysing image {} ('{}')", itemId, item.getFileName());

    VisionResult vision =
        visionAnalysisService.describe(item.getContent(), item.getMimeType(), promptUsed);

    UUID recordId = null;
    if (vision.succeeded()) {
      recordId =
          analysisStore.record(
              item.getId(),
              item.getSession().getId(),
              AnalysisKind.VISION_CUSTOM,
              vision.description());
      log.debug(
          "Image {} now has {} custom analyses",
          itemId,
          analysisStore.countForItem(itemId, AnalysisKind.VISION_CUSTOM));
    } else {
      log.warn("Re-analysis of image {} failed", itemId);
    }
    return new ReanalysisResult(
        vision.succeeded(), vision.description(), promptUsed, item.getFileName(), recordId);
  }

  @Override
  public List<AnalysisView> listAnalyses(UUID sessionId, String userId) {
    sessionService.getOwnedSession(sessionId, userId);
    return analysisStore.listForSession(sessionId);
  }

  @Override
  public void deleteItem(UUID itemId, String userId) {
    itemService.deleteItem(itemId, userId);
  }

  private UploadType resolveUploadType(String fileName) {
    UploadType uploadType = UploadType.fromFilename(fileName);
    String extension = UploadType.extensionOf(fileName);
    if (!uploadType.isSupported()
        || !nexusConfig.getUpload().getAllowedExtensions().contains(extension)) {
      throw new UnsupportedFileTypeException(fileName);
    }
    return uploadType;
  }

  private static String detectMimeType(String fileName) {
    String detected = TIKA.detect(fileName);
    return detected == null || detected.isBlank() ? FALLBACK_MIME_TYPE : detected;
  }

  private static String preview(String value, int limit) {
    return value.length() > limit ? value.substring(0, limit) : value;
  }
}
