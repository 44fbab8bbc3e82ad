package com.flamingo.ai.nexuschat.service.ingestion;

import com.flamingo.ai.nexuschat.service.analysis.AnalysisView;
import java.util.List;
import java.util.UUID;

/** Service interface for uploading files into sessions and analysing them. */
public interface IngestionService {

  /**
   * Extracts, analyses and stores an upload.
   *
   * @throws com.flamingo.ai.nexuschat.exception.SessionNotFoundException if the session is not
   *     the user's
   * @throws com.flamingo.ai.nexuschat.exception.UnsupportedFileTypeException if the extension is
   *     not allowed or the file is empty
   */
  IngestResult ingest(UUID sessionId, String userId, String fileName, byte[] bytes);

  /**
   * Describes a stored image again with a caller instruction. Earlier records are kept.
   *
   * @param instruction optional instruction; the default is used when blank
   * @throws com.flamingo.ai.nexuschat.exception.ItemNotFoundException if the item is absent, not
   *     an image, or not owned
   */
  ReanalysisResult reanalyzeImage(UUID itemId, String userId, String instruction);

  /** Lists the analyses of a session newest first. */
  List<AnalysisView> listAnalyses(UUID sessionId, String userId);

  /** Deletes an item and its analyses. */
  void deleteItem(UUID itemId, String userId);
}
