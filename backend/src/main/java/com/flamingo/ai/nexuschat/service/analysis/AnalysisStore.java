package com.flamingo.ai.nexuschat.service.analysis;

import com.flamingo.ai.nexuschat.domain.entity.AnalysisRecord;
import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Append-only store of analysis records attached to uploaded items. */
public interface AnalysisStore {

  /**
   * Inserts a new record. Existing records are never overwritten.
   *
   * @return the id of the new record
   */
  UUID record(UUID itemId, UUID sessionId, AnalysisKind kind, String summary);

  /**
   * Lists a session's records newest first, joined with their item's filename and kind.
   * Records whose item no longer exists are skipped.
   */
  List<AnalysisView> listForSession(UUID sessionId);

  /** Returns the newest vision record of an item, whether produced at upload or re-analysis. */
  Optional<AnalysisRecord> latestVision(UUID itemId);

  /** Counts an item's records of one kind. */
  long countForItem(UUID itemId, AnalysisKind kind);

  /** Removes all records of an item. Called only when the item itself is deleted. */
  void deleteForItem(UUID itemId);
}
