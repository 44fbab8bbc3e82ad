package com.flamingo.ai.nexuschat.domain.repository;

import com.flamingo.ai.nexuschat.domain.entity.AnalysisRecord;
import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisView;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for AnalysisRecord entities. */
@Repository
public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecord, UUID> {

  /**
   * Lists a session's records newest first, joined with their item.
   *
   * <p>The inner join drops records whose item no longer exists.
   */
  @Query(
      "SELECT new com.flamingo.ai.nexuschat.service.analysis.AnalysisView("
          + "a.id, a.itemId, i.fileName, i.kind, a.kind, a.summary, a.createdAt) "
          + "FROM AnalysisRecord a JOIN UploadedItem i ON a.itemId = i.id "
          + "WHERE a.sessionId = :sessionId ORDER BY a.createdAt DESC")
  List<AnalysisView> findViewsBySessionId(@Param("sessionId") UUID sessionId);

  /** Finds an item's records of the given kinds, newest first. */
  @Query(
      "SELECT a FROM AnalysisRecord a WHERE a.itemId = :itemId AND a.kind IN :kinds "
          + "ORDER BY a.createdAt DESC")
  List<AnalysisRecord> findLatestByItemIdAndKinds(
      @Param("itemId") UUID itemId,
      @Param("kinds") Collection<AnalysisKind> kinds,
      Pageable pageable);

  long countByItemIdAndKind(UUID itemId, AnalysisKind kind);

  @Modifying
  @Query("DELETE FROM AnalysisRecord a WHERE a.itemId = :itemId")
  int deleteByItemId(@Param("itemId") UUID itemId);
}
