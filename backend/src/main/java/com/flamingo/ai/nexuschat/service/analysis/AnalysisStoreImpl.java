package com.flamingo.ai.nexuschat.service.analysis;

import com.flamingo.ai.nexuschat.domain.entity.AnalysisRecord;
import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import com.flamingo.ai.nexuschat.domain.repository.AnalysisRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the AnalysisStore over Spring Data JPA. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisStoreImpl implements AnalysisStore {

  private static final Set<AnalysisKind> VISION_KINDS =
      Arrays.stream(AnalysisKind.values())
          .filter(AnalysisKind::isVision)
          .collect(Collectors.toCollection(() -> EnumSet.noneOf(AnalysisKind.class)));

  private final AnalysisRecordRepository analysisRecordRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public UUID record(UUID itemId, UUID sessionId, AnalysisKind kind, String summary) {
    AnalysisRecord saved =
        analysisRecordRepository.save(
            AnalysisRecord.builder()
                .itemId(itemId)
                .sessionId(sessionId)
                .kind(kind)
                .summary(summary == null ? "" : summary)
                .build());
    meterRegistry.counter("analysis.recorded", "kind", kind.getWireName()).increment();
    log.debug("Recorded {} analysis {} for item {}", kind.getWireName(), saved.getId(), itemId);
    return saved.getId();
  }

  @Override
  @Transactional(readOnly = true)
  public List<AnalysisView> listForSession(UUID sessionId) {
    return analysisRecordRepository.findViewsBySessionId(sessionId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AnalysisRecord> latestVision(UUID itemId) {
    return analysisRecordRepository
        .findLatestByItemIdAndKinds(itemId, VISION_KINDS, Pageable.ofSize(1))
        .stream()
        .findFirst();
  }

  @Override
  @Transactional(readOnly = true)
  public long countForItem(UUID itemId, AnalysisKind kind) {
    return analysisRecordRepository.countByItemIdAndKind(itemId, kind);
  }

  @Override
  @Transactional
  public void deleteForItem(UUID itemId) {
    int removed = analysisRecordRepository.deleteByItemId(itemId);
    log.debug("Removed {} analysis records of item {}", removed, itemId);
  }
}
