package com.flamingo.ai.nexuschat.service.ingestion;

import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import java.util.UUID;

/**
 * One analysis produced during an upload.
 *
 * @param kind analysis kind
 * @param content analysis text, or the failure sentence of a failed vision call
 * @param success whether the analysis succeeded
 * @param recordId id of the stored record, null when nothing was stored
 */
public record AnalysisOutcome(AnalysisKind kind, String content, boolean success, UUID recordId) {}
