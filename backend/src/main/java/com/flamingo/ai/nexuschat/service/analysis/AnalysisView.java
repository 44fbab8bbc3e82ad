package com.flamingo.ai.nexuschat.service.analysis;

import com.flamingo.ai.nexuschat.domain.enums.AnalysisKind;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An analysis record joined with the filename and kind of the item it belongs to.
 *
 * @param recordId analysis record id
 * @param itemId id of the analysed item
 * @param fileName original filename of the item
 * @param itemKind declared kind of the item
 * @param kind analysis kind
 * @param summary analysis text
 * @param createdAt when the record was written
 */
public record AnalysisView(
    UUID recordId,
    UUID itemId,
    String fileName,
    ItemKind itemKind,
    AnalysisKind kind,
    String summary,
    LocalDateTime createdAt) {}
