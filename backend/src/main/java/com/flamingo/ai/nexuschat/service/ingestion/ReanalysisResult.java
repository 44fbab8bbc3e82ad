package com.flamingo.ai.nexuschat.service.ingestion;

import java.util.UUID;

/**
 * Result of re-describing a stored image.
 *
 * @param success whether the vision call succeeded
 * @param description the description, or the failure sentence
 * @param promptUsed the instruction actually sent
 * @param fileName filename of the image
 * @param recordId id of the appended record, null on failure
 */
public record ReanalysisResult(
    boolean success, String description, String promptUsed, String fileName, UUID recordId) {}
