package com.flamingo.ai.nexuschat.service.item;

import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import com.flamingo.ai.nexuschat.domain.repository.UploadedItemRepository;
import com.flamingo.ai.nexuschat.exception.ItemNotFoundException;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the ItemService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemServiceImpl implements ItemService {

  private final UploadedItemRepository uploadedItemRepository;
  private final AnalysisStore analysisStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public UploadedItem insertItem(
      Session session,
      String userId,
      String fileName,
      ItemKind kind,
      String mimeType,
      byte[] content,
      String extractedText) {
    UploadedItem saved =
        uploadedItemRepository.save(
            UploadedItem.builder()
                .session(session)
                .userId(userId)
                .fileName(fileName)
                .kind(kind)
                .mimeType(mimeType)
                .content(content)
                .extractedText(extractedText)
                .build());
    meterRegistry.counter("item.stored", "kind", kind.getWireName()).increment();
    log.debug("Stored item {} ({}, {} bytes)", saved.getId(), fileName, saved.getFileSize());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<UploadedItem> itemsForSession(UUID sessionId) {
    return uploadedItemRepository.findBySessionIdOrderByUploadedAtAsc(sessionId);
  }

  @Override
  @Transactional(readOnly = true)
  public UploadedItem getOwnedImage(UUID itemId, String userId) {
    return uploadedItemRepository
        .findByIdAndUserIdAndKind(itemId, userId, ItemKind.IMAGE)
        .orElseThrow(() -> new ItemNotFoundException(itemId));
  }

  @Override
  @Transactional
  @Timed(value = "item.delete", description = "Time to delete an item")
  public void deleteItem(UUID itemId, String userId) {
    UploadedItem item =
        uploadedItemRepository
            .findByIdAndUserId(itemId, userId)
            .orElseThrow(() -> new ItemNotFoundException(itemId));

    analysisStore.deleteForItem(itemId);
    uploadedItemRepository.delete(item);
    meterRegistry.counter("item.deleted").increment();
    log.info("Deleted item {} ({})", itemId, item.getFileName());
  }
}
