package com.flamingo.ai.nexuschat.domain.repository;

import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for UploadedItem entities. */
@Repository
public interface UploadedItemRepository extends JpaRepository<UploadedItem, UUID> {

  /** Finds all items of a session in upload order. */
  List<UploadedItem> findBySessionIdOrderByUploadedAtAsc(UUID sessionId);

  /** Finds an item of the given kind owned by the given user. */
  Optional<UploadedItem> findByIdAndUserIdAndKind(UUID id, String userId, ItemKind kind);

  /** Finds an item owned by the given user. */
  Optional<UploadedItem> findByIdAndUserId(UUID id, String userId);
}
