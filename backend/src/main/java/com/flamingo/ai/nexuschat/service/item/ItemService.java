package com.flamingo.ai.nexuschat.service.item;

import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.ItemKind;
import java.util.List;
import java.util.UUID;

/** Service interface for uploaded items. */
public interface ItemService {

  /**
   * Stores a new item. The extracted text is fixed from here on.
   *
   * @return the stored item
   */
  UploadedItem insertItem(
      Session session,
      String userId,
      String fileName,
      ItemKind kind,
      String mimeType,
      byte[] content,
      String extractedText);

  /** Lists a session's items in upload order. */
  List<UploadedItem> itemsForSession(UUID sessionId);

  /**
   * Gets an image item owned by the user.
   *
   * @throws com.flamingo.ai.nexuschat.exception.ItemNotFoundException if absent, not an image, or
   *     not owned
   */
  UploadedItem getOwnedImage(UUID itemId, String userId);

  /**
   * Deletes an item owned by the user together with its analysis records.
   *
   * @throws com.flamingo.ai.nexuschat.exception.ItemNotFoundException if absent or not owned
   */
  void deleteItem(UUID itemId, String userId);
}
