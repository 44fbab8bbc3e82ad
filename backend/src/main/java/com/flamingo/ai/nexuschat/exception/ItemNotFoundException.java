package com.flamingo.ai.nexuschat.exception;

import java.util.UUID;

/** Exception thrown when an uploaded item is absent, of the wrong kind, or not owned. */
public class ItemNotFoundException extends RuntimeException {

  private final UUID itemId;

  public ItemNotFoundException(UUID itemId) {
    super("Item not found: " + itemId);
    this.itemId = itemId;
  }

  public UUID getItemId() {
    return itemId;
  }
}
