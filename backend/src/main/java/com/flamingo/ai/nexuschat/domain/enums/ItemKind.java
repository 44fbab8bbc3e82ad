package com.flamingo.ai.nexuschat.domain.enums;

/** Declared kind of an uploaded item. */
public enum ItemKind {
  PDF("pdf"),
  IMAGE("image"),
  OTHER("other");

  private final String wireName;

  ItemKind(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }
}
