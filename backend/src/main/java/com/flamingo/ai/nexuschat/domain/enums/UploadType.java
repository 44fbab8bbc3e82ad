package com.flamingo.ai.nexuschat.domain.enums;

import java.util.Locale;
import java.util.Set;

/**
 * Content type of an upload, resolved once from the filename extension.
 *
 * <p>Later stages dispatch on this value and never inspect the extension again.
 */
public enum UploadType {
  DOCUMENT(Set.of("pdf"), ItemKind.PDF),
  IMAGE(Set.of("png", "jpg", "jpeg", "gif", "webp"), ItemKind.IMAGE),
  PLAIN_TEXT(Set.of("txt"), ItemKind.OTHER),
  UNSUPPORTED(Set.of(), null);

  private final Set<String> extensions;
  private final ItemKind itemKind;

  UploadType(Set<String> extensions, ItemKind itemKind) {
    this.extensions = extensions;
    this.itemKind = itemKind;
  }

  /**
   * Resolves the upload type of a filename.
   *
   * @param filename original filename, may be null
   * @return the matching type, or UNSUPPORTED when there is no known extension
   */
  public static UploadType fromFilename(String filename) {
    return fromExtension(extensionOf(filename));
  }

  /** Resolves the upload type of a bare extension, case-insensitively. */
  public static UploadType fromExtension(String extension) {
    if (extension == null || extension.isBlank()) {
      return UNSUPPORTED;
    }
    String normalized = extension.toLowerCase(Locale.ROOT);
    for (UploadType type : values()) {
      if (type.extensions.contains(normalized)) {
        return type;
      }
    }
    return UNSUPPORTED;
  }

  /** Returns the lower-cased extension of a filename, or an empty string. */
  public static String extensionOf(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * Item kind stored for this upload type.
   *
   * @throws IllegalStateException for UNSUPPORTED
   */
  public ItemKind itemKind() {
    if (itemKind == null) {
      throw new IllegalStateException("Unsupported uploads have no item kind");
    }
    return itemKind;
  }

  public boolean isSupported() {
    return this != UNSUPPORTED;
  }
}
