package com.flamingo.ai.nexuschat.domain.enums;

/** Kind of a derived analysis attached to an uploaded item. */
public enum AnalysisKind {
  /** Model-written summary of the extracted text. */
  TEXT_ANALYSIS("text_analysis"),

  /** Visual description produced at upload time. */
  VISION_ANALYSIS("vision_analysis"),

  /** Visual description produced by a re-analysis with a caller instruction. */
  VISION_CUSTOM("vision_custom");

  private final String wireName;

  AnalysisKind(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public boolean isVision() {
    return this == VISION_ANALYSIS || this == VISION_CUSTOM;
  }
}
