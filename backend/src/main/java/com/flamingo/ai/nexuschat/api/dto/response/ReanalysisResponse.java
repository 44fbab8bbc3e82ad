package com.flamingo.ai.nexuschat.api.dto.response;

import com.flamingo.ai.nexuschat.service.ingestion.ReanalysisResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a re-described image. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReanalysisResponse {

  private boolean success;
  private String analysis;
  private String promptUsed;
  private String filename;

  public static ReanalysisResponse fromResult(ReanalysisResult result) {
    return ReanalysisResponse.builder()
        .success(result.success())
        .analysis(result.description())
        .promptUsed(result.promptUsed())
        .filename(result.fileName())
        .build();
  }
}
