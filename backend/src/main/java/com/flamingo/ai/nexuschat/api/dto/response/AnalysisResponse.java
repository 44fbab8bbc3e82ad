package com.flamingo.ai.nexuschat.api.dto.response;

import com.flamingo.ai.nexuschat.service.analysis.AnalysisView;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored analysis joined with its item. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private UUID id;
  private UUID itemId;
  private String analysisType;
  private String summary;
  private LocalDateTime createdAt;
  private String filename;
  private String fileType;

  public static AnalysisResponse fromView(AnalysisView view) {
    return AnalysisResponse.builder()
        .id(view.recordId())
        .itemId(view.itemId())
        .analysisType(view.kind().getWireName())
        .summary(view.summary())
        .createdAt(view.createdAt())
        .filename(view.fileName())
        .fileType(view.itemKind().getWireName())
        .build();
  }
}
