package com.flamingo.ai.nexuschat.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.nexuschat.service.ingestion.AnalysisOutcome;
import com.flamingo.ai.nexuschat.service.ingestion.IngestResult;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingested upload. Previews are omitted when absent. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {

  private String message;
  private UUID fileId;
  private String filename;
  private String fileType;
  private String extractedText;
  private String visionPreview;
  private List<AnalysisEntry> analyses;
  private boolean analysisAvailable;

  /** One analysis produced during the upload. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class AnalysisEntry {
    private String type;
    private String content;
    private boolean success;
    private UUID recordId;

    static AnalysisEntry fromOutcome(AnalysisOutcome outcome) {
      return AnalysisEntry.builder()
          .type(outcome.kind().getWireName())
          .content(outcome.content())
          .success(outcome.success())
          .recordId(outcome.recordId())
          .build();
    }
  }

  public static UploadResponse fromResult(IngestResult result) {
    return UploadResponse.builder()
        .message("File uploaded and analyzed successfully")
        .fileId(result.itemId())
        .filename(result.fileName())
        .fileType(result.kind().getWireName())
        .extractedText(result.extractedTextPreview())
        .visionPreview(result.visionPreview())
        .analyses(result.analyses().stream().map(AnalysisEntry::fromOutcome).toList())
        .analysisAvailable(result.analysisAvailable())
        .build();
  }
}
