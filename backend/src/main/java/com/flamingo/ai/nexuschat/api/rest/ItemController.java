package com.flamingo.ai.nexuschat.api.rest;

import com.flamingo.ai.nexuschat.api.dto.request.ReanalyzeRequest;
import com.flamingo.ai.nexuschat.api.dto.response.AnalysisResponse;
import com.flamingo.ai.nexuschat.api.dto.response.ReanalysisResponse;
import com.flamingo.ai.nexuschat.api.dto.response.UploadResponse;
import com.flamingo.ai.nexuschat.service.ingestion.IngestResult;
import com.flamingo.ai.nexuschat.service.ingestion.IngestionService;
import com.flamingo.ai.nexuschat.service.ingestion.ReanalysisResult;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for uploaded items and their analyses. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ItemController {

  private final IngestionService ingestionService;

  /** Uploads a file into a session and analyses it. */
  @PostMapping(
      value = "/sessions/{sessionId}/items",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadItem(
      @RequestHeader(RequestHeaders.USER_ID) String userId,
      @PathVariable UUID sessionId,
      @RequestParam("file") MultipartFile file)
      throws IOException {
    IngestResult result =
        ingestionService.ingest(sessionId, userId, file.getOriginalFilename(), file.getBytes());
    return ResponseEntity.ok(UploadResponse.fromResult(result));
  }

  /** Lists the analyses of a session, newest first. */
  @GetMapping("/sessions/{sessionId}/analyses")
  public ResponseEntity<List<AnalysisResponse>> listAnalyses(
      @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable UUID sessionId) {
    List<AnalysisResponse> responses =
        ingestionService.listAnalyses(sessionId, userId).stream()
            .map(AnalysisResponse::fromView)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Describes a stored image again with an optional instruction. */
  @PostMapping("/items/{itemId}/analyze")
  public ResponseEntity<ReanalysisResponse> reanalyzeImage(
      @RequestHeader(RequestHeaders.USER_ID) String userId,
      @PathVariable UUID itemId,
      @Valid @RequestBody(required = false) ReanalyzeRequest request) {
    String prompt = request != null ? request.getPrompt() : null;
    ReanalysisResult result = ingestionService.reanalyzeImage(itemId, userId, prompt);
    return ResponseEntity.ok(ReanalysisResponse.fromResult(result));
  }

  /** Deletes an item and its analyses. */
  @DeleteMapping("/items/{itemId}")
  public ResponseEntity<Void> deleteItem(
      @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable UUID itemId) {
    ingestionService.deleteItem(itemId, userId);
    return ResponseEntity.noContent().build();
  }
}
