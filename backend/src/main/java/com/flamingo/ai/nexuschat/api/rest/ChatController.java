package com.flamingo.ai.nexuschat.api.rest;

import com.flamingo.ai.nexuschat.api.dto.request.AskRequest;
import com.flamingo.ai.nexuschat.api.dto.response.AnswerResponse;
import com.flamingo.ai.nexuschat.api.dto.response.ChatMessageResponse;
import com.flamingo.ai.nexuschat.service.chat.AnswerResult;
import com.flamingo.ai.nexuschat.service.chat.ChatService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for questions and message history. */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class ChatController {

  private static final int MAX_HISTORY = 500;

  private final ChatService chatService;

  /** Answers a question in a session. */
  @PostMapping("/answer")
  public ResponseEntity<AnswerResponse> answer(
      @RequestHeader(RequestHeaders.USER_ID) String userId,
      @PathVariable UUID sessionId,
      @Valid @RequestBody AskRequest request) {
    AnswerResult result = chatService.answer(sessionId, userId, request.getQuestion());
    return ResponseEntity.ok(AnswerResponse.fromResult(result));
  }

  /** Gets the latest messages of a session in chronological order. */
  @GetMapping("/messages")
  public ResponseEntity<List<ChatMessageResponse>> getMessages(
      @RequestHeader(RequestHeaders.USER_ID) String userId,
      @PathVariable UUID sessionId,
      @RequestParam(defaultValue = "50") int limit) {
    int bounded = Math.max(0, Math.min(limit, MAX_HISTORY));
    List<ChatMessageResponse> messages =
        chatService.history(sessionId, userId, bounded).stream()
            .map(ChatMessageResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(messages);
  }
}
