package com.flamingo.ai.nexuschat.api.rest;

import com.flamingo.ai.nexuschat.api.dto.request.CreateSessionRequest;
import com.flamingo.ai.nexuschat.api.dto.response.SessionResponse;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for session management. */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionService sessionService;

  /** Creates a new session. */
  @PostMapping
  public ResponseEntity<SessionResponse> createSession(
      @RequestHeader(RequestHeaders.USER_ID) String userId,
      @Valid @RequestBody(required = false) CreateSessionRequest request) {
    String title = request != null ? request.getTitle() : null;
    Session session = sessionService.createSession(userId, title);
    return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.fromEntity(session));
  }

  /** Gets a session owned by the caller. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<SessionResponse> getSession(
      @RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable UUID sessionId) {
    Session session = sessionService.getOwnedSession(sessionId, userId);
    return ResponseEntity.ok(SessionResponse.fromEntity(session));
  }
}
