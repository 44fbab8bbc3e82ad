package com.flamingo.ai.nexuschat.service.session;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.enums.MessageRole;
import com.flamingo.ai.nexuschat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.nexuschat.domain.repository.SessionRepository;
import com.flamingo.ai.nexuschat.exception.SessionNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the SessionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionServiceImpl implements SessionService {

  static final String DEFAULT_TITLE = "New Chat";

  private final SessionRepository sessionRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "session.create", description = "Time to create a session")
  public Session createSession(String userId, String title) {
    String effectiveTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title.trim();
    log.info("Creating new session for user {} with title: {}", userId, effectiveTitle);

    Session saved =
        sessionRepository.save(Session.builder().userId(userId).title(effectiveTitle).build());
    meterRegistry.counter("session.created").increment();

    log.info("Created session with ID: {}", saved.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "session.get", description = "Time to get a session")
  public Session getOwnedSession(UUID sessionId, String userId) {
    return sessionRepository
        .findByIdAndUserId(sessionId, userId)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  @Override
  @Transactional
  public ChatMessage appendMessage(Session session, MessageRole role, String content) {
    ChatMessage saved =
        chatMessageRepository.save(
            ChatMessage.builder().session(session).role(role).content(content).build());
    log.debug("Appended {} message to session {}", role, session.getId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> recentMessages(UUID sessionId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    return chatMessageRepository.findRecentMessages(sessionId, limit);
  }

  @Override
  @Transactional
  public Session touchSession(UUID sessionId) {
    Session session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    session.touch();
    return sessionRepository.save(session);
  }
}
