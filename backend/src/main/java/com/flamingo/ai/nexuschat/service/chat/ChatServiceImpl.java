package com.flamingo.ai.nexuschat.service.chat;

import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import com.flamingo.ai.nexuschat.domain.entity.Session;
import com.flamingo.ai.nexuschat.domain.enums.MessageRole;
import com.flamingo.ai.nexuschat.service.context.ComposedContext;
import com.flamingo.ai.nexuschat.service.context.ContextComposer;
import com.flamingo.ai.nexuschat.service.responder.Responder;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of the ChatService.
 *
 * <p>The context is composed before the question is stored, so history holds only earlier turns.
 * The question is stored before the model is called and stays stored if the reply never arrives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  private final SessionService sessionService;
  private final ContextComposer contextComposer;
  private final Responder responder;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.answer", description = "Time to answer a question")
  public AnswerResult answer(UUID sessionId, String userId, String question) {
    Session session = sessionService.getOwnedSession(sessionId, userId);
    log.info("Answering question in session {} ({} chars)", sessionId, question.length());

    ComposedContext context = contextComposer.compose(sessionId, question);
    ChatMessage userMessage = sessionService.appendMessage(session, MessageRole.USER, question);

    String reply =
        context.isFileGrounded()
            ? responder.respond(context.text(), "")
            : responder.respond(question, context.text());

    ChatMessage assistantMessage =
        sessionService.appendMessage(session, MessageRole.ASSISTANT, reply);
    sessionService.touchSession(sessionId);

    meterRegistry
        .counter("chat.answers", "mode", context.mode().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info("Answered in session {} using {} context", sessionId, context.mode());
    return new AnswerResult(userMessage, assistantMessage, context.mode());
  }

  @Override
  public List<ChatMessage> history(UUID sessionId, String userId, int limit) {
    sessionService.getOwnedSession(sessionId, userId);
    List<ChatMessage> messages = new ArrayList<>(sessionService.recentMessages(sessionId, limit));
    Collections.reverse(messages);
    return messages;
  }
}
