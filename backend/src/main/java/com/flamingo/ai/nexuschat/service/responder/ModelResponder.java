package com.flamingo.ai.nexuschat.service.responder;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.service.model.GenerativeModelClient;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link Responder} that flattens the persona, context and question into one model prompt. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelResponder implements Responder {

  static final String PERSONA =
      """
      You are NexusChat, a helpful and friendly AI assistant. You should:
      - Respond naturally and conversationally like a helpful friend
      - Be warm, engaging, and personable in your responses
      - Answer questions directly and helpfully
      - If someone greets you (like "hi", "hello", "how are you"), respond naturally like a human would
      - Keep responses concise but informative
      - Don't over-analyze simple greetings or casual conversation
      - Be supportive and encouraging

      Remember: You're having a conversation, not analyzing text or providing academic explanations.""";

  static final String EMPTY_REPLY =
      "I received an empty response. Please try rephrasing your question.";

  private final GenerativeModelClient modelClient;
  private final NexusConfig nexusConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "responder.respond", description = "Time to produce an answer")
  public String respond(String question, String context) {
    String prompt = buildPrompt(question, context);
    try {
      String reply = modelClient.generate(prompt);
      if (reply == null || reply.isBlank()) {
        log.warn("Model returned an empty reply");
        meterRegistry.counter("responder.outcome", "category", "empty").increment();
        return EMPTY_REPLY;
      }
      meterRegistry.counter("responder.outcome", "category", "success").increment();
      return reply;
    } catch (Exception e) {
      String diagnostic = describe(e);
      ModelFailureCategory category = ModelFailureCategory.classify(diagnostic);
      log.warn("Model call failed ({}): {}", category, diagnostic);
      meterRegistry
          .counter("responder.outcome", "category", category.name().toLowerCase(Locale.ROOT))
          .increment();
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return category.sentence(message, nexusConfig.getResponder().getDiagnosticChars());
    }
  }

  static String buildPrompt(String question, String context) {
    StringBuilder prompt = new StringBuilder(PERSONA);
    if (context != null && !context.isBlank()) {
      prompt.append("\n\nPrevious conversation context: ").append(context);
    }
    prompt.append("\n\nUser: ").append(question).append("\n\nAssistant:");
    return prompt.toString();
  }

  /** Joins the messages of the whole cause chain, using the class name where a message is null. */
  private static String describe(Throwable error) {
    List<String> parts = new ArrayList<>();
    Throwable current = error;
    while (current != null && parts.size() < 10) {
      parts.add(
          current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName());
      current = current.getCause() == current ? null : current.getCause();
    }
    return String.join(": ", parts);
  }
}
