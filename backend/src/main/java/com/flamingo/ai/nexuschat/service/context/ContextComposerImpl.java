package com.flamingo.ai.nexuschat.service.context;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import com.flamingo.ai.nexuschat.domain.entity.AnalysisRecord;
import com.flamingo.ai.nexuschat.domain.entity.ChatMessage;
import com.flamingo.ai.nexuschat.domain.entity.UploadedItem;
import com.flamingo.ai.nexuschat.domain.enums.ContextMode;
import com.flamingo.ai.nexuschat.service.analysis.AnalysisStore;
import com.flamingo.ai.nexuschat.service.item.ItemService;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Implementation of the ContextComposer.
 *
 * <p>File content always wins over conversation history. Budgets are hard character cuts applied
 * per field.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextComposerImpl implements ContextComposer {

  static final String NOT_FOUND_PHRASE = "I could not find the answer in the uploaded file.";

  private static final String GROUNDED_TEMPLATE =
      "You are an expert assistant. Answer the user's question based ONLY on the following "
          + "uploaded document(s) or image(s).\n"
          + "User question: %s\n\n---\n\n%s\n\n"
          + "If the answer is not in the document/image, say '"
          + NOT_FOUND_PHRASE
          + "'";

  private final ItemService itemService;
  private final AnalysisStore analysisStore;
  private final SessionService sessionService;
  private final NexusConfig nexusConfig;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "context.compose", description = "Time to compose answer context")
  public ComposedContext compose(UUID sessionId, String question) {
    List<String> fragments = fileFragments(sessionId);
    if (!fragments.isEmpty()) {
      String text = GROUNDED_TEMPLATE.formatted(question, String.join("\n\n", fragments));
      log.debug(
          "Composed file-grounded context for session {}: {} fragments, {} chars",
          sessionId,
          fragments.size(),
          text.length());
      return new ComposedContext(ContextMode.FILE_GROUNDED, text);
    }

    String history = conversationHistory(sessionId);
    log.debug(
        "Composed conversational context for session {}: {} chars", sessionId, history.length());
    return new ComposedContext(ContextMode.CONVERSATIONAL, history);
  }

  private List<String> fileFragments(UUID sessionId) {
    NexusConfig.Context budget = nexusConfig.getContext();
    List<String> fragments = new ArrayList<>();
    for (UploadedItem item : itemService.itemsForSession(sessionId)) {
      String text = item.getExtractedText();
      if (text != null && !text.isEmpty()) {
        fragments.add(
            "Extracted text from "
                + item.getFileName()
                + ":\n"
                + cut(text, budget.getTextFragmentChars()));
      }
      String vision =
          analysisStore.latestVision(item.getId()).map(AnalysisRecord::getSummary).orElse("");
      if (!vision.isEmpty()) {
        fragments.add(
            "Vision analysis for "
                + item.getFileName()
                + ":\n"
                + cut(vision, budget.getVisionFragmentChars()));
      }
    }
    return fragments;
  }

  private String conversationHistory(UUID sessionId) {
    List<ChatMessage> recent =
        new ArrayList<>(
            sessionService.recentMessages(sessionId, nexusConfig.getContext().getHistoryWindow()));
    Collections.reverse(recent);
    return recent.stream()
        .map(message -> message.getRole().senderName() + ": " + message.getContent())
        .collect(Collectors.joining("\n"));
  }

  private static String cut(String value, int limit) {
    return value.length() > limit ? value.substring(0, limit) : value;
  }
}
