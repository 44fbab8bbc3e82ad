package com.flamingo.ai.nexuschat.service.model;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** {@link GenerativeModelClient} backed by the shared LangChain4j chat models. */
@Service
@Slf4j
public class LangChain4jGenerativeModelClient implements GenerativeModelClient {

  private final ChatModel textChatModel;
  private final ChatModel visionChatModel;

  public LangChain4jGenerativeModelClient(
      @Qualifier("textChatModel") ChatModel textChatModel,
      @Qualifier("visionChatModel") ChatModel visionChatModel) {
    this.textChatModel = textChatModel;
    this.visionChatModel = visionChatModel;
  }

  @Override
  @Timed(value = "model.generate.text", description = "Time for a text model call")
  public String generate(String prompt) {
    log.debug("Sending text prompt ({} chars)", prompt.length());
    ChatResponse response = textChatModel.chat(UserMessage.from(prompt));
    return textOf(response);
  }

  @Override
  @Timed(value = "model.generate.vision", description = "Time for a vision model call")
  public String generate(String instruction, byte[] imageBytes, String mimeType) {
    log.debug(
        "Sending vision prompt ({} chars, {} image bytes, {})",
        instruction.length(),
        imageBytes.length,
        mimeType);
    UserMessage message =
        UserMessage.from(
            TextContent.from(instruction),
            ImageContent.from(Base64.getEncoder().encodeToString(imageBytes), mimeType));
    return textOf(visionChatModel.chat(message));
  }

  private String textOf(ChatResponse response) {
    if (response == null) {
      return "";
    }
    AiMessage aiMessage = response.aiMessage();
    if (aiMessage == null || aiMessage.text() == null) {
      return "";
    }
    return aiMessage.text();
  }
}
