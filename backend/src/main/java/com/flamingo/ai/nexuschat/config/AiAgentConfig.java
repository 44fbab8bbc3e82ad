package com.flamingo.ai.nexuschat.config;

import com.flamingo.ai.nexuschat.agent.TextAnalysisAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are interfaces annotated with @UserMessage; AiServices provides the implementation.
 */
@Configuration
public class AiAgentConfig {

  /** Text analysis agent run once per upload with non-empty extracted text. */
  @Bean
  public TextAnalysisAgent textAnalysisAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TextAnalysisAgent.class).chatModel(textChatModel).build();
  }
}
