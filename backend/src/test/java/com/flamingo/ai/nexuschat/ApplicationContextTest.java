package com.flamingo.ai.nexuschat;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.nexuschat.service.analysis.AnalysisStore;
import com.flamingo.ai.nexuschat.service.chat.ChatService;
import com.flamingo.ai.nexuschat.service.context.ContextComposer;
import com.flamingo.ai.nexuschat.service.ingestion.IngestionService;
import com.flamingo.ai.nexuschat.service.item.ItemService;
import com.flamingo.ai.nexuschat.service.responder.Responder;
import com.flamingo.ai.nexuschat.service.session.SessionService;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. Both chat models are mocked so the test runs
 * without network access.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @MockitoBean(name = "visionChatModel")
  private ChatModel visionChatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SessionService.class)).isNotNull();
    assertThat(applicationContext.getBean(ItemService.class)).isNotNull();
    assertThat(applicationContext.getBean(AnalysisStore.class)).isNotNull();
    assertThat(applicationContext.getBean(IngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(ContextComposer.class)).isNotNull();
    assertThat(applicationContext.getBean(Responder.class)).isNotNull();
    assertThat(applicationContext.getBean(ChatService.class)).isNotNull();
  }
}
