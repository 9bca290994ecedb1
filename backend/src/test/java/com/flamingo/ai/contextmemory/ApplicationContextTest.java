package com.flamingo.ai.contextmemory;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.contextmemory.service.context.ContextAssemblyService;
import com.flamingo.ai.contextmemory.service.document.DocumentMemoryService;
import com.flamingo.ai.contextmemory.service.linker.DocumentLinkService;
import com.flamingo.ai.contextmemory.service.preferences.UserPreferencesService;
import com.flamingo.ai.contextmemory.service.search.MemoryVectorIndex;
import com.flamingo.ai.contextmemory.service.search.StoreScanVectorIndex;
import com.flamingo.ai.contextmemory.service.session.SessionStateService;
import com.flamingo.ai.contextmemory.service.writer.MemoryWriterService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies that the Spring application context loads. The model clients are mocked so the test
 * runs without an API key or network.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ContextAssemblyService.class)).isNotNull();
    assertThat(applicationContext.getBean(MemoryWriterService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentMemoryService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentLinkService.class)).isNotNull();
    assertThat(applicationContext.getBean(UserPreferencesService.class)).isNotNull();
    assertThat(applicationContext.getBean(SessionStateService.class)).isNotNull();
  }

  @Test
  @DisplayName("Store scan should be the vector index when Elasticsearch is not configured")
  void storeScanShouldBeTheDefaultIndex() {
    assertThat(applicationContext.getBean(MemoryVectorIndex.class))
        .isInstanceOf(StoreScanVectorIndex.class);
  }
}
