package com.flamingo.ai.contextmemory.config;

import com.flamingo.ai.contextmemory.agent.ContextSynthesisAgent;
import com.flamingo.ai.contextmemory.agent.TurnSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Both agents are plain blocking calls. Callers bound them with their own timeout.
 */
@Configuration
public class AiAgentConfig {

  /** Produces the synthesized digest for an assembled context. */
  @Bean
  public ContextSynthesisAgent contextSynthesisAgent(ChatModel chatModel) {
    return AiServices.builder(ContextSynthesisAgent.class).chatModel(chatModel).build();
  }

  /** Optional LLM summary of a finished turn, used by the memory writer. */
  @Bean
  public TurnSummaryAgent turnSummaryAgent(ChatModel chatModel) {
    return AiServices.builder(TurnSummaryAgent.class).chatModel(chatModel).build();
  }
}
