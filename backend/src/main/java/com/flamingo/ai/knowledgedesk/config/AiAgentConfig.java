package com.flamingo.ai.knowledgedesk.config;

import com.flamingo.ai.knowledgedesk.agent.QueryClassificationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Query classification agent for the supervisor router. Returns structured JSON output. */
  @Bean
  public QueryClassificationAgent queryClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(QueryClassificationAgent.class).chatModel(chatModel).build();
  }
}
