package com.flamingo.ai.knowledgedesk.config;

import com.flamingo.ai.knowledgedesk.agent.QueryClassificationAgent;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalService;
import com.flamingo.ai.knowledgedesk.service.supervisor.HeuristicQueryClassifier;
import com.flamingo.ai.knowledgedesk.service.supervisor.LlmQueryClassifier;
import com.flamingo.ai.knowledgedesk.service.supervisor.QueryClassifier;
import com.flamingo.ai.knowledgedesk.service.supervisor.RetrievalSpecialist;
import com.flamingo.ai.knowledgedesk.service.supervisor.Specialist;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Specialists and the classifier used by the supervisor router. The Jira specialist is a
 * component of its own.
 */
@Configuration
@Slf4j
public class SupervisorConfig {

  @Bean
  public Specialist confluenceSpecialist(RetrievalService retrievalService, RagConfig ragConfig) {
    return new RetrievalSpecialist(
        SpecialistTag.CONFLUENCE,
        retrievalService,
        ragConfig,
        List.of(
            "api", "endpoint", "deploy", "deployment", "architecture", "database", "schema",
            "configuration", "config", "technical", "server", "integration", "install",
            "kubernetes", "docker", "code", "service", "error"));
  }

  @Bean
  public Specialist sharepointSpecialist(RetrievalService retrievalService, RagConfig ragConfig) {
    return new RetrievalSpecialist(
        SpecialistTag.SHAREPOINT,
        retrievalService,
        ragConfig,
        List.of(
            "business", "process", "requirement", "requirements", "functional", "policy",
            "user story", "approval", "procedure", "form", "stakeholder", "rule", "rules",
            "onboarding"));
  }

  @Bean
  public Specialist generalSpecialist(RetrievalService retrievalService, RagConfig ragConfig) {
    return new RetrievalSpecialist(SpecialistTag.GENERAL, retrievalService, ragConfig, List.of());
  }

  @Bean
  public QueryClassifier queryClassifier(
      List<Specialist> specialists,
      QueryClassificationAgent classificationAgent,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    QueryClassifier heuristic = new HeuristicQueryClassifier(specialists);
    String strategy = ragConfig.getRouting().getClassifier();
    log.info("Query classifier strategy: {}", strategy);
    if ("llm".equalsIgnoreCase(strategy)) {
      return new LlmQueryClassifier(classificationAgent, heuristic, meterRegistry);
    }
    return heuristic;
  }
}
