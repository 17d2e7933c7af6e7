package com.flamingo.ai.knowledgedesk.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors and scheduling for background work. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /**
   * Bounded pool for per-document ingestion work. A full queue makes the submitting sync thread
   * run the task itself, which throttles dispatch instead of rejecting documents.
   */
  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor(RagConfig ragConfig) {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingestion.getWorkers());
    executor.setMaxPoolSize(ingestion.getWorkers());
    executor.setQueueCapacity(ingestion.getQueueCapacity());
    executor.setThreadNamePrefix("ingest-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    // in-flight document replaces finish before the pool goes away
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
