package com.flamingo.ai.knowledgedesk.service.ingestion;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically re-syncs every configured collection. */
@Component
@ConditionalOnProperty(name = "rag.ingestion.schedule.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionScheduler {

  private final IngestionPipeline pipeline;
  private final RagConfig ragConfig;

  @Scheduled(cron = "${rag.ingestion.schedule.cron:0 0 2 * * *}")
  public void syncAll() {
    for (RagConfig.Collection collection : ragConfig.getCollections()) {
      try {
        pipeline.sync(collection.getName());
      } catch (IngestionAlreadyRunningException e) {
        log.info("Skipping scheduled sync of {}: already running", collection.getName());
      } catch (RuntimeException e) {
        // one collection's hard failure must not starve the others
        log.error("Scheduled sync of {} failed: {}", collection.getName(), e.getMessage(), e);
      }
    }
  }
}
