package com.flamingo.ai.knowledgedesk.service.ingestion;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionScheduler Tests")
class IngestionSchedulerTest {

  @Mock private IngestionPipeline pipeline;

  @Test
  @DisplayName("should sync every collection even when earlier ones fail")
  void shouldSyncAllCollections_whenSomeFail() {
    RagConfig ragConfig = new RagConfig();
    for (String name : new String[] {"busy", "broken", "tech-docs"}) {
      RagConfig.Collection collection = new RagConfig.Collection();
      collection.setName(name);
      ragConfig.getCollections().add(collection);
    }
    when(pipeline.sync("busy")).thenThrow(new IngestionAlreadyRunningException("busy"));
    when(pipeline.sync("broken")).thenThrow(new IllegalStateException("source misconfigured"));

    new IngestionScheduler(pipeline, ragConfig).syncAll();

    verify(pipeline).sync("tech-docs");
  }
}
