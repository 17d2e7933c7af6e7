package com.flamingo.ai.knowledgedesk.service.source;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Builds the {@link SourceAdapter} for each configured collection, once. */
@Component
@Slf4j
public class SourceAdapterRegistry {

  private final RagConfig ragConfig;
  private final Map<String, SourceAdapter> adapters = new ConcurrentHashMap<>();

  public SourceAdapterRegistry(RagConfig ragConfig) {
    this.ragConfig = ragConfig;
  }

  public SourceAdapter adapterFor(RagConfig.Collection collection) {
    return adapters.computeIfAbsent(collection.getName(), name -> create(collection));
  }

  public SourceConfig sourceConfigFor(RagConfig.Collection collection) {
    return SourceConfig.of(
        collection.getRoot(),
        collection.getIncludePattern(),
        collection.getExcludePattern(),
        collection.isRecursive());
  }

  private SourceAdapter create(RagConfig.Collection collection) {
    log.info(
        "Creating {} source adapter for collection {}",
        collection.getSourceType(),
        collection.getName());
    return switch (collection.getSourceType()) {
      case FILESYSTEM -> new FileSystemSourceAdapter();
      case CONFLUENCE -> confluenceAdapter();
    };
  }

  private SourceAdapter confluenceAdapter() {
    RagConfig.Confluence confluence = ragConfig.getConfluence();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(confluence.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024));
    if (confluence.getToken() != null && !confluence.getToken().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + confluence.getToken());
    }
    return new ConfluenceSourceAdapter(
        builder.build(),
        confluence.getBaseUrl(),
        confluence.getPageSize(),
        Duration.ofMillis(confluence.getTimeoutMs()));
  }
}
