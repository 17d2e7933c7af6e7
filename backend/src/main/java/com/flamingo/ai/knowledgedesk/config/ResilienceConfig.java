package com.flamingo.ai.knowledgedesk.config;

import com.flamingo.ai.knowledgedesk.exception.CompletionServiceException;
import com.flamingo.ai.knowledgedesk.exception.EmbeddingServiceException;
import com.flamingo.ai.knowledgedesk.exception.TicketTrackerException;
import com.flamingo.ai.knowledgedesk.exception.TransientSourceException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j instances used by the ingestion pipeline.
 *
 * <p>The embedding limiter is shared by all ingestion workers so the external service sees one
 * aggregate request rate.
 */
@Configuration
public class ResilienceConfig {

  @Bean
  public RateLimiter embeddingRateLimiter(RateLimiterRegistry registry, RagConfig ragConfig) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    RateLimiterConfig config =
        RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .limitForPeriod(embedding.getPermitsPerSecond())
            .timeoutDuration(embedding.getPermitTimeout())
            .build();
    return registry.rateLimiter("embedding", config);
  }

  @Bean
  public Retry ingestionRetry(RetryRegistry registry, RagConfig ragConfig) {
    return registry.retry("ingestion", ingestionRetryConfig(ragConfig.getIngestion()));
  }

  /** Exponential backoff on transient failures only; permanent ones fail on the first attempt. */
  public static RetryConfig ingestionRetryConfig(RagConfig.Ingestion ingestion) {
    return RetryConfig.custom()
        .maxAttempts(ingestion.getMaxAttempts())
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                ingestion.getInitialBackoff(), ingestion.getBackoffMultiplier()))
        .retryOnException(ResilienceConfig::isTransient)
        .build();
  }

  public static boolean isTransient(Throwable t) {
    if (t instanceof TransientSourceException) {
      return true;
    }
    if (t instanceof EmbeddingServiceException e) {
      return !e.isPermanent();
    }
    if (t instanceof CompletionServiceException e) {
      return !e.isPermanent();
    }
    if (t instanceof TicketTrackerException e) {
      return e.isTransientFailure();
    }
    return false;
  }
}
