package com.flamingo.ai.knowledgedesk.service.rag.embedding;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.exception.EmbeddingServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings through the configured {@link EmbeddingModel}.
 *
 * <p>Every call to the model takes one permit from the {@code embedding} rate limiter. Callers
 * block while the limiter is exhausted; if no permit is granted within the configured wait, the
 * call fails with a transient {@link EmbeddingServiceException}.
 */
@Service
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below it for dense CJK text
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final RateLimiter rateLimiter;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingRateLimiter") RateLimiter rateLimiter,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.rateLimiter = rateLimiter;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds a single text.
   *
   * @param text the text to embed
   * @return embedding vector
   */
  @Timed(value = "embedding.embed", description = "Time to embed one text")
  public List<Float> embed(String text) {
    acquirePermit();
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success", "type", "single").increment();
      return toFloatList(response.content().vector());
    } catch (RuntimeException e) {
      throw translate(e);
    }
  }

  /**
   * Embeds texts in batches of {@code rag.embedding.batch-size}. The result has the same size and
   * order as the input.
   *
   * @param texts the texts to embed
   * @return one vector per input text
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed a batch")
  public List<List<Float>> embedBatch(List<String> texts) {
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    List<List<Float>> results = new ArrayList<>(texts.size());
    for (int start = 0; start < texts.size(); start += batchSize) {
      List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
      List<TextSegment> segments = batch.stream().map(t -> TextSegment.from(truncate(t))).toList();
      acquirePermit();
      try {
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        if (embeddings.size() != batch.size()) {
          throw new EmbeddingServiceException(
              "Embedding service returned "
                  + embeddings.size()
                  + " vectors for "
                  + batch.size()
                  + " texts",
              false);
        }
        embeddings.forEach(e -> results.add(toFloatList(e.vector())));
      } catch (RuntimeException e) {
        throw translate(e);
      }
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    log.debug("Embedded {} texts in batches of {}", texts.size(), batchSize);
    return results;
  }

  private void acquirePermit() {
    if (!rateLimiter.acquirePermission()) {
      meterRegistry.counter("embedding.requests.throttled").increment();
      throw new EmbeddingServiceException(
          "Timed out waiting for an embedding rate limit permit", false);
    }
  }

  private EmbeddingServiceException translate(RuntimeException e) {
    if (e instanceof EmbeddingServiceException ese) {
      return ese;
    }
    meterRegistry.counter("embedding.requests.failure").increment();
    boolean permanent = e instanceof NonRetriableException;
    log.warn("Embedding call failed (permanent={}): {}", permanent, e.getMessage());
    return new EmbeddingServiceException("Embedding failed: " + e.getMessage(), permanent, e);
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
