package com.flamingo.ai.knowledgedesk.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.exception.EmbeddingServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Captor private ArgumentCaptor<List<TextSegment>> segmentsCaptor;

  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setBatchSize(2);
    embeddingService = new EmbeddingService(embeddingModel, limiter(100), ragConfig, meterRegistry);
  }

  private static RateLimiter limiter(int permits) {
    return RateLimiter.of(
        "test",
        RateLimiterConfig.custom()
            .limitForPeriod(permits)
            .limitRefreshPeriod(Duration.ofHours(1))
            .timeoutDuration(Duration.ZERO)
            .build());
  }

  private static Embedding vector(float... values) {
    return Embedding.from(values);
  }

  @Test
  @DisplayName("should embed a single text")
  void shouldEmbedSingleText() {
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(vector(0.1f, 0.2f)));

    List<Float> result = embeddingService.embed("How do I restart the gateway?");

    assertThat(result).containsExactly(0.1f, 0.2f);
    assertThat(meterRegistry.counter("embedding.requests.success", "type", "single").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should embed in batches and keep input order")
  void shouldEmbedInBatches_preservingOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(vector(1f), vector(2f))))
        .thenReturn(Response.from(List.of(vector(3f))));

    List<List<Float>> result = embeddingService.embedBatch(List.of("a", "b", "c"));

    assertThat(result).containsExactly(List.of(1f), List.of(2f), List.of(3f));
    verify(embeddingModel, times(2)).embedAll(segmentsCaptor.capture());
    assertThat(segmentsCaptor.getAllValues().get(0)).extracting(TextSegment::text)
        .containsExactly("a", "b");
    assertThat(segmentsCaptor.getAllValues().get(1)).extracting(TextSegment::text)
        .containsExactly("c");
  }

  @Test
  @DisplayName("should fail transiently when the service returns the wrong number of vectors")
  void shouldFail_whenVectorCountMismatches() {
    when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(vector(1f))));

    assertThatThrownBy(() -> embeddingService.embedBatch(List.of("a", "b")))
        .isInstanceOf(EmbeddingServiceException.class)
        .satisfies(e -> assertThat(((EmbeddingServiceException) e).isPermanent()).isFalse());
  }

  @Test
  @DisplayName("should mark non-retriable model errors as permanent")
  void shouldMarkPermanent_whenModelRejectsInput() {
    when(embeddingModel.embed(anyString())).thenThrow(new NonRetriableException("bad input"));

    assertThatThrownBy(() -> embeddingService.embed("x"))
        .isInstanceOf(EmbeddingServiceException.class)
        .satisfies(e -> assertThat(((EmbeddingServiceException) e).isPermanent()).isTrue());
    assertThat(meterRegistry.counter("embedding.requests.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should mark other model errors as transient")
  void shouldMarkTransient_whenModelCallFails() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("connection reset"));

    assertThatThrownBy(() -> embeddingService.embed("x"))
        .isInstanceOf(EmbeddingServiceException.class)
        .satisfies(e -> assertThat(((EmbeddingServiceException) e).isPermanent()).isFalse());
  }

  @Test
  @DisplayName("should fail without calling the model when no rate limit permit is available")
  void shouldThrottle_whenRateLimiterIsExhausted() {
    embeddingService = new EmbeddingService(embeddingModel, limiter(1), ragConfig, meterRegistry);
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(vector(0.5f)));

    embeddingService.embed("first");

    assertThatThrownBy(() -> embeddingService.embed("second"))
        .isInstanceOf(EmbeddingServiceException.class)
        .hasMessageContaining("rate limit");
    verify(embeddingModel, times(1)).embed(anyString());
    assertThat(meterRegistry.counter("embedding.requests.throttled").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should truncate very long texts before embedding")
  void shouldTruncateVeryLongText() {
    ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
    when(embeddingModel.embed(anyString())).thenReturn(Response.from(vector(0.1f)));

    embeddingService.embed("a".repeat(6000));

    verify(embeddingModel).embed(text.capture());
    assertThat(text.getValue()).hasSize(5000);
  }
}
