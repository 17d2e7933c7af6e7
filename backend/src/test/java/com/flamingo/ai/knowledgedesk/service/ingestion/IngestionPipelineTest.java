package com.flamingo.ai.knowledgedesk.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.config.ResilienceConfig;
import com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException;
import com.flamingo.ai.knowledgedesk.exception.TransientSourceException;
import com.flamingo.ai.knowledgedesk.exception.UnknownCollectionException;
import com.flamingo.ai.knowledgedesk.exception.VectorStoreException;
import com.flamingo.ai.knowledgedesk.service.rag.chunking.SectionAwareChunker;
import com.flamingo.ai.knowledgedesk.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgedesk.service.rag.parsing.DocumentParserRouter;
import com.flamingo.ai.knowledgedesk.service.rag.parsing.MarkdownDocumentParser;
import com.flamingo.ai.knowledgedesk.service.rag.parsing.TikaXhtmlDocumentParser;
import com.flamingo.ai.knowledgedesk.service.source.SourceAdapterRegistry;
import com.flamingo.ai.knowledgedesk.service.source.SourceConfig;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

  private static final String COLLECTION = "functional-docs";
  private static final SourceConfig ALL_MARKDOWN =
      SourceConfig.of("/docs", ".*\\.md", "drafts/.*", true);

  @Mock private EmbeddingService embeddingService;
  @Mock private SourceAdapterRegistry adapterRegistry;

  private InMemoryVectorStore vectorStore;
  private InMemoryLedger ledger;
  private FakeSourceAdapter source;
  private CollectionLockRegistry lockRegistry;
  private SimpleMeterRegistry meterRegistry;
  private IngestionPipeline pipeline;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getIngestion().setMaxAttempts(2);
    ragConfig.getIngestion().setInitialBackoff(Duration.ofMillis(1));
    Retry retry = Retry.of("test", ResilienceConfig.ingestionRetryConfig(ragConfig.getIngestion()));
    Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    vectorStore = new InMemoryVectorStore();
    ledger = new InMemoryLedger();
    source = new FakeSourceAdapter();
    lockRegistry = new CollectionLockRegistry();
    meterRegistry = new SimpleMeterRegistry();
    DocumentIngestor ingestor =
        new DocumentIngestor(
            ledger.repository(),
            vectorStore,
            embeddingService,
            new DocumentParserRouter(new MarkdownDocumentParser(), new TikaXhtmlDocumentParser()),
            new SectionAwareChunker(),
            ragConfig,
            retry,
            clock);
    pipeline =
        new IngestionPipeline(
            ingestor,
            ledger.repository(),
            lockRegistry,
            adapterRegistry,
            ragConfig,
            Runnable::run,
            retry,
            meterRegistry,
            clock);

    lenient()
        .when(embeddingService.embedBatch(anyList()))
        .thenAnswer(
            inv -> ((List<String>) inv.getArgument(0)).stream().map(t -> List.of(0.5f)).toList());
  }

  private IngestionReport sync() {
    return sync(IngestionCancellation.create());
  }

  private IngestionReport sync(IngestionCancellation cancellation) {
    return pipeline.sync(COLLECTION, source, ALL_MARKDOWN, cancellation);
  }

  @Test
  @DisplayName("should ingest every listed document that passes the patterns")
  void shouldIngestListedDocuments() {
    source
        .put("guide.md", "# Guide\n\nHello.")
        .put("faq.md", "# FAQ\n\nAnswers.")
        .put("drafts/wip.md", "# WIP\n\nNot yet.")
        .put("image.png", "binary");

    IngestionReport report = sync();

    assertThat(report.status()).isEqualTo(IngestionReport.Status.COMPLETED);
    assertThat(report.ingested()).isEqualTo(2);
    assertThat(report.failed()).isZero();
    assertThat(vectorStore.chunksOf(COLLECTION, "guide.md")).hasSize(1);
    assertThat(vectorStore.chunksOf(COLLECTION, "drafts/wip.md")).isEmpty();
    assertThat(meterRegistry.counter("ingestion.documents.ingested").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should report unchanged documents on a second run")
  void shouldReportUnchanged_onRerun() {
    source.put("guide.md", "# Guide\n\nHello.").put("faq.md", "# FAQ\n\nAnswers.");
    sync();

    IngestionReport report = sync();

    assertThat(report.ingested()).isZero();
    assertThat(report.unchanged()).isEqualTo(2);
  }

  @Test
  @DisplayName("should delete documents that disappeared from the source")
  void shouldDeleteTombstonedDocuments() {
    source.put("guide.md", "# Guide\n\nHello.").put("old.md", "# Old\n\nGone soon.");
    sync();
    source.remove("old.md");

    IngestionReport report = sync();

    assertThat(report.deleted()).isEqualTo(1);
    assertThat(vectorStore.chunksOf(COLLECTION, "old.md")).isEmpty();
    assertThat(ledger.find(COLLECTION, "old.md")).isEmpty();
    assertThat(ledger.find(COLLECTION, "guide.md")).isPresent();
  }

  @Test
  @DisplayName("should report a failed document and carry on with the rest")
  void shouldContinue_whenOneDocumentFails() {
    source
        .put("guide.md", "# Guide\n\nHello.")
        .put("flaky.md", "# Flaky\n\nSometimes.")
        .failFetch(
            "flaky.md", new TransientSourceException("503"), new TransientSourceException("503"));

    IngestionReport report = sync();

    assertThat(report.status()).isEqualTo(IngestionReport.Status.COMPLETED);
    assertThat(report.ingested()).isEqualTo(1);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.failures())
        .singleElement()
        .satisfies(
            f -> {
              assertThat(f.path()).isEqualTo("flaky.md");
              assertThat(f.errorType()).isEqualTo("TransientSourceException");
              assertThat(f.transientError()).isTrue();
            });
  }

  @Test
  @DisplayName("should not tombstone a document whose fetch failed")
  void shouldKeepDocument_whenFetchFailsButStillListed() {
    source.put("guide.md", "# Guide\n\nHello.");
    sync();
    source.failFetch(
        "guide.md", new TransientSourceException("503"), new TransientSourceException("503"));

    IngestionReport report = sync();

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.deleted()).isZero();
    assertThat(vectorStore.versionsOf(COLLECTION, "guide.md")).containsExactly(1L);
  }

  @Test
  @DisplayName("should refuse to start while the collection is already syncing")
  void shouldRefuse_whenCollectionLocked() {
    try (CollectionLockRegistry.CollectionLock ignored = lockRegistry.acquire(COLLECTION)) {
      assertThatThrownBy(this::sync).isInstanceOf(IngestionAlreadyRunningException.class);
    }
    assertThat(lockRegistry.isLocked(COLLECTION)).isFalse();
  }

  @Test
  @DisplayName("should abort the run and release the lock when the vector store is down")
  void shouldAbort_whenVectorStoreUnavailable() {
    source.put("a.md", "# A\n\nx.").put("b.md", "# B\n\ny.").put("c.md", "# C\n\nz.");
    vectorStore.upsertFailure = new VectorStoreException("connection refused", true);

    assertThatThrownBy(this::sync)
        .isInstanceOfSatisfying(
            VectorStoreException.class, e -> assertThat(e.isStoreUnavailable()).isTrue());

    assertThat(vectorStore.upserts.get()).isEqualTo(1);
    assertThat(lockRegistry.isLocked(COLLECTION)).isFalse();
    assertThat(meterRegistry.counter("ingestion.runs.aborted").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should write nothing and keep existing documents when listing fails")
  void shouldReportListingFailure() {
    source.put("guide.md", "# Guide\n\nHello.");
    sync();
    source.failListing(new TransientSourceException("space unavailable"));

    IngestionReport report = sync();

    assertThat(report.status()).isEqualTo(IngestionReport.Status.LISTING_FAILED);
    assertThat(report.failures())
        .singleElement()
        .satisfies(f -> assertThat(f.path()).isEqualTo("/docs"));
    assertThat(ledger.find(COLLECTION, "guide.md")).isPresent();
  }

  @Test
  @DisplayName("should skip the tombstone pass when cancelled")
  void shouldSkipTombstonePass_whenCancelled() {
    source.put("guide.md", "# Guide\n\nHello.");
    sync();
    source.remove("guide.md").put("new.md", "# New\n\nFresh.");
    IngestionCancellation cancellation = IngestionCancellation.create();
    cancellation.cancel();

    IngestionReport report = sync(cancellation);

    assertThat(report.status()).isEqualTo(IngestionReport.Status.CANCELLED);
    assertThat(report.deleted()).isZero();
    assertThat(ledger.find(COLLECTION, "guide.md")).isPresent();
    assertThat(vectorStore.chunksOf(COLLECTION, "new.md")).isEmpty();
  }

  @Test
  @DisplayName("should finish the replace in flight but dispatch nothing after a cancel")
  @SuppressWarnings("unchecked")
  void shouldCompleteInFlightReplace_whenCancelledDuringIt() {
    source.put("a.md", "# A\n\nFirst.").put("b.md", "# B\n\nFirst.");
    sync();
    source.put("a.md", "# A\n\nSecond.").put("b.md", "# B\n\nSecond.");
    IngestionCancellation cancellation = IngestionCancellation.create();
    doAnswer(
            inv -> {
              cancellation.cancel();
              return ((List<String>) inv.getArgument(0)).stream().map(t -> List.of(0.5f)).toList();
            })
        .when(embeddingService)
        .embedBatch(anyList());

    IngestionReport report = sync(cancellation);

    assertThat(report.status()).isEqualTo(IngestionReport.Status.CANCELLED);
    assertThat(report.ingested()).isEqualTo(1);
    assertThat(vectorStore.versionsOf(COLLECTION, "a.md")).containsExactly(2L);
    assertThat(vectorStore.chunksOf(COLLECTION, "a.md"))
        .singleElement()
        .satisfies(c -> assertThat(c.getContent()).contains("Second."));
    assertThat(ledger.find(COLLECTION, "a.md").orElseThrow().getVersion()).isEqualTo(2);
    assertThat(vectorStore.versionsOf(COLLECTION, "b.md")).containsExactly(1L);
    assertThat(ledger.find(COLLECTION, "b.md").orElseThrow().getVersion()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reject collections that are not configured")
  void shouldRejectUnknownCollection() {
    assertThatThrownBy(() -> pipeline.sync("nope")).isInstanceOf(UnknownCollectionException.class);
    verifyNoInteractions(adapterRegistry);
  }

  @Test
  @DisplayName("should report no running sync to cancel")
  void shouldReturnFalse_whenNothingToCancel() {
    assertThat(pipeline.cancel(COLLECTION)).isFalse();
  }
}
