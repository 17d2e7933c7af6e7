package com.flamingo.ai.knowledgedesk.service.ingestion;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.config.ResilienceConfig;
import com.flamingo.ai.knowledgedesk.domain.entity.IngestionRecord;
import com.flamingo.ai.knowledgedesk.domain.repository.IngestionRecordRepository;
import com.flamingo.ai.knowledgedesk.exception.UnknownCollectionException;
import com.flamingo.ai.knowledgedesk.exception.VectorStoreException;
import com.flamingo.ai.knowledgedesk.service.ingestion.IngestionReport.IngestionFailure;
import com.flamingo.ai.knowledgedesk.service.source.DocumentDescriptor;
import com.flamingo.ai.knowledgedesk.service.source.SourceAdapter;
import com.flamingo.ai.knowledgedesk.service.source.SourceAdapterRegistry;
import com.flamingo.ai.knowledgedesk.service.source.SourceConfig;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Synchronizes a collection of the vector index with its document source.
 *
 * <p>A sync lists the source, hands every listed document to {@link DocumentIngestor} on the
 * ingestion worker pool, and finally runs a tombstone pass that deletes documents the ledger knows
 * but the source no longer lists. Per-document failures are collected into the report; only an
 * outage of the vector store itself aborts the run.
 */
@Service
@Slf4j
public class IngestionPipeline {

  private final DocumentIngestor documentIngestor;
  private final IngestionRecordRepository recordRepository;
  private final CollectionLockRegistry lockRegistry;
  private final SourceAdapterRegistry adapterRegistry;
  private final RagConfig ragConfig;
  private final Executor executor;
  private final Retry retry;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Map<String, IngestionCancellation> activeRuns = new ConcurrentHashMap<>();

  public IngestionPipeline(
      DocumentIngestor documentIngestor,
      IngestionRecordRepository recordRepository,
      CollectionLockRegistry lockRegistry,
      SourceAdapterRegistry adapterRegistry,
      RagConfig ragConfig,
      @Qualifier("ingestionExecutor") Executor executor,
      @Qualifier("ingestionRetry") Retry retry,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.documentIngestor = documentIngestor;
    this.recordRepository = recordRepository;
    this.lockRegistry = lockRegistry;
    this.adapterRegistry = adapterRegistry;
    this.ragConfig = ragConfig;
    this.executor = executor;
    this.retry = retry;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Syncs a configured collection with the source it is bound to.
   *
   * @throws UnknownCollectionException if no collection has this name
   * @throws com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException if the
   *     collection is already syncing
   * @throws VectorStoreException if the vector store became unreachable during the run
   */
  public IngestionReport sync(String collection) {
    RagConfig.Collection config =
        ragConfig
            .findCollection(collection)
            .orElseThrow(() -> new UnknownCollectionException(collection));
    return sync(
        collection,
        adapterRegistry.adapterFor(config),
        adapterRegistry.sourceConfigFor(config),
        IngestionCancellation.create());
  }

  /** Syncs a collection from an explicit adapter and source configuration. */
  @Timed(value = "ingestion.sync", description = "Time to sync one collection")
  public IngestionReport sync(
      String collection,
      SourceAdapter adapter,
      SourceConfig sourceConfig,
      IngestionCancellation cancellation) {
    try (CollectionLockRegistry.CollectionLock lock = lockRegistry.acquire(collection)) {
      activeRuns.put(collection, cancellation);
      try {
        return run(collection, adapter, sourceConfig, cancellation);
      } finally {
        activeRuns.remove(collection);
      }
    }
  }

  /** Requests cancellation of a running sync; returns false if none is running. */
  public boolean cancel(String collection) {
    IngestionCancellation cancellation = activeRuns.get(collection);
    if (cancellation == null) {
      return false;
    }
    log.info("Cancelling ingestion of {}", collection);
    cancellation.cancel();
    return true;
  }

  @PreDestroy
  public void cancelAll() {
    activeRuns.forEach((collection, cancellation) -> cancellation.cancel());
  }

  private IngestionReport run(
      String collection,
      SourceAdapter adapter,
      SourceConfig sourceConfig,
      IngestionCancellation cancellation) {
    Instant started = clock.instant();
    log.info("Starting ingestion of collection {} from {}", collection, sourceConfig.root());

    List<DocumentDescriptor> descriptors;
    try {
      descriptors = retry.executeSupplier(() -> adapter.list(sourceConfig));
    } catch (RuntimeException e) {
      log.error("Listing {} failed, nothing ingested: {}", sourceConfig.root(), e.getMessage());
      return new IngestionReport(
          collection,
          IngestionReport.Status.LISTING_FAILED,
          0,
          0,
          0,
          0,
          List.of(failure(sourceConfig.root(), e)),
          Duration.between(started, clock.instant()));
    }

    AtomicInteger ingested = new AtomicInteger();
    AtomicInteger unchanged = new AtomicInteger();
    List<IngestionFailure> failures = Collections.synchronizedList(new ArrayList<>());
    AtomicReference<VectorStoreException> outage = new AtomicReference<>();
    Set<String> seen = new HashSet<>();
    List<CompletableFuture<Void>> tasks = new ArrayList<>();
    boolean dispatchedAll = true;

    for (DocumentDescriptor descriptor : descriptors) {
      if (cancellation.isCancelled() || outage.get() != null) {
        dispatchedAll = false;
        break;
      }
      seen.add(descriptor.path());
      tasks.add(
          CompletableFuture.runAsync(
              () -> {
                if (outage.get() != null) {
                  return;
                }
                try {
                  DocumentIngestor.Outcome outcome =
                      documentIngestor.ingest(collection, adapter, descriptor);
                  (outcome == DocumentIngestor.Outcome.INGESTED ? ingested : unchanged)
                      .incrementAndGet();
                } catch (VectorStoreException e) {
                  if (e.isStoreUnavailable()) {
                    outage.compareAndSet(null, e);
                  }
                  failures.add(failure(descriptor.path(), e));
                } catch (RuntimeException e) {
                  log.warn(
                      "Failed to ingest {}:{}: {}", collection, descriptor.path(), e.getMessage());
                  failures.add(failure(descriptor.path(), e));
                }
              },
              executor));
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

    if (outage.get() != null) {
      meterRegistry.counter("ingestion.runs.aborted").increment();
      log.error("Vector store unavailable, aborting ingestion of {}", collection);
      throw outage.get();
    }

    int deleted = 0;
    IngestionReport.Status status = IngestionReport.Status.CANCELLED;
    if (dispatchedAll && !cancellation.isCancelled()) {
      status = IngestionReport.Status.COMPLETED;
      deleted = tombstonePass(collection, seen, failures);
    } else {
      log.info("Ingestion of {} cancelled, skipping tombstone pass", collection);
    }

    IngestionReport report =
        new IngestionReport(
            collection,
            status,
            ingested.get(),
            unchanged.get(),
            deleted,
            failures.size(),
            List.copyOf(failures),
            Duration.between(started, clock.instant()));
    recordMetrics(report);
    log.info(
        "Ingestion of {} {}: ingested={}, unchanged={}, deleted={}, failed={} in {} ms",
        collection,
        status,
        report.ingested(),
        report.unchanged(),
        report.deleted(),
        report.failed(),
        report.elapsed().toMillis());
    return report;
  }

  private int tombstonePass(String collection, Set<String> seen, List<IngestionFailure> failures) {
    int deleted = 0;
    for (IngestionRecord record : recordRepository.findByCollection(collection)) {
      if (seen.contains(record.getPath())) {
        continue;
      }
      try {
        if (documentIngestor.remove(record)) {
          deleted++;
        }
      } catch (VectorStoreException e) {
        if (e.isStoreUnavailable()) {
          throw e;
        }
        failures.add(failure(record.getPath(), e));
      } catch (RuntimeException e) {
        log.warn("Failed to remove {}:{}: {}", collection, record.getPath(), e.getMessage());
        failures.add(failure(record.getPath(), e));
      }
    }
    return deleted;
  }

  private void recordMetrics(IngestionReport report) {
    meterRegistry.counter("ingestion.documents.ingested").increment(report.ingested());
    meterRegistry.counter("ingestion.documents.unchanged").increment(report.unchanged());
    meterRegistry.counter("ingestion.documents.deleted").increment(report.deleted());
    meterRegistry.counter("ingestion.documents.failed").increment(report.failed());
  }

  private static IngestionFailure failure(String path, RuntimeException e) {
    return new IngestionFailure(
        path, e.getClass().getSimpleName(), e.getMessage(), ResilienceConfig.isTransient(e));
  }
}
