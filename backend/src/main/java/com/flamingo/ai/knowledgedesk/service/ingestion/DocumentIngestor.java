package com.flamingo.ai.knowledgedesk.service.ingestion;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.domain.entity.IngestionRecord;
import com.flamingo.ai.knowledgedesk.domain.repository.IngestionRecordRepository;
import com.flamingo.ai.knowledgedesk.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledgedesk.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.knowledgedesk.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import com.flamingo.ai.knowledgedesk.service.rag.model.RawDocumentChunk;
import com.flamingo.ai.knowledgedesk.service.rag.parsing.DocumentParserRouter;
import com.flamingo.ai.knowledgedesk.service.rag.store.VectorStore;
import com.flamingo.ai.knowledgedesk.service.source.DocumentDescriptor;
import com.flamingo.ai.knowledgedesk.service.source.SourceAdapter;
import com.flamingo.ai.knowledgedesk.service.source.SourceDocument;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Striped;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Brings one source document's chunks in line with its current content.
 *
 * <p>A changed document is replaced insert-before-delete: chunks of the new version are written,
 * then the previous version's chunks are removed, then the ledger moves to the new version. If any
 * step fails, the new version's chunks are removed again and the document stays at its previous
 * version. Replaces of the same path are serialized by a striped lock.
 */
@Component
@Slf4j
public class DocumentIngestor {

  private static final int LOCK_STRIPES = 64;

  private final IngestionRecordRepository recordRepository;
  private final VectorStore vectorStore;
  private final EmbeddingService embeddingService;
  private final DocumentParserRouter parserRouter;
  private final DocumentChunker chunker;
  private final RagConfig ragConfig;
  private final Retry retry;
  private final Clock clock;
  private final Striped<Lock> pathLocks = Striped.lock(LOCK_STRIPES);

  public DocumentIngestor(
      IngestionRecordRepository recordRepository,
      VectorStore vectorStore,
      EmbeddingService embeddingService,
      DocumentParserRouter parserRouter,
      DocumentChunker chunker,
      RagConfig ragConfig,
      @Qualifier("ingestionRetry") Retry retry,
      Clock clock) {
    this.recordRepository = recordRepository;
    this.vectorStore = vectorStore;
    this.embeddingService = embeddingService;
    this.parserRouter = parserRouter;
    this.chunker = chunker;
    this.ragConfig = ragConfig;
    this.retry = retry;
    this.clock = clock;
  }

  /** Result of ingesting one document. */
  public enum Outcome {
    INGESTED,
    UNCHANGED
  }

  /**
   * Fetches and, if its content changed, re-indexes one document. Transient failures are retried
   * with backoff before they propagate.
   *
   * @return whether the document was rewritten
   */
  public Outcome ingest(String collection, SourceAdapter adapter, DocumentDescriptor descriptor) {
    SourceDocument document = retry.executeSupplier(() -> adapter.fetch(descriptor));
    String hash = Hashing.sha256().hashBytes(document.content()).toString();

    Lock lock = pathLocks.get(collection + "\u0000" + descriptor.path());
    lock.lock();
    try {
      Optional<IngestionRecord> existing =
          recordRepository.findByCollectionAndPath(collection, descriptor.path());
      if (existing.isPresent() && hash.equals(existing.get().getContentHash())) {
        log.debug("Unchanged {}:{}", collection, descriptor.path());
        return Outcome.UNCHANGED;
      }
      try {
        replace(collection, document, hash, existing.orElse(null));
        return Outcome.INGESTED;
      } catch (RuntimeException e) {
        existing.ifPresent(record -> recordFailure(record, e));
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes every chunk and the ledger entry of a document no longer at the source.
   *
   * @return true if a ledger entry was removed
   */
  public boolean remove(IngestionRecord record) {
    Lock lock = pathLocks.get(record.getCollection() + "\u0000" + record.getPath());
    lock.lock();
    try {
      vectorStore.deleteDocument(record.getCollection(), record.getPath());
      recordRepository.delete(record);
      log.info("Removed {}:{} (no longer at source)", record.getCollection(), record.getPath());
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void replace(
      String collection, SourceDocument document, String hash, IngestionRecord previous) {
    DocumentDescriptor descriptor = document.descriptor();
    ParsedDocument parsed = parserRouter.parse(document.content(), document.mimeType());
    List<RawDocumentChunk> rawChunks = chunker.chunk(parsed, ragConfig.getChunking());

    List<String> texts = rawChunks.stream().map(DocumentIngestor::embeddingText).toList();
    List<List<Float>> vectors =
        texts.isEmpty()
            ? List.of()
            : retry.executeSupplier(() -> embeddingService.embedBatch(texts));

    long newVersion = previous == null ? 1 : previous.getVersion() + 1;
    List<DocumentChunk> chunks = new ArrayList<>(rawChunks.size());
    for (int i = 0; i < rawChunks.size(); i++) {
      RawDocumentChunk raw = rawChunks.get(i);
      String id =
          DocumentChunk.chunkId(collection, descriptor.path(), newVersion, raw.chunkIndex());
      chunks.add(
          DocumentChunk.builder()
              .id(id)
              .collection(collection)
              .path(descriptor.path())
              .title(descriptor.title())
              .url(descriptor.url())
              .version(newVersion)
              .contentHash(hash)
              .chunkIndex(raw.chunkIndex())
              .content(raw.content())
              .tokenCount(raw.estimatedTokens())
              .sectionBreadcrumb(raw.sectionBreadcrumb())
              .embedding(vectors.get(i))
              .build());
    }

    try {
      if (!chunks.isEmpty()) {
        vectorStore.upsert(collection, chunks);
      }
      if (previous != null) {
        vectorStore.deleteDocument(collection, descriptor.path(), previous.getVersion());
      }
    } catch (RuntimeException e) {
      discardVersion(collection, descriptor.path(), newVersion, e);
      throw e;
    }

    Instant now = clock.instant();
    IngestionRecord record =
        previous != null
            ? previous
            : IngestionRecord.builder().collection(collection).path(descriptor.path()).build();
    record.markIngested(hash, newVersion, descriptor.modifiedAt(), now);
    recordRepository.save(record);
    log.info(
        "Ingested {}:{} v{} ({} chunks)", collection, descriptor.path(), newVersion, chunks.size());
  }

  private void discardVersion(
      String collection, String path, long version, RuntimeException cause) {
    try {
      vectorStore.deleteDocument(collection, path, version);
    } catch (RuntimeException cleanupError) {
      cause.addSuppressed(cleanupError);
      log.warn(
          "Could not remove partial v{} of {}:{}: {}",
          version,
          collection,
          path,
          cleanupError.getMessage());
    }
  }

  private void recordFailure(IngestionRecord record, RuntimeException error) {
    try {
      record.markFailed(error.getMessage(), clock.instant());
      recordRepository.save(record);
    } catch (RuntimeException e) {
      error.addSuppressed(e);
      log.warn("Could not record failure for {}: {}", record.getPath(), e.getMessage());
    }
  }

  private static String embeddingText(RawDocumentChunk chunk) {
    if (chunk.sectionBreadcrumb().isEmpty()) {
      return chunk.content();
    }
    return String.join(" > ", chunk.sectionBreadcrumb()) + "\n\n" + chunk.content();
  }
}
