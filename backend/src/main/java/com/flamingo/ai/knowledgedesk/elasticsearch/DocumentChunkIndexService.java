package com.flamingo.ai.knowledgedesk.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.knowledgedesk.exception.VectorStoreException;
import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import com.flamingo.ai.knowledgedesk.service.rag.store.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link VectorStore} backed by a single Elasticsearch index.
 *
 * <p>Collections are a {@code collection} keyword filter rather than separate indices. Vectors use
 * cosine similarity; Elasticsearch reports knn scores as {@code (1 + cos) / 2}, which this class
 * maps back to the cosine before applying the minimum score.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk>
    implements VectorStore {

  @Value("${app.elasticsearch.index-name:knowledge-desk-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  @Timed(value = "vector_store.upsert", description = "Time to write chunks")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertFallback")
  public void upsert(String collection, List<DocumentChunk> chunks) {
    for (DocumentChunk chunk : chunks) {
      if (!collection.equals(chunk.getCollection())) {
        throw new IllegalArgumentException(
            "Chunk " + chunk.getId() + " belongs to " + chunk.getCollection());
      }
    }
    indexDocuments(chunks);
  }

  @Override
  @Timed(value = "vector_store.delete", description = "Time to delete a document version")
  public void deleteDocument(String collection, String path, long version) {
    long deleted =
        deleteByQuery(
            Query.of(
                q ->
                    q.bool(
                        b ->
                            b.filter(term("collection", collection))
                                .filter(term("path", path))
                                .filter(f -> f.term(t -> t.field("version").value(version))))));
    log.debug("Deleted {} chunks of {}:{} v{}", deleted, collection, path, version);
  }

  @Override
  @Timed(value = "vector_store.delete", description = "Time to delete a document")
  public void deleteDocument(String collection, String path) {
    long deleted =
        deleteByQuery(
            Query.of(
                q ->
                    q.bool(
                        b -> b.filter(term("collection", collection)).filter(term("path", path)))));
    log.debug("Deleted {} chunks of {}:{} (all versions)", deleted, collection, path);
  }

  @Override
  @Timed(value = "vector_store.query", description = "Time for a similarity query")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "queryFallback")
  public List<ScoredChunk> query(String collection, List<Float> vector, int k, double minScore) {
    if (k <= 0) {
      return List.of();
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        knn ->
                            knn.field(EMBEDDING_FIELD)
                                .queryVector(vector)
                                .k(k)
                                .numCandidates(Math.max(k * 4, 50))
                                .filter(term("collection", collection)))
                    .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                    .size(k));

    List<ScoredChunk> results =
        search(request).stream()
            .map(hit -> new ScoredChunk(hit.document(), toCosine(hit.score())))
            .filter(sc -> sc.score() >= minScore)
            .sorted(ScoredChunk.BY_SCORE_DESC)
            .toList();
    log.info(
        "Vector query on collection={} k={} minScore={} returned {} chunks",
        collection,
        k,
        minScore,
        results.size());
    return results;
  }

  @SuppressWarnings("unused")
  private void upsertFallback(String collection, List<DocumentChunk> chunks, Throwable t) {
    throw asStoreFailure(t);
  }

  @SuppressWarnings("unused")
  private List<ScoredChunk> queryFallback(
      String collection, List<Float> vector, int k, double minScore, Throwable t) {
    throw asStoreFailure(t);
  }

  /** An open breaker means the store has been failing; callers treat that as an outage. */
  private RuntimeException asStoreFailure(Throwable t) {
    if (t instanceof CallNotPermittedException) {
      meterRegistry.counter("vector_store.circuit_open").increment();
      return new VectorStoreException("Vector store circuit is open", true, t);
    }
    if (t instanceof RuntimeException e) {
      return e;
    }
    return new VectorStoreException("Vector store call failed: " + t.getMessage(), true, t);
  }

  static double toCosine(double esScore) {
    return 2 * esScore - 1;
  }

  private static Query term(String field, String value) {
    return Query.of(q -> q.term(t -> t.field(field).value(FieldValue.of(value))));
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // identity fields are keywords for exact filtering
    properties.put("collection", Property.of(p -> p.keyword(k -> k)));
    properties.put("path", Property.of(p -> p.keyword(k -> k)));
    properties.put("version", Property.of(p -> p.long_(l -> l)));
    properties.put("contentHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("url", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("tokenCount", Property.of(p -> p.integer(i -> i)));
    properties.put("sectionBreadcrumb", Property.of(p -> p.keyword(k -> k)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity("cosine")))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("collection", chunk.getCollection());
    document.put("path", chunk.getPath());
    document.put("version", chunk.getVersion());
    document.put("contentHash", chunk.getContentHash());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    document.put("tokenCount", chunk.getTokenCount());
    document.put(EMBEDDING_FIELD, chunk.getEmbedding());
    if (chunk.getTitle() != null) {
      document.put("title", chunk.getTitle());
    }
    if (chunk.getUrl() != null) {
      document.put("url", chunk.getUrl());
    }
    if (chunk.getSectionBreadcrumb() != null && !chunk.getSectionBreadcrumb().isEmpty()) {
      document.put("sectionBreadcrumb", chunk.getSectionBreadcrumb());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    DocumentChunk.DocumentChunkBuilder builder =
        DocumentChunk.builder()
            .id((String) source.get("id"))
            .collection((String) source.get("collection"))
            .path((String) source.get("path"))
            .version(((Number) source.get("version")).longValue())
            .contentHash((String) source.get("contentHash"))
            .chunkIndex(((Number) source.get("chunkIndex")).intValue())
            .content((String) source.get("content"))
            .title((String) source.get("title"))
            .url((String) source.get("url"));
    if (source.get("tokenCount") instanceof Number n) {
      builder.tokenCount(n.intValue());
    }
    if (source.get("sectionBreadcrumb") instanceof List<?> crumb) {
      builder.sectionBreadcrumb((List<String>) crumb);
    }
    return builder.build();
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }
}
