package com.flamingo.ai.knowledgedesk.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.knowledgedesk.exception.VectorStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch indices that store documents with a dense vector.
 *
 * <p>Failures are reported as {@link VectorStoreException}. Transport failures ({@link
 * IOException}) mean the cluster cannot be reached and are flagged {@code storeUnavailable};
 * rejected requests and per-item bulk errors are not.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected static final String EMBEDDING_FIELD = "embedding";

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /** Metric name prefix, e.g. {@code document_chunk}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        Map<String, Property> properties = defineIndexProperties();
        indices.create(
            CreateIndexRequest.of(
                c ->
                    c.index(getIndexName())
                        .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties))));
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        log.debug("Elasticsearch index '{}' already exists", getIndexName());
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  /**
   * Bulk-indexes documents and waits until they are searchable.
   *
   * @throws VectorStoreException if the request fails or any item is rejected
   */
  protected void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }

    BulkRequest request = bulkBuilder.build();
    BulkResponse response = execute("bulk index", () -> elasticsearchClient.bulk(request));
    if (response.errors()) {
      List<String> reasons = new ArrayList<>();
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          reasons.add(item.id() + ": " + item.error().reason());
        }
      }
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw new VectorStoreException(
          String.format(
              "Bulk index into %s rejected %d item(s): %s",
              getIndexName(), reasons.size(), reasons),
          false);
    }
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
  }

  /** Runs a search and maps hits with their scores. A missing index yields no hits. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<Scored<T>> search(SearchRequest request) {
    SearchResponse<Map> response;
    try {
      response = execute("search", () -> elasticsearchClient.search(request, Map.class));
    } catch (VectorStoreException e) {
      if (e.getCause() instanceof ElasticsearchException ee && ee.status() == 404) {
        log.warn("Index {} does not exist, returning no results", getIndexName());
        return List.of();
      }
      throw e;
    }
    List<Scored<T>> results = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      source.put("id", hit.id());
      double score = hit.score() != null ? hit.score() : 0;
      results.add(new Scored<>(convertFromDocument(source), score));
    }
    meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
    return results;
  }

  /** Deletes matching documents and refreshes so the deletion is visible to the next query. */
  protected long deleteByQuery(Query query) {
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query).refresh(true));
    DeleteByQueryResponse response =
        execute("delete by query", () -> elasticsearchClient.deleteByQuery(request));
    long deleted = response.deleted() != null ? response.deleted() : 0;
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
    return deleted;
  }

  private <R> R execute(String operation, EsCall<R> call) {
    try {
      return call.run();
    } catch (IOException e) {
      log.error("Elasticsearch {} on {} failed: {}", operation, getIndexName(), e.getMessage());
      throw new VectorStoreException(
          "Elasticsearch unreachable during " + operation + ": " + e.getMessage(), true, e);
    } catch (ElasticsearchException e) {
      log.warn("Elasticsearch {} on {} rejected: {}", operation, getIndexName(), e.getMessage());
      throw new VectorStoreException(
          "Elasticsearch rejected " + operation + ": " + e.getMessage(), false, e);
    }
  }

  @FunctionalInterface
  private interface EsCall<R> {
    R run() throws IOException;
  }

  /** A document with its raw Elasticsearch score. */
  public record Scored<T>(T document, double score) {}
}
