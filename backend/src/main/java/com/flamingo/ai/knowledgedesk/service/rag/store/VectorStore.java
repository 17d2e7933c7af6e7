package com.flamingo.ai.knowledgedesk.service.rag.store;

import com.flamingo.ai.knowledgedesk.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import java.util.List;

/**
 * Persistence for chunks and their vectors, partitioned by collection.
 *
 * <p>All methods throw {@link com.flamingo.ai.knowledgedesk.exception.VectorStoreException};
 * {@code isStoreUnavailable()} is set when the store itself cannot be reached.
 */
public interface VectorStore {

  /** Writes the chunks and returns once they are durable and visible to queries. */
  void upsert(String collection, List<DocumentChunk> chunks);

  /** Removes every chunk of one version of a document. */
  void deleteDocument(String collection, String path, long version);

  /** Removes every chunk of a document, whatever its version. */
  void deleteDocument(String collection, String path);

  /**
   * Returns up to {@code k} chunks of the collection with similarity at least {@code minScore},
   * ordered by descending score. A collection with no matches yields an empty list.
   */
  List<ScoredChunk> query(String collection, List<Float> vector, int k, double minScore);
}
