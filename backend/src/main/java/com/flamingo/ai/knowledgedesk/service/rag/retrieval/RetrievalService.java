package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.exception.VectorStoreException;
import com.flamingo.ai.knowledgedesk.service.rag.completion.ChatCompletionService;
import com.flamingo.ai.knowledgedesk.service.rag.completion.CompletionPrompt;
import com.flamingo.ai.knowledgedesk.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import com.flamingo.ai.knowledgedesk.service.rag.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Retrieval-augmented answering over one or more collections.
 *
 * <p>The query is embedded once and run against each collection with the minimum score applied.
 * Results are merged across collections and ranked by score. When a document is mid-replace and
 * two of its versions are visible, only chunks of the newest version are kept. If nothing scores
 * above the threshold the completion service is not called and an explicit no-answer result is
 * returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalService {

  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ChatCompletionService completionService;
  private final ContextAssembler contextAssembler;
  private final GroundedPromptBuilder promptBuilder;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds the query and returns matching chunks from every requested collection.
   *
   * @param query the query
   * @return chunks ordered by non-increasing score, all at or above the minimum score
   * @throws VectorStoreException if the vector store is unreachable
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve chunks")
  public RetrievalResult retrieve(RetrievalQuery query) {
    int topK = query.topK() != null ? query.topK() : ragConfig.getRetrieval().getTopK();
    double minScore =
        query.minScore() != null ? query.minScore() : ragConfig.getRetrieval().getMinScore();

    List<Float> vector = embeddingService.embed(query.text());
    List<ScoredChunk> merged = new ArrayList<>();
    for (String collection : query.collections()) {
      try {
        merged.addAll(vectorStore.query(collection, vector, topK, minScore));
      } catch (VectorStoreException e) {
        if (e.isStoreUnavailable()) {
          throw e;
        }
        log.warn("Query against collection {} failed, skipping it: {}", collection, e.getMessage());
      }
    }

    List<ScoredChunk> ranked =
        latestVersionsOnly(merged).stream()
            .filter(sc -> sc.score() >= minScore)
            .sorted(ScoredChunk.BY_SCORE_DESC)
            .limit(topK)
            .toList();
    log.info(
        "Retrieved {} chunks for query across collections {}", ranked.size(), query.collections());
    return new RetrievalResult(ranked);
  }

  /**
   * Answers the query from retrieved context.
   *
   * @param query the query
   * @return a grounded answer, or {@link Answer#noGroundedAnswer()} when nothing relevant exists
   */
  @Timed(value = "retrieval.answer", description = "Time to answer a query")
  public Answer answer(RetrievalQuery query) {
    RetrievalResult result = retrieve(query);
    if (result.isEmpty()) {
      return noGroundedAnswer(query);
    }
    List<ScoredChunk> context = contextAssembler.assemble(result.chunks(), tokenBudget(query));
    CompletionPrompt prompt = promptBuilder.build(query.text(), context);
    String text = completionService.complete(prompt);
    return new Answer(text, citations(context), true);
  }

  /**
   * Streaming variant of {@link #answer}. Retrieval happens before this method returns; the
   * completion runs when the returned fragments are subscribed to.
   */
  public StreamingAnswer streamAnswer(RetrievalQuery query) {
    RetrievalResult result = retrieve(query);
    if (result.isEmpty()) {
      return StreamingAnswer.of(noGroundedAnswer(query));
    }
    List<ScoredChunk> context = contextAssembler.assemble(result.chunks(), tokenBudget(query));
    CompletionPrompt prompt = promptBuilder.build(query.text(), context);
    return new StreamingAnswer(
        citations(context), true, completionService.completeStreaming(prompt));
  }

  private Answer noGroundedAnswer(RetrievalQuery query) {
    log.info("No chunks above threshold for query in {}", query.collections());
    meterRegistry.counter("retrieval.no_grounded_answer").increment();
    return Answer.noGroundedAnswer();
  }

  private int tokenBudget(RetrievalQuery query) {
    return query.tokenBudget() != null
        ? query.tokenBudget()
        : ragConfig.getRetrieval().getTokenBudget();
  }

  /** Drops chunks of any document version older than the newest version present. */
  static List<ScoredChunk> latestVersionsOnly(List<ScoredChunk> chunks) {
    Map<String, Long> newest = new HashMap<>();
    for (ScoredChunk sc : chunks) {
      newest.merge(documentKey(sc), sc.chunk().getVersion(), Math::max);
    }
    return chunks.stream()
        .filter(sc -> sc.chunk().getVersion() == newest.get(documentKey(sc)))
        .toList();
  }

  static List<Citation> citations(List<ScoredChunk> context) {
    Map<String, Citation> byDocument = new LinkedHashMap<>();
    for (ScoredChunk sc : context) {
      Citation citation =
          new Citation(
              sc.chunk().getCollection(),
              sc.chunk().getPath(),
              sc.chunk().getTitle(),
              sc.chunk().getUrl(),
              sc.score());
      byDocument.putIfAbsent(citation.documentKey(), citation);
    }
    return List.copyOf(byDocument.values());
  }

  private static String documentKey(ScoredChunk sc) {
    return sc.chunk().getCollection() + ":" + sc.chunk().getPath();
  }
}
