package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalQuery;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.RetrievalService;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Specialist answering from the collections bound to its tag. The general specialist searches
 * every collection and reports a fixed, low relevance so that it is only chosen as a fallback or
 * by the user.
 */
@Slf4j
public class RetrievalSpecialist implements Specialist {

  static final double GENERAL_RELEVANCE = 0.3;

  private final SpecialistTag tag;
  private final RetrievalService retrievalService;
  private final RagConfig ragConfig;
  private final KeywordRelevance relevance;

  public RetrievalSpecialist(
      SpecialistTag tag,
      RetrievalService retrievalService,
      RagConfig ragConfig,
      List<String> keywords) {
    this.tag = tag;
    this.retrievalService = retrievalService;
    this.ragConfig = ragConfig;
    this.relevance = new KeywordRelevance(keywords);
  }

  @Override
  public SpecialistTag tag() {
    return tag;
  }

  @Override
  public double classifyRelevance(String query) {
    if (tag == SpecialistTag.GENERAL) {
      return GENERAL_RELEVANCE;
    }
    if (ragConfig.collectionsFor(tag).isEmpty()) {
      return 0.0;
    }
    return relevance.score(query);
  }

  @Override
  public Answer answer(String query) {
    return retrievalService.answer(toRetrievalQuery(query));
  }

  @Override
  public StreamingAnswer streamAnswer(String query) {
    return retrievalService.streamAnswer(toRetrievalQuery(query));
  }

  private RetrievalQuery toRetrievalQuery(String query) {
    List<String> collections = ragConfig.collectionsFor(tag);
    if (collections.isEmpty()) {
      throw new IllegalStateException("No collections configured for specialist " + tag);
    }
    log.debug("{} specialist searching {}", tag, collections);
    return RetrievalQuery.of(query, collections);
  }
}
