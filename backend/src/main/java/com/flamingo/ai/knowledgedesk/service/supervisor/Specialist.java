package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;

/**
 * An answering capability the supervisor can dispatch a query to.
 *
 * <p>A specialist signals failure by throwing; an answer that found nothing relevant is a normal,
 * ungrounded {@link Answer}.
 */
public interface Specialist {

  SpecialistTag tag();

  /** How well this specialist fits the query, from 0 (unrelated) to 1 (certain). */
  double classifyRelevance(String query);

  Answer answer(String query);

  StreamingAnswer streamAnswer(String query);
}
