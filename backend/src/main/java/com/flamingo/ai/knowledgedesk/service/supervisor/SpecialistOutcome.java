package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;

/**
 * What one dispatched specialist produced.
 *
 * @param requested the specialist the router chose
 * @param answeredBy the specialist that produced the answer, differs after a fallback, null on
 *     failure
 * @param confidence classification confidence of the requested specialist
 * @param answer the answer, null on failure and for streamed answers
 * @param error the last failure, null on success
 */
record SpecialistOutcome(
    SpecialistTag requested,
    SpecialistTag answeredBy,
    double confidence,
    Answer answer,
    RuntimeException error) {

  boolean succeeded() {
    return answeredBy != null;
  }
}
