package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import java.util.List;
import reactor.core.publisher.Flux;

/**
 * An answer delivered as text fragments.
 *
 * <p>Citations are known before the first fragment. {@code fragments} is cold and single-use: it
 * calls the completion service on subscription, and cancelling it ends the upstream call.
 */
public record StreamingAnswer(List<Citation> citations, boolean grounded, Flux<String> fragments) {

  public static StreamingAnswer of(Answer answer) {
    return new StreamingAnswer(answer.citations(), answer.grounded(), Flux.just(answer.text()));
  }
}
