package com.flamingo.ai.knowledgedesk.service.rag.completion;

import reactor.core.publisher.Flux;

/**
 * External chat completion service.
 *
 * <p>Failures surface as {@link com.flamingo.ai.knowledgedesk.exception.CompletionServiceException}
 * (thrown, or signalled through the stream).
 */
public interface ChatCompletionService {

  /** Blocking completion. */
  String complete(CompletionPrompt prompt);

  /**
   * Streams the completion as text fragments in arrival order. Nothing is requested until
   * subscription; cancelling the subscription releases the upstream connection.
   */
  Flux<String> completeStreaming(CompletionPrompt prompt);
}
