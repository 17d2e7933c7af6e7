package com.flamingo.ai.knowledgedesk.service.rag.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledgedesk.exception.CompletionServiceException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

/**
 * {@link ChatCompletionService} for OpenAI-compatible endpoints.
 *
 * <p>Blocking calls go through the LangChain4j {@link ChatModel}. Streaming calls post to {@code
 * /chat/completions} with {@code stream=true} and decode the server-sent events directly, so the
 * returned {@link Flux} owns the HTTP exchange: cancelling it closes the connection.
 */
@Service
@Slf4j
public class OpenAiChatCompletionService implements ChatCompletionService {

  private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
      new ParameterizedTypeReference<>() {};
  private static final String DONE = "[DONE]";

  private final ChatModel chatModel;
  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final String modelName;
  private final Duration streamIdleTimeout;

  public OpenAiChatCompletionService(
      ChatModel chatModel,
      @Qualifier("completionWebClient") WebClient webClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}") String modelName,
      @Value("${langchain4j.openai.chat-model.stream-idle-timeout:30s}")
          Duration streamIdleTimeout) {
    this.chatModel = chatModel;
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.modelName = modelName;
    this.streamIdleTimeout = streamIdleTimeout;
  }

  @Override
  @Timed(value = "completion.complete", description = "Time for a blocking completion")
  public String complete(CompletionPrompt prompt) {
    try {
      ChatResponse response =
          chatModel.chat(
              List.of(SystemMessage.from(prompt.system()), UserMessage.from(prompt.user())));
      meterRegistry.counter("completion.requests.success", "mode", "blocking").increment();
      return response.aiMessage().text();
    } catch (RuntimeException e) {
      meterRegistry.counter("completion.requests.failure", "mode", "blocking").increment();
      boolean permanent = e instanceof NonRetriableException;
      log.warn("Completion failed (permanent={}): {}", permanent, e.getMessage());
      throw new CompletionServiceException("Completion failed: " + e.getMessage(), permanent, e);
    }
  }

  @Override
  public Flux<String> completeStreaming(CompletionPrompt prompt) {
    Map<String, Object> body =
        Map.of(
            "model",
            modelName,
            "stream",
            true,
            "messages",
            List.of(
                Map.of("role", "system", "content", prompt.system()),
                Map.of("role", "user", "content", prompt.user())));

    return webClient
        .post()
        .uri("/chat/completions")
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.TEXT_EVENT_STREAM)
        .bodyValue(body)
        .retrieve()
        .bodyToFlux(SSE_TYPE)
        .timeout(streamIdleTimeout)
        .mapNotNull(ServerSentEvent::data)
        .takeWhile(data -> !DONE.equals(data.trim()))
        .mapNotNull(this::deltaContent)
        .filter(fragment -> !fragment.isEmpty())
        .doOnComplete(
            () ->
                meterRegistry.counter("completion.requests.success", "mode", "stream").increment())
        .doOnCancel(() -> log.debug("Completion stream cancelled by consumer"))
        .onErrorMap(e -> !(e instanceof CompletionServiceException), this::translateStreamError);
  }

  private String deltaContent(String data) {
    try {
      JsonNode root = objectMapper.readTree(data);
      JsonNode content = root.path("choices").path(0).path("delta").path("content");
      return content.isTextual() ? content.asText() : null;
    } catch (Exception e) {
      throw new CompletionServiceException("Malformed stream event: " + data, false, e);
    }
  }

  private CompletionServiceException translateStreamError(Throwable e) {
    meterRegistry.counter("completion.requests.failure", "mode", "stream").increment();
    if (e instanceof WebClientResponseException wre) {
      int status = wre.getStatusCode().value();
      boolean permanent = status >= 400 && status < 500 && status != 408 && status != 429;
      log.warn("Completion stream failed with HTTP {} (permanent={})", status, permanent);
      return new CompletionServiceException(
          "Completion stream failed with HTTP " + status, permanent, e);
    }
    if (e instanceof TimeoutException) {
      log.warn("Completion stream idle for more than {}", streamIdleTimeout);
      return new CompletionServiceException("Completion stream timed out", false, e);
    }
    log.warn("Completion stream failed: {}", e.getMessage());
    return new CompletionServiceException("Completion stream failed: " + e.getMessage(), false, e);
  }
}
