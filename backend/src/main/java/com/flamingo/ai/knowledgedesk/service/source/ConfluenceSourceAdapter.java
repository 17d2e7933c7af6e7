package com.flamingo.ai.knowledgedesk.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.knowledgedesk.exception.PermanentSourceException;
import com.flamingo.ai.knowledgedesk.exception.TransientSourceException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link SourceAdapter} for the pages of one Confluence space.
 *
 * <p>Page titles are unique within a space, so a page's path is {@code /SPACE/Title}. Content is
 * the page's storage-format XHTML, parsed downstream like any other HTML.
 */
@Slf4j
public class ConfluenceSourceAdapter implements SourceAdapter {

  private final WebClient webClient;
  private final String baseUrl;
  private final int pageSize;
  private final Duration timeout;

  public ConfluenceSourceAdapter(
      WebClient webClient, String baseUrl, int pageSize, Duration timeout) {
    this.webClient = webClient;
    this.baseUrl = baseUrl;
    this.pageSize = pageSize;
    this.timeout = timeout;
  }

  @Override
  public List<DocumentDescriptor> list(SourceConfig config) {
    String spaceKey = config.root();
    List<DocumentDescriptor> descriptors = new ArrayList<>();
    int start = 0;
    while (true) {
      int offset = start;
      JsonNode page =
          call(
              "/SPACE/" + spaceKey,
              webClient
                  .get()
                  .uri(
                      uri ->
                          uri.path("/rest/api/content")
                              .queryParam("spaceKey", spaceKey)
                              .queryParam("type", "page")
                              .queryParam("start", offset)
                              .queryParam("limit", pageSize)
                              .queryParam("expand", "version")
                              .build())
                  .accept(MediaType.APPLICATION_JSON)
                  .retrieve()
                  .bodyToMono(JsonNode.class));
      JsonNode results = page.path("results");
      for (JsonNode result : results) {
        DocumentDescriptor descriptor = describe(spaceKey, result);
        if (config.accepts(descriptor.path())) {
          descriptors.add(descriptor);
        }
      }
      if (results.size() < pageSize) {
        break;
      }
      start += results.size();
    }
    log.info("Listed {} Confluence pages in space {}", descriptors.size(), spaceKey);
    return descriptors;
  }

  @Override
  public SourceDocument fetch(DocumentDescriptor descriptor) {
    JsonNode page =
        call(
            descriptor.path(),
            webClient
                .get()
                .uri("/rest/api/content/{id}?expand=body.storage", descriptor.sourceId())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class));
    String html = page.path("body").path("storage").path("value").asText("");
    String document =
        "<html><body><h1>" + escape(descriptor.title()) + "</h1>" + html + "</body></html>";
    return new SourceDocument(descriptor, document.getBytes(StandardCharsets.UTF_8), "text/html");
  }

  private DocumentDescriptor describe(String spaceKey, JsonNode result) {
    String title = result.path("title").asText();
    String webUi = result.path("_links").path("webui").asText(null);
    return new DocumentDescriptor(
        "/" + spaceKey + "/" + title,
        parseInstant(result.path("version").path("when").asText(null)),
        title,
        webUi != null ? baseUrl + webUi : null,
        result.path("id").asText());
  }

  private JsonNode call(String path, Mono<JsonNode> request) {
    try {
      JsonNode body = request.timeout(timeout).block();
      if (body == null) {
        throw new TransientSourceException("Empty response from Confluence for " + path);
      }
      return body;
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      if (status == 404) {
        throw PermanentSourceException.notFound(path);
      }
      if (status == 401 || status == 403) {
        throw PermanentSourceException.accessDenied(path);
      }
      throw new TransientSourceException("Confluence returned HTTP " + status + " for " + path, e);
    } catch (WebClientRequestException e) {
      throw new TransientSourceException("Confluence unreachable: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      if (e.getCause() instanceof TimeoutException) {
        throw new TransientSourceException("Confluence request timed out for " + path, e);
      }
      throw e;
    }
  }

  private static Instant parseInstant(String value) {
    if (value == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      log.debug("Unparseable Confluence timestamp '{}'", value);
      return null;
    }
  }

  private static String escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
