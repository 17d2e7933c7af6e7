package com.flamingo.ai.knowledgedesk.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledgedesk.exception.PermanentSourceException;
import com.flamingo.ai.knowledgedesk.exception.TransientSourceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

@DisplayName("ConfluenceSourceAdapter Tests")
class ConfluenceSourceAdapterTest {

  private MockWebServer server;
  private ConfluenceSourceAdapter adapter;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    baseUrl = server.url("/wiki").toString();
    adapter =
        new ConfluenceSourceAdapter(WebClient.create(baseUrl), baseUrl, 2, Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private void enqueueJson(String body) {
    server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
  }

  private static String page(String id, String title, String when) {
    return "{\"id\":\""
        + id
        + "\",\"title\":\""
        + title
        + "\",\"version\":{\"when\":\""
        + when
        + "\"},\"_links\":{\"webui\":\"/spaces/TECH/pages/"
        + id
        + "\"}}";
  }

  @Test
  @DisplayName("should page through the space and describe each page")
  void shouldListAllPages() throws InterruptedException {
    enqueueJson(
        "{\"results\":["
            + page("1", "Runbook", "2026-01-05T10:15:30.000+01:00")
            + ","
            + page("2", "Deploy", "2026-01-06T08:00:00.000Z")
            + "]}");
    enqueueJson("{\"results\":[" + page("3", "Draft notes", "2026-01-07T08:00:00.000Z") + "]}");

    List<DocumentDescriptor> pages =
        adapter.list(SourceConfig.of("TECH", ".*", "/TECH/Draft.*", true));

    assertThat(pages)
        .extracting(DocumentDescriptor::path)
        .containsExactly("/TECH/Runbook", "/TECH/Deploy");
    DocumentDescriptor runbook = pages.get(0);
    assertThat(runbook.sourceId()).isEqualTo("1");
    assertThat(runbook.url()).isEqualTo(baseUrl + "/spaces/TECH/pages/1");
    assertThat(runbook.modifiedAt()).isEqualTo(Instant.parse("2026-01-05T09:15:30Z"));

    RecordedRequest first = server.takeRequest();
    assertThat(first.getPath())
        .startsWith("/wiki/rest/api/content")
        .contains("spaceKey=TECH")
        .contains("start=0")
        .contains("limit=2");
    assertThat(server.takeRequest().getPath()).contains("start=2");
  }

  @Test
  @DisplayName("should fetch the storage body wrapped under the page title")
  void shouldFetchStorageBody() throws InterruptedException {
    enqueueJson("{\"id\":\"1\",\"body\":{\"storage\":{\"value\":\"<p>Restart the node.</p>\"}}}");
    DocumentDescriptor descriptor =
        new DocumentDescriptor("/TECH/Runbook", null, "Runbook", null, "1");

    SourceDocument document = adapter.fetch(descriptor);

    assertThat(document.mimeType()).isEqualTo("text/html");
    assertThat(new String(document.content(), StandardCharsets.UTF_8))
        .isEqualTo("<html><body><h1>Runbook</h1><p>Restart the node.</p></body></html>");
    assertThat(server.takeRequest().getPath())
        .isEqualTo("/wiki/rest/api/content/1?expand=body.storage");
  }

  @Test
  @DisplayName("should map 404 to not found and 403 to access denied")
  void shouldMapClientErrorsToPermanentFailures() {
    DocumentDescriptor descriptor = new DocumentDescriptor("/TECH/Gone", null, "Gone", null, "9");
    server.enqueue(new MockResponse().setResponseCode(404));
    server.enqueue(new MockResponse().setResponseCode(403));

    assertThatThrownBy(() -> adapter.fetch(descriptor))
        .isInstanceOfSatisfying(
            PermanentSourceException.class,
            e -> assertThat(e.getKind()).isEqualTo(PermanentSourceException.Kind.NOT_FOUND));
    assertThatThrownBy(() -> adapter.fetch(descriptor))
        .isInstanceOfSatisfying(
            PermanentSourceException.class,
            e -> assertThat(e.getKind()).isEqualTo(PermanentSourceException.Kind.ACCESS_DENIED));
  }

  @Test
  @DisplayName("should treat rate limiting and server errors as transient")
  void shouldMapServerErrorsToTransientFailures() {
    DocumentDescriptor descriptor = new DocumentDescriptor("/TECH/Busy", null, "Busy", null, "5");
    server.enqueue(new MockResponse().setResponseCode(429));

    assertThatThrownBy(() -> adapter.fetch(descriptor))
        .isInstanceOf(TransientSourceException.class)
        .hasMessageContaining("429");
  }

  @Test
  @DisplayName("should treat a slow response as a transient timeout")
  void shouldTimeOut() {
    adapter =
        new ConfluenceSourceAdapter(
            WebClient.create(baseUrl), baseUrl, 2, Duration.ofMillis(200));
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"results\":[]}")
            .setHeadersDelay(2, TimeUnit.SECONDS));

    assertThatThrownBy(() -> adapter.list(SourceConfig.of("TECH", ".*", null, true)))
        .isInstanceOf(TransientSourceException.class)
        .hasMessageContaining("timed out");
  }
}
