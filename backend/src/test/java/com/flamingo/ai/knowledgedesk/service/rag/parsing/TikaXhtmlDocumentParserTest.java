package com.flamingo.ai.knowledgedesk.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgedesk.service.rag.model.DocumentSection;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TikaXhtmlDocumentParser Tests")
class TikaXhtmlDocumentParserTest {

  private TikaXhtmlDocumentParser parser;

  @BeforeEach
  void setUp() {
    parser = new TikaXhtmlDocumentParser();
  }

  private ParsedDocument parseHtml(String body) {
    String html = "<html><head><title>t</title></head><body>" + body + "</body></html>";
    return parser.parse(html.getBytes(StandardCharsets.UTF_8), "text/html");
  }

  @Test
  @DisplayName("should split HTML into sections with heading breadcrumbs")
  void shouldSplitIntoSections_withBreadcrumbs() {
    ParsedDocument doc =
        parseHtml(
            "<h1>Runbook</h1><p>Overview.</p>"
                + "<h2>Restart</h2><p>Use systemctl restart.</p>"
                + "<h2>Logs</h2><p>Check journalctl.</p>");

    assertThat(doc.sections())
        .extracting(DocumentSection::breadcrumb)
        .containsExactly(
            List.of("Runbook"), List.of("Runbook", "Restart"), List.of("Runbook", "Logs"));
    assertThat(doc.sections().get(1).content()).isEqualTo("Use systemctl restart.");
    assertThat(doc.fullText()).contains("Runbook").contains("Check journalctl.");
  }

  @Test
  @DisplayName("should render tables as markdown inside the current section")
  void shouldRenderTablesAsMarkdown() {
    ParsedDocument doc =
        parseHtml(
            "<h1>Ports</h1>"
                + "<table><tr><th>Name</th><th>Port</th></tr>"
                + "<tr><td>http</td><td>8080</td></tr></table>"
                + "<p>Open them in the firewall.</p>");

    assertThat(doc.sections()).hasSize(1);
    String content = doc.sections().get(0).content();
    assertThat(content)
        .contains("| Name | Port |")
        .contains("|---|---|")
        .contains("| http | 8080 |");
    assertThat(content).contains("Open them in the firewall.");
  }

  @Test
  @DisplayName("should keep text before the first heading")
  void shouldPreserveContentBeforeFirstHeading() {
    ParsedDocument doc = parseHtml("<p>Preamble text.</p><h1>First</h1><p>Body.</p>");

    assertThat(doc.sections()).hasSize(2);
    assertThat(doc.sections().get(0).level()).isZero();
    assertThat(doc.sections().get(0).content()).isEqualTo("Preamble text.");
  }

  @Test
  @DisplayName("should accept any non-null MIME type")
  void shouldSupportAnyMimeType() {
    assertThat(parser.supports("application/pdf")).isTrue();
    assertThat(parser.supports(null)).isFalse();
  }
}
