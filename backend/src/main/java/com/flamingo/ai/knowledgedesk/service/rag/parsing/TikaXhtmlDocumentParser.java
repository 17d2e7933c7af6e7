package com.flamingo.ai.knowledgedesk.service.rag.parsing;

import com.flamingo.ai.knowledgedesk.exception.PermanentSourceException;
import com.flamingo.ai.knowledgedesk.service.rag.model.DocumentSection;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * {@link DocumentParser} for HTML and Office formats (Confluence storage format, DOCX, PPTX, ODF,
 * PDF text layer).
 *
 * <p>Apache Tika renders the input to XHTML; the DOM walk then turns:
 *
 * <ul>
 *   <li>{@code <h1>}–{@code <h6>} into section boundaries with a heading breadcrumb
 *   <li>{@code <table>} into a Markdown pipe table kept inside the current section
 *   <li>paragraphs, list items and preformatted blocks into section text
 * </ul>
 */
@Service
@Slf4j
public class TikaXhtmlDocumentParser implements DocumentParser {

  @Override
  public ParsedDocument parse(byte[] content, String mimeType) {
    try {
      byte[] xhtml = toXhtml(content, mimeType);
      return parseXhtml(xhtml);
    } catch (Exception e) {
      log.error("Tika parsing failed for mimeType={}: {}", mimeType, e.getMessage());
      throw new PermanentSourceException(
          PermanentSourceException.Kind.UNREADABLE,
          null,
          "Unparseable document (" + mimeType + "): " + e.getMessage(),
          e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null;
  }

  private byte[] toXhtml(byte[] content, String mimeType) throws Exception {
    AutoDetectParser tika = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, mimeType);
    tika.parse(new ByteArrayInputStream(content), handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  private ParsedDocument parseXhtml(byte[] xhtml) throws Exception {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    dom.getDocumentElement().normalize();

    SectionCollector collector = new SectionCollector();
    walk(dom.getDocumentElement(), collector);
    collector.flush();
    return new ParsedDocument(collector.fullText.toString().strip(), collector.sections);
  }

  private void walk(Element root, SectionCollector collector) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = localName(el);

      if (tag.matches("h[1-6]")) {
        collector.startSection(Integer.parseInt(tag.substring(1)), el.getTextContent().trim());
      } else if ("table".equals(tag)) {
        collector.appendBlock(tableToMarkdown(el));
      } else if ("p".equals(tag) || "li".equals(tag) || "pre".equals(tag)) {
        collector.appendBlock(el.getTextContent().trim());
      } else if ("head".equals(tag) || "script".equals(tag) || "style".equals(tag)) {
        // metadata only
      } else {
        walk(el, collector);
      }
    }
  }

  String tableToMarkdown(Element tableEl) {
    StringBuilder sb = new StringBuilder();
    NodeList rows = tableEl.getElementsByTagNameNS("*", "tr");
    boolean headerDone = false;

    for (int r = 0; r < rows.getLength(); r++) {
      Element row = (Element) rows.item(r);
      NodeList cells = row.getChildNodes();
      StringBuilder rowSb = new StringBuilder("|");
      int cellCount = 0;

      for (int c = 0; c < cells.getLength(); c++) {
        Node cell = cells.item(c);
        if (cell.getNodeType() != Node.ELEMENT_NODE) {
          continue;
        }
        String cellTag = localName((Element) cell);
        if ("td".equals(cellTag) || "th".equals(cellTag)) {
          String text = cell.getTextContent().trim().replace("|", "\\|").replaceAll("\\s+", " ");
          rowSb.append(' ').append(text).append(" |");
          cellCount++;
        }
      }
      if (cellCount == 0) {
        continue;
      }
      sb.append(rowSb).append('\n');
      if (!headerDone) {
        sb.append('|').append("---|".repeat(cellCount)).append('\n');
        headerDone = true;
      }
    }
    return sb.toString().strip();
  }

  private static String localName(Element el) {
    String name = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return name.toLowerCase();
  }

  /** Accumulates blocks into the section opened by the most recent heading. */
  private static final class SectionCollector {
    private final List<DocumentSection> sections = new ArrayList<>();
    private final String[] headings = new String[7];
    private final StringBuilder fullText = new StringBuilder();
    private final StringBuilder body = new StringBuilder();
    private String title = "";
    private int level = 0;
    private List<String> breadcrumb = List.of();

    void startSection(int newLevel, String heading) {
      flush();
      headings[newLevel] = heading;
      for (int i = newLevel + 1; i <= 6; i++) {
        headings[i] = null;
      }
      List<String> crumb = new ArrayList<>();
      for (int i = 1; i <= newLevel; i++) {
        if (headings[i] != null) {
          crumb.add(headings[i]);
        }
      }
      title = heading;
      level = newLevel;
      breadcrumb = List.copyOf(crumb);
      fullText.append(heading).append("\n\n");
    }

    void appendBlock(String text) {
      if (text == null || text.isBlank()) {
        return;
      }
      body.append(text).append("\n\n");
      fullText.append(text).append("\n\n");
    }

    void flush() {
      String content = body.toString().strip();
      if (!content.isEmpty() || level > 0) {
        sections.add(new DocumentSection(title, level, breadcrumb, content, List.of()));
      }
      body.setLength(0);
    }
  }
}
