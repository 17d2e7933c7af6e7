package com.flamingo.ai.knowledgedesk.service.rag.parsing;

import com.flamingo.ai.knowledgedesk.service.rag.model.DocumentSection;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Parses Markdown and plain text by splitting on ATX headings ({@code #} to {@code ######}).
 *
 * <p>Sections are returned flat, one per heading, each carrying its full heading breadcrumb.
 * Text before the first heading becomes a level-0 section with an empty breadcrumb.
 */
@Service
public class MarkdownDocumentParser implements DocumentParser {

  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*\\s*$");

  @Override
  public ParsedDocument parse(byte[] content, String mimeType) {
    String text = new String(content, StandardCharsets.UTF_8).replace("\r\n", "\n");
    return parseText(text);
  }

  public ParsedDocument parseText(String text) {
    List<DocumentSection> sections = new ArrayList<>();
    String[] headings = new String[7];
    String currentTitle = "";
    int currentLevel = 0;
    List<String> currentCrumb = List.of();
    StringBuilder body = new StringBuilder();
    boolean inFence = false;

    for (String line : text.split("\n", -1)) {
      if (line.trim().startsWith("```")) {
        inFence = !inFence;
      }
      Matcher m = inFence ? null : HEADING.matcher(line);
      if (m != null && m.matches()) {
        addSection(sections, currentTitle, currentLevel, currentCrumb, body);
        int level = m.group(1).length();
        headings[level] = m.group(2);
        for (int i = level + 1; i <= 6; i++) {
          headings[i] = null;
        }
        currentTitle = m.group(2);
        currentLevel = level;
        currentCrumb = breadcrumb(headings, level);
        body.setLength(0);
      } else {
        body.append(line).append('\n');
      }
    }
    addSection(sections, currentTitle, currentLevel, currentCrumb, body);
    return new ParsedDocument(text, sections);
  }

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null
        && (mimeType.startsWith("text/markdown")
            || mimeType.startsWith("text/x-markdown")
            || mimeType.startsWith("text/x-web-markdown")
            || mimeType.startsWith("text/plain"));
  }

  private void addSection(
      List<DocumentSection> sections,
      String title,
      int level,
      List<String> crumb,
      StringBuilder body) {
    String content = body.toString().strip();
    if (content.isEmpty() && level == 0) {
      return;
    }
    sections.add(new DocumentSection(title, level, crumb, content, List.of()));
  }

  private List<String> breadcrumb(String[] headings, int level) {
    List<String> crumb = new ArrayList<>();
    for (int i = 1; i <= level; i++) {
      if (headings[i] != null) {
        crumb.add(headings[i]);
      }
    }
    return List.copyOf(crumb);
  }
}
