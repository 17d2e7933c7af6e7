package com.flamingo.ai.knowledgedesk.service.rag.chunking;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.service.rag.model.DocumentSection;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import com.flamingo.ai.knowledgedesk.service.rag.model.RawDocumentChunk;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that keeps chunks inside section boundaries.
 *
 * <p>A section that fits the configured size becomes one chunk. Larger sections are split at
 * paragraph boundaries ({@code \n\n}), then at sentence boundaries, and only then by character
 * count, carrying a word overlap from one chunk into the next.
 *
 * <p>Markdown tables are never cut mid-row. A table longer than {@code tableRowsPerChunk} rows is
 * split into row groups, each repeating the header and separator lines.
 *
 * <p>Documents without sections are chunked as one implicit section with an empty breadcrumb.
 */
@Service
@Slf4j
public class SectionAwareChunker implements DocumentChunker {

  @Override
  public List<RawDocumentChunk> chunk(ParsedDocument document, RagConfig.Chunking config) {
    List<RawDocumentChunk> result = new ArrayList<>();
    if (document.isBlank()) {
      return result;
    }

    if (document.sections().isEmpty()) {
      addAll(result, chunkSectionContent(document.fullText().strip(), config), List.of());
    } else {
      walkSections(document.sections(), config, result);
      if (result.isEmpty()) {
        log.warn(
            "All {} sections were empty, falling back to full text", document.sections().size());
        addAll(result, chunkSectionContent(document.fullText().strip(), config), List.of());
      }
    }

    log.debug("SectionAwareChunker produced {} chunks", result.size());
    return result;
  }

  private void walkSections(
      List<DocumentSection> sections, RagConfig.Chunking config, List<RawDocumentChunk> result) {
    for (DocumentSection section : sections) {
      String content = section.content().strip();
      if (!content.isBlank()) {
        addAll(result, chunkSectionContent(content, config), section.breadcrumb());
      }
      if (!section.children().isEmpty()) {
        walkSections(section.children(), config, result);
      }
    }
  }

  private void addAll(List<RawDocumentChunk> result, List<String> texts, List<String> crumb) {
    for (String text : texts) {
      if (!text.isBlank()) {
        result.add(new RawDocumentChunk(text, crumb, result.size()));
      }
    }
  }

  List<String> chunkSectionContent(String content, RagConfig.Chunking config) {
    if (content.length() <= config.getMaxChars()
        && estimateTokens(content) <= config.getSize()
        && !hasLongTable(content, config.getTableRowsPerChunk())) {
      return List.of(content);
    }

    List<String> chunks = new ArrayList<>();
    for (String segment : splitAroundTables(content)) {
      if (segment.strip().startsWith("|")) {
        chunks.addAll(splitTable(segment.strip(), config.getTableRowsPerChunk()));
      } else if (!segment.isBlank()) {
        chunks.addAll(slidingWindow(segment, config));
      }
    }
    return chunks;
  }

  /** Splits content into alternating prose and table segments; table lines start with "|". */
  private List<String> splitAroundTables(String content) {
    List<String> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inTable = false;

    for (String line : content.split("\n", -1)) {
      boolean isTableRow = line.trim().startsWith("|");
      if (isTableRow != inTable) {
        if (current.length() > 0) {
          segments.add(current.toString());
          current.setLength(0);
        }
        inTable = isTableRow;
      }
      current.append(line).append('\n');
    }
    if (current.length() > 0) {
      segments.add(current.toString());
    }
    return segments;
  }

  private boolean hasLongTable(String content, int rowsPerChunk) {
    for (String segment : splitAroundTables(content)) {
      if (segment.strip().startsWith("|") && dataRows(segment.strip()).size() > rowsPerChunk) {
        return true;
      }
    }
    return false;
  }

  List<String> splitTable(String table, int rowsPerChunk) {
    String[] lines = table.split("\n");
    if (lines.length < 2 || !isSeparator(lines[1])) {
      return List.of(table);
    }
    String header = lines[0] + "\n" + lines[1];
    List<String> rows = dataRows(table);
    if (rows.size() <= rowsPerChunk) {
      return List.of(table);
    }
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < rows.size(); i += rowsPerChunk) {
      List<String> group = rows.subList(i, Math.min(i + rowsPerChunk, rows.size()));
      parts.add(header + "\n" + String.join("\n", group));
    }
    return parts;
  }

  private List<String> dataRows(String table) {
    String[] lines = table.split("\n");
    int start = lines.length >= 2 && isSeparator(lines[1]) ? 2 : 0;
    List<String> rows = new ArrayList<>();
    for (int i = start; i < lines.length; i++) {
      if (!lines[i].isBlank()) {
        rows.add(lines[i]);
      }
    }
    return rows;
  }

  private boolean isSeparator(String line) {
    return line.trim().matches("\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?");
  }

  private List<String> slidingWindow(String text, RagConfig.Chunking config) {
    int chunkSize = config.getSize();
    int overlap = config.getOverlap();
    int maxChars = config.getMaxChars();
    List<String> chunks = new ArrayList<>();
    StringBuilder currentChunk = new StringBuilder();
    int currentTokens = 0;

    for (String paragraph : text.split("\\n\\s*\\n+")) {
      if (paragraph.isBlank()) {
        continue;
      }
      int paraTokens = estimateTokens(paragraph);
      if (paragraph.length() > maxChars || paraTokens > chunkSize) {
        if (currentChunk.length() > 0) {
          chunks.add(currentChunk.toString().trim());
          currentChunk = new StringBuilder();
          currentTokens = 0;
        }
        chunks.addAll(splitBySentences(paragraph, Math.min(maxChars, chunkSize * 4), overlap));
        continue;
      }

      if (currentChunk.length() > 0
          && (currentTokens + paraTokens > chunkSize
              || currentChunk.length() + paragraph.length() > maxChars)) {
        chunks.add(currentChunk.toString().trim());
        String overlapText = overlapTail(currentChunk.toString(), overlap);
        currentChunk = new StringBuilder(overlapText);
        currentTokens = estimateTokens(overlapText);
      }

      currentChunk.append(paragraph.strip()).append("\n\n");
      currentTokens += paraTokens;
    }

    if (currentChunk.length() > 0 && !currentChunk.toString().isBlank()) {
      chunks.add(currentChunk.toString().trim());
    }
    return chunks;
  }

  private List<String> splitBySentences(String text, int maxChars, int overlap) {
    List<String> chunks = new ArrayList<>();
    StringBuilder currentChunk = new StringBuilder();

    for (String sentence : text.split("(?<=[.!?])\\s+")) {
      if (sentence.length() > maxChars) {
        if (currentChunk.length() > 0) {
          chunks.add(currentChunk.toString().trim());
          currentChunk = new StringBuilder();
        }
        for (int i = 0; i < sentence.length(); i += maxChars) {
          chunks.add(sentence.substring(i, Math.min(i + maxChars, sentence.length())));
        }
        continue;
      }
      if (currentChunk.length() + sentence.length() > maxChars && currentChunk.length() > 0) {
        chunks.add(currentChunk.toString().trim());
        currentChunk = new StringBuilder(overlapTail(currentChunk.toString(), overlap));
      }
      currentChunk.append(sentence).append(' ');
    }
    if (currentChunk.length() > 0) {
      chunks.add(currentChunk.toString().trim());
    }
    return chunks;
  }

  private String overlapTail(String text, int overlapWords) {
    String[] words = text.trim().split("\\s+");
    int keep = Math.min(overlapWords, words.length);
    StringBuilder sb = new StringBuilder();
    for (int i = words.length - keep; i < words.length; i++) {
      sb.append(words[i]).append(' ');
    }
    return sb.toString();
  }

  private int estimateTokens(String text) {
    return text.length() / 4;
  }
}
