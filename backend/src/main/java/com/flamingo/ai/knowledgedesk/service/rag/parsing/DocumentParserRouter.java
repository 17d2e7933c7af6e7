package com.flamingo.ai.knowledgedesk.service.rag.parsing;

import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the parser for a document's MIME type: Markdown and plain text keep their {@code #}
 * headings, everything else goes through Tika.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentParserRouter {

  private final MarkdownDocumentParser markdownParser;
  private final TikaXhtmlDocumentParser tikaParser;

  public ParsedDocument parse(byte[] content, String mimeType) {
    DocumentParser parser = markdownParser.supports(mimeType) ? markdownParser : tikaParser;
    log.debug(
        "Parsing {} bytes of {} with {}",
        content.length,
        mimeType,
        parser.getClass().getSimpleName());
    return parser.parse(content, mimeType);
  }
}
