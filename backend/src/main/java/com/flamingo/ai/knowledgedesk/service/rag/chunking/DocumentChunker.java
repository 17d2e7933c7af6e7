package com.flamingo.ai.knowledgedesk.service.rag.chunking;

import com.flamingo.ai.knowledgedesk.config.RagConfig;
import com.flamingo.ai.knowledgedesk.service.rag.model.ParsedDocument;
import com.flamingo.ai.knowledgedesk.service.rag.model.RawDocumentChunk;
import java.util.List;

/** Splits a parsed document into ordered chunks ready for embedding. */
public interface DocumentChunker {

  List<RawDocumentChunk> chunk(ParsedDocument document, RagConfig.Chunking config);
}
