package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import com.flamingo.ai.knowledgedesk.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fills the context window greedily from the highest-scoring chunk down.
 *
 * <p>Selection stops at the first chunk that does not fit, so whatever is dropped always scores no
 * higher than what was kept. If even the best chunk exceeds the budget, it is truncated to the
 * budget rather than sending no context at all.
 */
@Component
@Slf4j
public class ContextAssembler {

  public List<ScoredChunk> assemble(List<ScoredChunk> ranked, int tokenBudget) {
    List<ScoredChunk> selected = new ArrayList<>();
    int used = 0;
    for (ScoredChunk candidate : ranked) {
      int tokens = tokensOf(candidate.chunk());
      if (used + tokens > tokenBudget) {
        if (selected.isEmpty() && tokenBudget > 0) {
          selected.add(truncate(candidate, tokenBudget));
        }
        break;
      }
      selected.add(candidate);
      used += tokens;
    }
    log.debug(
        "Context assembled: {} of {} chunks within {} tokens",
        selected.size(),
        ranked.size(),
        tokenBudget);
    return selected;
  }

  static int tokensOf(DocumentChunk chunk) {
    return chunk.getTokenCount() > 0 ? chunk.getTokenCount() : chunk.getContent().length() / 4;
  }

  private ScoredChunk truncate(ScoredChunk candidate, int tokenBudget) {
    DocumentChunk source = candidate.chunk();
    int maxChars = Math.min(source.getContent().length(), tokenBudget * 4);
    DocumentChunk truncated =
        DocumentChunk.builder()
            .id(source.getId())
            .collection(source.getCollection())
            .path(source.getPath())
            .title(source.getTitle())
            .url(source.getUrl())
            .version(source.getVersion())
            .contentHash(source.getContentHash())
            .chunkIndex(source.getChunkIndex())
            .sectionBreadcrumb(source.getSectionBreadcrumb())
            .content(source.getContent().substring(0, maxChars))
            .tokenCount(maxChars / 4)
            .build();
    return new ScoredChunk(truncated, candidate.score());
  }
}
