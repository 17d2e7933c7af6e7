package com.flamingo.ai.knowledgedesk.service.rag.retrieval;

import com.flamingo.ai.knowledgedesk.elasticsearch.DocumentChunk;
import com.flamingo.ai.knowledgedesk.service.rag.completion.CompletionPrompt;
import com.flamingo.ai.knowledgedesk.service.rag.model.ScoredChunk;
import java.util.List;
import org.springframework.stereotype.Component;

/** Builds prompts that restrict the model to the retrieved context. */
@Component
public class GroundedPromptBuilder {

  static final String SYSTEM_PROMPT =
      """
      You are a documentation assistant. Answer the question using ONLY the numbered context
      passages provided. Cite the passages you use as [1], [2], ...

      Rules:
      1. If the context does not contain the answer, say that the documentation does not cover
         it. Do not use outside knowledge and do not guess.
      2. Quote commands, configuration keys and values exactly as they appear in the context.
      3. Keep the answer concise and use the language of the question.
      """;

  public CompletionPrompt build(String question, List<ScoredChunk> context) {
    StringBuilder user = new StringBuilder("Context:\n\n");
    for (int i = 0; i < context.size(); i++) {
      DocumentChunk chunk = context.get(i).chunk();
      user.append('[').append(i + 1).append("] ").append(label(chunk)).append('\n');
      if (chunk.getSectionBreadcrumb() != null && !chunk.getSectionBreadcrumb().isEmpty()) {
        String section = String.join(" > ", chunk.getSectionBreadcrumb());
        user.append("Section: ").append(section).append('\n');
      }
      user.append(chunk.getContent().strip()).append("\n\n");
    }
    user.append("Question: ").append(question.strip());
    return new CompletionPrompt(SYSTEM_PROMPT, user.toString());
  }

  private String label(DocumentChunk chunk) {
    String title = chunk.getTitle() != null ? chunk.getTitle() : chunk.getPath();
    return title + " (" + chunk.getCollection() + ")";
  }
}
