package com.flamingo.ai.knowledgedesk.agent;

import com.flamingo.ai.knowledgedesk.agent.dto.QueryClassificationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that decides which specialist should answer a user question. */
public interface QueryClassificationAgent {

  @SystemMessage(
      """
        You are the supervisor of a team of assistants. Decide which assistant should answer
        the user's question.

        Assistants:
        - confluence: technical documentation (APIs, architecture, deployment, configuration)
        - sharepoint: functional documentation (business processes, requirements, policies)
        - jira: tickets, their status, progress, assignees and history
        - general: anything else, searches all documentation

        Rate every assistant with a confidence between 0.0 and 1.0. Give low confidence to
        all of them when the question is ambiguous; do not guess.

        Return JSON with these fields:
        - scores (array of objects with "specialist" and "confidence")
        - reasoning (string) - one sentence explaining the ranking
        """)
  @UserMessage("Question: {{query}}")
  QueryClassificationResult classify(@V("query") String query);
}
