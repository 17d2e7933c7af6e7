package com.flamingo.ai.knowledgedesk.service.tracker.model;

import java.time.Instant;
import java.util.List;

/**
 * A ticket with its status history and comment thread.
 *
 * @param key ticket key, e.g. {@code PAY-123}
 * @param summary one-line title
 * @param status current status
 * @param assignee current assignee user name, may be null
 * @param created creation time, may be null
 * @param changelog status transitions as returned by the tracker
 * @param comments comments as returned by the tracker
 */
public record Ticket(
    String key,
    String summary,
    String status,
    String assignee,
    Instant created,
    List<ChangelogEntry> changelog,
    List<Comment> comments) {

  public Ticket {
    changelog = changelog == null ? List.of() : List.copyOf(changelog);
    comments = comments == null ? List.of() : List.copyOf(comments);
  }
}
