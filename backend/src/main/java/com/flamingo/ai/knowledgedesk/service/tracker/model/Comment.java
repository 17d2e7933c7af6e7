package com.flamingo.ai.knowledgedesk.service.tracker.model;

import java.time.Instant;
import java.util.Set;

/**
 * A comment on a ticket.
 *
 * @param id tracker id of the comment
 * @param author user name of the author
 * @param timestamp creation time
 * @param mentionedUsers user names mentioned in the text
 * @param text comment body
 * @param resolved true if the comment marks the discussion above it as resolved
 */
public record Comment(
    String id,
    String author,
    Instant timestamp,
    Set<String> mentionedUsers,
    String text,
    boolean resolved) {

  public Comment {
    mentionedUsers = mentionedUsers == null ? Set.of() : Set.copyOf(mentionedUsers);
  }
}
