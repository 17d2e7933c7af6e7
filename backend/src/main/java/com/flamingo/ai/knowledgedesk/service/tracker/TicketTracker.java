package com.flamingo.ai.knowledgedesk.service.tracker;

import com.flamingo.ai.knowledgedesk.service.tracker.model.ChangelogEntry;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Comment;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import java.util.List;

/**
 * Issue tracker operations used by the progress and follow-up features.
 *
 * <p>Failures surface as {@link com.flamingo.ai.knowledgedesk.exception.TicketTrackerException}.
 */
public interface TicketTracker {

  Ticket fetchTicket(String ticketKey);

  List<ChangelogEntry> fetchChangelog(String ticketKey);

  List<Comment> fetchComments(String ticketKey);

  void postComment(String ticketKey, String text);

  /** Keys of tickets matching a JQL query, at most {@code maxResults}. */
  List<String> searchTicketKeys(String jql, int maxResults);
}
