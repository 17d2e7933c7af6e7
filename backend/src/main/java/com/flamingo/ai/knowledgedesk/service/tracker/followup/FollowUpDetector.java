package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.service.tracker.model.Comment;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds questions in a comment thread that still wait for the mentioned user.
 *
 * <p>A comment asks a question if it contains a question mark or a request phrase, and mentions
 * someone other than its author. The question is answered once a later comment comes from the
 * mentioned user, or a later comment marks the thread resolved.
 */
@Component
public class FollowUpDetector {

  private static final Pattern REQUEST_PHRASE =
      Pattern.compile(
          "\\b(can you|could you|would you|will you|please|any update|let me know|kindly)\\b",
          Pattern.CASE_INSENSITIVE);

  private static final Comparator<Comment> THREAD_ORDER =
      Comparator.comparing(Comment::timestamp, Comparator.nullsLast(Comparator.naturalOrder()));

  /** Unanswered questions, oldest first, one per (comment, mentioned user). */
  public List<PendingQuestion> findUnanswered(List<Comment> comments) {
    List<Comment> thread = new ArrayList<>(comments);
    thread.sort(THREAD_ORDER);

    List<PendingQuestion> pending = new ArrayList<>();
    for (int i = 0; i < thread.size(); i++) {
      Comment comment = thread.get(i);
      if (comment.resolved() || !isInterrogative(comment.text())) {
        continue;
      }
      List<Comment> later = thread.subList(i + 1, thread.size());
      for (String user : comment.mentionedUsers()) {
        if (user.equalsIgnoreCase(comment.author())) {
          continue;
        }
        if (!isAnswered(user, later)) {
          pending.add(new PendingQuestion(comment, user));
        }
      }
    }
    return pending;
  }

  /** A question asked at {@code askedAt} is stale once the window has fully elapsed. */
  public boolean isStale(Instant askedAt, Duration stalenessWindow, Instant now) {
    return askedAt != null && !askedAt.plus(stalenessWindow).isAfter(now);
  }

  static boolean isInterrogative(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    return text.indexOf('?') >= 0 || REQUEST_PHRASE.matcher(text.toLowerCase(Locale.ROOT)).find();
  }

  private static boolean isAnswered(String user, List<Comment> later) {
    return later.stream().anyMatch(c -> c.resolved() || user.equalsIgnoreCase(c.author()));
  }
}
