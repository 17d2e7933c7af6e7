package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.service.tracker.model.Comment;

/**
 * A question in a comment that the mentioned user has not answered yet.
 *
 * @param comment the comment asking
 * @param mentionedUser the user expected to answer
 */
public record PendingQuestion(Comment comment, String mentionedUser) {

  public String key() {
    return comment.id() + "|" + mentionedUser;
  }
}
