package com.flamingo.ai.knowledgedesk.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An unanswered question addressed to a user in a ticket's comment thread.
 *
 * <p>Keyed by (ticket, comment, mentioned user). The {@code notified} flag is what keeps repeated
 * scans from reminding the same person twice about the same comment.
 */
@Entity
@Table(
    name = "follow_up_candidates",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"ticket_key", "comment_id", "mentioned_user"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowUpCandidate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "ticket_key", nullable = false)
  private String ticketKey;

  @Column(name = "comment_id", nullable = false)
  private String commentId;

  @Column(name = "mentioned_user", nullable = false)
  private String mentionedUser;

  /** Author of the question. */
  private String askedBy;

  @Column(nullable = false)
  private Instant askedAt;

  @Column(nullable = false)
  private Instant firstSeenAt;

  @Builder.Default private boolean notified = false;

  private Instant notifiedAt;

  public void markNotified(Instant now) {
    this.notified = true;
    this.notifiedAt = now;
  }
}
