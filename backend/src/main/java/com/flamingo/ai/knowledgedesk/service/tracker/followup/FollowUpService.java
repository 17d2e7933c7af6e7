package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.domain.entity.FollowUpCandidate;
import com.flamingo.ai.knowledgedesk.domain.repository.FollowUpCandidateRepository;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the durable set of follow-up candidates in line with a ticket's comment thread.
 *
 * <p>Scanning is idempotent: a candidate marked notified is never drafted again, and a candidate
 * whose question got a reply is deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FollowUpService {

  private static final DateTimeFormatter ASKED_AT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

  private static final int EXCERPT_CHARS = 200;

  private final FollowUpDetector detector;
  private final FollowUpCandidateRepository candidateRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Reconciles stored candidates with the ticket's comments and drafts reminders for stale ones.
   *
   * @param ticket ticket with its comments
   * @param stalenessWindow how long a question may wait before a reminder is due
   * @return stale, not yet notified candidates with their reminder drafts
   */
  @Transactional
  public FollowUpScan scan(Ticket ticket, Duration stalenessWindow) {
    Instant now = clock.instant();
    List<PendingQuestion> pending = detector.findUnanswered(ticket.comments());

    Map<String, FollowUpCandidate> stored = new HashMap<>();
    for (FollowUpCandidate candidate : candidateRepository.findByTicketKey(ticket.key())) {
      stored.put(candidate.getCommentId() + "|" + candidate.getMentionedUser(), candidate);
    }

    List<FollowUpCandidate> current = new ArrayList<>();
    for (PendingQuestion question : pending) {
      FollowUpCandidate candidate = stored.remove(question.key());
      if (candidate == null) {
        Instant askedAt =
            question.comment().timestamp() != null ? question.comment().timestamp() : now;
        candidate =
            candidateRepository.save(
                FollowUpCandidate.builder()
                    .ticketKey(ticket.key())
                    .commentId(question.comment().id())
                    .mentionedUser(question.mentionedUser())
                    .askedBy(question.comment().author())
                    .askedAt(askedAt)
                    .firstSeenAt(now)
                    .build());
        log.debug(
            "New follow-up candidate on {}: comment {} for {}",
            ticket.key(),
            candidate.getCommentId(),
            candidate.getMentionedUser());
      }
      current.add(candidate);
    }

    // whatever is left was answered or resolved since the last scan
    int cleared = stored.size();
    if (cleared > 0) {
      candidateRepository.deleteAll(stored.values());
      log.info("Cleared {} answered follow-up candidates on {}", cleared, ticket.key());
    }

    List<FollowUpCandidate> due = new ArrayList<>();
    List<ReminderDraft> reminders = new ArrayList<>();
    for (FollowUpCandidate candidate : current) {
      if (!candidate.isNotified()
          && detector.isStale(candidate.getAskedAt(), stalenessWindow, now)) {
        due.add(candidate);
        reminders.add(draft(ticket, candidate, textOf(ticket, candidate.getCommentId())));
      }
    }
    meterRegistry.counter("followup.reminders.drafted").increment(reminders.size());
    log.info(
        "Follow-up scan of {}: {} pending, {} due, {} cleared",
        ticket.key(),
        current.size(),
        due.size(),
        cleared);
    return new FollowUpScan(ticket.key(), due, reminders, current.size(), cleared);
  }

  /** Records that the reminder for a candidate was delivered. */
  @Transactional
  public void markNotified(UUID candidateId) {
    candidateRepository
        .findById(candidateId)
        .ifPresent(
            candidate -> {
              candidate.markNotified(clock.instant());
              candidateRepository.save(candidate);
            });
  }

  private static ReminderDraft draft(Ticket ticket, FollowUpCandidate candidate, String question) {
    String excerpt =
        question.length() > EXCERPT_CHARS ? question.substring(0, EXCERPT_CHARS) + "..." : question;
    String body =
        "[~"
            + candidate.getMentionedUser()
            + "] friendly reminder: "
            + (candidate.getAskedBy() != null ? candidate.getAskedBy() : "someone")
            + " asked you on "
            + ASKED_AT.format(candidate.getAskedAt())
            + " and is still waiting for a reply:\n{quote}"
            + excerpt
            + "{quote}";
    String subject = "Following up on " + ticket.key() + ": " + ticket.summary();
    return new ReminderDraft(
        candidate.getId(), ticket.key(), candidate.getMentionedUser(), subject, body);
  }

  private static String textOf(Ticket ticket, String commentId) {
    return ticket.comments().stream()
        .filter(c -> c.id().equals(commentId))
        .map(c -> c.text().strip())
        .findFirst()
        .orElse("");
  }
}
