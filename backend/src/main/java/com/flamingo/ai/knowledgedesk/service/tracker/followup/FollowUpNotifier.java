package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.exception.TicketTrackerException;
import com.flamingo.ai.knowledgedesk.service.tracker.TicketTracker;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Posts reminder drafts on their tickets. A candidate is marked notified only after its post
 * succeeded, so a failed post is retried on the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FollowUpNotifier {

  private final TicketTracker ticketTracker;
  private final FollowUpService followUpService;
  private final TrackerConfig trackerConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Scans one ticket and posts a reminder for each stale question.
   *
   * @return number of reminders posted
   */
  public int sendReminders(String ticketKey) {
    Ticket ticket = ticketTracker.fetchTicket(ticketKey);
    FollowUpScan scan =
        followUpService.scan(ticket, trackerConfig.getFollowUp().getStalenessWindow());
    int sent = 0;
    for (ReminderDraft reminder : scan.reminders()) {
      try {
        ticketTracker.postComment(reminder.ticketKey(), reminder.body());
      } catch (TicketTrackerException e) {
        meterRegistry.counter("followup.reminders.failed").increment();
        log.warn(
            "Could not remind {} on {}: {}",
            reminder.recipient(),
            reminder.ticketKey(),
            e.getMessage());
        continue;
      }
      followUpService.markNotified(reminder.candidateId());
      meterRegistry.counter("followup.reminders.sent").increment();
      sent++;
    }
    return sent;
  }
}
