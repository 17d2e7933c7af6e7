package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.exception.TicketTrackerException;
import com.flamingo.ai.knowledgedesk.service.tracker.TicketTracker;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("FollowUpNotifier Tests")
class FollowUpNotifierTest {

  @Mock private TicketTracker ticketTracker;
  @Mock private FollowUpService followUpService;

  private SimpleMeterRegistry meterRegistry;
  private FollowUpNotifier notifier;
  private final Ticket ticket =
      new Ticket("PAY-42", "Refund flow", "In Progress", "bob", null, List.of(), List.of());

  @BeforeEach
  void setUp() {
    TrackerConfig trackerConfig = new TrackerConfig();
    trackerConfig.getFollowUp().setStalenessWindow(Duration.ofDays(3));
    meterRegistry = new SimpleMeterRegistry();
    notifier = new FollowUpNotifier(ticketTracker, followUpService, trackerConfig, meterRegistry);
  }

  private static ReminderDraft draft(String recipient) {
    return new ReminderDraft(
        UUID.randomUUID(), "PAY-42", recipient, "Following up", "[~" + recipient + "] reminder");
  }

  @Test
  @DisplayName("should mark only delivered reminders as notified")
  void shouldContinue_whenOnePostFails() {
    ReminderDraft toAlice = draft("alice");
    ReminderDraft toDave = draft("dave");
    when(ticketTracker.fetchTicket("PAY-42")).thenReturn(ticket);
    when(followUpService.scan(ticket, Duration.ofDays(3)))
        .thenReturn(new FollowUpScan("PAY-42", List.of(), List.of(toAlice, toDave), 2, 0));
    doThrow(new TicketTrackerException("Jira returned HTTP 503", true))
        .when(ticketTracker)
        .postComment("PAY-42", toAlice.body());

    int sent = notifier.sendReminders("PAY-42");

    assertThat(sent).isEqualTo(1);
    verify(ticketTracker).postComment(eq("PAY-42"), eq(toDave.body()));
    verify(followUpService, never()).markNotified(toAlice.candidateId());
    verify(followUpService).markNotified(toDave.candidateId());
    assertThat(meterRegistry.counter("followup.reminders.failed").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("followup.reminders.sent").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should post nothing when no reminder is due")
  void shouldPostNothing_whenNoReminders() {
    when(ticketTracker.fetchTicket("PAY-42")).thenReturn(ticket);
    when(followUpService.scan(ticket, Duration.ofDays(3)))
        .thenReturn(new FollowUpScan("PAY-42", List.of(), List.of(), 1, 0));

    assertThat(notifier.sendReminders("PAY-42")).isZero();
  }
}
