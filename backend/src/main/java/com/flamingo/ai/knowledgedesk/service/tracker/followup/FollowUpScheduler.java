package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.service.tracker.TicketTracker;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically sends reminders for the tickets matched by the configured JQL. */
@Component
@ConditionalOnProperty(name = "tracker.follow-up.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class FollowUpScheduler {

  private final TicketTracker ticketTracker;
  private final FollowUpNotifier notifier;
  private final TrackerConfig trackerConfig;

  @Scheduled(cron = "${tracker.follow-up.cron:0 0 9 * * MON-FRI}")
  public void remindAll() {
    TrackerConfig.FollowUp followUp = trackerConfig.getFollowUp();
    List<String> keys = ticketTracker.searchTicketKeys(followUp.getJql(), followUp.getMaxTickets());
    int sent = 0;
    for (String key : keys) {
      try {
        sent += notifier.sendReminders(key);
      } catch (RuntimeException e) {
        log.error("Follow-up run failed for {}: {}", key, e.getMessage(), e);
      }
    }
    log.info("Follow-up run scanned {} tickets, sent {} reminders", keys.size(), sent);
  }
}
