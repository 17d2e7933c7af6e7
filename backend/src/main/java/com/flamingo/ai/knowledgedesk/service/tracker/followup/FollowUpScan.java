package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import com.flamingo.ai.knowledgedesk.domain.entity.FollowUpCandidate;
import java.util.List;

/**
 * Result of scanning one ticket's comment thread.
 *
 * @param ticketKey the scanned ticket
 * @param candidates stale, not yet notified questions
 * @param reminders one draft per candidate, same order
 * @param pending unanswered questions tracked for the ticket, stale or not
 * @param cleared candidates removed because a reply arrived
 */
public record FollowUpScan(
    String ticketKey,
    List<FollowUpCandidate> candidates,
    List<ReminderDraft> reminders,
    int pending,
    int cleared) {}
