package com.flamingo.ai.knowledgedesk.service.tracker.followup;

import java.util.UUID;

/**
 * A reminder ready to be posted on a ticket.
 *
 * @param candidateId the follow-up candidate the reminder is for
 * @param ticketKey ticket to post on
 * @param recipient user being reminded
 * @param subject short subject line
 * @param body comment text, mentioning the recipient
 */
public record ReminderDraft(
    UUID candidateId, String ticketKey, String recipient, String subject, String body) {}
