package com.flamingo.ai.knowledgedesk.service.tracker.progress;

import java.time.Instant;

/**
 * A transition back to an earlier workflow status.
 *
 * @param fromStatus status left
 * @param toStatus earlier status re-entered
 * @param timestamp when it happened
 * @param actor who moved the ticket, may be null
 */
public record StatusTransition(
    String fromStatus, String toStatus, Instant timestamp, String actor) {}
