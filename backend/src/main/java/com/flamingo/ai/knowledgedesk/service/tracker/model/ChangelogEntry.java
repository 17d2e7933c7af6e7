package com.flamingo.ai.knowledgedesk.service.tracker.model;

import java.time.Instant;

/**
 * One status transition of a ticket.
 *
 * @param fromStatus status left, null for the creation event
 * @param toStatus status entered
 * @param timestamp when the transition was recorded
 * @param actor who made the transition, may be null
 * @param sequenceId tracker-assigned order, breaks ties between equal or skewed timestamps
 */
public record ChangelogEntry(
    String fromStatus, String toStatus, Instant timestamp, String actor, long sequenceId) {}
