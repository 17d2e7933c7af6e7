package com.flamingo.ai.knowledgedesk.service.tracker.progress;

import com.flamingo.ai.knowledgedesk.domain.enums.ReportConfidence;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metrics derived from one ticket's status history.
 *
 * @param ticketKey the ticket
 * @param currentStatus status after the last event, or the tracker's status if there are none
 * @param assignee current assignee, may be null
 * @param timeInStatus cumulative time per status left, in order of first appearance; the status
 *     the ticket is still in is not included
 * @param regressions transitions back to an earlier workflow status
 * @param cycleTime first entry into active work to first completion after it, null if incomplete
 * @param completedAt first transition into a done status, null if never completed
 * @param firstEvent timestamp of the earliest usable event, null without events
 * @param lastEvent timestamp of the latest usable event, null without events
 * @param confidence COMPLETE only when events were contiguous and cycle time was computed
 * @param notes what made the report partial: gaps, dropped or collapsed events
 * @param summary one-paragraph human-readable summary
 */
public record ProgressReport(
    String ticketKey,
    String currentStatus,
    String assignee,
    Map<String, Duration> timeInStatus,
    List<StatusTransition> regressions,
    Duration cycleTime,
    Instant completedAt,
    Instant firstEvent,
    Instant lastEvent,
    ReportConfidence confidence,
    List<String> notes,
    String summary) {

  public boolean isCycleTimeComplete() {
    return cycleTime != null;
  }

  public boolean hasRegressions() {
    return !regressions.isEmpty();
  }

  /** Sum of all per-status durations. */
  public Duration totalTrackedTime() {
    return timeInStatus.values().stream().reduce(Duration.ZERO, Duration::plus);
  }
}
