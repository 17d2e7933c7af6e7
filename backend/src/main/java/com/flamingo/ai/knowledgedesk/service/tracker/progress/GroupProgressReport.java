package com.flamingo.ai.knowledgedesk.service.tracker.progress;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Progress of a set of tickets within a reporting window.
 *
 * @param windowStart inclusive start
 * @param windowEnd exclusive end
 * @param ticketsPerAssignee tickets with status activity in the window, by current assignee
 * @param throughput tickets first completed in each period of the window
 * @param reports per-ticket reports, in input order
 * @param summary one line per ticket
 */
public record GroupProgressReport(
    Instant windowStart,
    Instant windowEnd,
    Map<String, Long> ticketsPerAssignee,
    List<ThroughputBucket> throughput,
    List<ProgressReport> reports,
    String summary) {

  /** Completed tickets in {@code [periodStart, periodEnd)}. */
  public record ThroughputBucket(Instant periodStart, Instant periodEnd, long completed) {}

  public long totalCompleted() {
    return throughput.stream().mapToLong(ThroughputBucket::completed).sum();
  }
}
