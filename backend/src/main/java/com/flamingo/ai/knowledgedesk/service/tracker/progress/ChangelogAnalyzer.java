package com.flamingo.ai.knowledgedesk.service.tracker.progress;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.domain.enums.ReportConfidence;
import com.flamingo.ai.knowledgedesk.service.tracker.model.ChangelogEntry;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives progress metrics from ticket status histories.
 *
 * <p>Events are ordered by timestamp, then sequence id. Time between two consecutive events is
 * attributed to the status the later event leaves, so per-status durations always add up to the
 * time between the first and last event. Status names are compared after normalization: lower
 * case, with spaces and underscores as hyphens.
 */
@Component
@Slf4j
public class ChangelogAnalyzer {

  static final Comparator<ChangelogEntry> EVENT_ORDER =
      Comparator.comparing(ChangelogEntry::timestamp)
          .thenComparingLong(ChangelogEntry::sequenceId);

  private final Map<String, Integer> workflowRank = new HashMap<>();
  private final Set<String> inProgressStatuses;
  private final Set<String> doneStatuses;
  private final Duration throughputPeriod;

  public ChangelogAnalyzer(TrackerConfig trackerConfig) {
    List<String> workflow = trackerConfig.getWorkflow();
    for (int i = 0; i < workflow.size(); i++) {
      workflowRank.putIfAbsent(normalize(workflow.get(i)), i);
    }
    this.inProgressStatuses = normalizeAll(trackerConfig.getInProgressStatuses());
    this.doneStatuses = normalizeAll(trackerConfig.getDoneStatuses());
    Duration period = trackerConfig.getThroughputPeriod();
    if (period == null || period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException(
          "tracker.throughput-period must be positive, was " + period);
    }
    this.throughputPeriod = period;
  }

  /** Computes the progress report of one ticket. Never fails on incomplete histories. */
  public ProgressReport analyze(Ticket ticket) {
    List<String> notes = new ArrayList<>();
    List<ChangelogEntry> events = orderedEvents(ticket.changelog(), notes);

    Map<String, Duration> timeInStatus = new LinkedHashMap<>();
    // first spelling seen of each normalized status
    Map<String, String> statusNames = new HashMap<>();
    List<StatusTransition> regressions = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    boolean gap = false;
    Instant cycleStart = null;
    Instant cycleEnd = null;
    Instant completedAt = null;

    for (int i = 0; i < events.size(); i++) {
      ChangelogEntry event = events.get(i);
      if (i == 0 && event.fromStatus() != null) {
        visited.add(normalize(event.fromStatus()));
      }
      if (i > 0) {
        ChangelogEntry previous = events.get(i - 1);
        if (!sameStatus(previous.toStatus(), event.fromStatus())) {
          gap = true;
          notes.add(
              "Gap: entered '"
                  + previous.toStatus()
                  + "' but next left '"
                  + event.fromStatus()
                  + "' at "
                  + event.timestamp());
        }
        String left = event.fromStatus() != null ? event.fromStatus() : previous.toStatus();
        String name = statusNames.computeIfAbsent(normalize(left), k -> left);
        timeInStatus.merge(
            name, Duration.between(previous.timestamp(), event.timestamp()), Duration::plus);
      }

      String to = normalize(event.toStatus());
      if (isRegression(event, visited)) {
        regressions.add(
            new StatusTransition(
                event.fromStatus(), event.toStatus(), event.timestamp(), event.actor()));
      }
      visited.add(to);

      if (cycleStart == null && inProgressStatuses.contains(to)) {
        cycleStart = event.timestamp();
      } else if (cycleStart != null && cycleEnd == null && doneStatuses.contains(to)) {
        cycleEnd = event.timestamp();
      }
      if (completedAt == null && doneStatuses.contains(to)) {
        completedAt = event.timestamp();
      }
    }

    Duration cycleTime = cycleEnd != null ? Duration.between(cycleStart, cycleEnd) : null;
    boolean dropped =
        ticket.changelog().stream().anyMatch(e -> e.timestamp() == null || e.toStatus() == null);
    ReportConfidence confidence =
        !gap && !dropped && cycleTime != null
            ? ReportConfidence.COMPLETE
            : ReportConfidence.PARTIAL;
    String currentStatus =
        events.isEmpty() ? ticket.status() : events.get(events.size() - 1).toStatus();
    Map<String, Duration> durations = Collections.unmodifiableMap(timeInStatus);

    ProgressReport report =
        new ProgressReport(
            ticket.key(),
            currentStatus,
            ticket.assignee(),
            durations,
            List.copyOf(regressions),
            cycleTime,
            completedAt,
            events.isEmpty() ? null : events.get(0).timestamp(),
            events.isEmpty() ? null : events.get(events.size() - 1).timestamp(),
            confidence,
            List.copyOf(notes),
            summarize(ticket, currentStatus, durations, cycleTime, regressions, confidence));
    log.debug(
        "Analyzed {}: {} events, {} regressions, confidence={}",
        ticket.key(),
        events.size(),
        regressions.size(),
        confidence);
    return report;
  }

  /**
   * Aggregates several tickets over {@code [from, to)}: tickets with status activity per
   * assignee, and tickets first completed per throughput period.
   */
  public GroupProgressReport analyzeGroup(List<Ticket> tickets, Instant from, Instant to) {
    if (!from.isBefore(to)) {
      throw new IllegalArgumentException("Reporting window start must be before its end");
    }
    List<ProgressReport> reports = tickets.stream().map(this::analyze).toList();

    Map<String, Long> perAssignee = new TreeMap<>();
    for (int i = 0; i < tickets.size(); i++) {
      boolean active =
          tickets.get(i).changelog().stream()
              .map(ChangelogEntry::timestamp)
              .filter(Objects::nonNull)
              .anyMatch(ts -> !ts.isBefore(from) && ts.isBefore(to));
      if (active) {
        String assignee = reports.get(i).assignee();
        perAssignee.merge(assignee != null ? assignee : "unassigned", 1L, Long::sum);
      }
    }

    List<GroupProgressReport.ThroughputBucket> buckets = new ArrayList<>();
    for (Instant start = from; start.isBefore(to); start = start.plus(throughputPeriod)) {
      Instant periodStart = start;
      Instant end = start.plus(throughputPeriod);
      Instant periodEnd = end.isAfter(to) ? to : end;
      long completed =
          reports.stream()
              .map(ProgressReport::completedAt)
              .filter(Objects::nonNull)
              .filter(ts -> !ts.isBefore(periodStart) && ts.isBefore(periodEnd))
              .count();
      buckets.add(new GroupProgressReport.ThroughputBucket(periodStart, periodEnd, completed));
    }

    String summary =
        reports.stream()
            .map(r -> "- " + r.ticketKey() + ": " + r.summary())
            .collect(Collectors.joining("\n"));
    return new GroupProgressReport(
        from, to, Map.copyOf(perAssignee), List.copyOf(buckets), reports, summary);
  }

  private List<ChangelogEntry> orderedEvents(List<ChangelogEntry> changelog, List<String> notes) {
    List<ChangelogEntry> usable = new ArrayList<>();
    for (ChangelogEntry entry : changelog) {
      if (entry.timestamp() == null || entry.toStatus() == null) {
        notes.add("Dropped event without timestamp or target status: " + entry);
      } else {
        usable.add(entry);
      }
    }
    usable.sort(EVENT_ORDER);

    List<ChangelogEntry> collapsed = new ArrayList<>(usable.size());
    for (ChangelogEntry entry : usable) {
      ChangelogEntry previous = collapsed.isEmpty() ? null : collapsed.get(collapsed.size() - 1);
      if (previous != null
          && sameStatus(previous.fromStatus(), entry.fromStatus())
          && sameStatus(previous.toStatus(), entry.toStatus())) {
        notes.add("Collapsed duplicate transition to '" + entry.toStatus() + "'");
        continue;
      }
      collapsed.add(entry);
    }
    return collapsed;
  }

  private boolean isRegression(ChangelogEntry event, Set<String> visited) {
    String to = normalize(event.toStatus());
    if (!visited.contains(to) || event.fromStatus() == null) {
      return false;
    }
    Integer toRank = workflowRank.get(to);
    Integer fromRank = workflowRank.get(normalize(event.fromStatus()));
    if (toRank == null || fromRank == null) {
      // outside the canonical workflow, returning to any visited status counts
      return true;
    }
    return toRank < fromRank;
  }

  private static String summarize(
      Ticket ticket,
      String currentStatus,
      Map<String, Duration> timeInStatus,
      Duration cycleTime,
      List<StatusTransition> regressions,
      ReportConfidence confidence) {
    StringBuilder text = new StringBuilder();
    text.append(ticket.key());
    if (ticket.summary() != null && !ticket.summary().isBlank()) {
      text.append(" (").append(ticket.summary()).append(")");
    }
    text.append(" is in '").append(currentStatus).append("'");
    if (ticket.assignee() != null) {
      text.append(", assigned to ").append(ticket.assignee());
    }
    text.append(". ");
    if (!timeInStatus.isEmpty()) {
      text.append("Time in status: ")
          .append(
              timeInStatus.entrySet().stream()
                  .map(e -> e.getKey() + " " + formatDuration(e.getValue()))
                  .collect(Collectors.joining(", ")))
          .append(". ");
    }
    text.append("Cycle time: ")
        .append(cycleTime != null ? formatDuration(cycleTime) : "incomplete")
        .append(". ");
    if (!regressions.isEmpty()) {
      text.append("Regressions: ")
          .append(
              regressions.stream()
                  .map(r -> r.fromStatus() + " -> " + r.toStatus())
                  .collect(Collectors.joining(", ")))
          .append(". ");
    }
    if (confidence == ReportConfidence.PARTIAL) {
      text.append("Metrics are partial.");
    }
    return text.toString().trim();
  }

  @VisibleForTesting
  static String formatDuration(Duration duration) {
    long days = duration.toDays();
    long hours = duration.toHoursPart();
    long minutes = duration.toMinutesPart();
    StringBuilder text = new StringBuilder();
    if (days > 0) {
      text.append(days).append("d ");
    }
    if (hours > 0) {
      text.append(hours).append("h ");
    }
    if (minutes > 0 || text.length() == 0) {
      text.append(minutes).append("m");
    }
    return text.toString().trim();
  }

  static String normalize(String status) {
    if (status == null) {
      return "";
    }
    return status.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
  }

  private static Set<String> normalizeAll(List<String> statuses) {
    return statuses.stream().map(ChangelogAnalyzer::normalize).collect(Collectors.toSet());
  }

  private static boolean sameStatus(String a, String b) {
    return normalize(a).equals(normalize(b));
  }
}
