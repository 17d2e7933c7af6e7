package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import com.flamingo.ai.knowledgedesk.exception.TicketTrackerException;
import com.flamingo.ai.knowledgedesk.service.rag.completion.ChatCompletionService;
import com.flamingo.ai.knowledgedesk.service.rag.completion.CompletionPrompt;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Answer;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.Citation;
import com.flamingo.ai.knowledgedesk.service.rag.retrieval.StreamingAnswer;
import com.flamingo.ai.knowledgedesk.service.tracker.TicketTracker;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.ChangelogAnalyzer;
import com.flamingo.ai.knowledgedesk.service.tracker.progress.ProgressReport;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Specialist for questions about tickets. It reads the tickets named in the query, analyzes their
 * status history and lets the model answer from the resulting progress reports only.
 */
@Component
@Slf4j
public class JiraSpecialist implements Specialist {

  static final Pattern TICKET_KEY = Pattern.compile("\\b[A-Z][A-Z0-9]+-\\d+\\b");

  /** Prefixes of standard identifiers that look like ticket keys, such as UTF-8 or SHA-256. */
  static final Set<String> NON_TICKET_PREFIXES =
      Set.of(
          "UTF", "UCS", "SHA", "MD", "ISO", "IEC", "RFC", "GPT", "HTTP", "TLS", "SSL", "AES", "RSA",
          "CVE", "CWE", "JDK", "JSR", "JEP", "PEP", "IEEE", "ECMA", "ES", "WCAG", "OAUTH", "PCI",
          "GDPR", "SOC", "COVID", "W3C", "H2");

  static final String NO_TICKET_ANSWER =
      "Please mention the ticket key (for example PAY-123) so I can look it up.";

  static final String SYSTEM_PROMPT =
      """
      You are a project tracking assistant. Answer the question using ONLY the ticket progress
      reports provided. Mention ticket keys when you refer to a ticket. If the reports do not
      contain the answer, say so. Do not guess dates, owners or statuses.
      """;

  private static final double KEY_RELEVANCE = 0.95;

  private final TicketTracker ticketTracker;
  private final ChangelogAnalyzer changelogAnalyzer;
  private final ChatCompletionService completionService;
  private final TrackerConfig trackerConfig;
  private final KeywordRelevance relevance =
      new KeywordRelevance(
          List.of(
              "ticket", "tickets", "jira", "issue", "status", "progress", "sprint", "assignee",
              "assigned", "blocked", "cycle time", "velocity", "backlog"));

  public JiraSpecialist(
      TicketTracker ticketTracker,
      ChangelogAnalyzer changelogAnalyzer,
      ChatCompletionService completionService,
      TrackerConfig trackerConfig) {
    this.ticketTracker = ticketTracker;
    this.changelogAnalyzer = changelogAnalyzer;
    this.completionService = completionService;
    this.trackerConfig = trackerConfig;
  }

  @Override
  public SpecialistTag tag() {
    return SpecialistTag.JIRA;
  }

  @Override
  public double classifyRelevance(String query) {
    if (!ticketKeys(query).isEmpty()) {
      return KEY_RELEVANCE;
    }
    return relevance.score(query);
  }

  @Override
  public Answer answer(String query) {
    List<ProgressReport> reports = reportsFor(query);
    if (reports.isEmpty()) {
      return new Answer(NO_TICKET_ANSWER, List.of(), false);
    }
    String text = completionService.complete(prompt(query, reports));
    return new Answer(text, citations(reports), true);
  }

  @Override
  public StreamingAnswer streamAnswer(String query) {
    List<ProgressReport> reports = reportsFor(query);
    if (reports.isEmpty()) {
      return StreamingAnswer.of(new Answer(NO_TICKET_ANSWER, List.of(), false));
    }
    return new StreamingAnswer(
        citations(reports), true, completionService.completeStreaming(prompt(query, reports)));
  }

  /**
   * Ticket keys named in the query, in order of appearance. With configured project keys only
   * those projects count; otherwise standard identifiers shaped like keys are skipped.
   */
  Set<String> ticketKeys(String query) {
    Set<String> keys = new LinkedHashSet<>();
    Matcher matcher = TICKET_KEY.matcher(query);
    while (matcher.find()) {
      String key = matcher.group();
      if (isKnownProject(key.substring(0, key.lastIndexOf('-')))) {
        keys.add(key);
      }
    }
    return keys;
  }

  private boolean isKnownProject(String project) {
    List<String> configured =
        trackerConfig.getProjectKeys().stream().filter(k -> !k.isBlank()).toList();
    if (!configured.isEmpty()) {
      return configured.stream().anyMatch(project::equalsIgnoreCase);
    }
    return !NON_TICKET_PREFIXES.contains(project);
  }

  /**
   * Reports for every named ticket that exists. Tickets Jira does not know are skipped; the call
   * fails only when none of them could be read.
   */
  private List<ProgressReport> reportsFor(String query) {
    List<ProgressReport> reports = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    for (String key : ticketKeys(query)) {
      try {
        Ticket ticket = ticketTracker.fetchTicket(key);
        reports.add(changelogAnalyzer.analyze(ticket));
      } catch (TicketTrackerException e) {
        if (!e.isNotFound()) {
          throw e;
        }
        log.info("Ticket {} not found in Jira, skipping it", key);
        missing.add(key);
      }
    }
    if (reports.isEmpty() && !missing.isEmpty()) {
      throw new TicketTrackerException(
          "No ticket found in Jira for " + String.join(", ", missing), 404, false, null);
    }
    log.debug("Jira specialist built {} progress reports", reports.size());
    return reports;
  }

  private CompletionPrompt prompt(String query, List<ProgressReport> reports) {
    StringBuilder user = new StringBuilder("Ticket progress reports:\n\n");
    for (ProgressReport report : reports) {
      user.append("- ").append(report.summary()).append('\n');
    }
    user.append("\nQuestion: ").append(query.strip());
    return new CompletionPrompt(SYSTEM_PROMPT, user.toString());
  }

  private List<Citation> citations(List<ProgressReport> reports) {
    String browse = trackerConfig.getBaseUrl().replaceAll("/+$", "") + "/browse/";
    return reports.stream()
        .map(r -> new Citation("jira", r.ticketKey(), r.ticketKey(), browse + r.ticketKey(), 1.0))
        .toList();
  }
}
