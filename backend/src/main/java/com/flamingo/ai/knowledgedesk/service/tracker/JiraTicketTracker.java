package com.flamingo.ai.knowledgedesk.service.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.flamingo.ai.knowledgedesk.config.TrackerConfig;
import com.flamingo.ai.knowledgedesk.exception.TicketTrackerException;
import com.flamingo.ai.knowledgedesk.service.tracker.model.ChangelogEntry;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Comment;
import com.flamingo.ai.knowledgedesk.service.tracker.model.Ticket;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link TicketTracker} over the Jira Server REST API v2.
 *
 * <p>Mentions use Jira's wiki syntax {@code [~username]}.
 */
@Component
@Slf4j
public class JiraTicketTracker implements TicketTracker {

  private static final Pattern MENTION = Pattern.compile("\\[~(?:accountid:)?([^\\]\\s]+)\\]");

  private static final DateTimeFormatter JIRA_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

  private final WebClient webClient;
  private final Duration timeout;
  private final List<String> resolvedMarkers;

  public JiraTicketTracker(TrackerConfig trackerConfig) {
    this.timeout = Duration.ofMillis(trackerConfig.getTimeoutMs());
    this.resolvedMarkers =
        trackerConfig.getFollowUp().getResolvedMarkers().stream()
            .map(m -> m.toLowerCase(Locale.ROOT))
            .toList();
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(trackerConfig.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024));
    if (trackerConfig.getToken() != null && !trackerConfig.getToken().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + trackerConfig.getToken());
    }
    this.webClient = builder.build();
    log.info("Jira tracker client initialized: baseUrl={}", trackerConfig.getBaseUrl());
  }

  @Override
  @Timed(value = "tracker.fetch_ticket", description = "Time to fetch a ticket")
  public Ticket fetchTicket(String ticketKey) {
    JsonNode issue = getIssue(ticketKey);
    JsonNode fields = issue.path("fields");
    JsonNode assignee = fields.path("assignee");
    return new Ticket(
        issue.path("key").asText(ticketKey),
        fields.path("summary").asText(""),
        fields.path("status").path("name").asText(null),
        assignee.isMissingNode() || assignee.isNull() ? null : assignee.path("name").asText(null),
        parseTimestamp(fields.path("created").asText(null)),
        parseChangelog(issue.path("changelog")),
        parseComments(fields.path("comment").path("comments")));
  }

  @Override
  public List<ChangelogEntry> fetchChangelog(String ticketKey) {
    return parseChangelog(getIssue(ticketKey).path("changelog"));
  }

  @Override
  @Timed(value = "tracker.fetch_comments", description = "Time to fetch ticket comments")
  public List<Comment> fetchComments(String ticketKey) {
    JsonNode body =
        call(
            ticketKey,
            webClient
                .get()
                .uri("/rest/api/2/issue/{key}/comment?orderBy=created", ticketKey)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class));
    return parseComments(body.path("comments"));
  }

  @Override
  @Timed(value = "tracker.post_comment", description = "Time to post a comment")
  public void postComment(String ticketKey, String text) {
    call(
        ticketKey,
        webClient
            .post()
            .uri("/rest/api/2/issue/{key}/comment", ticketKey)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("body", text))
            .retrieve()
            .bodyToMono(JsonNode.class));
    log.info("Posted comment on {}", ticketKey);
  }

  @Override
  public List<String> searchTicketKeys(String jql, int maxResults) {
    List<String> keys = new ArrayList<>();
    int startAt = 0;
    while (keys.size() < maxResults) {
      Map<String, Object> request =
          Map.of(
              "jql", jql,
              "startAt", startAt,
              "maxResults", Math.min(50, maxResults - keys.size()),
              "fields", List.of("key"));
      JsonNode body =
          call(
              "search",
              webClient
                  .post()
                  .uri("/rest/api/2/search")
                  .contentType(MediaType.APPLICATION_JSON)
                  .bodyValue(request)
                  .retrieve()
                  .bodyToMono(JsonNode.class));
      JsonNode issues = body.path("issues");
      issues.forEach(issue -> keys.add(issue.path("key").asText()));
      startAt += issues.size();
      if (issues.isEmpty() || startAt >= body.path("total").asInt(0)) {
        break;
      }
    }
    log.debug("JQL '{}' matched {} tickets", jql, keys.size());
    return keys;
  }

  private JsonNode getIssue(String ticketKey) {
    return call(
        ticketKey,
        webClient
            .get()
            .uri(
                "/rest/api/2/issue/{key}?expand=changelog&fields=summary,status,assignee,created,"
                    + "comment",
                ticketKey)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(JsonNode.class));
  }

  private List<ChangelogEntry> parseChangelog(JsonNode changelog) {
    List<ChangelogEntry> entries = new ArrayList<>();
    long position = 0;
    for (JsonNode history : changelog.path("histories")) {
      Instant created = parseTimestamp(history.path("created").asText(null));
      String actor = history.path("author").path("name").asText(null);
      long historyId = history.path("id").asLong(position);
      for (JsonNode item : history.path("items")) {
        position++;
        if (!"status".equals(item.path("field").asText())) {
          continue;
        }
        entries.add(
            new ChangelogEntry(
                item.path("fromString").asText(null),
                item.path("toString").asText(null),
                created,
                actor,
                historyId));
      }
    }
    return entries;
  }

  private List<Comment> parseComments(JsonNode comments) {
    List<Comment> result = new ArrayList<>();
    for (JsonNode node : comments) {
      String text = node.path("body").asText("");
      result.add(
          new Comment(
              node.path("id").asText(),
              node.path("author").path("name").asText(null),
              parseTimestamp(node.path("created").asText(null)),
              mentions(text),
              text,
              isResolution(text)));
    }
    return result;
  }

  static Set<String> mentions(String text) {
    Set<String> users = new LinkedHashSet<>();
    Matcher matcher = MENTION.matcher(text);
    while (matcher.find()) {
      users.add(matcher.group(1));
    }
    return users;
  }

  private boolean isResolution(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    return resolvedMarkers.stream().anyMatch(lower::contains);
  }

  static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value, JIRA_TIMESTAMP).toInstant();
    } catch (DateTimeParseException e) {
      return OffsetDateTime.parse(value).toInstant();
    }
  }

  private JsonNode call(String subject, Mono<JsonNode> request) {
    try {
      JsonNode body = request.timeout(timeout).block();
      return body != null ? body : NullNode.getInstance();
    } catch (WebClientResponseException e) {
      int status = e.getStatusCode().value();
      boolean transientFailure = status == 408 || status == 429 || status >= 500;
      throw new TicketTrackerException(
          "Jira returned HTTP " + status + " for " + subject, status, transientFailure, e);
    } catch (WebClientRequestException e) {
      throw new TicketTrackerException("Jira unreachable: " + e.getMessage(), true, e);
    } catch (RuntimeException e) {
      if (e.getCause() instanceof TimeoutException) {
        throw new TicketTrackerException("Jira request timed out for " + subject, true, e);
      }
      throw e;
    }
  }
}
