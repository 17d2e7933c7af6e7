package com.flamingo.ai.knowledgedesk.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the issue tracker integration. */
@Configuration
@ConfigurationProperties(prefix = "tracker")
@Getter
@Setter
public class TrackerConfig {

  private String baseUrl = "http://localhost:8080";
  private String token = "";
  private int timeoutMs = 15000;

  /**
   * Projects whose keys are recognized in questions. Empty accepts any project except prefixes of
   * standard identifiers such as UTF-8 or SHA-256.
   */
  private List<String> projectKeys = new ArrayList<>();

  /** Canonical workflow, earliest status first. */
  private List<String> workflow =
      new ArrayList<>(
          List.of(
              "Open",
              "Development To-Do",
              "In Progress",
              "Development In-Progress",
              "Work in Progress",
              "Ready to Merge",
              "Code Merged",
              "Ready for Testing",
              "Business for Testing",
              "Ready for Release",
              "Done"));

  private List<String> inProgressStatuses =
      new ArrayList<>(List.of("In Progress", "Development In-Progress", "Work in Progress"));

  private List<String> doneStatuses = new ArrayList<>(List.of("Done", "Closed", "Resolved"));

  private Duration throughputPeriod = Duration.ofDays(7);

  private FollowUp followUp = new FollowUp();

  @Getter
  @Setter
  public static class FollowUp {
    private Duration stalenessWindow = Duration.ofDays(2);
    private boolean enabled = false;
    private String cron = "0 0 9 * * MON-FRI";

    /** Tickets scanned by the scheduled follow-up run. */
    private String jql = "statusCategory != Done AND updated >= -14d";

    private int maxTickets = 50;

    /** A comment containing any of these marks the questions above it as resolved. */
    private List<String> resolvedMarkers = new ArrayList<>(List.of("(/)", "[resolved]"));
  }
}
