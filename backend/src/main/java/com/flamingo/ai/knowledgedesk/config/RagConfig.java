package com.flamingo.ai.knowledgedesk.config;

import com.flamingo.ai.knowledgedesk.domain.enums.SourceType;
import com.flamingo.ai.knowledgedesk.domain.enums.SpecialistTag;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, retrieval and routing. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private Ingestion ingestion = new Ingestion();
  private Routing routing = new Routing();
  private Confluence confluence = new Confluence();
  private List<Collection> collections = new ArrayList<>();

  /** Looks up a configured collection by name. */
  public Optional<Collection> findCollection(String name) {
    return collections.stream().filter(c -> c.getName().equals(name)).findFirst();
  }

  /** Names of every collection bound to the given specialist. */
  public List<String> collectionsFor(SpecialistTag tag) {
    return collections.stream()
        .filter(c -> tag == SpecialistTag.GENERAL || c.getSpecialist() == tag)
        .map(Collection::getName)
        .toList();
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Target chunk size in estimated tokens. */
    private int size = 512;

    /** Words carried over from the previous chunk. */
    private int overlap = 20;

    private int maxChars = 4096;
    private int tableRowsPerChunk = 5;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 6;
    private double minScore = 0.5;
    private int tokenBudget = 3000;
  }

  @Getter
  @Setter
  public static class Embedding {
    private int batchSize = 16;

    /** Embedding requests allowed per second across all ingestion workers. */
    private int permitsPerSecond = 10;

    private Duration permitTimeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int workers = 4;
    private int queueCapacity = 500;
    private int maxAttempts = 4;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Schedule {
      private boolean enabled = false;
      private String cron = "0 0 2 * * *";
    }
  }

  @Getter
  @Setter
  public static class Routing {
    /** Minimum relevance a specialist needs to be picked without asking the user. */
    private double confidenceThreshold = 0.5;

    /** Two candidates closer than this are treated as a tie. */
    private double tieMargin = 0.1;

    private boolean multiAgent = false;
    private boolean retryOnFailure = true;
    private boolean fallbackToGeneral = true;

    /** "heuristic" (default) or "llm". */
    private String classifier = "heuristic";
  }

  @Getter
  @Setter
  public static class Confluence {
    private String baseUrl = "http://localhost:8090";
    private String token = "";
    private int timeoutMs = 15000;
    private int pageSize = 50;
  }

  /** A named partition of the vector index fed by one document source. */
  @Getter
  @Setter
  public static class Collection {
    private String name;
    private SourceType sourceType = SourceType.FILESYSTEM;

    /** Directory for filesystem sources, space key for Confluence. */
    private String root;

    private String includePattern = ".*";
    private String excludePattern;
    private boolean recursive = true;
    private SpecialistTag specialist = SpecialistTag.CONFLUENCE;
  }
}
