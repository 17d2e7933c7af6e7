package com.flamingo.ai.knowledgedesk.elasticsearch;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk of one version of a source document, stored in Elasticsearch with its embedding.
 *
 * <p>Chunks are addressed by (collection, path, version, chunkIndex); every chunk written for a
 * version shares the {@code contentHash} of the text it was cut from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

  private String id;
  private String collection;
  private String path;
  private String title;
  private String url;
  private long version;
  private String contentHash;
  private int chunkIndex;
  private String content;
  private int tokenCount;
  @Builder.Default private List<String> sectionBreadcrumb = List.of();
  private List<Float> embedding;

  /** Deterministic id, so re-writing a version after a partial failure overwrites it. */
  public static String chunkId(String collection, String path, long version, int chunkIndex) {
    String documentKey =
        Hashing.sha256()
            .hashString(collection + "\u0000" + path, StandardCharsets.UTF_8)
            .toString();
    return documentKey.substring(0, 32) + "-v" + version + "-" + chunkIndex;
  }
}
