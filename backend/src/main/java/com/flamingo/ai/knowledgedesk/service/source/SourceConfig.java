package com.flamingo.ai.knowledgedesk.service.source;

import java.util.regex.Pattern;

/**
 * What to list from a source.
 *
 * @param root directory or space to list from
 * @param include paths must fully match this pattern
 * @param exclude paths fully matching this pattern are skipped, may be null
 * @param recursive whether to descend into sub-paths
 */
public record SourceConfig(String root, Pattern include, Pattern exclude, boolean recursive) {

  public static SourceConfig of(String root, String include, String exclude, boolean recursive) {
    return new SourceConfig(
        root,
        Pattern.compile(include == null || include.isBlank() ? ".*" : include),
        exclude == null || exclude.isBlank() ? null : Pattern.compile(exclude),
        recursive);
  }

  public boolean accepts(String path) {
    return include.matcher(path).matches() && (exclude == null || !exclude.matcher(path).matches());
  }
}
