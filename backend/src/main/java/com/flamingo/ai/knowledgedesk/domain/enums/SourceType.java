package com.flamingo.ai.knowledgedesk.domain.enums;

/** Kind of external document source backing a collection. */
public enum SourceType {
  CONFLUENCE,
  FILESYSTEM
}
