package com.flamingo.ai.knowledgedesk.domain.enums;

/** Specialists the supervisor can dispatch a query to. */
public enum SpecialistTag {
  /** Technical documentation. */
  CONFLUENCE,

  /** Functional and business documentation. */
  SHAREPOINT,

  /** Ticket status, progress and history. */
  JIRA,

  /** Searches every collection; used as the fallback. */
  GENERAL;

  public String displayName() {
    String lower = name().toLowerCase();
    return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
  }
}
