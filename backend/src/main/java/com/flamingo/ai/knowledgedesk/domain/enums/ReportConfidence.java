package com.flamingo.ai.knowledgedesk.domain.enums;

/** How much of a progress report could be computed from the available changelog. */
public enum ReportConfidence {
  /** Events were contiguous and cycle time was computed. */
  COMPLETE,

  /** Gaps in the changelog or no cycle time; metrics are partial. */
  PARTIAL
}
