package com.flamingo.ai.knowledgedesk.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a query passes through in the supervisor router.
 *
 * <p>The happy path is {@code RECEIVED -> CLASSIFIED -> DISPATCHED -> SPECIALIST_SUCCEEDED ->
 * SYNTHESIZED -> RESPONDED}. Low-confidence classification takes {@code CLASSIFIED ->
 * CLARIFICATION_REQUESTED -> AWAITING_USER}, and the user's reply re-enters at {@code RECEIVED}.
 */
public enum RouteState {
  RECEIVED,
  CLASSIFIED,
  DISPATCHED,
  SPECIALIST_SUCCEEDED,
  SPECIALIST_FAILED,
  SYNTHESIZED,
  RESPONDED,
  CLARIFICATION_REQUESTED,
  AWAITING_USER;

  /** Returns the states reachable from this one in a single step. */
  public Set<RouteState> successors() {
    return switch (this) {
      case RECEIVED -> EnumSet.of(CLASSIFIED);
      case CLASSIFIED -> EnumSet.of(DISPATCHED, CLARIFICATION_REQUESTED);
      // a failed specialist may be re-dispatched (retry or fallback)
      case DISPATCHED -> EnumSet.of(SPECIALIST_SUCCEEDED, SPECIALIST_FAILED);
      case SPECIALIST_FAILED -> EnumSet.of(DISPATCHED, SYNTHESIZED);
      case SPECIALIST_SUCCEEDED -> EnumSet.of(DISPATCHED, SYNTHESIZED);
      case SYNTHESIZED -> EnumSet.of(RESPONDED);
      case CLARIFICATION_REQUESTED -> EnumSet.of(AWAITING_USER);
      case AWAITING_USER -> EnumSet.of(RECEIVED);
      case RESPONDED -> EnumSet.noneOf(RouteState.class);
    };
  }

  public boolean canTransitionTo(RouteState next) {
    return successors().contains(next);
  }

  public boolean isTerminal() {
    return this == RESPONDED || this == AWAITING_USER;
  }
}
