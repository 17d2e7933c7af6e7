package com.flamingo.ai.knowledgedesk.service.supervisor;

import com.flamingo.ai.knowledgedesk.domain.enums.RouteState;
import java.util.ArrayList;
import java.util.List;

/** Current state of one routed query and the states it passed through. Not thread-safe. */
final class RouteTrace {

  private final List<RouteState> states = new ArrayList<>();

  RouteTrace() {
    states.add(RouteState.RECEIVED);
  }

  RouteState current() {
    return states.get(states.size() - 1);
  }

  /**
   * Moves to the next state.
   *
   * @throws IllegalStateException if the transition is not allowed from the current state
   */
  void moveTo(RouteState next) {
    RouteState current = current();
    if (!current.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal route transition " + current + " -> " + next);
    }
    states.add(next);
  }

  List<RouteState> states() {
    return List.copyOf(states);
  }
}
