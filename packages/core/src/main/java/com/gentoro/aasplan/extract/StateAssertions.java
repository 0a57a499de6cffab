package com.gentoro.aasplan.extract;

import java.util.List;

/** Initial facts and goals extracted in one pass over the instance submodels. */
public record StateAssertions(List<StateAssertion> initialStates, List<StateAssertion> goals) {
  public StateAssertions {
    initialStates = List.copyOf(initialStates);
    goals = List.copyOf(goals);
  }
}
