package com.gentoro.aasplan.extract;

import java.util.List;
import java.util.Objects;

/** Everything the extractor read from one graph, ready for the domain builder. */
public record ExtractedDomain(
    TypeHierarchy typeHierarchy,
    List<PredicateSignature> predicates,
    List<ActionSpec> actions,
    List<InstanceSpec> instances,
    List<StateAssertion> initialStates,
    List<StateAssertion> goals) {
  public ExtractedDomain {
    Objects.requireNonNull(typeHierarchy, "typeHierarchy");
    predicates = List.copyOf(predicates);
    actions = List.copyOf(actions);
    instances = List.copyOf(instances);
    initialStates = List.copyOf(initialStates);
    goals = List.copyOf(goals);
  }
}
