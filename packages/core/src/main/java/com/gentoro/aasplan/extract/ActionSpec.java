package com.gentoro.aasplan.extract;

import java.util.List;
import java.util.Objects;

/** Capability read from a process operator collection. */
public record ActionSpec(
    String name,
    List<Parameter> parameters,
    List<ConditionSpec> preconditions,
    List<ConditionSpec> effects) {
  public ActionSpec {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
    effects = effects == null ? List.of() : List.copyOf(effects);
  }
}
