package com.gentoro.aasplan.domain;

import java.util.List;
import java.util.Objects;

public record Action(
    String name,
    List<TypedParameter> parameters,
    List<Literal> preconditions,
    List<Literal> effects) {
  public Action {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
    effects = effects == null ? List.of() : List.copyOf(effects);
  }
}
