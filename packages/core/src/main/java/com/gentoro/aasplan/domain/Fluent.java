package com.gentoro.aasplan.domain;

import java.util.List;
import java.util.Objects;

/** Boolean relation over typed parameters; every application defaults to false. */
public record Fluent(String name, List<TypedParameter> parameters) {
  public Fluent {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public int arity() {
    return parameters.size();
  }
}
