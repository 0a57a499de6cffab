package com.gentoro.aasplan.extract;

import java.util.List;
import java.util.Objects;

/** Declared predicate; argument binding is positional against {@link #parameters()}. */
public record PredicateSignature(String name, List<Parameter> parameters) {
  public PredicateSignature {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public int arity() {
    return parameters.size();
  }
}
