package com.gentoro.aasplan.extract;

import java.util.Objects;

/** Typed parameter of a predicate or action, in declaration order. */
public record Parameter(String variable, String type) {
  public Parameter {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(type, "type");
  }
}
