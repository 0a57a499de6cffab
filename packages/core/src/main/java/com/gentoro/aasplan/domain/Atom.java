package com.gentoro.aasplan.domain;

import java.util.List;
import java.util.Objects;

/**
 * Application of a fluent to arguments. Inside actions the arguments are action parameter names;
 * in the initial state and goals they are object names.
 */
public record Atom(String fluent, List<String> arguments) {
  public Atom {
    Objects.requireNonNull(fluent, "fluent");
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  public static Atom of(String fluent, String... arguments) {
    return new Atom(fluent, List.of(arguments));
  }

  @Override
  public String toString() {
    return fluent + arguments;
  }
}
