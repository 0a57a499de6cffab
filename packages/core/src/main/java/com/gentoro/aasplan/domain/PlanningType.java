package com.gentoro.aasplan.domain;

import java.util.Objects;
import java.util.Optional;

/** Node of the single-inheritance type forest; a null parent marks a root. */
public record PlanningType(String name, String parent) {
  public PlanningType {
    Objects.requireNonNull(name, "name");
  }

  public Optional<String> parentName() {
    return Optional.ofNullable(parent);
  }

  public boolean isRoot() {
    return parent == null;
  }
}
