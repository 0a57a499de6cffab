package com.gentoro.aasplan.domain;

import java.util.Objects;

public record PlanningObject(String name, String type) {
  public PlanningObject {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
