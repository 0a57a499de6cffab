package com.gentoro.aasplan.domain;

import java.util.Objects;

public record TypedParameter(String name, String type) {
  public TypedParameter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
