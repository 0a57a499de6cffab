package com.gentoro.aasplan.extract;

import java.util.Objects;

public record InstanceSpec(String name, String type) {
  public InstanceSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
