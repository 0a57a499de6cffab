package com.gentoro.aasplan.access;

import java.util.List;
import java.util.Objects;

/** Domain/problem naming and requirement tags handed to the domain writer. */
public record PlanningConfig(String domainName, String problemName, List<String> requirements) {
  public PlanningConfig {
    Objects.requireNonNull(domainName, "domainName");
    Objects.requireNonNull(problemName, "problemName");
    requirements = requirements == null ? List.of() : List.copyOf(requirements);
  }
}
