package com.gentoro.aasplan.graph;

import java.util.List;
import java.util.Objects;

/**
 * Top-level asset unit. Submodels are referenced by identifier and resolved through the owning
 * {@link ElementGraph}.
 */
public record Shell(String id, String idShort, String displayName, List<String> submodelIds) {
  public Shell {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(idShort, "idShort");
    submodelIds = submodelIds == null ? List.of() : List.copyOf(submodelIds);
  }

  /** Display name when one is set, otherwise the idShort. */
  public String label() {
    return displayName == null || displayName.isBlank() ? idShort : displayName;
  }
}
