package com.gentoro.aasplan.access;

import java.util.Locale;
import java.util.Optional;

/** Role of a top-level shell. */
public enum AasRole {
  /** Holds global planning configuration. */
  SYSTEM,
  /** Contributes planning vocabulary: types, predicates, capabilities, instances. */
  COMPONENT;

  /** Parse the {@code AASRole} property value, ignoring case and surrounding blanks. */
  public static Optional<AasRole> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "system":
        return Optional.of(SYSTEM);
      case "component":
        return Optional.of(COMPONENT);
      default:
        return Optional.empty();
    }
  }
}
