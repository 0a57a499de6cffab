package com.gentoro.aasplan.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Initial fact or goal over concrete objects. Bindings are keyed by predicate parameter and are
 * reordered against the predicate declaration when grounded.
 */
public record StateAssertion(String predicate, StateRole role, Map<String, String> bindings) {
  public StateAssertion {
    Objects.requireNonNull(predicate, "predicate");
    Objects.requireNonNull(role, "role");
    bindings =
        bindings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
  }
}
