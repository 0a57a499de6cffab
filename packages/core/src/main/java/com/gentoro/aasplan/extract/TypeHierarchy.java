package com.gentoro.aasplan.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Type name to parent name mapping as declared by the graph. A type without parent is a root.
 * Redeclaring a type keeps its original position and takes the latest parent.
 */
public final class TypeHierarchy {
  private final Map<String, String> parents;

  private TypeHierarchy(Map<String, String> parents) {
    this.parents = Collections.unmodifiableMap(parents);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Type names in declaration order. */
  public Set<String> typeNames() {
    return parents.keySet();
  }

  public boolean contains(String type) {
    return parents.containsKey(type);
  }

  public Optional<String> parentOf(String type) {
    return Optional.ofNullable(parents.get(type));
  }

  public int size() {
    return parents.size();
  }

  public boolean isEmpty() {
    return parents.isEmpty();
  }

  /** Read-only view; root types map to null. */
  public Map<String, String> asMap() {
    return parents;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TypeHierarchy other && parents.equals(other.parents);
  }

  @Override
  public int hashCode() {
    return parents.hashCode();
  }

  @Override
  public String toString() {
    return "TypeHierarchy" + parents;
  }

  public static final class Builder {
    private final Map<String, String> parents = new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String type, String parent) {
      parents.put(Objects.requireNonNull(type, "type"), parent);
      return this;
    }

    public Builder root(String type) {
      return add(type, null);
    }

    public TypeHierarchy build() {
      return new TypeHierarchy(new LinkedHashMap<>(parents));
    }
  }
}
