package com.gentoro.aasplan.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, identifier-addressable store of shells and submodels produced by a {@link
 * GraphLoader}. It is the single arena every later stage reads from.
 */
public final class ElementGraph {
  private final Path source;
  private final List<Shell> shells;
  private final Map<String, Submodel> submodelsById;

  public ElementGraph(Path source, List<Shell> shells, List<Submodel> submodels) {
    this.source = source;
    this.shells = List.copyOf(shells);
    Map<String, Submodel> byId = new LinkedHashMap<>();
    for (Submodel submodel : submodels) {
      byId.putIfAbsent(submodel.id(), submodel);
    }
    this.submodelsById = Collections.unmodifiableMap(byId);
  }

  /** Where the graph was loaded from; null for graphs assembled in memory. */
  public Path source() {
    return source;
  }

  /** File name of the source without its extension, or null when there is no source. */
  public String sourceStem() {
    if (source == null || source.getFileName() == null) {
      return null;
    }
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /** Shells in source order. */
  public List<Shell> shells() {
    return shells;
  }

  public Optional<Submodel> lookupById(String id) {
    return Optional.ofNullable(submodelsById.get(id));
  }

  public Iterable<Submodel> submodels() {
    return submodelsById.values();
  }

  /** Submodels referenced by the shell that exist in the graph, in reference order. */
  public List<Submodel> submodelsOf(Shell shell) {
    List<Submodel> result = new ArrayList<>();
    for (String id : shell.submodelIds()) {
      Submodel submodel = submodelsById.get(id);
      if (submodel != null) {
        result.add(submodel);
      }
    }
    return result;
  }
}
