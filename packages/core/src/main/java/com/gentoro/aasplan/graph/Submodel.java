package com.gentoro.aasplan.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Named substructure of a shell, addressed globally by its identifier. */
public record Submodel(String id, String idShort, List<ElementNode> elements) {
  public Submodel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(idShort, "idShort");
    elements = elements == null ? List.of() : List.copyOf(elements);
  }

  public Optional<ElementNode> element(String name) {
    return ElementLookup.find(elements, name);
  }

  public Optional<String> propertyValue(String name) {
    return ElementLookup.propertyValue(elements, name);
  }
}
