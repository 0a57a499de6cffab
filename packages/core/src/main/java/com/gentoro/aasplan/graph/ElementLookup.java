package com.gentoro.aasplan.graph;

import java.util.List;
import java.util.Optional;

/** Name-based lookups over ordered element lists. */
final class ElementLookup {
  private ElementLookup() {}

  static Optional<ElementNode> find(List<ElementNode> elements, String idShort) {
    for (ElementNode element : elements) {
      if (element.idShort().equals(idShort)) {
        return Optional.of(element);
      }
    }
    return Optional.empty();
  }

  /**
   * Value of the first property named {@code idShort}. Elements of other kinds sharing the name
   * are skipped.
   */
  static Optional<String> propertyValue(List<ElementNode> elements, String idShort) {
    for (ElementNode element : elements) {
      if (!element.idShort().equals(idShort)) {
        continue;
      }
      Optional<ElementNode.PropertyNode> property = element.asProperty();
      if (property.isPresent() && property.get().hasValue()) {
        return Optional.of(property.get().value());
      }
    }
    return Optional.empty();
  }
}
