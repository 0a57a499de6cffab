package com.gentoro.aasplan.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A submodel element of the loaded graph.
 *
 * <p>Traversals dispatch through {@link Visitor}, which forces every call site to handle all four
 * variants. The {@code asX()} accessors are shortcuts for sites that only care about one variant.
 */
public sealed interface ElementNode {

  /** Local (idShort) name of the element. */
  String idShort();

  ElementKind kind();

  <R> R accept(Visitor<R> visitor);

  default Optional<PropertyNode> asProperty() {
    return Optional.empty();
  }

  default Optional<ReferenceNode> asReferenceElement() {
    return Optional.empty();
  }

  default Optional<CollectionNode> asCollection() {
    return Optional.empty();
  }

  default Optional<EntityNode> asEntity() {
    return Optional.empty();
  }

  interface Visitor<R> {
    R visitProperty(PropertyNode property);

    R visitReference(ReferenceNode reference);

    R visitCollection(CollectionNode collection);

    R visitEntity(EntityNode entity);
  }

  /** Scalar property; the value is kept as its lexical string form and may be null. */
  record PropertyNode(String idShort, String value) implements ElementNode {
    public PropertyNode {
      Objects.requireNonNull(idShort, "idShort");
    }

    @Override
    public ElementKind kind() {
      return ElementKind.PROPERTY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProperty(this);
    }

    @Override
    public Optional<PropertyNode> asProperty() {
      return Optional.of(this);
    }

    /** True when the value is present and not blank. */
    public boolean hasValue() {
      return value != null && !value.isBlank();
    }
  }

  /**
   * Reference to another element, kept as the ordered key values of the reference. The first key
   * is the identifier of the target submodel; the following keys walk into its elements. Targets
   * are looked up on demand, the node never holds the target itself.
   */
  record ReferenceNode(String idShort, List<String> keyPath) implements ElementNode {
    public ReferenceNode {
      Objects.requireNonNull(idShort, "idShort");
      keyPath = keyPath == null ? List.of() : List.copyOf(keyPath);
    }

    @Override
    public ElementKind kind() {
      return ElementKind.REFERENCE_ELEMENT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReference(this);
    }

    @Override
    public Optional<ReferenceNode> asReferenceElement() {
      return Optional.of(this);
    }
  }

  /** Ordered container of child elements (collections and lists alike). */
  record CollectionNode(String idShort, List<ElementNode> children) implements ElementNode {
    public CollectionNode {
      Objects.requireNonNull(idShort, "idShort");
      children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ElementKind kind() {
      return ElementKind.COLLECTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCollection(this);
    }

    @Override
    public Optional<CollectionNode> asCollection() {
      return Optional.of(this);
    }

    /** First child with the given idShort. */
    public Optional<ElementNode> child(String name) {
      return ElementLookup.find(children, name);
    }

    /** Value of the first child property with the given idShort, if it has one. */
    public Optional<String> propertyValue(String name) {
      return ElementLookup.propertyValue(children, name);
    }

    public Optional<CollectionNode> childCollection(String name) {
      return child(name).flatMap(ElementNode::asCollection);
    }
  }

  /** Entity with its nested statements; used for the type hierarchy. */
  record EntityNode(String idShort, List<ElementNode> statements) implements ElementNode {
    public EntityNode {
      Objects.requireNonNull(idShort, "idShort");
      statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public ElementKind kind() {
      return ElementKind.ENTITY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEntity(this);
    }

    @Override
    public Optional<EntityNode> asEntity() {
      return Optional.of(this);
    }
  }
}
