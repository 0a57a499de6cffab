package com.gentoro.aasplan.graph;

/** The four element variants the compiler understands. */
public enum ElementKind {
  PROPERTY,
  REFERENCE_ELEMENT,
  COLLECTION,
  ENTITY
}
