package com.gentoro.aasplan.exception;

import java.util.Map;

/** Two actions or two objects were declared with the same name. */
public class DuplicateDeclarationException extends AasPlanException {
  public DuplicateDeclarationException(String kind, String name) {
    super(
        AasPlanErrorCode.DUPLICATE_DECLARATION,
        "Duplicate " + kind + " '" + name + "'",
        null,
        Map.of(kind, name));
  }
}
