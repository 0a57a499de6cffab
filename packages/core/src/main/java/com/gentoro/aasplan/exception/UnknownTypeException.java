package com.gentoro.aasplan.exception;

import java.util.Map;

/** A predicate, action or object declares a type that is not part of the type table. */
public class UnknownTypeException extends AasPlanException {
  public UnknownTypeException(String typeName, String ownerKind, String ownerName) {
    super(
        AasPlanErrorCode.UNKNOWN_TYPE,
        "Type '" + typeName + "' used by " + ownerKind + " '" + ownerName + "' is not declared",
        null,
        Map.of("type", typeName, ownerKind, ownerName));
  }
}
