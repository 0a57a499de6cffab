package com.gentoro.aasplan.exception;

import java.util.Map;

/** A state assertion binds a value that is not a declared object. */
public class UnknownObjectException extends AasPlanException {
  public UnknownObjectException(String object, String predicate) {
    super(
        AasPlanErrorCode.UNKNOWN_OBJECT,
        "Object '" + object + "' bound in predicate '" + predicate + "' is not declared",
        null,
        Map.of("object", object, "predicate", predicate));
  }
}
