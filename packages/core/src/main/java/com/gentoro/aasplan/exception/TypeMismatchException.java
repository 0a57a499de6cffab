package com.gentoro.aasplan.exception;

import java.util.Map;

/** An argument's type is not compatible with the predicate parameter it is bound to. */
public class TypeMismatchException extends AasPlanException {
  public TypeMismatchException(
      String argument, String actualType, String expectedType, String predicate) {
    super(
        AasPlanErrorCode.TYPE_MISMATCH,
        "Argument '"
            + argument
            + "' of type '"
            + actualType
            + "' cannot be bound to a '"
            + expectedType
            + "' parameter of predicate '"
            + predicate
            + "'",
        null,
        Map.of(
            "argument", argument,
            "actualType", actualType,
            "expectedType", expectedType,
            "predicate", predicate));
  }
}
