package com.gentoro.aasplan.exception;

import java.util.Map;

/** A state assertion lacks a binding for one of the predicate's declared parameters. */
public class MissingBindingException extends AasPlanException {
  public MissingBindingException(String parameter, String predicate, String role) {
    super(
        AasPlanErrorCode.MISSING_BINDING,
        "Parameter '"
            + parameter
            + "' has no binding in "
            + role
            + " assertion for predicate '"
            + predicate
            + "'",
        null,
        Map.of("parameter", parameter, "predicate", predicate, "role", role));
  }
}
