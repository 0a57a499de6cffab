package com.gentoro.aasplan.exception;

import java.util.Map;

/** A condition or state assertion refers to a predicate that was never declared. */
public class UnknownPredicateException extends AasPlanException {
  public UnknownPredicateException(String predicate, String ownerKind, String ownerName) {
    super(
        AasPlanErrorCode.UNKNOWN_PREDICATE,
        "Predicate '"
            + predicate
            + "' used by "
            + ownerKind
            + " '"
            + ownerName
            + "' is not declared",
        null,
        Map.of("predicate", predicate, ownerKind, ownerName));
  }
}
