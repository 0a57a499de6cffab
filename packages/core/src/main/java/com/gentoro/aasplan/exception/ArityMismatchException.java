package com.gentoro.aasplan.exception;

import java.util.Map;

/** A condition passes a different number of arguments than its predicate declares. */
public class ArityMismatchException extends AasPlanException {
  public ArityMismatchException(String predicate, int expected, int actual, String action) {
    super(
        AasPlanErrorCode.ARITY_MISMATCH,
        "Predicate '"
            + predicate
            + "' expects "
            + expected
            + " argument(s) but action '"
            + action
            + "' binds "
            + actual,
        null,
        Map.of("predicate", predicate, "expected", expected, "actual", actual, "action", action));
  }
}
