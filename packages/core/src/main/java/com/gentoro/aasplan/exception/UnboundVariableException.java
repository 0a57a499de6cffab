package com.gentoro.aasplan.exception;

import java.util.Map;

/** A condition binds a variable that is not a parameter of its own action. */
public class UnboundVariableException extends AasPlanException {
  public UnboundVariableException(String variable, String predicate, String action) {
    super(
        AasPlanErrorCode.UNBOUND_VARIABLE,
        "Variable '"
            + variable
            + "' bound by predicate '"
            + predicate
            + "' is not a parameter of action '"
            + action
            + "'",
        null,
        Map.of("variable", variable, "predicate", predicate, "action", action));
  }
}
