package com.gentoro.aasplan.exception;

/** A component was used before it reached the required lifecycle state. */
public class StateException extends AasPlanException {
  public StateException(String message) {
    super(AasPlanErrorCode.STATE_ERROR, message);
  }
}
