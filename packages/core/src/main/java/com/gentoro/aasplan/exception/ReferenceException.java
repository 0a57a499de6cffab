package com.gentoro.aasplan.exception;

import java.util.List;
import java.util.Map;

/** A cross-submodel reference could not be followed to its target. */
public class ReferenceException extends AasPlanException {
  public ReferenceException(String message, List<String> keyPath) {
    super(
        AasPlanErrorCode.REFERENCE_ERROR,
        message,
        null,
        Map.of("keyPath", keyPath == null ? List.of() : List.copyOf(keyPath)));
  }
}
