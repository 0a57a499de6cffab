package com.gentoro.aasplan.exception;

import java.util.Map;

/** The source container could not be read or does not hold a usable element graph. */
public class LoadException extends AasPlanException {
  public LoadException(String message) {
    super(AasPlanErrorCode.LOAD_ERROR, message);
  }

  public LoadException(String message, Throwable cause) {
    super(AasPlanErrorCode.LOAD_ERROR, message, cause, Map.of());
  }
}
