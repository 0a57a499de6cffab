package com.gentoro.aasplan.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure raised by the pipeline.
 *
 * <p>Each exception carries an {@link AasPlanErrorCode} and an immutable context map naming the
 * offending entity (type, predicate, action, object, reference path, ...). The pipeline never
 * retries: the first exception aborts the run and is surfaced verbatim to the caller.
 */
public class AasPlanException extends RuntimeException {
  private final AasPlanErrorCode code;
  private final Map<String, Object> context;

  public AasPlanException(AasPlanErrorCode code, String message) {
    this(code, message, null, Map.of());
  }

  public AasPlanException(AasPlanErrorCode code, String message, Throwable cause) {
    this(code, message, cause, Map.of());
  }

  public AasPlanException(
      AasPlanErrorCode code, String message, Throwable cause, Map<String, Object> context) {
    super(message, cause);
    this.code = code == null ? AasPlanErrorCode.UNKNOWN : code;
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public AasPlanErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }
}
