package com.gentoro.aasplan.exception;

import java.util.Map;

/**
 * Flattened view of a failed compilation: the error code and context of the pipeline exception
 * that caused it, plus the innermost cause when a lower layer (I/O, parser) started it.
 */
public record ErrorDetails(
    AasPlanErrorCode code,
    String type,
    String message,
    Map<String, Object> context,
    String rootCause) {}
