package com.gentoro.aasplan.exception;

/** Stable error categories reported by the compiler pipeline. */
public enum AasPlanErrorCode {
  UNKNOWN,
  LOAD_ERROR, // container unreadable or malformed
  CONFIG_ERROR, // planning or application configuration invalid
  REFERENCE_ERROR, // cross-submodel reference could not be dereferenced
  UNKNOWN_TYPE,
  UNKNOWN_PREDICATE,
  UNBOUND_VARIABLE,
  UNKNOWN_OBJECT,
  MISSING_BINDING,
  ARITY_MISMATCH,
  TYPE_MISMATCH,
  DUPLICATE_DECLARATION,
  STATE_ERROR, // component used before it was initialized
  IO_ERROR
}
