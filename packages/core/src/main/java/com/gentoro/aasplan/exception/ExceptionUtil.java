package com.gentoro.aasplan.exception;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Turns pipeline failures into one-line summaries for the console. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Describe a failure by the first {@link AasPlanException} in its cause chain. Foreign
   * exceptions without one map to {@link AasPlanErrorCode#UNKNOWN} and an empty context.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t == null) {
      return new ErrorDetails(AasPlanErrorCode.UNKNOWN, "Unknown", "", Map.of(), null);
    }
    Throwable root = rootCause(t);
    String rootCause = root == t ? null : shortMessage(root);
    AasPlanException pipeline = pipelineException(t);
    Throwable reported = pipeline == null ? t : pipeline;
    return new ErrorDetails(
        pipeline == null ? AasPlanErrorCode.UNKNOWN : pipeline.getCode(),
        reported.getClass().getSimpleName(),
        reported.getMessage() == null ? "" : reported.getMessage(),
        pipeline == null ? Map.of() : pipeline.getContext(),
        rootCause);
  }

  /**
   * One line naming code, exception, message and offending entities, e.g. {@code [UNKNOWN_OBJECT]
   * UnknownObjectException: Object 'r9' bound in predicate 'at' is not declared {object=r9,
   * predicate=at}}. A lower-level cause is appended after {@code caused by}.
   */
  public static String describe(Throwable t) {
    ErrorDetails details = toErrorDetails(t);
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(details.code()).append("] ").append(details.type());
    if (!details.message().isBlank()) {
      sb.append(": ").append(details.message());
    }
    if (!details.context().isEmpty()) {
      sb.append(' ').append(formatContext(details.context()));
    }
    if (details.rootCause() != null) {
      sb.append(" caused by ").append(details.rootCause());
    }
    return sb.toString();
  }

  static String formatContext(Map<String, Object> context) {
    return context.entrySet().stream()
        .map(e -> e.getKey() + "=" + e.getValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }

  private static AasPlanException pipelineException(Throwable t) {
    Set<Throwable> seen = new HashSet<>();
    for (Throwable current = t; current != null && seen.add(current); ) {
      if (current instanceof AasPlanException ex) {
        return ex;
      }
      current = current.getCause();
    }
    return null;
  }

  private static Throwable rootCause(Throwable t) {
    Set<Throwable> seen = new HashSet<>();
    Throwable current = t;
    while (current.getCause() != null && seen.add(current)) {
      current = current.getCause();
    }
    return current;
  }

  private static String shortMessage(Throwable t) {
    String message = t.getMessage();
    String type = t.getClass().getSimpleName();
    return message == null || message.isBlank() ? type : type + ": " + message;
  }
}
