package com.gentoro.aasplan.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfPipelineExceptions() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new UnknownObjectException("r9", "at"));

    assertEquals(AasPlanErrorCode.UNKNOWN_OBJECT, details.code());
    assertEquals("UnknownObjectException", details.type());
    assertEquals(Map.of("object", "r9", "predicate", "at"), details.context());
    assertNull(details.rootCause());
  }

  @Test
  void foreignExceptionsAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(AasPlanErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
    assertTrue(details.context().isEmpty());
  }

  @Test
  void findsPipelineExceptionBehindWrappers() {
    LoadException load =
        new LoadException("Failed to read container: x.json", new IOException("disk"));
    ErrorDetails details = ExceptionUtil.toErrorDetails(new RuntimeException("wrapped", load));

    assertEquals(AasPlanErrorCode.LOAD_ERROR, details.code());
    assertEquals("LoadException", details.type());
    assertEquals("IOException: disk", details.rootCause());
  }

  @Test
  void describesFailuresOnOneLine() {
    assertEquals(
        "[UNKNOWN_OBJECT] UnknownObjectException: Object 'r9' bound in predicate 'at' is not"
            + " declared {object=r9, predicate=at}",
        ExceptionUtil.describe(new UnknownObjectException("r9", "at")));
    assertEquals(
        "[UNKNOWN] IllegalStateException", ExceptionUtil.describe(new IllegalStateException()));
    assertEquals("[UNKNOWN] Unknown", ExceptionUtil.describe(null));
    assertTrue(
        ExceptionUtil.describe(new ReferenceException("gone", List.of("a")))
            .endsWith("ReferenceException: gone {keyPath=[a]}"));
  }
}
