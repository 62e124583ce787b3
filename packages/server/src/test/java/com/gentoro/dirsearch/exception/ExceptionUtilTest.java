package com.gentoro.dirsearch.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.dirsearch.search.PipelineStage;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfApplicationExceptions() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new CancelledException(PipelineStage.QUERYING));

    assertEquals("CancelledException", details.type());
    assertEquals(DirSearchErrorCode.CANCELLED, details.code());
    assertEquals(Map.of("stage", "query"), details.context());
    assertEquals("[query] Search cancelled before completion", details.message());
  }

  @Test
  void otherThrowablesAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(DirSearchErrorCode.UNKNOWN, details.code());
    assertEquals("", details.message());
    assertTrue(details.context().isEmpty());
  }

  @Test
  void describeFallsBackToStackTrace() {
    assertEquals("boom", ExceptionUtil.describe(new RuntimeException("boom")));
    String trace = ExceptionUtil.describe(new RuntimeException());
    assertTrue(trace.startsWith(getClass().getName() + ".describeFallsBackToStackTrace ("), trace);
    assertEquals("", ExceptionUtil.describe(null));
  }

  @Test
  void compactStackTraceHonoursFrameLimit() {
    RuntimeException e = new RuntimeException();
    e.setStackTrace(
        new StackTraceElement[] {
          new StackTraceElement("a.B", "c", "B.java", 12),
          new StackTraceElement("a.D", "e", null, -1)
        });

    assertEquals("a.B.c (B.java:12) > a.D.e (Unknown Source)", ExceptionUtil.compactStackTrace(e, 0));
    assertEquals("a.B.c (B.java:12)", ExceptionUtil.compactStackTrace(e, 1));
  }

  @Test
  void indexFailuresNameTheirStage() {
    IndexException commit =
        new IndexException(IndexException.Kind.COMMIT, "disk full", new IOException("disk full"));
    assertEquals(PipelineStage.COMMITTING, commit.getStage());
    assertEquals(DirSearchErrorCode.INDEX_ERROR, commit.getCode());
    assertEquals("[commit] Commit error: disk full", commit.getMessage());
    assertEquals("commit", commit.getContext().get("stage"));

    IndexException oom =
        new IndexException(IndexException.Kind.ADD_DOCUMENT, "a.txt", new OutOfMemoryError("heap"));
    assertEquals(DirSearchErrorCode.RESOURCE_EXHAUSTED, oom.getCode());
  }

  @Test
  void propagateKeepsApplicationExceptions() {
    StateException state = new StateException("closed");
    assertSame(state, ExceptionUtil.propagate(state, t -> new ExecutionException("x", t)));

    DirSearchException wrapped =
        ExceptionUtil.propagate(new RuntimeException(), t -> new ExecutionException("x", t));
    assertInstanceOf(ExecutionException.class, wrapped);
    assertEquals(DirSearchErrorCode.EXECUTION_ERROR, wrapped.getCode());
  }

  @Test
  void toStringShowsCodeAndContext() {
    DirectoryException ex = DirectoryException.notADirectory("/nope");
    String text = ex.toString();
    assertTrue(
        text.startsWith(
            "DirectoryException[NOT_FOUND] The specified path '/nope' is not a directory {"),
        text);
    assertTrue(text.contains("stage=walk"), text);
    assertTrue(text.contains("directory=/nope"), text);
  }
}
