package com.gentoro.dirsearch.exception;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Helpers for turning exceptions into caller facing messages and structured details. */
public final class ExceptionUtil {
  private static final int DEFAULT_TRACE_FRAMES = 10;

  private ExceptionUtil() {}

  /** Application exceptions keep their code and context; anything else is {@code UNKNOWN}. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    String message = t.getMessage() == null ? "" : t.getMessage();
    if (t instanceof DirSearchException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(), message, ex.getCode(), ex.getContext());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), message, DirSearchErrorCode.UNKNOWN, Map.of());
  }

  /** The exception message, or its compact stack trace when there is no message. */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    return message == null || message.isBlank()
        ? compactStackTrace(t, DEFAULT_TRACE_FRAMES)
        : message;
  }

  /**
   * Top stack frames on one line, innermost first, e.g. {@code a.B.c (B.java:12) > a.D.e
   * (D.java:40)}. A non-positive {@code maxFrames} keeps every frame.
   */
  public static String compactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    Stream<StackTraceElement> frames = Arrays.stream(t.getStackTrace());
    if (maxFrames > 0) frames = frames.limit(maxFrames);
    return frames.map(ExceptionUtil::formatFrame).collect(Collectors.joining(" > "));
  }

  /** {@code t} itself when it is already a {@link DirSearchException}, otherwise wrapped. */
  public static DirSearchException propagate(
      Throwable t, Function<Throwable, ? extends DirSearchException> wrapper) {
    return t instanceof DirSearchException ex ? ex : wrapper.apply(t);
  }

  private static String formatFrame(StackTraceElement frame) {
    String location = frame.getFileName() == null ? "Unknown Source" : frame.getFileName();
    if (frame.getLineNumber() >= 0) location += ":" + frame.getLineNumber();
    return frame.getClassName() + '.' + frame.getMethodName() + " (" + location + ')';
  }
}
