package com.gentoro.dirsearch.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of every failure the search service reports on purpose.
 *
 * <p>Messages are shown to callers as they are, so they name the offending path or keyword where
 * there is one. The {@link DirSearchErrorCode} and the context map (stage, path, keyword) are for
 * logs and structured error details.
 */
public class DirSearchException extends RuntimeException {
  private final DirSearchErrorCode code;
  private final Map<String, Object> context;

  public DirSearchException(DirSearchErrorCode code, String message) {
    this(code, message, Map.of(), null);
  }

  public DirSearchException(DirSearchErrorCode code, String message, Throwable cause) {
    this(code, message, Map.of(), cause);
  }

  public DirSearchException(DirSearchErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public DirSearchException(
      DirSearchErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(context));
  }

  public DirSearchErrorCode getCode() {
    return code;
  }

  /** Unmodifiable, insertion ordered. */
  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    if (getCause() != null) sb.append(" caused by ").append(getCause().getClass().getSimpleName());
    return sb.toString();
  }
}
