package com.gentoro.dirsearch.progress;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One progress update of a search stage, as published to logs and MCP clients.
 *
 * @param stage stage identifier, e.g. "walk" or "index"
 * @param label human-readable stage label
 * @param status lifecycle position of the stage
 * @param completed work units done so far
 * @param total known work units, 0 when the stage cannot know its size upfront
 * @param elapsedMs time since the stage began
 * @param message short description of the current step
 * @param attrs stage specific counters
 */
public record ProgressEvent(
    String stage,
    String label,
    Status status,
    long completed,
    long total,
    long elapsedMs,
    String message,
    Map<String, Object> attrs) {

  public enum Status {
    BEGIN,
    RUNNING,
    OK,
    ERROR;

    String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public ProgressEvent {
    total = Math.max(0, total);
    completed = Math.max(0, total > 0 ? Math.min(completed, total) : completed);
    message = message == null ? "" : message;
    attrs = attrs == null ? Map.of() : Map.copyOf(attrs);
  }

  /** Share of the stage already done in [0, 1]; 0 when the total is unknown. */
  public double fraction() {
    if (status == Status.OK) return 1.0;
    return total > 0 ? (double) completed / total : 0.0;
  }

  /** JSON-friendly view with a stable key order. */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stage", stage);
    payload.put("label", label);
    payload.put("status", status.wireName());
    payload.put("completed", completed);
    payload.put("total", total);
    payload.put("percent", (int) Math.round(fraction() * 100));
    payload.put("elapsedMs", elapsedMs);
    payload.put("message", message);
    payload.put("attrs", attrs);
    return payload;
  }
}
