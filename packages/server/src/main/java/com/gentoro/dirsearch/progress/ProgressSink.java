package com.gentoro.dirsearch.progress;

import java.util.Map;

/**
 * Progress reporting abstraction for a search request.
 *
 * <p>Decouples the search pipeline (producer of progress events) from the transport layer (MCP
 * notifications, logs). Implementations must be lightweight and apply their own rate limiting.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier ("walk", "index", "query")
   * @param label human-readable label for presentation
   * @param totalWork total work units, 0 when unknown (the walk does not know its size upfront)
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param id stage identifier
   * @param completed completed work units so far
   * @param message short message describing the current step
   * @param attrs optional structured attributes (e.g., indexed, skipped)
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  /** Mark a stage as successfully completed. */
  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);

  /**
   * Return true if the current request has been cancelled by the caller or ran out of time.
   * Implementations that do not support cancellation always return false.
   */
  default boolean isCancelled() {
    return false;
  }
}
