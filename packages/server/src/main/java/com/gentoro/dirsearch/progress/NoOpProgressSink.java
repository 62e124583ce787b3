package com.gentoro.dirsearch.progress;

import java.util.Map;

/** Sink for callers that did not ask for progress. Never cancels. */
public enum NoOpProgressSink implements ProgressSink {
  INSTANCE;

  @Override
  public void beginStage(String id, String label, long totalWork) {}

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {}

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {}

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {}
}
