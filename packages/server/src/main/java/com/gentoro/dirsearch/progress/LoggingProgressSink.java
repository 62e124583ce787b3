package com.gentoro.dirsearch.progress;

import com.gentoro.dirsearch.utility.JacksonUtility;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Progress sink that writes one JSON line per event to the application log.
 *
 * <p>Used as is by the command line mode and as the base of {@link McpProgressSink}. Stage
 * boundaries are always published; steps inside a stage go through a {@link ProgressRateLimiter}
 * so a walk over a large tree does not flood the log. A line looks like:
 *
 * <pre>
 * [search.progress] {"stage":"walk","label":"Walking directory","status":"running",
 *   "completed":120,"total":0,"percent":0,"elapsedMs":35,"message":"/data/notes.txt",
 *   "attrs":{"indexed":98,"skipped":22}}
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final ProgressRateLimiter limiter;
  private final LongSupplier clock;
  private final Map<String, StageState> stages = new HashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this(logger, minIntervalMs, minDelta, System::currentTimeMillis);
  }

  LoggingProgressSink(
      org.slf4j.Logger logger, long minIntervalMs, long minDelta, LongSupplier clock) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.limiter = new ProgressRateLimiter(minIntervalMs, minDelta);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    StageState state = new StageState(label, Math.max(0, totalWork), clock.getAsLong());
    stages.put(id, state);
    publish(state.event(id, ProgressEvent.Status.BEGIN, clock.getAsLong(), label, Map.of()));
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    long now = clock.getAsLong();
    StageState state = stages.computeIfAbsent(id, k -> new StageState(k, 0, now));
    state.completed = completed;
    if (limiter.tryAcquire(now, completed)) {
      publish(state.event(id, ProgressEvent.Status.RUNNING, now, message, attrs));
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    long now = clock.getAsLong();
    StageState state = stages.computeIfAbsent(id, k -> new StageState(k, 0, now));
    state.total = Math.max(state.total, state.completed);
    publish(state.event(id, ProgressEvent.Status.OK, now, "done", attrs));
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    long now = clock.getAsLong();
    StageState state = stages.computeIfAbsent(id, k -> new StageState(k, 0, now));
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    publish(state.event(id, ProgressEvent.Status.ERROR, now, "failed", merged));
  }

  /** Deliver one event. Subclasses forward it elsewhere and usually call super to keep the log. */
  protected void publish(ProgressEvent event) {
    log.info("[search.progress] {}", JacksonUtility.toJson(event.toPayload()));
  }

  private static final class StageState {
    private final String label;
    private final long startedAt;
    private long total;
    private long completed;

    StageState(String label, long total, long startedAt) {
      this.label = label;
      this.total = total;
      this.startedAt = startedAt;
    }

    ProgressEvent event(
        String id,
        ProgressEvent.Status status,
        long now,
        String message,
        Map<String, Object> attrs) {
      return new ProgressEvent(
          id, label, status, completed, total, Math.max(0, now - startedAt), message, attrs);
    }
  }
}
