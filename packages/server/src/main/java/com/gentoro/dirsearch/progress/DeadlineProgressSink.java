package com.gentoro.dirsearch.progress;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Decorator that adds a request-scoped time budget to another sink. Once the budget is spent,
 * {@link #isCancelled()} returns true and the pipeline stops at its next checkpoint.
 */
public class DeadlineProgressSink implements ProgressSink {
  private final ProgressSink delegate;
  private final LongSupplier clock;
  private final long deadlineMs;

  public DeadlineProgressSink(ProgressSink delegate, Duration budget) {
    this(delegate, budget, System::currentTimeMillis);
  }

  DeadlineProgressSink(ProgressSink delegate, Duration budget, LongSupplier clock) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.deadlineMs = clock.getAsLong() + Objects.requireNonNull(budget, "budget").toMillis();
  }

  /** Wrap {@code sink} unless the budget is zero or negative, which means "no limit". */
  public static ProgressSink wrap(ProgressSink sink, Duration budget) {
    if (budget == null || budget.isZero() || budget.isNegative()) return sink;
    return new DeadlineProgressSink(sink, budget);
  }

  public long remainingMs() {
    return Math.max(0, deadlineMs - clock.getAsLong());
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    delegate.beginStage(id, label, totalWork);
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    delegate.step(id, completed, message, attrs);
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    delegate.endStageOk(id, attrs);
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    delegate.endStageError(id, errorSummary, attrs);
  }

  @Override
  public boolean isCancelled() {
    return remainingMs() <= 0 || delegate.isCancelled();
  }
}
