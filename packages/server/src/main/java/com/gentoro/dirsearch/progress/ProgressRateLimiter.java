package com.gentoro.dirsearch.progress;

/**
 * Time and delta based rate limiter for progress updates.
 *
 * <p>An event passes if at least {@code minIntervalMs} elapsed since the last accepted event, or
 * if the completed counter moved by at least {@code minDelta} units. The first event always passes.
 */
public class ProgressRateLimiter {
  private static final long NONE = Long.MIN_VALUE;

  private final long minIntervalMs;
  private final long minDelta;

  private long lastAcceptedAt = 0L;
  private long lastCompleted = NONE;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  /** Return true if the event should be emitted given current time and completed units. */
  public synchronized boolean tryAcquire(long nowMs, long completed) {
    if (lastCompleted != NONE
        && nowMs - lastAcceptedAt < minIntervalMs
        && Math.abs(completed - lastCompleted) < minDelta) {
      return false;
    }
    lastAcceptedAt = nowMs;
    lastCompleted = completed;
    return true;
  }
}
