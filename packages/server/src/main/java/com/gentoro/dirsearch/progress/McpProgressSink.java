package com.gentoro.dirsearch.progress;

import com.gentoro.dirsearch.search.PipelineStage;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Objects;

/**
 * Streams search progress to the MCP client that sent a {@code progressToken}.
 *
 * <p>MCP progress must grow with every notification, while stage counters restart at each stage.
 * The notification therefore reports progress over the whole request: the number of finished work
 * stages plus the finished share of the current one, out of {@link PipelineStage#WORK_STAGES}.
 * Events that would not move that value forward, such as walk steps whose total is unknown, are
 * only logged. The structured event travels in the notification's meta field.
 */
public class McpProgressSink extends LoggingProgressSink {

  private final McpSyncServerExchange exchange;
  private final Object progressToken;
  private double lastProgress = -1;

  public McpProgressSink(
      org.slf4j.Logger logger,
      long minIntervalMs,
      long minDelta,
      McpSyncServerExchange exchange,
      Object progressToken) {
    super(logger, minIntervalMs, minDelta);
    this.exchange = Objects.requireNonNull(exchange, "exchange");
    this.progressToken = Objects.requireNonNull(progressToken, "progressToken");
  }

  @Override
  protected void publish(ProgressEvent event) {
    super.publish(event);
    if (event.status() == ProgressEvent.Status.ERROR) return;

    double progress = overallProgress(event);
    if (progress < 0 || progress <= lastProgress) return;
    lastProgress = progress;
    exchange.progressNotification(
        new McpSchema.ProgressNotification(
            String.valueOf(progressToken),
            progress,
            (double) PipelineStage.WORK_STAGES,
            event.label() + ": " + event.message(),
            event.toPayload()));
  }

  /** Overall progress in stage units, or -1 for events of unknown stages. */
  static double overallProgress(ProgressEvent event) {
    return PipelineStage.fromId(event.stage())
        .filter(stage -> stage != PipelineStage.IDLE)
        .map(stage -> stage.ordinal() - 1 + Math.min(1.0, event.fraction()))
        .orElse(-1.0);
  }
}
