package com.gentoro.dirsearch.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@ExtendWith(MockitoExtension.class)
class McpProgressSinkTest {

  @Mock private McpSyncServerExchange exchange;

  private McpProgressSink sink() {
    return new McpProgressSink(
        LoggerFactory.getLogger(McpProgressSinkTest.class), 0, 0, exchange, "token-1");
  }

  private List<McpSchema.ProgressNotification> sent(int expected) {
    ArgumentCaptor<McpSchema.ProgressNotification> captor =
        ArgumentCaptor.forClass(McpSchema.ProgressNotification.class);
    verify(exchange, times(expected)).progressNotification(captor.capture());
    return captor.getAllValues();
  }

  @Test
  void reportsProgressAcrossStages() {
    McpProgressSink sink = sink();

    sink.beginStage("walk", "Walking directory", 0);
    sink.step("walk", 1, "a.txt", Map.of());
    sink.step("walk", 2, "b.txt", Map.of());
    sink.endStageOk("walk", Map.of());
    sink.beginStage("index", "Building index", 2);
    sink.step("index", 1, "a.txt", Map.of());
    sink.step("index", 2, "b.txt", Map.of());
    sink.endStageOk("index", Map.of());

    List<Double> progress =
        sent(4).stream().map(McpSchema.ProgressNotification::progress).toList();
    assertEquals(List.of(0.0, 1.0, 1.5, 2.0), progress);
  }

  @Test
  void notificationsCarryTokenTotalAndPayload() {
    McpProgressSink sink = sink();

    sink.beginStage("walk", "Walking directory", 0);

    McpSchema.ProgressNotification notification = sent(1).get(0);
    assertEquals("token-1", String.valueOf(notification.progressToken()));
    assertEquals(5.0, notification.total());
    assertEquals("Walking directory: Walking directory", notification.message());
  }

  @Test
  void errorsAreOnlyLogged() {
    McpProgressSink sink = sink();

    sink.beginStage("walk", "Walking directory", 0);
    sink.endStageError("walk", "[walk] boom", Map.of());

    sent(1);
  }

  @Test
  void overallProgressIgnoresUnknownStages() {
    ProgressEvent unknown =
        new ProgressEvent("other", "Other", ProgressEvent.Status.OK, 1, 1, 0, "", Map.of());
    ProgressEvent query =
        new ProgressEvent("query", "Querying", ProgressEvent.Status.OK, 1, 1, 0, "", Map.of());

    assertEquals(-1.0, McpProgressSink.overallProgress(unknown));
    assertEquals(4.0, McpProgressSink.overallProgress(query));
  }
}
