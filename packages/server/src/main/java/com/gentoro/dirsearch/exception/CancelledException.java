package com.gentoro.dirsearch.exception;

import com.gentoro.dirsearch.search.PipelineStage;
import java.util.Map;

/** The request was cancelled by its caller or ran out of its time budget. */
public class CancelledException extends DirSearchException {
  private final PipelineStage stage;

  public CancelledException(PipelineStage stage) {
    super(
        DirSearchErrorCode.CANCELLED,
        "[%s] Search cancelled before completion".formatted(stage.id()),
        Map.of("stage", stage.id()));
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
