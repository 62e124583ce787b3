package com.gentoro.dirsearch.search;

import java.util.Optional;

/** Linear stages of one search request, in execution order. */
public enum PipelineStage {
  IDLE("validate"),
  WALKING("walk"),
  BUILDING("index"),
  COMMITTING("commit"),
  QUERYING("query"),
  FORMATTING("format");

  /** Stages that do work after validation; used as the denominator of overall progress. */
  public static final int WORK_STAGES = values().length - 1;

  private final String id;

  PipelineStage(String id) {
    this.id = id;
  }

  /** Short identifier used in progress notifications and error messages. */
  public String id() {
    return id;
  }

  public static Optional<PipelineStage> fromId(String id) {
    for (PipelineStage stage : values()) {
      if (stage.id.equals(id)) return Optional.of(stage);
    }
    return Optional.empty();
  }
}
