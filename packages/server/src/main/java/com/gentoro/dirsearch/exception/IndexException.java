package com.gentoro.dirsearch.exception;

import com.gentoro.dirsearch.search.PipelineStage;
import java.util.Map;

/**
 * Failure while building, committing or opening the per-request index. Always fatal for the
 * current request: no partially built index is ever queried.
 */
public class IndexException extends DirSearchException {

  public enum Kind {
    WRITER_INIT(PipelineStage.BUILDING, "Index writer error"),
    ADD_DOCUMENT(PipelineStage.BUILDING, "Document addition error"),
    COMMIT(PipelineStage.COMMITTING, "Commit error"),
    READER_OPEN(PipelineStage.QUERYING, "Index reader error");

    private final PipelineStage stage;
    private final String label;

    Kind(PipelineStage stage, String label) {
      this.stage = stage;
      this.label = label;
    }

    public PipelineStage stage() {
      return stage;
    }
  }

  private final Kind kind;

  public IndexException(Kind kind, String detail, Throwable cause) {
    super(
        cause instanceof OutOfMemoryError
            ? DirSearchErrorCode.RESOURCE_EXHAUSTED
            : DirSearchErrorCode.INDEX_ERROR,
        "[%s] %s: %s".formatted(kind.stage.id(), kind.label, detail),
        Map.of("stage", kind.stage.id(), "kind", kind.name()),
        cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public PipelineStage getStage() {
    return kind.stage;
  }
}
