package com.gentoro.dirsearch.exception;

import com.gentoro.dirsearch.search.PipelineStage;
import java.util.Map;

/** The keyword could not be turned into results. "No hits" is never reported through here. */
public class QueryException extends DirSearchException {

  public enum Reason {
    EMPTY_KEYWORD,
    PARSE_FAILED,
    EXECUTION_FAILED
  }

  private final Reason reason;
  private final String keyword;

  private QueryException(
      DirSearchErrorCode code,
      Reason reason,
      PipelineStage stage,
      String keyword,
      String message,
      Throwable cause) {
    super(
        code,
        message,
        Map.of("stage", stage.id(), "reason", reason.name(), "keyword", String.valueOf(keyword)),
        cause);
    this.reason = reason;
    this.keyword = keyword;
  }

  public static QueryException emptyKeyword(String keyword) {
    return new QueryException(
        DirSearchErrorCode.INVALID_ARGUMENT,
        Reason.EMPTY_KEYWORD,
        PipelineStage.IDLE,
        keyword,
        "Search keyword is empty. Please enter a valid keyword.",
        null);
  }

  public static QueryException parseFailed(String keyword, Throwable cause) {
    return new QueryException(
        DirSearchErrorCode.INVALID_ARGUMENT,
        Reason.PARSE_FAILED,
        PipelineStage.QUERYING,
        keyword,
        "[%s] Query parse error for keyword '%s': %s"
            .formatted(PipelineStage.QUERYING.id(), keyword, ExceptionUtil.describe(cause)),
        cause);
  }

  public static QueryException executionFailed(String keyword, Throwable cause) {
    return new QueryException(
        DirSearchErrorCode.QUERY_ERROR,
        Reason.EXECUTION_FAILED,
        PipelineStage.QUERYING,
        keyword,
        "[%s] Search error for keyword '%s': %s"
            .formatted(PipelineStage.QUERYING.id(), keyword, ExceptionUtil.describe(cause)),
        cause);
  }

  public Reason getReason() {
    return reason;
  }

  public String getKeyword() {
    return keyword;
  }
}
