package com.gentoro.dirsearch.exception;

/** Error while starting or running an application component. */
public class ExecutionException extends DirSearchException {
  public ExecutionException(String message) {
    super(DirSearchErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(DirSearchErrorCode.EXECUTION_ERROR, message, cause);
  }
}
