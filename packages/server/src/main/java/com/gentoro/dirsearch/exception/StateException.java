package com.gentoro.dirsearch.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends DirSearchException {
  public StateException(String message) {
    super(DirSearchErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(DirSearchErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
