package com.gentoro.dirsearch.exception;

/** Network-level error while binding or serving HTTP. */
public class NetworkException extends DirSearchException {
  public NetworkException(String message) {
    super(DirSearchErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(DirSearchErrorCode.NETWORK_ERROR, message, cause);
  }
}
