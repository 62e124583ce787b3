package com.gentoro.dirsearch.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends DirSearchException {
  public SerializationException(String message) {
    super(DirSearchErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(DirSearchErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
