package com.gentoro.dirsearch.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends DirSearchException {
  public ConfigException(String message) {
    super(DirSearchErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DirSearchErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
