package com.gentoro.dirsearch.exception;

import com.gentoro.dirsearch.search.PipelineStage;
import java.util.Map;

/** The search root does not resolve to a readable directory. */
public class DirectoryException extends DirSearchException {
  private final String directory;

  public DirectoryException(String directory, String message) {
    super(
        DirSearchErrorCode.NOT_FOUND,
        message,
        Map.of("stage", PipelineStage.WALKING.id(), "directory", String.valueOf(directory)));
    this.directory = directory;
  }

  public static DirectoryException notADirectory(String directory) {
    return new DirectoryException(
        directory, "The specified path '%s' is not a directory".formatted(directory));
  }

  public String getDirectory() {
    return directory;
  }
}
