package com.gentoro.dirsearch.search.classify;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Leading bytes of a file, as inspected by the classification rules.
 *
 * @param path file the sample was taken from, used for the extension rule
 * @param bytes up to {@code limit} leading bytes; empty for empty or unreadable files
 * @param truncated true when the file is longer than the sample
 * @param readable false when the file could not be opened or read
 */
public record ContentSample(Path path, byte[] bytes, boolean truncated, boolean readable) {

  public static ContentSample of(Path path, byte[] bytes) {
    return new ContentSample(path, bytes, false, true);
  }

  public static ContentSample unreadable(Path path) {
    return new ContentSample(path, new byte[0], false, false);
  }

  /** Read at most {@code limit} bytes from the start of {@code path}. */
  public static ContentSample read(Path path, int limit) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      byte[] head = in.readNBytes(limit + 1);
      if (head.length > limit) {
        byte[] sample = new byte[limit];
        System.arraycopy(head, 0, sample, 0, limit);
        return new ContentSample(path, sample, true, true);
      }
      return new ContentSample(path, head, false, true);
    }
  }

  public int size() {
    return bytes.length;
  }
}
