package com.gentoro.dirsearch.search.corpus;

import java.util.Objects;

/**
 * One file accepted for indexing.
 *
 * @param path path of the file as discovered beneath the search root
 * @param content full text body; never blank
 */
public record CorpusDocument(String path, String content) {
  public CorpusDocument {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
    if (content.isBlank()) {
      throw new IllegalArgumentException("Blank documents are never indexed: " + path);
    }
  }
}
