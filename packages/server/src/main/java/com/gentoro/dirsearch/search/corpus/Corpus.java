package com.gentoro.dirsearch.search.corpus;

import java.util.List;
import java.util.Objects;

/** Documents discovered by one walk, in discovery order, together with the walk counters. */
public final class Corpus {
  private final List<CorpusDocument> documents;
  private final WalkStats stats;

  public Corpus(List<CorpusDocument> documents, WalkStats stats) {
    this.documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
    this.stats = Objects.requireNonNull(stats, "stats");
  }

  public List<CorpusDocument> documents() {
    return documents;
  }

  public WalkStats stats() {
    return stats;
  }

  public int size() {
    return documents.size();
  }

  public boolean isEmpty() {
    return documents.isEmpty();
  }
}
