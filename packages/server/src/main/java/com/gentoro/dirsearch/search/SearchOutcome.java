package com.gentoro.dirsearch.search;

import com.gentoro.dirsearch.search.corpus.WalkStats;
import com.gentoro.dirsearch.search.query.SearchHit;
import java.util.List;
import java.util.Objects;

/** Successful end of a search request, including the two informational "empty" endings. */
public final class SearchOutcome {

  public enum Kind {
    /** At least one document matched. */
    HITS,
    /** Documents were indexed but none matched. */
    NO_HITS,
    /** The walk produced no document, so no index was built. */
    NO_INDEXABLE_FILES
  }

  private final Kind kind;
  private final SearchRequest request;
  private final WalkStats stats;
  private final List<SearchHit> hits;
  private final String report;

  private SearchOutcome(
      Kind kind, SearchRequest request, WalkStats stats, List<SearchHit> hits, String report) {
    this.kind = kind;
    this.request = Objects.requireNonNull(request, "request");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.hits = List.copyOf(hits);
    this.report = report;
  }

  static SearchOutcome noIndexableFiles(SearchRequest request, WalkStats stats) {
    return new SearchOutcome(
        Kind.NO_INDEXABLE_FILES,
        request,
        stats,
        List.of(),
        SearchReportFormatter.noIndexableFiles(request.directory(), stats));
  }

  static SearchOutcome ranked(SearchRequest request, WalkStats stats, List<SearchHit> hits) {
    if (hits.isEmpty()) {
      return new SearchOutcome(
          Kind.NO_HITS,
          request,
          stats,
          hits,
          SearchReportFormatter.noHits(request.keyword(), stats.indexed()));
    }
    return new SearchOutcome(Kind.HITS, request, stats, hits, SearchReportFormatter.hits(hits));
  }

  public Kind kind() {
    return kind;
  }

  public SearchRequest request() {
    return request;
  }

  public WalkStats stats() {
    return stats;
  }

  /** Ranked hits, best first; empty unless {@link #kind()} is {@link Kind#HITS}. */
  public List<SearchHit> hits() {
    return hits;
  }

  public String report() {
    return report;
  }

  @Override
  public String toString() {
    return "SearchOutcome{kind=" + kind + ", stats=" + stats + ", hits=" + hits.size() + '}';
  }
}
