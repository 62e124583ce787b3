package com.gentoro.dirsearch.search;

import com.gentoro.dirsearch.search.classify.BinaryExtensions;
import com.gentoro.dirsearch.search.corpus.WalkStats;
import com.gentoro.dirsearch.search.query.SearchHit;
import java.util.List;
import java.util.Locale;

/** Human-readable reports returned to the caller. */
final class SearchReportFormatter {
  private SearchReportFormatter() {}

  static String hits(List<SearchHit> hits) {
    StringBuilder sb = new StringBuilder();
    sb.append("Search results (").append(hits.size()).append(" hits):\n");
    for (SearchHit hit : hits) {
      sb.append("Hit: ")
          .append(hit.path())
          .append(" (Score: ")
          .append(String.format(Locale.ROOT, "%.2f", hit.score()))
          .append(")\n");
    }
    return sb.toString();
  }

  static String noHits(String keyword, int indexed) {
    return "No search results for keyword '%s'. Number of indexed files: %d"
        .formatted(keyword, indexed);
  }

  static String noIndexableFiles(String directory, WalkStats stats) {
    return ("No text files suitable for indexing were found in the specified directory '%s'.\n"
            + "Found files: %d, Indexed: %d, Skipped: %d\n"
            + "Excluded binary extensions: %s")
        .formatted(
            directory,
            stats.found(),
            stats.indexed(),
            stats.skipped(),
            String.join(", ", BinaryExtensions.DENYLIST));
  }
}
