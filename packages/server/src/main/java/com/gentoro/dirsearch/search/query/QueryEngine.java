package com.gentoro.dirsearch.search.query;

import com.gentoro.dirsearch.exception.QueryException;
import com.gentoro.dirsearch.search.index.EphemeralIndex;
import com.gentoro.dirsearch.search.index.IndexSchema;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;

/**
 * Runs a keyword expression against a committed {@link EphemeralIndex}.
 *
 * <p>The keyword is parsed with Lucene's classic query syntax against the {@code content} field:
 * plain terms, {@code "quoted phrases"}, {@code AND}/{@code OR}/{@code NOT}, {@code +}/{@code -},
 * grouping and wildcards. Terms without an explicit operator are combined with the configured
 * default operator. Results are ordered by BM25 score, ties by insertion order.
 */
public class QueryEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(QueryEngine.class);

  public static final int DEFAULT_TOP_K = 10;
  public static final String UNKNOWN_PATH = "Unknown path";

  private static final Set<String> PATH_ONLY = Set.of(IndexSchema.FIELD_PATH);

  private final int topK;
  private final QueryParser.Operator defaultOperator;

  public QueryEngine() {
    this(DEFAULT_TOP_K, QueryParser.Operator.OR);
  }

  public QueryEngine(int topK, QueryParser.Operator defaultOperator) {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive: " + topK);
    }
    this.topK = topK;
    this.defaultOperator = Objects.requireNonNull(defaultOperator, "defaultOperator");
  }

  /** Reject null, empty and whitespace-only keywords. Returns the keyword unchanged. */
  public static String requireKeyword(String keyword) {
    if (keyword == null || keyword.isBlank()) {
      throw QueryException.emptyKeyword(keyword);
    }
    return keyword;
  }

  /** Parse {@code keyword} into a query bound to the content field. */
  public Query parse(EphemeralIndex index, String keyword) {
    requireKeyword(keyword);
    QueryParser parser = new QueryParser(IndexSchema.FIELD_CONTENT, index.analyzer());
    parser.setDefaultOperator(defaultOperator);
    try {
      return parser.parse(keyword);
    } catch (ParseException | IndexSearcher.TooManyClauses e) {
      throw QueryException.parseFailed(keyword, e);
    }
  }

  /**
   * Top hits for {@code keyword}, best first. An empty list means nothing matched.
   *
   * @throws QueryException for blank keywords, syntax errors or execution failures
   */
  public List<SearchHit> search(EphemeralIndex index, String keyword) {
    Query query = parse(index, keyword);
    log.debug("Executing query '{}' parsed as {}", keyword, query);

    IndexSearcher searcher = index.searcher();
    try {
      TopDocs top = searcher.search(query, topK);
      StoredFields storedFields = searcher.storedFields();
      List<SearchHit> hits = new ArrayList<>(top.scoreDocs.length);
      for (ScoreDoc scoreDoc : top.scoreDocs) {
        Document stored = storedFields.document(scoreDoc.doc, PATH_ONLY);
        String path = stored.get(IndexSchema.FIELD_PATH);
        hits.add(new SearchHit(path == null ? UNKNOWN_PATH : path, scoreDoc.score));
      }
      return hits;
    } catch (IOException | IndexSearcher.TooManyClauses e) {
      throw QueryException.executionFailed(keyword, e);
    }
  }
}
