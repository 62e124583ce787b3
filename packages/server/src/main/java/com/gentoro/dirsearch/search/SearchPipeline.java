package com.gentoro.dirsearch.search;

import com.gentoro.dirsearch.exception.CancelledException;
import com.gentoro.dirsearch.exception.DirSearchException;
import com.gentoro.dirsearch.exception.DirectoryException;
import com.gentoro.dirsearch.exception.ExceptionUtil;
import com.gentoro.dirsearch.exception.ExecutionException;
import com.gentoro.dirsearch.progress.DeadlineProgressSink;
import com.gentoro.dirsearch.progress.NoOpProgressSink;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.classify.ContentClassifier;
import com.gentoro.dirsearch.search.corpus.Corpus;
import com.gentoro.dirsearch.search.corpus.CorpusWalker;
import com.gentoro.dirsearch.search.corpus.WalkStats;
import com.gentoro.dirsearch.search.index.EphemeralIndex;
import com.gentoro.dirsearch.search.index.IndexBuilder;
import com.gentoro.dirsearch.search.query.QueryEngine;
import com.gentoro.dirsearch.search.query.SearchHit;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs one search request end to end: validate, walk, build, commit, query, format.
 *
 * <p>Every call builds its own index and discards it before returning, so the pipeline holds no
 * per-request state and can serve concurrent callers. A directory without indexable files is an
 * informational outcome, not an error. All other failures surface as {@link DirSearchException}s
 * whose message names the failing stage.
 */
public class SearchPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(SearchPipeline.class);

  private final CorpusWalker walker;
  private final IndexBuilder indexBuilder;
  private final QueryEngine queryEngine;
  private final Duration timeout;

  public SearchPipeline(SearchSettings settings) {
    this(
        new CorpusWalker(new ContentClassifier(settings.sampleBytes())),
        new IndexBuilder(settings.ramBufferMb()),
        new QueryEngine(settings.topK(), settings.defaultOperator()),
        settings.timeout());
  }

  public SearchPipeline(
      CorpusWalker walker, IndexBuilder indexBuilder, QueryEngine queryEngine, Duration timeout) {
    this.walker = Objects.requireNonNull(walker, "walker");
    this.indexBuilder = Objects.requireNonNull(indexBuilder, "indexBuilder");
    this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine");
    this.timeout = timeout == null ? Duration.ZERO : timeout;
  }

  public SearchOutcome search(SearchRequest request) {
    return search(request, NoOpProgressSink.INSTANCE);
  }

  public SearchOutcome search(SearchRequest request, ProgressSink progress) {
    Objects.requireNonNull(request, "request");
    ProgressSink sink =
        DeadlineProgressSink.wrap(
            progress == null ? NoOpProgressSink.INSTANCE : progress, timeout);

    String keyword = QueryEngine.requireKeyword(request.keyword());
    Path root = resolveDirectory(request.directory());

    Corpus corpus =
        runStage(
            sink, PipelineStage.WALKING, "Walking directory", 0, () -> walker.walk(root, sink));
    WalkStats stats = corpus.stats();
    if (stats.nothingIndexed()) {
      log.info(
          "No indexable files under '{}' (found={}, skipped={})",
          request.directory(),
          stats.found(),
          stats.skipped());
      return SearchOutcome.noIndexableFiles(request, stats);
    }

    EphemeralIndex index =
        runStage(
            sink,
            PipelineStage.BUILDING,
            "Building index",
            corpus.size(),
            () -> indexBuilder.build(corpus, sink),
            EphemeralIndex::close);
    try (index) {
      runStage(
          sink,
          PipelineStage.COMMITTING,
          "Committing index",
          1,
          () -> {
            index.commit();
            return index.documentCount();
          });
      List<SearchHit> hits =
          runStage(
              sink,
              PipelineStage.QUERYING,
              "Querying index",
              1,
              () -> queryEngine.search(index, keyword));
      SearchOutcome outcome =
          runStage(
              sink,
              PipelineStage.FORMATTING,
              "Formatting results",
              hits.size(),
              () -> SearchOutcome.ranked(request, stats, hits));
      log.info(
          "Search for '{}' in '{}' returned {} hits from {} documents",
          keyword,
          request.directory(),
          hits.size(),
          stats.indexed());
      return outcome;
    }
  }

  private static Path resolveDirectory(String directory) {
    if (directory == null || directory.isBlank()) {
      throw DirectoryException.notADirectory(directory);
    }
    try {
      return Path.of(directory);
    } catch (InvalidPathException e) {
      throw DirectoryException.notADirectory(directory);
    }
  }

  private static <T> T runStage(
      ProgressSink sink, PipelineStage stage, String label, long totalWork, Supplier<T> work) {
    return runStage(sink, stage, label, totalWork, work, result -> {});
  }

  /**
   * Run one stage between its progress boundaries. {@code discard} receives a result that was
   * produced but cannot be handed back because closing the stage failed.
   */
  private static <T> T runStage(
      ProgressSink sink,
      PipelineStage stage,
      String label,
      long totalWork,
      Supplier<T> work,
      Consumer<? super T> discard) {
    if (sink.isCancelled()) {
      throw new CancelledException(stage);
    }
    sink.beginStage(stage.id(), label, totalWork);
    T result = null;
    try {
      result = work.get();
      sink.endStageOk(stage.id(), Map.of());
      return result;
    } catch (RuntimeException e) {
      if (result != null) {
        try {
          discard.accept(result);
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
      }
      DirSearchException failure =
          ExceptionUtil.propagate(
              e,
              ex ->
                  new ExecutionException(
                      "[%s] Unexpected failure: %s"
                          .formatted(stage.id(), ExceptionUtil.describe(ex)),
                      ex));
      sink.endStageError(stage.id(), failure.getMessage(), Map.of());
      log.warn("Search stage '{}' failed: {}", stage.id(), failure.getMessage());
      throw failure;
    }
  }
}
