package com.gentoro.dirsearch.search.index;

import com.gentoro.dirsearch.exception.CancelledException;
import com.gentoro.dirsearch.progress.NoOpProgressSink;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.PipelineStage;
import com.gentoro.dirsearch.search.corpus.Corpus;
import com.gentoro.dirsearch.search.corpus.CorpusDocument;
import java.util.Map;

/**
 * Populates a fresh {@link EphemeralIndex} from a corpus. The returned index is not committed yet;
 * the caller owns it and must close it.
 */
public class IndexBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(IndexBuilder.class);

  public static final double DEFAULT_RAM_BUFFER_MB = 50.0;

  private final double ramBufferMb;

  public IndexBuilder() {
    this(DEFAULT_RAM_BUFFER_MB);
  }

  public IndexBuilder(double ramBufferMb) {
    if (!(ramBufferMb > 0)) {
      throw new IllegalArgumentException("ramBufferMb must be positive: " + ramBufferMb);
    }
    this.ramBufferMb = ramBufferMb;
  }

  public EphemeralIndex build(Corpus corpus) {
    return build(corpus, NoOpProgressSink.INSTANCE);
  }

  public EphemeralIndex build(Corpus corpus, ProgressSink sink) {
    EphemeralIndex index = new EphemeralIndex(ramBufferMb);
    try {
      int added = 0;
      for (CorpusDocument document : corpus.documents()) {
        if (sink.isCancelled()) {
          throw new CancelledException(PipelineStage.BUILDING);
        }
        index.add(document);
        added++;
        sink.step(PipelineStage.BUILDING.id(), added, document.path(), Map.of());
      }
      log.debug("Added {} documents to in-memory index", added);
      return index;
    } catch (RuntimeException e) {
      index.close();
      throw e;
    }
  }
}
