package com.gentoro.dirsearch.search.index;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.gentoro.dirsearch.exception.CancelledException;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.PipelineStage;
import com.gentoro.dirsearch.search.corpus.Corpus;
import com.gentoro.dirsearch.search.corpus.CorpusDocument;
import com.gentoro.dirsearch.search.corpus.WalkStats;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IndexBuilderTest {

  private static Corpus corpus(CorpusDocument... documents) {
    return new Corpus(List.of(documents), new WalkStats(documents.length, documents.length, 0));
  }

  @Test
  void buildsUncommittedIndexWithAllDocuments() {
    Corpus corpus =
        corpus(new CorpusDocument("a.txt", "alpha"), new CorpusDocument("b.txt", "beta"));

    try (EphemeralIndex index = new IndexBuilder(8).build(corpus)) {
      assertEquals(2, index.documentCount());
      assertFalse(index.isCommitted());
      index.commit();
      assertNotNull(index.searcher());
    }
  }

  @Test
  void reportsOneStepPerDocument() {
    ProgressSink sink = mock(ProgressSink.class);
    Corpus corpus =
        corpus(new CorpusDocument("a.txt", "alpha"), new CorpusDocument("b.txt", "beta"));

    try (EphemeralIndex index = new IndexBuilder().build(corpus, sink)) {
      assertEquals(2, index.documentCount());
    }

    verify(sink).step("index", 1L, "a.txt", Map.of());
    verify(sink).step("index", 2L, "b.txt", Map.of());
  }

  @Test
  void stopsWhenCancelled() {
    ProgressSink sink = mock(ProgressSink.class);
    when(sink.isCancelled()).thenReturn(true);

    CancelledException ex =
        assertThrows(
            CancelledException.class,
            () -> new IndexBuilder().build(corpus(new CorpusDocument("a.txt", "alpha")), sink));

    assertEquals(PipelineStage.BUILDING, ex.getStage());
    verify(sink, never()).step(anyString(), anyLong(), anyString(), anyMap());
  }

  @Test
  void rejectsNonPositiveBuffer() {
    assertThrows(IllegalArgumentException.class, () -> new IndexBuilder(0));
    assertThrows(IllegalArgumentException.class, () -> new IndexBuilder(Double.NaN));
  }
}
