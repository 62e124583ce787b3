package com.gentoro.dirsearch.search.index;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.dirsearch.exception.StateException;
import com.gentoro.dirsearch.search.corpus.CorpusDocument;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EphemeralIndexTest {

  @Test
  @DisplayName("committed documents are searchable by content but not by path")
  void contentIsIndexedPathIsStoredOnly() throws Exception {
    try (EphemeralIndex index = new EphemeralIndex(16)) {
      index.add(new CorpusDocument("/docs/readme.txt", "Hello Lucene World"));
      index.add(new CorpusDocument("/docs/other.txt", "goodbye"));
      index.commit();

      IndexSearcher searcher = index.searcher();
      assertEquals(2, index.documentCount());
      assertEquals(1, searcher.count(new TermQuery(new Term(IndexSchema.FIELD_CONTENT, "hello"))));
      assertEquals(
          0, searcher.count(new TermQuery(new Term(IndexSchema.FIELD_PATH, "/docs/readme.txt"))));
    }
  }

  @Test
  @DisplayName("an index cannot be searched before it is committed")
  void searcherRequiresCommit() {
    try (EphemeralIndex index = new EphemeralIndex(16)) {
      index.add(new CorpusDocument("a.txt", "alpha"));
      assertFalse(index.isCommitted());
      assertThrows(StateException.class, index::searcher);
    }
  }

  @Test
  @DisplayName("a committed index is immutable")
  void commitIsTerminal() {
    try (EphemeralIndex index = new EphemeralIndex(16)) {
      index.add(new CorpusDocument("a.txt", "alpha"));
      index.commit();
      assertTrue(index.isCommitted());
      assertThrows(StateException.class, index::commit);
      assertThrows(StateException.class, () -> index.add(new CorpusDocument("b.txt", "beta")));
    }
  }

  @Test
  @DisplayName("closing is idempotent and ends the lifecycle")
  void closeIsIdempotent() {
    EphemeralIndex index = new EphemeralIndex(16);
    index.add(new CorpusDocument("a.txt", "alpha"));
    index.commit();
    index.searcher();

    index.close();
    index.close();

    assertThrows(StateException.class, index::searcher);
    assertThrows(StateException.class, () -> index.add(new CorpusDocument("b.txt", "beta")));
  }

  @Test
  @DisplayName("an index closed before commit is discarded")
  void closeBeforeCommit() {
    EphemeralIndex index = new EphemeralIndex(16);
    index.add(new CorpusDocument("a.txt", "alpha"));
    index.close();
    assertFalse(index.isCommitted());
    assertThrows(StateException.class, index::commit);
  }
}
