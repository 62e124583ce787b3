package com.gentoro.dirsearch.search.index;

import com.gentoro.dirsearch.exception.IndexException;
import com.gentoro.dirsearch.exception.StateException;
import com.gentoro.dirsearch.search.corpus.CorpusDocument;
import java.io.IOException;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.util.IOUtils;

/**
 * In-memory Lucene index owned by a single search request.
 *
 * <p>Lifecycle: {@link #add} any number of documents, {@link #commit()} exactly once, then {@link
 * #searcher()}. {@link #close()} releases the writer, reader and memory on every exit path; an
 * index closed before commit is rolled back and never becomes readable.
 */
public class EphemeralIndex implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(EphemeralIndex.class);

  private final ByteBuffersDirectory directory;
  private final Analyzer analyzer;
  private IndexWriter writer;
  private DirectoryReader reader;
  private int documentCount;
  private boolean committed;
  private boolean closed;

  EphemeralIndex(double ramBufferMb) {
    this.directory = new ByteBuffersDirectory();
    this.analyzer = IndexSchema.newAnalyzer();
    try {
      IndexWriterConfig config = new IndexWriterConfig(analyzer);
      config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
      config.setRAMBufferSizeMB(ramBufferMb);
      config.setCommitOnClose(false);
      this.writer = new IndexWriter(directory, config);
    } catch (IOException | IllegalArgumentException | OutOfMemoryError e) {
      closeQuietly();
      throw new IndexException(IndexException.Kind.WRITER_INIT, String.valueOf(e.getMessage()), e);
    }
  }

  public void add(CorpusDocument document) {
    ensureWritable();
    try {
      writer.addDocument(IndexSchema.toDocument(document));
      documentCount++;
    } catch (IOException | IllegalArgumentException | OutOfMemoryError e) {
      throw new IndexException(
          IndexException.Kind.ADD_DOCUMENT, document.path() + " - " + e.getMessage(), e);
    }
  }

  /** Finalize all additions and make them visible to readers. */
  public void commit() {
    ensureWritable();
    try {
      writer.commit();
      writer.close();
      writer = null;
      committed = true;
      log.debug("Committed in-memory index with {} documents", documentCount);
    } catch (IOException | OutOfMemoryError e) {
      throw new IndexException(IndexException.Kind.COMMIT, String.valueOf(e.getMessage()), e);
    }
  }

  /** Searcher over the committed snapshot; the reader is opened on first use. */
  public IndexSearcher searcher() {
    if (closed) throw new StateException("Index already closed");
    if (!committed) throw new StateException("Index must be committed before it can be searched");
    if (reader == null) {
      try {
        reader = DirectoryReader.open(directory);
      } catch (IOException e) {
        throw new IndexException(IndexException.Kind.READER_OPEN, e.getMessage(), e);
      }
    }
    return new IndexSearcher(reader);
  }

  public Analyzer analyzer() {
    return analyzer;
  }

  public int documentCount() {
    return documentCount;
  }

  public boolean isCommitted() {
    return committed;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    closeQuietly();
  }

  private void ensureWritable() {
    if (closed) throw new StateException("Index already closed");
    if (committed) throw new StateException("Index already committed; it is immutable now");
  }

  private void closeQuietly() {
    if (writer != null) {
      try {
        writer.rollback();
      } catch (IOException | RuntimeException e) {
        log.debug("Failed to roll back index writer", e);
      } finally {
        writer = null;
      }
    }
    if (reader != null) {
      try {
        reader.close();
      } catch (IOException e) {
        log.debug("Failed to close index reader", e);
      } finally {
        reader = null;
      }
    }
    IOUtils.closeWhileHandlingException(analyzer, directory);
  }
}
