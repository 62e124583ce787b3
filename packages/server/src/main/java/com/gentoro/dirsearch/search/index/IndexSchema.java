package com.gentoro.dirsearch.search.index;

import com.gentoro.dirsearch.search.corpus.CorpusDocument;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;

/**
 * Two-field document layout: {@code path} is stored verbatim and not searchable, {@code content}
 * is analyzed by {@link StandardAnalyzer} (word boundaries, lowercasing, no stop words) and stored.
 */
public final class IndexSchema {
  public static final String FIELD_PATH = "path";
  public static final String FIELD_CONTENT = "content";

  private IndexSchema() {}

  public static Analyzer newAnalyzer() {
    return new StandardAnalyzer();
  }

  public static Document toDocument(CorpusDocument source) {
    Document doc = new Document();
    doc.add(new StoredField(FIELD_PATH, source.path()));
    doc.add(new TextField(FIELD_CONTENT, source.content(), Field.Store.YES));
    return doc;
  }
}
