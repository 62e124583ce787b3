/**
 * Disposable full-text search over the text files beneath a directory.
 *
 * <h2>Key components</h2>
 *
 * <ul>
 *   <li>{@link com.gentoro.dirsearch.search.classify.ContentClassifier}: text/binary decision per
 *       file from its extension and leading bytes.
 *   <li>{@link com.gentoro.dirsearch.search.corpus.CorpusWalker}: recursive walk producing a
 *       {@link com.gentoro.dirsearch.search.corpus.Corpus} and its found/indexed/skipped counters.
 *   <li>{@link com.gentoro.dirsearch.search.index.IndexBuilder}: fills an in-memory Lucene index
 *       ({@link com.gentoro.dirsearch.search.index.EphemeralIndex}) with one document per file.
 *   <li>{@link com.gentoro.dirsearch.search.query.QueryEngine}: classic Lucene query syntax over the
 *       content field, top hits by BM25.
 *   <li>{@link com.gentoro.dirsearch.search.SearchPipeline}: runs the stages for one request and
 *       renders the report.
 * </ul>
 *
 * <p>Nothing survives a request: the corpus and the index are created and released inside {@link
 * com.gentoro.dirsearch.search.SearchPipeline#search(SearchRequest,
 * com.gentoro.dirsearch.progress.ProgressSink)}.
 */
package com.gentoro.dirsearch.search;
