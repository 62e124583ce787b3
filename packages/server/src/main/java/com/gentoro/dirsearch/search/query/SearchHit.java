package com.gentoro.dirsearch.search.query;

/**
 * A ranked reference to one indexed document.
 *
 * @param path stored path of the document, or {@link QueryEngine#UNKNOWN_PATH}
 * @param score BM25 relevance score; higher is better
 */
public record SearchHit(String path, float score) {}
