package com.gentoro.dirsearch.search.corpus;

/**
 * Counters of one directory walk. Every regular file found ends up either indexed or skipped.
 *
 * @param found regular files encountered
 * @param indexed files turned into documents
 * @param skipped files rejected by classification, unreadable, or blank
 */
public record WalkStats(int found, int indexed, int skipped) {

  public static final WalkStats EMPTY = new WalkStats(0, 0, 0);

  public boolean nothingIndexed() {
    return found == 0 || indexed == 0;
  }

  WalkStats withIndexed() {
    return new WalkStats(found + 1, indexed + 1, skipped);
  }

  WalkStats withSkipped() {
    return new WalkStats(found + 1, indexed, skipped + 1);
  }
}
