package com.gentoro.dirsearch.search.classify;

/**
 * Outcome of classifying one candidate file. Lives only for the duration of a walk.
 *
 * @param text true when the file is accepted for indexing
 * @param rule name of the rule that decided the verdict
 */
public record ClassificationVerdict(boolean text, String rule) {

  public static final String BINARY_EXTENSION = "binary-extension";
  public static final String UNREADABLE = "unreadable";
  public static final String EMPTY = "empty";
  public static final String NUL_BYTE = "nul-byte";
  public static final String CONTROL_RATIO = "control-ratio";
  public static final String ENCODING = "encoding";
  public static final String ASCII_RATIO = "ascii-ratio";

  public static ClassificationVerdict text(String rule) {
    return new ClassificationVerdict(true, rule);
  }

  public static ClassificationVerdict binary(String rule) {
    return new ClassificationVerdict(false, rule);
  }

  public boolean isBinary() {
    return !text;
  }
}
