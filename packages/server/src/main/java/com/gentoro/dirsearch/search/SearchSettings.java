package com.gentoro.dirsearch.search;

import com.gentoro.dirsearch.exception.ConfigException;
import com.gentoro.dirsearch.search.classify.ContentClassifier;
import com.gentoro.dirsearch.search.index.IndexBuilder;
import com.gentoro.dirsearch.search.query.QueryEngine;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.lucene.queryparser.classic.QueryParser;

/**
 * Tunables of the search pipeline. The pipeline itself never reads configuration; the application
 * builds this object once at startup.
 *
 * @param topK maximum number of hits returned
 * @param sampleBytes leading bytes inspected by the content classifier
 * @param ramBufferMb index writer RAM buffer before a flush
 * @param defaultOperator operator joining terms without an explicit one
 * @param timeout per-request time budget; zero disables it
 */
public record SearchSettings(
    int topK,
    int sampleBytes,
    double ramBufferMb,
    QueryParser.Operator defaultOperator,
    Duration timeout) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  public SearchSettings {
    Objects.requireNonNull(defaultOperator, "defaultOperator");
    Objects.requireNonNull(timeout, "timeout");
    if (topK <= 0) throw new ConfigException("search.top-k must be positive, got " + topK);
    if (sampleBytes <= 0) {
      throw new ConfigException("search.sample-bytes must be positive, got " + sampleBytes);
    }
    if (!(ramBufferMb > 0)) {
      throw new ConfigException("search.ram-buffer-mb must be positive, got " + ramBufferMb);
    }
    if (timeout.isNegative()) {
      throw new ConfigException("search.timeout must not be negative, got " + timeout);
    }
  }

  public static SearchSettings defaults() {
    return new SearchSettings(
        QueryEngine.DEFAULT_TOP_K,
        ContentClassifier.DEFAULT_SAMPLE_BYTES,
        IndexBuilder.DEFAULT_RAM_BUFFER_MB,
        QueryParser.Operator.OR,
        DEFAULT_TIMEOUT);
  }

  /**
   * Read {@code search.*} keys, falling back to {@link #defaults()} for absent ones.
   *
   * <pre>
   * search:
   *   top-k: 10
   *   sample-bytes: 8192
   *   ram-buffer-mb: 50
   *   timeout: "PT60S"
   *   query:
   *     default-operator: OR
   * </pre>
   */
  public static SearchSettings fromConfiguration(Configuration cfg) {
    SearchSettings d = defaults();
    if (cfg == null) return d;
    try {
      return new SearchSettings(
          cfg.getInt("search.top-k", d.topK()),
          cfg.getInt("search.sample-bytes", d.sampleBytes()),
          cfg.getDouble("search.ram-buffer-mb", d.ramBufferMb()),
          parseOperator(cfg.getString("search.query.default-operator", d.defaultOperator().name())),
          parseTimeout(cfg.getString("search.timeout", null), d.timeout()));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("Invalid search configuration: " + e.getMessage(), e);
    }
  }

  static QueryParser.Operator parseOperator(String value) {
    String v = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    return switch (v) {
      case "AND" -> QueryParser.Operator.AND;
      case "OR", "" -> QueryParser.Operator.OR;
      default -> throw new ConfigException(
          "search.query.default-operator must be AND or OR, got '" + value + "'");
    };
  }

  static Duration parseTimeout(String value, Duration fallback) {
    if (value == null || value.isBlank()) return fallback;
    String v = value.trim();
    try {
      return Duration.parse(v);
    } catch (DateTimeParseException e) {
      try {
        return Duration.ofSeconds(Long.parseLong(v));
      } catch (NumberFormatException nfe) {
        throw new ConfigException(
            "search.timeout must be an ISO-8601 duration or seconds, got '" + value + "'", e);
      }
    }
  }
}
