package com.gentoro.dirsearch.search.corpus;

import com.gentoro.dirsearch.exception.CancelledException;
import com.gentoro.dirsearch.exception.DirectoryException;
import com.gentoro.dirsearch.progress.NoOpProgressSink;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.PipelineStage;
import com.gentoro.dirsearch.search.classify.ClassificationVerdict;
import com.gentoro.dirsearch.search.classify.ContentClassifier;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Recursively collects the text files beneath a root directory.
 *
 * <p>The walk has no depth limit. Entries of a directory are visited in file name order, so two
 * walks over an unchanged tree produce the same corpus. Per-file problems never abort the walk:
 * they are counted as skipped. Symbolic links are followed; a directory reached twice through
 * links is visited once.
 */
public class CorpusWalker {
  private static final org.slf4j.Logger log =
      com.gentoro.dirsearch.logging.LoggingService.getLogger(CorpusWalker.class);

  private static final Comparator<Path> BY_NAME =
      Comparator.comparing(p -> p.getFileName() == null ? "" : p.getFileName().toString());

  private final ContentClassifier classifier;

  public CorpusWalker(ContentClassifier classifier) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  public Corpus walk(Path root) {
    return walk(root, NoOpProgressSink.INSTANCE);
  }

  /**
   * Walk {@code root} and return every accepted document with the walk counters.
   *
   * @throws DirectoryException when {@code root} is not a directory or cannot be listed
   * @throws CancelledException when the sink reports cancellation between two files
   */
  public Corpus walk(Path root, ProgressSink sink) {
    if (root == null || !Files.isDirectory(root)) {
      throw DirectoryException.notADirectory(String.valueOf(root));
    }
    log.debug("Target directory for search: {}", root);

    List<CorpusDocument> documents = new ArrayList<>();
    WalkStats stats = WalkStats.EMPTY;
    Set<Path> visited = new HashSet<>();
    Deque<Iterator<Path>> pending = new ArrayDeque<>();

    visited.add(identity(root));
    try {
      pending.push(list(root).iterator());
    } catch (IOException | UncheckedIOException | SecurityException e) {
      throw new DirectoryException(
          root.toString(), "Directory read error '%s': %s".formatted(root, e.getMessage()));
    }

    while (!pending.isEmpty()) {
      Iterator<Path> entries = pending.peek();
      if (!entries.hasNext()) {
        pending.pop();
        continue;
      }
      Path entry = entries.next();

      if (Files.isDirectory(entry)) {
        if (!visited.add(identity(entry))) {
          log.debug("Skipped (already visited directory): {}", entry);
          continue;
        }
        try {
          pending.push(list(entry).iterator());
        } catch (IOException | UncheckedIOException | SecurityException e) {
          log.warn("Skipped (directory read error): {} - {}", entry, e.getMessage());
        }
      } else if (Files.isRegularFile(entry)) {
        if (sink.isCancelled()) {
          throw new CancelledException(PipelineStage.WALKING);
        }
        stats = visitFile(entry, documents, stats);
        sink.step(
            PipelineStage.WALKING.id(),
            stats.found(),
            entry.toString(),
            Map.of("indexed", stats.indexed(), "skipped", stats.skipped()));
      }
    }

    log.info(
        "Processing complete: Found files={}, Indexed={}, Skipped={}",
        stats.found(),
        stats.indexed(),
        stats.skipped());
    return new Corpus(documents, stats);
  }

  private WalkStats visitFile(Path file, List<CorpusDocument> documents, WalkStats stats) {
    ClassificationVerdict verdict = classifier.classify(file);
    if (verdict.isBinary()) {
      log.trace("Skipped (non-text, {}): {}", verdict.rule(), file);
      return stats.withSkipped();
    }

    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException | SecurityException e) {
      log.debug("Skipped (read error): {} - {}", file, e.toString());
      return stats.withSkipped();
    }

    if (content.isBlank()) {
      log.trace("Skipped (empty file): {}", file);
      return stats.withSkipped();
    }

    documents.add(new CorpusDocument(file.toString(), content));
    log.trace("Indexed: {}", file);
    return stats.withIndexed();
  }

  private static List<Path> list(Path dir) throws IOException {
    try (Stream<Path> children = Files.list(dir)) {
      return children.sorted(BY_NAME).toList();
    }
  }

  private static Path identity(Path dir) {
    try {
      return dir.toRealPath();
    } catch (IOException | SecurityException e) {
      return dir.toAbsolutePath().normalize();
    }
  }
}
