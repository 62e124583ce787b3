package com.gentoro.dirsearch.search.corpus;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.dirsearch.exception.CancelledException;
import com.gentoro.dirsearch.exception.DirSearchErrorCode;
import com.gentoro.dirsearch.exception.DirectoryException;
import com.gentoro.dirsearch.progress.ProgressSink;
import com.gentoro.dirsearch.search.PipelineStage;
import com.gentoro.dirsearch.search.classify.ContentClassifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusWalkerTest {

  private final CorpusWalker walker = new CorpusWalker(new ContentClassifier());

  @TempDir Path root;

  @Test
  @DisplayName("every regular file is counted as either indexed or skipped")
  void countersAddUp() throws IOException {
    Files.writeString(root.resolve("a.txt"), "hello world");
    Files.write(root.resolve("b.png"), new byte[] {1, 2, 3});
    Files.writeString(root.resolve("c.txt"), "   \n\t ");
    Files.createFile(root.resolve("d.txt"));
    Files.write(root.resolve("e.bin.txt"), new byte[] {'a', 0, 'b'});

    Corpus corpus = walker.walk(root);

    assertEquals(new WalkStats(5, 1, 4), corpus.stats());
    assertEquals(1, corpus.size());
    assertEquals(root.resolve("a.txt").toString(), corpus.documents().get(0).path());
    assertEquals("hello world", corpus.documents().get(0).content());
  }

  @Test
  @DisplayName("nested directories are walked without a depth limit")
  void walksNestedDirectories() throws IOException {
    Path deep = Files.createDirectories(root.resolve("one/two/three/four"));
    Files.writeString(deep.resolve("deep.md"), "buried treasure");
    Files.writeString(root.resolve("top.txt"), "surface");

    Corpus corpus = walker.walk(root);

    assertEquals(2, corpus.stats().indexed());
    assertTrue(
        corpus.documents().stream().anyMatch(d -> d.path().equals(deep.resolve("deep.md").toString())));
  }

  @Test
  @DisplayName("directory entries are visited in file name order")
  void deterministicOrder() throws IOException {
    Files.writeString(root.resolve("charlie.txt"), "c");
    Files.writeString(root.resolve("alpha.txt"), "a");
    Path sub = Files.createDirectory(root.resolve("bravo"));
    Files.writeString(sub.resolve("inner.txt"), "b");

    List<String> first = walker.walk(root).documents().stream().map(CorpusDocument::path).toList();
    List<String> second = walker.walk(root).documents().stream().map(CorpusDocument::path).toList();

    assertEquals(
        List.of(
            root.resolve("alpha.txt").toString(),
            sub.resolve("inner.txt").toString(),
            root.resolve("charlie.txt").toString()),
        first);
    assertEquals(first, second);
  }

  @Test
  @DisplayName("text-looking files that are not valid UTF-8 are skipped when read")
  void invalidUtf8IsSkippedOnRead() throws IOException {
    Files.write(
        root.resolve("latin1.txt"), "café au lait, crème brûlée".getBytes(StandardCharsets.ISO_8859_1));

    Corpus corpus = walker.walk(root);

    assertEquals(new WalkStats(1, 0, 1), corpus.stats());
    assertTrue(corpus.stats().nothingIndexed());
  }

  @Test
  @DisplayName("an empty directory yields an empty corpus")
  void emptyDirectory() {
    Corpus corpus = walker.walk(root);
    assertTrue(corpus.isEmpty());
    assertEquals(WalkStats.EMPTY, corpus.stats());
    assertTrue(corpus.stats().nothingIndexed());
  }

  @Test
  @DisplayName("a root that is a file or missing is rejected")
  void rejectsNonDirectoryRoot() throws IOException {
    Path file = Files.writeString(root.resolve("file.txt"), "text");
    Path missing = root.resolve("missing");

    DirectoryException notDir = assertThrows(DirectoryException.class, () -> walker.walk(file));
    assertEquals(file.toString(), notDir.getDirectory());
    assertEquals(DirSearchErrorCode.NOT_FOUND, notDir.getCode());
    assertTrue(notDir.getMessage().contains("is not a directory"));

    assertThrows(DirectoryException.class, () -> walker.walk(missing));
    assertThrows(DirectoryException.class, () -> walker.walk(null));
  }

  @Test
  @DisplayName("a directory reachable through a link cycle is visited once")
  void followsLinksWithoutLooping() throws IOException {
    Path dir = Files.createDirectory(root.resolve("dir"));
    Files.writeString(dir.resolve("note.txt"), "loop safe");
    try {
      Files.createSymbolicLink(dir.resolve("back"), root);
    } catch (UnsupportedOperationException | IOException e) {
      assumeTrue(false, "symbolic links not supported: " + e.getMessage());
    }

    Corpus corpus = walker.walk(root);

    assertEquals(1, corpus.stats().found());
    assertEquals(1, corpus.stats().indexed());
  }

  @Test
  @DisplayName("progress is reported per file with running counters")
  void reportsProgressPerFile() throws IOException {
    Files.writeString(root.resolve("a.txt"), "alpha");
    Files.writeString(root.resolve("b.txt"), "beta");
    ProgressSink sink = mock(ProgressSink.class);

    walker.walk(root, sink);

    verify(sink).step(eq("walk"), eq(1L), eq(root.resolve("a.txt").toString()), anyMap());
    verify(sink).step(eq("walk"), eq(2L), eq(root.resolve("b.txt").toString()), anyMap());
  }

  @Test
  @DisplayName("cancellation is observed between files")
  void stopsWhenCancelled() throws IOException {
    Files.writeString(root.resolve("a.txt"), "alpha");
    Files.writeString(root.resolve("b.txt"), "beta");
    ProgressSink sink = mock(ProgressSink.class);
    when(sink.isCancelled()).thenReturn(false, true);

    CancelledException ex = assertThrows(CancelledException.class, () -> walker.walk(root, sink));

    assertEquals(PipelineStage.WALKING, ex.getStage());
    verify(sink, times(1)).step(anyString(), anyLong(), anyString(), anyMap());
  }
}
