package com.gentoro.dirsearch.search.classify;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a file looks like text worth indexing.
 *
 * <p>The decision is an ordered chain of {@link ClassificationRule}s; the first rule that returns
 * a verdict wins:
 *
 * <ol>
 *   <li>extension in {@link BinaryExtensions#DENYLIST}: binary
 *   <li>empty or unreadable sample: binary
 *   <li>any NUL byte: binary
 *   <li>more than 30% control bytes (other than TAB, LF, CR): binary
 *   <li>valid UTF-8, or at least 80% of bytes in the ASCII range: text; binary otherwise
 * </ol>
 *
 * <p>This is a heuristic. ASCII-heavy binary payloads such as some key or certificate files pass
 * the last rule and are indexed as text.
 */
public class ContentClassifier {
  public static final int DEFAULT_SAMPLE_BYTES = 8192;

  static final double MAX_CONTROL_RATIO = 0.3;
  static final double MIN_ASCII_RATIO = 0.8;

  private static final List<ClassificationRule> RULES =
      List.of(
          ContentClassifier::binaryExtension,
          ContentClassifier::emptyOrUnreadable,
          ContentClassifier::nulByte,
          ContentClassifier::controlRatio,
          ContentClassifier::textEncoding);

  private final int sampleBytes;

  public ContentClassifier() {
    this(DEFAULT_SAMPLE_BYTES);
  }

  public ContentClassifier(int sampleBytes) {
    if (sampleBytes <= 0) {
      throw new IllegalArgumentException("sampleBytes must be positive: " + sampleBytes);
    }
    this.sampleBytes = sampleBytes;
  }

  /** Classify a file on disk, reading only its leading bytes. */
  public ClassificationVerdict classify(Path path) {
    if (BinaryExtensions.isDenied(path)) {
      return ClassificationVerdict.binary(ClassificationVerdict.BINARY_EXTENSION);
    }
    ContentSample sample;
    try {
      sample = ContentSample.read(path, sampleBytes);
    } catch (IOException | SecurityException e) {
      sample = ContentSample.unreadable(path);
    }
    return classify(sample);
  }

  /** Classify already sampled bytes. {@code path} only feeds the extension rule. */
  public ClassificationVerdict classify(Path path, byte[] sampledBytes) {
    byte[] bytes = sampledBytes == null ? new byte[0] : sampledBytes;
    if (bytes.length > sampleBytes) {
      byte[] head = new byte[sampleBytes];
      System.arraycopy(bytes, 0, head, 0, sampleBytes);
      return classify(new ContentSample(path, head, true, true));
    }
    return classify(ContentSample.of(path, bytes));
  }

  public ClassificationVerdict classify(ContentSample sample) {
    for (ClassificationRule rule : RULES) {
      Optional<ClassificationVerdict> verdict = rule.evaluate(sample);
      if (verdict.isPresent()) return verdict.get();
    }
    // textEncoding always answers; kept for completeness of the loop contract
    return ClassificationVerdict.binary(ClassificationVerdict.ENCODING);
  }

  static Optional<ClassificationVerdict> binaryExtension(ContentSample sample) {
    return BinaryExtensions.isDenied(sample.path())
        ? Optional.of(ClassificationVerdict.binary(ClassificationVerdict.BINARY_EXTENSION))
        : Optional.empty();
  }

  static Optional<ClassificationVerdict> emptyOrUnreadable(ContentSample sample) {
    if (!sample.readable()) {
      return Optional.of(ClassificationVerdict.binary(ClassificationVerdict.UNREADABLE));
    }
    if (sample.size() == 0) {
      return Optional.of(ClassificationVerdict.binary(ClassificationVerdict.EMPTY));
    }
    return Optional.empty();
  }

  static Optional<ClassificationVerdict> nulByte(ContentSample sample) {
    for (byte b : sample.bytes()) {
      if (b == 0) return Optional.of(ClassificationVerdict.binary(ClassificationVerdict.NUL_BYTE));
    }
    return Optional.empty();
  }

  static Optional<ClassificationVerdict> controlRatio(ContentSample sample) {
    return controlRatio(sample.bytes()) > MAX_CONTROL_RATIO
        ? Optional.of(ClassificationVerdict.binary(ClassificationVerdict.CONTROL_RATIO))
        : Optional.empty();
  }

  static Optional<ClassificationVerdict> textEncoding(ContentSample sample) {
    if (isValidUtf8(sample.bytes(), sample.truncated())) {
      return Optional.of(ClassificationVerdict.text(ClassificationVerdict.ENCODING));
    }
    if (asciiRatio(sample.bytes()) >= MIN_ASCII_RATIO) {
      return Optional.of(ClassificationVerdict.text(ClassificationVerdict.ASCII_RATIO));
    }
    return Optional.of(ClassificationVerdict.binary(ClassificationVerdict.ENCODING));
  }

  static double controlRatio(byte[] bytes) {
    if (bytes.length == 0) return 0.0;
    int control = 0;
    for (byte b : bytes) {
      int v = b & 0xFF;
      if (v < 0x20 && v != '\t' && v != '\n' && v != '\r') control++;
    }
    return (double) control / bytes.length;
  }

  static double asciiRatio(byte[] bytes) {
    if (bytes.length == 0) return 0.0;
    int ascii = 0;
    for (byte b : bytes) {
      if ((b & 0xFF) <= 0x7F) ascii++;
    }
    return (double) ascii / bytes.length;
  }

  /**
   * Strict UTF-8 check. When the sample was cut from a longer file, an incomplete sequence at the
   * very end is accepted.
   */
  static boolean isValidUtf8(byte[] bytes, boolean truncated) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    CharBuffer out = CharBuffer.allocate(bytes.length + 1);
    CoderResult result = decoder.decode(ByteBuffer.wrap(bytes), out, !truncated);
    if (result.isError()) return false;
    return truncated || !decoder.flush(out).isError();
  }
}
