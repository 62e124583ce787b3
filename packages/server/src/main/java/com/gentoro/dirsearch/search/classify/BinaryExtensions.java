package com.gentoro.dirsearch.search.classify;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Extensions that are excluded from indexing without looking at the file content. */
public final class BinaryExtensions {

  /** Denylist in reporting order. */
  public static final List<String> DENYLIST =
      List.of(
          "exe", "dll", "so", "dylib", "bin", "obj", "o", "a", "lib", "png", "jpg", "jpeg", "gif",
          "bmp", "tiff", "webp", "ico", "mp3", "mp4", "wav", "ogg", "flac", "avi", "mov", "mkv",
          "zip", "gz", "tar", "7z", "rar", "jar", "war", "pdf", "doc", "docx", "xls", "xlsx", "ppt",
          "pptx", "db", "sqlite", "mdb", "iso", "dmg", "class");

  private static final Set<String> LOOKUP = Set.copyOf(DENYLIST);

  private BinaryExtensions() {}

  public static boolean isDenied(Path path) {
    String extension = extensionOf(path);
    return extension != null && LOOKUP.contains(extension.toLowerCase(Locale.ROOT));
  }

  /**
   * Text after the last dot of the file name, or null when there is none. A leading dot alone
   * (".bashrc") does not start an extension.
   */
  static String extensionOf(Path path) {
    if (path == null || path.getFileName() == null) return null;
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) return null;
    return name.substring(dot + 1);
  }
}
