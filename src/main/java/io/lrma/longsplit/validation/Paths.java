package io.lrma.longsplit.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File checks applied before the pipeline opens its input and output.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param name logical name for diagnostics
   * @param path candidate path
   * @return normalized absolute path
   * @throws IllegalArgumentException if the file is missing, not regular, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures {@code path} can be created as an output file.
   *
   * @param name logical name for diagnostics
   * @param path candidate path
   * @param extensions accepted lower-case extensions including the dot (e.g. {@code .bam}); empty accepts any
   * @param allowOverwrite whether an existing file may be replaced
   * @return normalized absolute path
   * @throws IllegalArgumentException if the extension is not accepted, the parent directory is missing or
   *     unwritable, the path is a directory, or the file exists without {@code allowOverwrite}
   */
  public static Path validateOutputFile(String name, Path path, Set<String> extensions, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (!extensions.isEmpty() && !extensions.contains(extension(normalized))) {
      throw new IllegalArgumentException(
          name + " must end with one of " + extensions + " (was " + normalized.getFileName() + ")");
    }
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Returns the lower-case extension of {@code path}, including the dot, or an empty string.
   *
   * @param path file path
   * @return extension such as {@code .bam}
   */
  public static String extension(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return "";
    }
    String raw = fileName.toString();
    int dot = raw.lastIndexOf('.');
    return dot <= 0 ? "" : raw.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
