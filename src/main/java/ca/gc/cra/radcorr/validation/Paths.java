package ca.gc.cra.radcorr.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> File validation for cube and header paths supplied on the command line.
 * <p><strong>Why:</strong> Missing inputs and accidental overwrites should be rejected before a correction run
 * allocates a multi-gigabyte output.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the file system at call time only.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an existing readable regular file.
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @return real path of the file
   * @throws IllegalArgumentException if the path is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " must be an existing file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a file that is about to be created or replaced.
   *
   * <p>The returned path is built from the real path of the parent directory, and an existing file or symbolic
   * link is followed to its target, so callers can compare it against {@link #requireReadableFile} results.</p>
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @param allowOverwrite whether an existing file may be replaced
   * @return real path the output will be written to
   * @throws IllegalArgumentException if the parent directory is missing or unwritable, the path is a directory or
   *     a dangling link, or the file exists and {@code allowOverwrite} is {@code false}
   */
  public static Path requireWritableFile(String name, Path path, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory must exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    Path target = resolve(name, parent).resolve(normalized.getFileName());
    if (Files.isDirectory(target)) {
      throw new IllegalArgumentException(name + " must not be a directory: " + normalized);
    }
    if (Files.isSymbolicLink(target) && !Files.exists(target)) {
      throw new IllegalArgumentException(name + " is a dangling symbolic link: " + normalized);
    }
    if (Files.exists(target)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      target = resolve(name, target);
    }
    return target;
  }

  /**
   * Ensures an output does not refer to the same file as any input, including through hard links.
   *
   * @param name output parameter name for diagnostics
   * @param output output path from {@link #requireWritableFile}
   * @param inputs input paths from {@link #requireReadableFile}
   * @throws IllegalArgumentException if the output is one of the inputs
   */
  public static void requireDistinct(String name, Path output, Path... inputs) {
    for (Path input : inputs) {
      boolean same;
      try {
        same = output.equals(input) || (Files.exists(output) && Files.isSameFile(output, input));
      } catch (IOException ex) {
        throw new IllegalArgumentException(
            "unable to compare " + name + " " + output + " with " + input + ": " + ex.getMessage(), ex);
      }
      if (same) {
        throw new IllegalArgumentException(name + " " + output + " would overwrite input " + input);
      }
    }
  }

  private static Path resolve(String name, Path path) {
    try {
      return path.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " " + path + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }
}
