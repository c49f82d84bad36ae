package ca.gc.cra.radcorr.util;

import java.nio.file.Path;
import java.util.Optional;

/** Utility helpers for deriving sibling file names. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Appends {@code suffix} to the file name, e.g. {@code cube.dat} to {@code cube.dat.hdr}.
   *
   * @param path source path with a file name
   * @param suffix text to append
   * @return sibling path
   */
  public static Path appendToFileName(Path path, String suffix) {
    String name = requireFileName(path);
    return path.resolveSibling(name + suffix);
  }

  /**
   * Inserts {@code marker} before the last extension, or appends it when there is none.
   * {@code cube.dat} becomes {@code cube_radcorr.dat}.
   *
   * @param path source path with a file name
   * @param marker text to insert
   * @return sibling path
   */
  public static Path insertBeforeExtension(Path path, String marker) {
    String name = requireFileName(path);
    int dot = name.lastIndexOf('.');
    String renamed = dot <= 0 ? name + marker : name.substring(0, dot) + marker + name.substring(dot);
    return path.resolveSibling(renamed);
  }

  private static String requireFileName(Path path) {
    return fileName(path).orElseThrow(() -> new IllegalArgumentException("path has no file name: " + path));
  }
}
