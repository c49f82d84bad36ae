package ca.gc.cra.radcorr.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Storage backend used to read and write cube files.
 * <p><strong>Why:</strong> Lets operators pick between positional channel I/O and memory mapping without code
 * changes; both produce byte-identical output.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum CubeStorageMode {
  /** Positional {@link java.nio.channels.FileChannel} reads and writes, synced with {@code force}. */
  CHANNEL,
  /** Per-chunk {@link java.nio.MappedByteBuffer} regions, synced with {@code MappedByteBuffer.force}. */
  MMAP;

  /**
   * Parses a case-insensitive storage name.
   *
   * @param raw value such as {@code channel} or {@code mmap}; blank yields {@code fallback}
   * @param fallback value used when {@code raw} is blank
   * @return parsed mode
   * @throws IllegalArgumentException when the value is not recognized
   */
  public static CubeStorageMode parse(String raw, CubeStorageMode fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "channel" -> CHANNEL;
      case "mmap" -> MMAP;
      default -> throw new IllegalArgumentException("storage must be 'channel' or 'mmap' (was '" + raw + "')");
    };
  }
}
