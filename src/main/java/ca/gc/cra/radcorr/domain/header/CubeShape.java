package ca.gc.cra.radcorr.domain.header;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Band-sequential cube geometry {@code (bands, lines, samples)}.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Performance:</strong> Size helpers use {@code long} arithmetic so multi-gigabyte cubes do not
 * overflow.</p>
 *
 * @param bands spectral band count; must be positive
 * @param lines rows per band; must be positive
 * @param samples columns per row; must be positive
 * @since 0.1.0
 */
public record CubeShape(int bands, int lines, int samples) {
  /** Bytes per float32 element. */
  public static final int BYTES_PER_SAMPLE = Float.BYTES;

  public CubeShape {
    if (bands <= 0 || lines <= 0 || samples <= 0) {
      throw new IllegalArgumentException(
          "cube dimensions must be positive (bands=" + bands + ", lines=" + lines + ", samples=" + samples + ")");
    }
  }

  /**
   * Returns the number of elements in one band.
   *
   * @return {@code lines * samples}
   */
  public long bandElements() {
    return (long) lines * samples;
  }

  /**
   * Returns the number of elements in the whole cube.
   *
   * @return {@code bands * lines * samples}
   */
  public long totalElements() {
    return bandElements() * bands;
  }

  /**
   * Returns the payload size in bytes.
   *
   * @return {@code bands * lines * samples * 4}
   */
  public long byteSize() {
    return totalElements() * BYTES_PER_SAMPLE;
  }

  /**
   * Lists the header keys whose values differ from another shape.
   *
   * @param other shape to compare against
   * @return differing keys among {@code samples}, {@code lines}, {@code bands}
   */
  public List<String> differingKeys(CubeShape other) {
    List<String> keys = new ArrayList<>(3);
    if (samples != other.samples) {
      keys.add(HeaderKeys.SAMPLES);
    }
    if (lines != other.lines) {
      keys.add(HeaderKeys.LINES);
    }
    if (bands != other.bands) {
      keys.add(HeaderKeys.BANDS);
    }
    return keys;
  }

  @Override
  public String toString() {
    return bands + " bands x " + lines + " lines x " + samples + " samples";
  }
}
