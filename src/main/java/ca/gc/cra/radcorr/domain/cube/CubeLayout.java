package ca.gc.cra.radcorr.domain.cube;

import ca.gc.cra.radcorr.domain.header.CubeShape;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * <strong>What:</strong> Byte layout of a band-sequential float32 cube file.
 * <p><strong>Why:</strong> Centralizes offset arithmetic so readers and writers agree on where element
 * {@code (band, line, sample)} lives.</p>
 * <p><strong>Role:</strong> Domain value shared by cube storage adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param shape cube geometry
 * @param headerOffset bytes preceding the first element
 * @param byteOrder byte order of stored floats
 * @since 0.1.0
 */
public record CubeLayout(CubeShape shape, long headerOffset, ByteOrder byteOrder) {
  /** Largest byte count moved by one positional read or write. */
  public static final int MAX_CHUNK_BYTES = Integer.MAX_VALUE - 8;

  public CubeLayout {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(byteOrder, "byteOrder");
    if (headerOffset < 0) {
      throw new IllegalArgumentException("headerOffset must not be negative");
    }
  }

  /**
   * Layout of the paired binary file described by a header.
   *
   * @param header validated header
   * @return layout using the header's offset and byte order
   */
  public static CubeLayout of(HeaderModel header) {
    return new CubeLayout(header.shape(), header.headerOffset(), header.byteOrder());
  }

  /**
   * Layout used for every cube this tool writes: little-endian, no leading offset.
   *
   * @param shape cube geometry
   * @return output layout
   */
  public static CubeLayout output(CubeShape shape) {
    return new CubeLayout(shape, 0L, ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Returns how many whole rows of {@code shape} fit in one chunk of at most {@link #MAX_CHUNK_BYTES}.
   *
   * @param shape cube geometry
   * @return row count capped at {@code lines}; {@code 0} when a single row is already too large
   */
  public static int maxChunkRows(CubeShape shape) {
    long rowBytes = (long) shape.samples() * CubeShape.BYTES_PER_SAMPLE;
    return (int) Math.min(shape.lines(), MAX_CHUNK_BYTES / rowBytes);
  }

  /**
   * Returns the absolute byte offset of an element.
   *
   * @param band zero-based band
   * @param line zero-based line
   * @param sample zero-based sample
   * @return {@code headerOffset + 4 * (band*lines*samples + line*samples + sample)}
   * @throws IndexOutOfBoundsException if any index lies outside the shape
   */
  public long offsetOf(int band, int line, int sample) {
    Objects.checkIndex(band, shape.bands());
    Objects.checkIndex(line, shape.lines());
    Objects.checkIndex(sample, shape.samples());
    long element = band * shape.bandElements() + (long) line * shape.samples() + sample;
    return headerOffset + element * CubeShape.BYTES_PER_SAMPLE;
  }

  /**
   * Validates a row range within a band.
   *
   * @param band zero-based band
   * @param firstLine first line of the range
   * @param lineCount number of lines; must be positive
   * @throws IndexOutOfBoundsException if the range leaves the cube
   */
  public void checkRows(int band, int firstLine, int lineCount) {
    Objects.checkIndex(band, shape.bands());
    Objects.checkFromIndexSize(firstLine, lineCount, shape.lines());
    if (lineCount <= 0) {
      throw new IndexOutOfBoundsException("lineCount must be positive (was " + lineCount + ")");
    }
  }

  /**
   * Returns the smallest file size that holds every element.
   *
   * @return {@code headerOffset + bands*lines*samples*4}
   */
  public long requiredFileSize() {
    return headerOffset + shape.byteSize();
  }
}
