package ca.gc.cra.radcorr.application.port;

import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import java.io.IOException;

/**
 * <strong>What:</strong> Writable view of a pre-sized band-sequential float32 cube.
 * <p><strong>Why:</strong> Separates the correction loop from the storage backend while keeping durability
 * explicit at this boundary.</p>
 * <p><strong>Role:</strong> Driven port implemented by file-backed adapters.</p>
 * <p><strong>Flush-after-write contract:</strong> bytes passed to {@link #writeRows} are only guaranteed durable
 * once {@link #flush()} returns. The correction pipeline calls {@code flush()} after every chunk, so a crashed
 * run leaves only fully flushed rows behind. Buffered backends must hold this contract by draining and syncing
 * inside {@code flush()}.</p>
 * <p><strong>Thread-safety:</strong> Single writer; not thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface CubeWriter extends AutoCloseable {
  /**
   * Returns the layout of the cube being written.
   *
   * @return cube layout
   */
  CubeLayout layout();

  /**
   * Writes {@code lineCount} full rows of one band from {@code src}, row-major.
   *
   * @param band zero-based band
   * @param firstLine first row to write
   * @param lineCount number of rows; must be positive
   * @param src source holding at least {@code lineCount * samples} floats
   * @throws IOException if the bytes cannot be written
   * @throws IndexOutOfBoundsException if the range leaves the cube or {@code src} is too small
   */
  void writeRows(int band, int firstLine, int lineCount, float[] src) throws IOException;

  /**
   * Forces every byte written so far to durable storage.
   *
   * @throws IOException if the sync fails
   */
  void flush() throws IOException;

  /**
   * Flushes and releases the underlying file.
   *
   * @throws IOException if flushing or closing fails
   */
  @Override
  void close() throws IOException;
}
