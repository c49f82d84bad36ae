package ca.gc.cra.radcorr.application.port;

import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import java.io.IOException;

/**
 * <strong>What:</strong> Read-only, random-access view of a band-sequential float32 cube.
 * <p><strong>Why:</strong> Lets the correction pipeline stream row chunks, and display tooling pull whole bands or
 * single-pixel spectra, without loading the cube into memory.</p>
 * <p><strong>Role:</strong> Driven port implemented by file-backed adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations are single-threaded unless documented.</p>
 * <p><strong>Performance:</strong> Reads touch only the requested byte ranges.</p>
 *
 * @since 0.1.0
 */
public interface CubeReader extends AutoCloseable {
  /**
   * Returns the layout this reader interprets.
   *
   * @return cube layout
   */
  CubeLayout layout();

  /**
   * Reads {@code lineCount} full rows of one band into {@code dst}, row-major.
   *
   * @param band zero-based band
   * @param firstLine first row to read
   * @param lineCount number of rows; must be positive
   * @param dst destination holding at least {@code lineCount * samples} floats
   * @throws IOException if the bytes cannot be read
   * @throws IndexOutOfBoundsException if the range leaves the cube or {@code dst} is too small
   */
  void readRows(int band, int firstLine, int lineCount, float[] dst) throws IOException;

  /**
   * Reads one full band.
   *
   * @param band zero-based band
   * @return {@code lines * samples} floats, row-major
   * @throws IOException if the bytes cannot be read
   */
  default float[] readBand(int band) throws IOException {
    long elements = layout().shape().bandElements();
    if (elements > Integer.MAX_VALUE - 8) {
      throw new IOException("band " + band + " holds " + elements + " samples; read it in row chunks");
    }
    float[] dst = new float[(int) elements];
    readRows(band, 0, layout().shape().lines(), dst);
    return dst;
  }

  /**
   * Reads the spectrum of one pixel across all bands.
   *
   * @param line zero-based row
   * @param sample zero-based column
   * @return one float per band
   * @throws IOException if the bytes cannot be read
   */
  float[] readSpectrum(int line, int sample) throws IOException;

  @Override
  void close() throws IOException;
}
