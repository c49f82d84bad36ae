package ca.gc.cra.radcorr.infrastructure.cube;

import ca.gc.cra.radcorr.application.port.CubeReader;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Read-only cube reader using positional {@link FileChannel} reads.
 *
 * <p>Honors the header offset and byte order of the layout. Not thread-safe: the scratch buffer is reused
 * between calls.</p>
 */
public final class FileChannelCubeReader implements CubeReader {
  private final Path path;
  private final CubeLayout layout;
  private final FileChannel channel;
  private ByteBuffer scratch;

  FileChannelCubeReader(Path path, CubeLayout layout) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.layout = Objects.requireNonNull(layout, "layout");
    this.channel = FileChannel.open(path, StandardOpenOption.READ);
  }

  @Override
  public CubeLayout layout() {
    return layout;
  }

  @Override
  public void readRows(int band, int firstLine, int lineCount, float[] dst) throws IOException {
    layout.checkRows(band, firstLine, lineCount);
    int elements = ChunkBuffers.rowElements(layout, lineCount, dst.length);
    scratch = ChunkBuffers.ensureCapacity(scratch, elements * CubeShape.BYTES_PER_SAMPLE, layout);
    ChunkBuffers.readFully(channel, scratch, layout.offsetOf(band, firstLine, 0));
    scratch.flip();
    scratch.asFloatBuffer().get(dst, 0, elements);
  }

  @Override
  public float[] readSpectrum(int line, int sample) throws IOException {
    CubeShape shape = layout.shape();
    float[] spectrum = new float[shape.bands()];
    ByteBuffer cell = ByteBuffer.allocate(CubeShape.BYTES_PER_SAMPLE).order(layout.byteOrder());
    for (int band = 0; band < shape.bands(); band++) {
      cell.clear();
      ChunkBuffers.readFully(channel, cell, layout.offsetOf(band, line, sample));
      spectrum[band] = cell.getFloat(0);
    }
    return spectrum;
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  @Override
  public String toString() {
    return "FileChannelCubeReader[" + path + ", " + layout.shape() + "]";
  }
}
