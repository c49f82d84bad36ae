package ca.gc.cra.radcorr.infrastructure.cube;

import ca.gc.cra.radcorr.application.port.CubeWriter;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cube writer that maps each written row range and forces the mapped regions on {@link #flush()}.
 *
 * <p>Regions are released to the garbage collector once forced; at most one chunk stays mapped between
 * flushes when the caller follows the flush-after-write contract.</p>
 */
final class MappedCubeWriter implements CubeWriter {
  private final CubeLayout layout;
  private final FileChannel channel;
  private final List<MappedByteBuffer> pending = new ArrayList<>(1);
  private boolean closed;

  MappedCubeWriter(FileChannel channel, CubeLayout layout) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.layout = Objects.requireNonNull(layout, "layout");
  }

  @Override
  public CubeLayout layout() {
    return layout;
  }

  @Override
  public void writeRows(int band, int firstLine, int lineCount, float[] src) throws IOException {
    layout.checkRows(band, firstLine, lineCount);
    int elements = ChunkBuffers.rowElements(layout, lineCount, src.length);
    MappedByteBuffer region = channel.map(
        FileChannel.MapMode.READ_WRITE,
        layout.offsetOf(band, firstLine, 0),
        (long) elements * CubeShape.BYTES_PER_SAMPLE);
    region.order(layout.byteOrder());
    region.asFloatBuffer().put(src, 0, elements);
    pending.add(region);
  }

  @Override
  public void flush() {
    for (MappedByteBuffer region : pending) {
      region.force();
    }
    pending.clear();
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try (FileChannel ignored = channel) {
      flush();
    }
  }
}
