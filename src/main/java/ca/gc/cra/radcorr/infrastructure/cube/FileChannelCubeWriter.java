package ca.gc.cra.radcorr.infrastructure.cube;

import ca.gc.cra.radcorr.application.port.CubeWriter;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Objects;

/**
 * Cube writer issuing positional {@link FileChannel} writes; {@link #flush()} calls {@code force(false)}.
 */
final class FileChannelCubeWriter implements CubeWriter {
  private final CubeLayout layout;
  private final FileChannel channel;
  private ByteBuffer scratch;
  private boolean closed;

  FileChannelCubeWriter(FileChannel channel, CubeLayout layout) {
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
    scratch = ChunkBuffers.ensureCapacity(scratch, elements * CubeShape.BYTES_PER_SAMPLE, layout);
    scratch.asFloatBuffer().put(src, 0, elements);
    ChunkBuffers.writeFully(channel, scratch, layout.offsetOf(band, firstLine, 0));
  }

  @Override
  public void flush() throws IOException {
    channel.force(false);
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
