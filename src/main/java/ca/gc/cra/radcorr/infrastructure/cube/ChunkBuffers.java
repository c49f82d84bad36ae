package ca.gc.cra.radcorr.infrastructure.cube;

import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/** Shared sizing and positional I/O helpers for cube adapters. */
final class ChunkBuffers {
  private ChunkBuffers() {}

  static int rowElements(CubeLayout layout, int lineCount, int bufferLength) {
    long elements = (long) lineCount * layout.shape().samples();
    if (elements * CubeShape.BYTES_PER_SAMPLE > CubeLayout.MAX_CHUNK_BYTES) {
      throw new IllegalArgumentException(
          lineCount + " rows of " + layout.shape().samples() + " samples exceed a single I/O chunk");
    }
    if (bufferLength < elements) {
      throw new IndexOutOfBoundsException(
          "buffer of " + bufferLength + " floats cannot hold " + elements + " samples");
    }
    return (int) elements;
  }

  static ByteBuffer ensureCapacity(ByteBuffer current, int bytes, CubeLayout layout) {
    ByteBuffer buffer = current;
    if (buffer == null || buffer.capacity() < bytes) {
      buffer = ByteBuffer.allocate(bytes);
    }
    buffer.clear().limit(bytes);
    return buffer.order(layout.byteOrder());
  }

  static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
    long pos = position;
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, pos);
      if (read < 0) {
        throw new EOFException("cube ended at byte " + pos + " with " + buffer.remaining() + " bytes still expected");
      }
      pos += read;
    }
  }

  static void writeFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
    long pos = position;
    while (buffer.hasRemaining()) {
      pos += channel.write(buffer, pos);
    }
  }
}
