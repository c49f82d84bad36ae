package ca.gc.cra.radcorr.infrastructure.cube;

import ca.gc.cra.radcorr.application.port.CubeReader;
import ca.gc.cra.radcorr.application.port.CubeStoragePort;
import ca.gc.cra.radcorr.application.port.CubeWriter;
import ca.gc.cra.radcorr.config.CubeStorageMode;
import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.cube.CubeLayoutException;
import ca.gc.cra.radcorr.domain.cube.OutputAllocationException;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File-backed {@link CubeStoragePort} choosing a writer per {@link CubeStorageMode}.
 * <p><strong>Why:</strong> Output cubes must exist at full size before the first data write, and inputs must be
 * at least as large as their headers claim, so both checks live in one place.</p>
 * <p><strong>Role:</strong> Infrastructure adapter wired by the composition root.</p>
 * <p><strong>Thread-safety:</strong> Stateless factory; returned readers and writers are single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class FileCubeStorage implements CubeStoragePort {
  private static final Logger log = LoggerFactory.getLogger(FileCubeStorage.class);

  private final CubeStorageMode mode;

  /**
   * Creates a storage adapter.
   *
   * @param mode backend used for writers; readers always use positional channel reads
   */
  public FileCubeStorage(CubeStorageMode mode) {
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  @Override
  public CubeReader openReader(Path path, CubeLayout layout) throws CubeLayoutException, IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(layout, "layout");
    long actual = Files.size(path);
    long required = layout.requiredFileSize();
    if (actual < required) {
      throw new CubeLayoutException("cube " + path + " holds " + actual + " bytes but its header ("
          + layout.shape() + ", offset " + layout.headerOffset() + ") requires " + required);
    }
    if (actual > required) {
      log.debug("Cube {} has {} trailing bytes beyond the declared layout", path, actual - required);
    }
    return new FileChannelCubeReader(path, layout);
  }

  @Override
  public CubeWriter create(Path path, CubeShape shape) throws OutputAllocationException {
    Objects.requireNonNull(path, "path");
    CubeLayout layout = CubeLayout.output(Objects.requireNonNull(shape, "shape"));
    long size = layout.requiredFileSize();
    requireSpace(path, size);

    FileChannel channel = null;
    try {
      channel = FileChannel.open(path,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.READ,
          StandardOpenOption.WRITE);
      ChunkBuffers.writeFully(channel, ByteBuffer.allocate(1), size - 1);
      channel.force(true);
    } catch (IOException | RuntimeException ex) {
      discard(path, channel, ex);
      throw new OutputAllocationException("unable to allocate " + size + " bytes for " + path, ex);
    }
    log.info("Allocated output cube {} ({} bytes, {} storage)", path, size, mode);
    return mode == CubeStorageMode.MMAP
        ? new MappedCubeWriter(channel, layout)
        : new FileChannelCubeWriter(channel, layout);
  }

  CubeStorageMode mode() {
    return mode;
  }

  private static void requireSpace(Path path, long size) throws OutputAllocationException {
    Path parent = path.toAbsolutePath().getParent();
    try {
      FileStore store = Files.getFileStore(parent);
      long reusable = Files.isRegularFile(path) ? Files.size(path) : 0L;
      long usable = store.getUsableSpace();
      if (usable + reusable < size) {
        throw new OutputAllocationException("insufficient space for " + path + ": need " + size
            + " bytes, " + usable + " usable on " + store.name());
      }
    } catch (IOException ex) {
      throw new OutputAllocationException("unable to inspect file store for " + path, ex);
    }
  }

  private static void discard(Path path, FileChannel channel, Exception cause) {
    if (channel != null) {
      try {
        channel.close();
      } catch (IOException closeFailure) {
        cause.addSuppressed(closeFailure);
      }
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException deleteFailure) {
      cause.addSuppressed(deleteFailure);
      log.warn("Unable to remove partially allocated cube {}", path, deleteFailure);
    }
  }
}
