package ca.gc.cra.radcorr.infrastructure.header;

import ca.gc.cra.radcorr.application.port.HeaderStorePort;
import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.domain.header.HeaderSyntaxException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Header store backed by UTF-8 text files.
 *
 * <p>Writes go to a sibling temporary file that is synced and then moved over the target, so a reader never
 * sees a half-written header.</p>
 */
public final class FileHeaderStore implements HeaderStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileHeaderStore.class);

  private final EnviHeaderParser parser;
  private final EnviHeaderWriter writer;

  /** Creates a store using the default parser and writer. */
  public FileHeaderStore() {
    this(new EnviHeaderParser(), new EnviHeaderWriter());
  }

  FileHeaderStore(EnviHeaderParser parser, EnviHeaderWriter writer) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  @Override
  public HeaderFields read(Path path) throws HeaderSyntaxException, IOException {
    Objects.requireNonNull(path, "path");
    String text = Files.readString(path, StandardCharsets.UTF_8);
    HeaderFields fields = parser.parse(text);
    log.debug("Read {} header fields from {}", fields.size(), path);
    return fields;
  }

  @Override
  public void write(Path path, HeaderModel model) throws IOException {
    Objects.requireNonNull(path, "path");
    byte[] bytes = writer.write(model).getBytes(StandardCharsets.UTF_8);
    Path absolute = path.toAbsolutePath();
    Path dir = absolute.getParent();
    Path temp = Files.createTempFile(dir, absolute.getFileName().toString() + ".", ".tmp");
    try {
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      move(temp, absolute);
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    log.debug("Wrote header {} ({} bytes)", absolute, bytes.length);
  }

  @Override
  public boolean delete(Path path) throws IOException {
    boolean removed = Files.deleteIfExists(Objects.requireNonNull(path, "path"));
    if (removed) {
      log.info("Removed stale header {}", path);
    }
    return removed;
  }

  private static void move(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.warn("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
