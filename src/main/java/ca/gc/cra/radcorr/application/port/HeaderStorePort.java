package ca.gc.cra.radcorr.application.port;

import ca.gc.cra.radcorr.domain.header.HeaderFields;
import ca.gc.cra.radcorr.domain.header.HeaderModel;
import ca.gc.cra.radcorr.domain.header.HeaderSyntaxException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port reading and writing the text headers paired with cube files.
 * <p><strong>Why:</strong> The presence of an output header is the signal that its cube is complete, so header
 * writes must be all-or-nothing.</p>
 * <p><strong>Role:</strong> Driven port implemented by the file-backed ENVI header adapter.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless.</p>
 *
 * @since 0.1.0
 */
public interface HeaderStorePort {
  /**
   * Reads and decodes a header file.
   *
   * @param path header file
   * @return decoded fields
   * @throws HeaderSyntaxException if the text violates the header grammar
   * @throws IOException if the file cannot be read
   */
  HeaderFields read(Path path) throws HeaderSyntaxException, IOException;

  /**
   * Writes a header so that readers observe either the previous state or the complete new file.
   *
   * @param path header file
   * @param model model to serialize
   * @throws IOException if the file cannot be written
   */
  void write(Path path, HeaderModel model) throws IOException;

  /**
   * Removes a header, if present.
   *
   * @param path header file
   * @return {@code true} when a file was removed
   * @throws IOException if the file exists but cannot be removed
   */
  boolean delete(Path path) throws IOException;
}
