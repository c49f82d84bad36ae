package ca.gc.cra.radcorr.application.port;

import ca.gc.cra.radcorr.domain.cube.CubeLayout;
import ca.gc.cra.radcorr.domain.cube.CubeLayoutException;
import ca.gc.cra.radcorr.domain.cube.OutputAllocationException;
import ca.gc.cra.radcorr.domain.header.CubeShape;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Factory port opening cube files for reading and creating them for writing.
 * <p><strong>Role:</strong> Driven port; adapters decide between positional channel I/O and memory mapping.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless factories.</p>
 *
 * @since 0.1.0
 */
public interface CubeStoragePort {
  /**
   * Opens an existing cube read-only.
   *
   * @param path cube file
   * @param layout layout declared by the paired header
   * @return reader positioned nowhere in particular; reads are absolute
   * @throws CubeLayoutException if the file is smaller than the layout requires
   * @throws IOException if the file cannot be opened
   */
  CubeReader openReader(Path path, CubeLayout layout) throws CubeLayoutException, IOException;

  /**
   * Creates (or truncates) a cube and sizes it to hold every element before returning.
   *
   * @param path cube file
   * @param shape cube geometry
   * @return writer for the freshly allocated cube
   * @throws OutputAllocationException if the file cannot be created or sized; no partial file is left behind
   */
  CubeWriter create(Path path, CubeShape shape) throws OutputAllocationException;
}
