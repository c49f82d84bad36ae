package ca.gc.cra.radcorr.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void fileNameHandlesNullAndRoot() {
    assertTrue(PathUtils.fileName(null).isEmpty());
    assertTrue(PathUtils.fileName(Path.of("/")).isEmpty());
    assertEquals("cube.dat", PathUtils.fileName(Path.of("/data/cube.dat")).orElseThrow());
  }

  @Test
  void appendToFileNameKeepsDirectory() {
    assertEquals(Path.of("/data/cube.dat.hdr"), PathUtils.appendToFileName(Path.of("/data/cube.dat"), ".hdr"));
  }

  @Test
  void insertBeforeExtensionUsesLastDot() {
    assertEquals(Path.of("/data/cube.v2_radcorr.dat"),
        PathUtils.insertBeforeExtension(Path.of("/data/cube.v2.dat"), "_radcorr"));
    assertEquals(Path.of("/data/.hidden_radcorr"),
        PathUtils.insertBeforeExtension(Path.of("/data/.hidden"), "_radcorr"));
    assertThrows(IllegalArgumentException.class, () -> PathUtils.insertBeforeExtension(Path.of("/"), "_x"));
  }
}
