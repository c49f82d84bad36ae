package ca.gc.cra.radcorr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws Exception {
    Path yaml = tempDir.resolve("radcorr.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: otlp
          chunkSize: 100
        correct:
          chunkSize: 250
          storage: mmap
          telemetry:
            site: ottawa
        inspect:
          band: 3
        """, StandardCharsets.UTF_8);

    Map<String, String> values = YamlConfigLoader.load(yaml, "correct").orElseThrow();

    assertEquals("otlp", values.get("metricsExporter"));
    assertEquals("250", values.get("chunkSize"));
    assertEquals("mmap", values.get("storage"));
    assertEquals("ottawa", values.get("telemetry.site"));
    assertFalse(values.containsKey("band"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("none.yaml"), "correct").isEmpty());
  }

  @Test
  void malformedDocumentsAreRejected() throws Exception {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, "- a\n- b\n", StandardCharsets.UTF_8);
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "correct: [unclosed\n", StandardCharsets.UTF_8);
    Path nestedList = tempDir.resolve("nested.yaml");
    Files.writeString(nestedList, "correct:\n  in:\n    - a\n", StandardCharsets.UTF_8);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "correct"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "correct"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "correct"));
  }
}
