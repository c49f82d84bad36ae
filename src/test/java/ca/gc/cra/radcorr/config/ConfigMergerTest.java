package ca.gc.cra.radcorr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("chunkSize", "500", "storage", "channel");
    Map<String, String> yaml = Map.of("chunkSize", "250", "storage", "mmap");
    Map<String, String> cli = Map.of("chunkSize", "100");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "correct", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("100", merged.get("chunkSize"));
    assertEquals("mmap", merged.get("storage"));
    assertEquals(List.of("CLI overrides YAML for key: chunkSize"), warnings);
  }

  @Test
  void defaultsFillMissingKeys() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "inspect", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("inspect"), msg -> {});

    assertEquals("none", merged.get("metricsExporter"));
    assertTrue(merged.containsKey("header"));
  }

  @Test
  void booleanKeysMustBeBooleans() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "correct", Optional.empty(), Map.of("dryRun", "maybe"), Map.of(), msg -> {}));
  }

  @Test
  void correctRejectsOutputEqualToInput() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "correct", Optional.empty(), Map.of("in", "/d/cube.dat", "out", "/d/../d/cube.dat"), Map.of(), msg -> {}));
  }
}
