package ca.gc.cra.radcorr.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void correctDefaultsBuildAValidConfigOnceInputsAreGiven() {
    Map<String, String> defaults = new LinkedHashMap<>(DefaultsForMode.asFlatMap("CORRECT"));
    defaults.put("in", "/d/scene_reflectance.dat");
    defaults.put("refHeader", "/d/scene_radiance.hdr");

    CorrectConfig config = CorrectConfig.fromMap(defaults);

    assertEquals(500, config.chunkSize());
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("false", defaults.get("allowOverwrite"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
