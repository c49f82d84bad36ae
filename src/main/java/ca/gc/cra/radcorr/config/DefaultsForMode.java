package ca.gc.cra.radcorr.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each RADCORR CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI options.</p>
 */
public final class DefaultsForMode {
  public static final String CORRECT = "correct";
  public static final String INSPECT = "inspect";

  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode {@code correct} or {@code inspect}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case CORRECT -> correctDefaults();
      case INSPECT -> inspectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> correctDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("inHeader", "");
    map.put("refHeader", "");
    map.put("out", "");
    map.put("outHeader", "");
    map.put("chunkSize", Integer.toString(CorrectConfig.DEFAULT_CHUNK_SIZE));
    map.put("storage", CubeStorageMode.CHANNEL.name().toLowerCase(Locale.ROOT));
    map.put("defaultScaleFactor", Double.toString(CorrectConfig.DEFAULT_SCALE_FACTOR));
    map.put("outputDescription", CorrectConfig.DEFAULT_DESCRIPTION);
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> inspectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("header", "");
    map.put("data", "");
    map.put("band", "");
    map.put("pixel", "");
    map.put("wavelength", "");
    return map;
  }
}
