package ca.gc.cra.radcorr.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final List<String> BOOLEAN_KEYS = List.of("verbose", "dryRun", "allowOverwrite");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged values are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    for (String key : BOOLEAN_KEYS) {
      String value = trim(effective.get(key)).toLowerCase(Locale.ROOT);
      if (!value.isEmpty() && !value.equals("true") && !value.equals("false")) {
        throw new IllegalArgumentException(key + " must be true or false (was '" + effective.get(key) + "')");
      }
    }
    if (DefaultsForMode.CORRECT.equalsIgnoreCase(mode)) {
      String in = trim(effective.get("in"));
      String out = trim(effective.get("out"));
      if (!in.isEmpty() && !out.isEmpty()
          && Path.of(in).toAbsolutePath().normalize().equals(Path.of(out).toAbsolutePath().normalize())) {
        throw new IllegalArgumentException("out must differ from in");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
