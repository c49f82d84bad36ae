package ca.gc.cra.radcorr.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by the commands for combining CLI flags with merged configuration maps.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && value.trim().toLowerCase(Locale.ROOT).equals("true");
  }
}
