package ca.gc.cra.radcorr.api;

import ca.gc.cra.radcorr.config.ConfigMerger;
import ca.gc.cra.radcorr.config.DefaultsForMode;
import ca.gc.cra.radcorr.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Argument handling shared by {@link CorrectCli} and {@link InspectCli}: flag checks, YAML loading and the
 * defaults &lt; YAML &lt; CLI merge.
 */
final class CommandSupport {

  private CommandSupport() {}

  /**
   * Builds the effective configuration for {@code mode}, logging and printing usage on failure.
   *
   * @param mode {@link DefaultsForMode#CORRECT} or {@link DefaultsForMode#INSPECT}
   * @param input parsed CLI input
   * @param supportedFlags flags the command accepts
   * @param usage one-line usage printed after argument errors
   * @param log logger of the calling command
   * @return merged configuration, or the exit code to return
   */
  static Effective effectiveConfig(
      String mode, CliInput input, Set<String> supportedFlags, String usage, Logger log) {
    List<String> unknown = input.unknownFlags(supportedFlags);
    if (!unknown.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknown));
      CliPrinter.println(usage);
      return Effective.failed(ExitCode.INVALID_ARGS);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Effective.failed(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath;
      try {
        yamlPath = Path.of(configPath);
      } catch (InvalidPathException ex) {
        log.error("Invalid configuration path: {}", configPath);
        CliPrinter.println(usage);
        return Effective.failed(ExitCode.INVALID_ARGS);
      }
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Effective.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Effective.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Effective.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> merged =
          ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Effective(new LinkedHashMap<>(merged), null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Effective.failed(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Merged configuration or the failure that prevented it.
   *
   * @param values mutable merged configuration; {@code null} on failure
   * @param failure exit code when merging failed; {@code null} on success
   */
  record Effective(Map<String, String> values, ExitCode failure) {
    static Effective failed(ExitCode code) {
      return new Effective(null, code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
