package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.config.ConfigMerger;
import ca.gc.cra.sentinel.config.DefaultsForMode;
import ca.gc.cra.sentinel.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the effective configuration of a command from {@code config=PATH}, CLI overrides and defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Resolves the effective configuration and applies telemetry settings.
   *
   * @param mode command name
   * @param input parsed CLI input
   * @param usage usage line printed on argument errors
   * @return mutable effective configuration without telemetry keys
   * @throws CliAbort when arguments, the YAML file, or merged values are invalid
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, String usage) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(mode, configPath, usage);

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    return effective;
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  private static Optional<Map<String, String>> loadYaml(String mode, String configPath, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }
}
