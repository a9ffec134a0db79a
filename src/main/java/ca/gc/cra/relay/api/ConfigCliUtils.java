package ca.gc.cra.relay.api;

import ca.gc.cra.relay.config.ConfigMerger;
import ca.gc.cra.relay.config.DefaultsForMode;
import ca.gc.cra.relay.config.YamlConfigLoader;
import ca.gc.cra.relay.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared option handling for the subcommands: {@code config=FILE} extraction, YAML loading, merging with
 * defaults, and the {@code logLevel} option.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  /**
   * Builds the effective options for {@code mode} from defaults, an optional YAML file, and CLI options.
   *
   * @throws CliAbort carrying the exit code to report when any layer is unusable
   */
  static Map<String, String> effectiveOptions(
      String mode, Map<String, String> cliOptions, Logger log, String usage) throws CliAbort {
    String configPath = extractConfigPath(cliOptions);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
      if (yaml.isEmpty()) {
        log.error("Configuration file {} does not exist", yamlPath);
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliOptions, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    String logLevel = effective.get("logLevel");
    if (logLevel != null && !logLevel.isBlank()) {
      try {
        LoggingConfigurator.applyRootLevel(logLevel);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid logLevel: {}", ex.getMessage());
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
    }
    return effective;
  }

  /** Signals that a CLI should stop early and report {@link #exitCode()}. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
