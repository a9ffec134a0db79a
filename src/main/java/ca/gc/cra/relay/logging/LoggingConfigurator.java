package ca.gc.cra.relay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts RELAY runtime logging from CLI flags.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} or pin a level with
 * {@code logLevel=...} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Elevates the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level.
   *
   * @param level one of {@code TRACE, DEBUG, INFO, WARN, ERROR, OFF}, case-insensitive
   * @throws IllegalArgumentException if the level name is not recognized
   */
  public static void applyRootLevel(String level) {
    Level target = parseLevel(level);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!target.equals(root.getLevel())) {
        root.setLevel(target);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        target, factory.getClass().getName());
  }

  static Level parseLevel(String level) {
    if (level == null || level.isBlank()) {
      throw new IllegalArgumentException("logLevel must not be blank");
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    if (parsed == null) {
      throw new IllegalArgumentException("logLevel must be TRACE, DEBUG, INFO, WARN, ERROR, or OFF");
    }
    return parsed;
  }
}
