package io.tessera.conv.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies the configured root log level to the running Logback context.
 * <p><strong>Why:</strong> {@code logging.level} and {@code --verbose} must take effect without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the root logger level.
   *
   * @param levelName level name such as {@code INFO} or {@code debug}
   * @throws IllegalArgumentException if the name is not a Logback level
   */
  public static void applyRootLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("logging.level must not be blank");
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("Unknown logging.level: " + levelName);
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        normalized, factory.getClass().getName());
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }
}
