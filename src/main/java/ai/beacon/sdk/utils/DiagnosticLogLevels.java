package ai.beacon.sdk.utils;

import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.types.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured diagnostic log level to the SDK's own logger and keeps the OpenTelemetry
 * SDK loggers quiet, on whichever of Logback or Log4j2 is present.
 */
public final class DiagnosticLogLevels {
  private static final Logger logger = LoggerFactory.getLogger(DiagnosticLogLevels.class);

  private DiagnosticLogLevels() {
    // Utility class
  }

  /**
   * @return true when a supported logging backend was found and configured
   */
  public static boolean apply(LogLevel level) {
    if (level == null) {
      level = LogLevel.INFO;
    }
    try {
      if (isLogbackAvailable() && applyLogback(level)) {
        return true;
      }
      if (isLog4j2Available()) {
        applyLog4j2(level);
        return true;
      }
    } catch (RuntimeException | LinkageError e) {
      logger.debug(
          "{} Could not apply diagnostic log level: {}", BeaconConstants.LOG_PREFIX, e.toString());
    }
    return false;
  }

  /** The OpenTelemetry loggers only get more verbose than WARN when asked for */
  static LogLevel otelLevelFor(LogLevel level) {
    if (level == LogLevel.TRACE || level == LogLevel.DEBUG || level == LogLevel.ERROR) {
      return level;
    }
    return LogLevel.WARN;
  }

  // False when Logback is on the classpath but is not the bound SLF4J backend
  private static boolean applyLogback(LogLevel level) {
    if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext)) {
      return false;
    }
    ch.qos.logback.classic.LoggerContext context =
        (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();

    context
        .getLogger(BeaconConstants.SDK_LOGGER_NAME)
        .setLevel(ch.qos.logback.classic.Level.toLevel(level.name()));
    context
        .getLogger(BeaconConstants.OTEL_LOGGER_NAME)
        .setLevel(ch.qos.logback.classic.Level.toLevel(otelLevelFor(level).name()));
    return true;
  }

  private static void applyLog4j2(LogLevel level) {
    org.apache.logging.log4j.core.config.Configurator.setLevel(
        BeaconConstants.SDK_LOGGER_NAME, org.apache.logging.log4j.Level.toLevel(level.name()));
    org.apache.logging.log4j.core.config.Configurator.setLevel(
        BeaconConstants.OTEL_LOGGER_NAME,
        org.apache.logging.log4j.Level.toLevel(otelLevelFor(level).name()));
  }

  private static boolean isLogbackAvailable() {
    try {
      Class.forName("ch.qos.logback.classic.LoggerContext");
      return true;
    } catch (ClassNotFoundException e) {
      return false;
    }
  }

  private static boolean isLog4j2Available() {
    try {
      Class.forName("org.apache.logging.log4j.core.config.Configurator");
      return true;
    } catch (ClassNotFoundException e) {
      return false;
    }
  }
}
