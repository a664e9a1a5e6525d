package ai.beacon.sdk.types;

public enum LogLevel {
  TRACE,
  DEBUG,
  INFO,
  WARN,
  ERROR;

  public static LogLevel fromString(String level) {
    if (level == null) {
      return INFO;
    }
    try {
      return LogLevel.valueOf(level.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      return INFO;
    }
  }
}
