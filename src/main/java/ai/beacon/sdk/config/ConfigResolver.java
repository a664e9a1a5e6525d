package ai.beacon.sdk.config;

import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.types.ExporterType;
import ai.beacon.sdk.types.LogLevel;
import ai.beacon.sdk.types.OtlpProtocol;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Merges environment variables, host settings and defaults into one {@link TelemetryConfig}.
 *
 * <p>Precedence, highest first:
 *
 * <ul>
 *   <li>host telemetry level {@code off} (kill switch)
 *   <li>{@code BEACON_OTEL_*} environment variables
 *   <li>{@code OTEL_EXPORTER_OTLP_*} standard environment variables
 *   <li>host application settings
 *   <li>defaults
 * </ul>
 *
 * <p>Resolution never throws. Malformed values fall back to their defaults.
 */
public final class ConfigResolver {

  private ConfigResolver() {
    // Utility class
  }

  /** Resolve against the current process environment */
  public static TelemetryConfig resolveFromEnvironment(
      HostSettings settings, String serviceVersion, String sessionId, String hostTelemetryLevel) {
    return resolve(System.getenv(), settings, serviceVersion, sessionId, hostTelemetryLevel);
  }

  public static TelemetryConfig resolve(
      Map<String, String> env,
      HostSettings settings,
      String serviceVersion,
      String sessionId,
      String hostTelemetryLevel) {
    if (env == null) {
      env = Collections.emptyMap();
    }
    if (settings == null) {
      settings = HostSettings.empty();
    }

    if (hostTelemetryLevel != null
        && hostTelemetryLevel.trim().equalsIgnoreCase(BeaconConstants.HOST_TELEMETRY_OFF)) {
      return TelemetryConfig.disabled(serviceVersion, sessionId);
    }

    Boolean enabled = envBool(env.get(BeaconConstants.ENV_ENABLED));
    if (enabled == null) {
      enabled = settings.getEnabled();
    }
    if (enabled == null) {
      enabled = isPresent(env.get(BeaconConstants.ENV_OTLP_ENDPOINT));
    }
    if (!enabled) {
      return TelemetryConfig.disabled(serviceVersion, sessionId);
    }

    String rawProtocol =
        firstNonNull(
            env.get(BeaconConstants.ENV_OTLP_PROTOCOL), env.get(BeaconConstants.ENV_PROTOCOL));
    OtlpProtocol protocol = OtlpProtocol.fromString(rawProtocol);

    String rawEndpoint =
        firstNonNull(
            env.get(BeaconConstants.ENV_ENDPOINT),
            env.get(BeaconConstants.ENV_OTLP_ENDPOINT),
            settings.getOtlpEndpoint(),
            BeaconConstants.DEFAULT_OTLP_ENDPOINT);
    String otlpEndpoint = parseOtlpEndpoint(rawEndpoint, protocol);
    if (otlpEndpoint == null) {
      otlpEndpoint = parseOtlpEndpoint(BeaconConstants.DEFAULT_OTLP_ENDPOINT, protocol);
    }

    String fileExporterPath =
        firstNonEmpty(env.get(BeaconConstants.ENV_FILE_EXPORTER_PATH), settings.getOutfile());

    ExporterType exporterType;
    if (fileExporterPath != null) {
      exporterType = ExporterType.FILE;
    } else if (settings.getExporterType() != null) {
      exporterType = settings.getExporterType();
    } else {
      exporterType = ExporterType.forProtocol(protocol);
    }

    Boolean captureContent = envBool(env.get(BeaconConstants.ENV_CAPTURE_CONTENT));
    if (captureContent == null) {
      captureContent = settings.getCaptureContent();
    }

    Boolean httpInstrumentation = envBool(env.get(BeaconConstants.ENV_HTTP_INSTRUMENTATION));

    return TelemetryConfig.builder()
        .enabled(true)
        .exporterType(exporterType)
        .otlpEndpoint(otlpEndpoint)
        .otlpProtocol(protocol)
        .captureContent(captureContent != null && captureContent)
        .fileExporterPath(fileExporterPath)
        .logLevel(LogLevel.fromString(env.get(BeaconConstants.ENV_LOG_LEVEL)))
        .httpInstrumentation(httpInstrumentation != null && httpInstrumentation)
        .serviceName(
            firstNonEmpty(
                env.get(BeaconConstants.ENV_SERVICE_NAME), BeaconConstants.DEFAULT_SERVICE_NAME))
        .serviceVersion(serviceVersion)
        .sessionId(sessionId)
        .resourceAttributes(parseKeyValueList(env.get(BeaconConstants.ENV_RESOURCE_ATTRIBUTES)))
        .tracesEndpoint(parseOtlpEndpoint(env.get(BeaconConstants.ENV_OTLP_TRACES_ENDPOINT), protocol))
        .logsEndpoint(parseOtlpEndpoint(env.get(BeaconConstants.ENV_OTLP_LOGS_ENDPOINT), protocol))
        .metricsEndpoint(
            parseOtlpEndpoint(env.get(BeaconConstants.ENV_OTLP_METRICS_ENDPOINT), protocol))
        .otlpHeaders(parseKeyValueList(env.get(BeaconConstants.ENV_OTLP_HEADERS)))
        .metricExportIntervalMillis(
            parsePositiveLong(
                env.get(BeaconConstants.ENV_METRIC_EXPORT_INTERVAL),
                BeaconConstants.DEFAULT_METRIC_EXPORT_INTERVAL_MILLIS))
        .batchScheduleDelayMillis(
            parsePositiveLong(
                env.get(BeaconConstants.ENV_BSP_SCHEDULE_DELAY),
                BeaconConstants.DEFAULT_BATCH_SCHEDULE_DELAY_MILLIS))
        .build();
  }

  /**
   * Parse {@code key1=val1,key2=val2}. Pairs without {@code =} or with an empty key are skipped;
   * a repeated key keeps its last value.
   */
  public static Map<String, String> parseKeyValueList(String raw) {
    Map<String, String> result = new LinkedHashMap<>();
    if (raw == null || raw.isEmpty()) {
      return result;
    }
    for (String pair : raw.split(",")) {
      int eqIdx = pair.indexOf('=');
      if (eqIdx <= 0) {
        continue;
      }
      String key = pair.substring(0, eqIdx).trim();
      String value = pair.substring(eqIdx + 1).trim();
      if (!key.isEmpty()) {
        result.put(key, value);
      }
    }
    return result;
  }

  /**
   * Parse and normalize an OTLP endpoint.
   *
   * <p>gRPC does not route by path, so only {@code scheme://host[:port]} is kept. HTTP collectors
   * route by path, so the full reference is kept (an empty path becomes {@code /}).
   *
   * @return the normalized endpoint, or null when the value is missing or not an absolute URL
   */
  public static String parseOtlpEndpoint(String raw, OtlpProtocol protocol) {
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    String trimmed = raw.replaceAll("^[\"']|[\"']$", "").trim();
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      return null;
    }
    if (!uri.isAbsolute()) {
      return null;
    }

    String host = uri.getHost();
    int port = uri.getPort();
    if (host == null) {
      // Host names with '_' (compose and cluster service names) parse as a registry authority
      String authority = uri.getRawAuthority();
      if (authority == null) {
        return null;
      }
      authority = authority.substring(authority.lastIndexOf('@') + 1);
      int colon = authority.lastIndexOf(':');
      host = colon < 0 ? authority : authority.substring(0, colon);
      if (colon >= 0) {
        String portText = authority.substring(colon + 1);
        if (!portText.isEmpty()) {
          if (!portText.chars().allMatch(Character::isDigit) || portText.length() > 5) {
            return null;
          }
          port = Integer.parseInt(portText);
        }
      }
      if (host.isEmpty()) {
        return null;
      }
    }

    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    host = host.toLowerCase(Locale.ROOT);
    boolean defaultPort =
        (port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"));
    String origin = scheme + "://" + host + (port == -1 || defaultPort ? "" : ":" + port);

    if (protocol == OtlpProtocol.GRPC) {
      return origin;
    }

    StringBuilder href = new StringBuilder(origin);
    String path = uri.getRawPath();
    href.append(path == null || path.isEmpty() ? "/" : path);
    if (uri.getRawQuery() != null) {
      href.append('?').append(uri.getRawQuery());
    }
    if (uri.getRawFragment() != null) {
      href.append('#').append(uri.getRawFragment());
    }
    return href.toString();
  }

  /** {@code true} and {@code 1} are true, any other value is false, null stays null */
  static Boolean envBool(String value) {
    if (value == null) {
      return null;
    }
    String normalized = value.trim();
    return normalized.equalsIgnoreCase("true") || normalized.equals("1");
  }

  private static long parsePositiveLong(String value, long defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      return parsed > 0 ? parsed : defaultValue;
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isEmpty();
  }

  private static String firstNonNull(String... values) {
    for (String value : values) {
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (isPresent(value)) {
        return value;
      }
    }
    return null;
  }
}
