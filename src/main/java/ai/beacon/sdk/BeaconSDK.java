package ai.beacon.sdk;

import ai.beacon.sdk.api.TelemetryService;
import ai.beacon.sdk.config.ConfigResolver;
import ai.beacon.sdk.config.HostSettings;
import ai.beacon.sdk.config.TelemetryConfig;
import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.exporter.DefaultExporterFactory;
import ai.beacon.sdk.exporter.ExporterFactory;
import ai.beacon.sdk.tracer.NoopTelemetryService;
import ai.beacon.sdk.tracer.OtelTelemetryService;
import ai.beacon.sdk.utils.DiagnosticLogLevels;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for Beacon SDK
 *
 * <p>Usage: {@code TelemetryService telemetry = BeaconSDK.initialize(settings, "1.2.0",
 * sessionId, null); telemetry.startSpan("operation").end();}
 */
public final class BeaconSDK {
  private static final Logger logger = LoggerFactory.getLogger(BeaconSDK.class);

  private static volatile TelemetryService instance;

  private BeaconSDK() {
    // Utility class
  }

  /**
   * Resolve the configuration from the process environment and host settings and create the
   * process-wide service. Later calls return the service created by the first one.
   */
  public static TelemetryService initialize(
      HostSettings settings, String serviceVersion, String sessionId, String hostTelemetryLevel) {
    if (instance != null) {
      logger.warn("{} Telemetry already initialized", BeaconConstants.LOG_PREFIX);
      return instance;
    }

    synchronized (BeaconSDK.class) {
      if (instance == null) {
        instance =
            create(
                ConfigResolver.resolveFromEnvironment(
                    settings, serviceVersion, sessionId, hostTelemetryLevel));
      }
      return instance;
    }
  }

  /** Check if the process-wide service exists */
  public static boolean isInitialized() {
    return instance != null;
  }

  /** The process-wide service, or a disabled one when {@link #initialize} was not called */
  public static TelemetryService get() {
    TelemetryService current = instance;
    return current != null ? current : new NoopTelemetryService(TelemetryConfig.disabled("", ""));
  }

  public static TelemetryService create(TelemetryConfig config) {
    return create(config, new DefaultExporterFactory());
  }

  /**
   * Create a service for an already resolved configuration: a no-op service when the
   * configuration is disabled, an OpenTelemetry-backed one otherwise.
   */
  public static TelemetryService create(TelemetryConfig config, ExporterFactory exporterFactory) {
    if (!config.isEnabled()) {
      return new NoopTelemetryService(config);
    }

    DiagnosticLogLevels.apply(config.getLogLevel());
    logger.info(
        "{} OTel instrumentation enabled exporter={} endpoint={} captureContent={}",
        BeaconConstants.LOG_PREFIX,
        config.getExporterType(),
        config.getOtlpEndpoint(),
        config.isCaptureContent());
    return new OtelTelemetryService(config, exporterFactory);
  }

  /** Shut down the process-wide service */
  public static CompletableFuture<Void> shutdown() {
    TelemetryService current;
    synchronized (BeaconSDK.class) {
      current = instance;
      instance = null;
    }
    if (current == null) {
      return CompletableFuture.completedFuture(null);
    }
    return shutdown(current);
  }

  /** Shut down a service, logging instead of propagating any error */
  public static CompletableFuture<Void> shutdown(TelemetryService service) {
    try {
      return service
          .shutdown()
          .exceptionally(
              e -> {
                logger.error("{} Error during shutdown", BeaconConstants.LOG_PREFIX, e);
                return null;
              });
    } catch (RuntimeException e) {
      logger.error("{} Error during shutdown", BeaconConstants.LOG_PREFIX, e);
      return CompletableFuture.completedFuture(null);
    }
  }
}
