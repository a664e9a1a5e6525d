package ai.beacon.sdk.exporter;

import ai.beacon.sdk.config.TelemetryConfig;
import java.util.concurrent.CompletableFuture;

/**
 * Creates the exporters for a resolved configuration.
 *
 * <p>Called at most once per service, off the caller's thread, and never for a disabled
 * configuration. Either all three exporters are returned or the future fails.
 */
@FunctionalInterface
public interface ExporterFactory {

  CompletableFuture<ExporterSet> create(TelemetryConfig config);
}
