package ai.beacon.sdk.tracer;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.api.SpanOptions;
import ai.beacon.sdk.api.TelemetryService;
import ai.beacon.sdk.config.TelemetryConfig;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * {@link TelemetryService} used when telemetry is disabled. Nothing is recorded and no
 * OpenTelemetry SDK object is ever created.
 */
public final class NoopTelemetryService implements TelemetryService {
  private final TelemetryConfig config;

  public NoopTelemetryService(TelemetryConfig config) {
    this.config = config;
  }

  @Override
  public TelemetryConfig getConfig() {
    return config;
  }

  @Override
  public SpanHandle startSpan(String name, SpanOptions options) {
    return NoopSpanHandle.INSTANCE;
  }

  @Override
  public <T> T startActiveSpan(String name, SpanOptions options, Function<SpanHandle, T> fn) {
    return fn.apply(NoopSpanHandle.INSTANCE);
  }

  @Override
  public <T> CompletableFuture<T> startActiveSpanAsync(
      String name, SpanOptions options, Function<SpanHandle, ? extends CompletionStage<T>> fn) {
    CompletionStage<T> stage;
    try {
      stage = fn.apply(NoopSpanHandle.INSTANCE);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return stage != null ? stage.toCompletableFuture() : CompletableFuture.completedFuture(null);
  }

  @Override
  public void recordMetric(String name, double value, Map<String, ?> attributes) {}

  @Override
  public void incrementCounter(String name, long value, Map<String, ?> attributes) {}

  @Override
  public void emitLogRecord(String body, Map<String, ?> attributes) {}

  @Override
  public CompletableFuture<Void> flush() {
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Void> shutdown() {
    return CompletableFuture.completedFuture(null);
  }
}
