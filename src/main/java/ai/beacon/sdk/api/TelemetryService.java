package ai.beacon.sdk.api;

import ai.beacon.sdk.config.TelemetryConfig;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Entry point for emitting spans, metrics and log records.
 *
 * <p>Every method returns immediately, may be called before the backend is ready, and never
 * throws because of a telemetry failure. The futures returned by {@link #flush()} and {@link
 * #shutdown()} never complete exceptionally.
 */
public interface TelemetryService {

  /** The configuration this service was created with */
  TelemetryConfig getConfig();

  default SpanHandle startSpan(String name) {
    return startSpan(name, SpanOptions.defaults());
  }

  /** Start a span. Returns a no-op handle when telemetry is disabled or unavailable. */
  SpanHandle startSpan(String name, SpanOptions options);

  /**
   * Start a span, make it current while {@code fn} runs so child spans are parented, and end it
   * when {@code fn} returns or throws. Exceptions from {@code fn} propagate unchanged.
   *
   * <p>Before the backend is ready the span is buffered and no context is made current, so spans
   * started inside {@code fn} are not parented to it.
   */
  <T> T startActiveSpan(String name, SpanOptions options, Function<SpanHandle, T> fn);

  /**
   * Asynchronous variant of {@link #startActiveSpan}: the span ends when the stage returned by
   * {@code fn} completes, normally or exceptionally. The same parenting limit applies before the
   * backend is ready.
   */
  <T> CompletableFuture<T> startActiveSpanAsync(
      String name, SpanOptions options, Function<SpanHandle, ? extends CompletionStage<T>> fn);

  default void recordMetric(String name, double value) {
    recordMetric(name, value, Collections.emptyMap());
  }

  /** Record a histogram value */
  void recordMetric(String name, double value, Map<String, ?> attributes);

  default void incrementCounter(String name) {
    incrementCounter(name, 1L, Collections.emptyMap());
  }

  default void incrementCounter(String name, long value) {
    incrementCounter(name, value, Collections.emptyMap());
  }

  void incrementCounter(String name, long value, Map<String, ?> attributes);

  default void emitLogRecord(String body) {
    emitLogRecord(body, Collections.emptyMap());
  }

  /** Emit a log record / event */
  void emitLogRecord(String body, Map<String, ?> attributes);

  /** Push any batched telemetry to the exporters */
  CompletableFuture<Void> flush();

  /** Flush, then release the backend */
  CompletableFuture<Void> shutdown();
}
