package ai.beacon.sdk.tracer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.beacon.sdk.api.SpanOptions;
import ai.beacon.sdk.config.TelemetryConfig;
import ai.beacon.sdk.types.SpanStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class NoopTelemetryServiceTest {
  private final NoopTelemetryService service =
      new NoopTelemetryService(TelemetryConfig.disabled("1.0.0", "session"));

  @Test
  void everyCallIsANoop() {
    assertThat(service.getConfig().isEnabled()).isFalse();
    assertThat(service.startSpan("span")).isSameAs(NoopSpanHandle.INSTANCE);

    NoopSpanHandle.INSTANCE.setAttribute("key", "value");
    NoopSpanHandle.INSTANCE.setAttribute("list", List.of("a"));
    NoopSpanHandle.INSTANCE.setStatus(SpanStatus.ERROR, "ignored");
    NoopSpanHandle.INSTANCE.end();
    service.recordMetric("latency", 1.0);
    service.incrementCounter("calls", 5, Map.of("k", "v"));
    service.emitLogRecord("event");

    assertThat(service.flush()).isCompleted();
    assertThat(service.shutdown()).isCompleted();
  }

  @Test
  void activeSpanStillRunsTheFunction() {
    String result = service.startActiveSpan("span", SpanOptions.defaults(), span -> "ran");

    assertThat(result).isEqualTo("ran");
  }

  @Test
  void activeSpanPropagatesExceptions() {
    assertThatThrownBy(
            () ->
                service.startActiveSpan(
                    "span",
                    SpanOptions.defaults(),
                    span -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
  }

  @Test
  void asyncActiveSpanReturnsTheStageResult() {
    CompletableFuture<String> result =
        service.startActiveSpanAsync(
            "span", SpanOptions.defaults(), span -> CompletableFuture.completedFuture("done"));

    assertThat(result).succeedsWithin(Duration.ofSeconds(1)).isEqualTo("done");
  }

  @Test
  void asyncActiveSpanSynchronousThrowFailsTheFuture() {
    CompletableFuture<Object> result =
        service.startActiveSpanAsync(
            "span",
            SpanOptions.defaults(),
            span -> {
              throw new IllegalStateException("sync");
            });

    assertThat(result).isCompletedExceptionally();
  }
}
