package ai.beacon.sdk;

import static org.assertj.core.api.Assertions.assertThat;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.api.SpanOptions;
import ai.beacon.sdk.api.TelemetryService;
import ai.beacon.sdk.config.HostSettings;
import ai.beacon.sdk.config.TelemetryConfig;
import ai.beacon.sdk.exporter.ExporterFactory;
import ai.beacon.sdk.exporter.ExporterSet;
import ai.beacon.sdk.tracer.NoopTelemetryService;
import ai.beacon.sdk.tracer.OtelTelemetryService;
import ai.beacon.sdk.types.ExporterType;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BeaconSDKTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private final Logger logger = (Logger) LoggerFactory.getLogger(BeaconSDK.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  @BeforeEach
  void setUp() {
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    BeaconSDK.shutdown().join();
  }

  @Test
  void disabledConfigCreatesNoopService() {
    AtomicInteger factoryCalls = new AtomicInteger();
    ExporterFactory factory =
        config -> {
          factoryCalls.incrementAndGet();
          return new CompletableFuture<>();
        };

    TelemetryService service = BeaconSDK.create(TelemetryConfig.disabled("1.0.0", "s"), factory);

    assertThat(service).isInstanceOf(NoopTelemetryService.class);
    assertThat(factoryCalls).hasValue(0);
    assertThat(appender.list).isEmpty();
  }

  @Test
  void enabledConfigLogsOneInfoLine() {
    TelemetryConfig config =
        TelemetryConfig.builder()
            .enabled(true)
            .exporterType(ExporterType.OTLP_HTTP)
            .otlpEndpoint("http://collector:4318/")
            .build();
    CompletableFuture<ExporterSet> never = new CompletableFuture<>();

    TelemetryService service = BeaconSDK.create(config, c -> never);
    try {
      assertThat(service).isInstanceOf(OtelTelemetryService.class);
      assertThat(appender.list)
          .filteredOn(event -> event.getLevel() == Level.INFO)
          .extracting(ILoggingEvent::getFormattedMessage)
          .containsExactly(
              "[Beacon] OTel instrumentation enabled exporter=otlp-http"
                  + " endpoint=http://collector:4318/ captureContent=false");
    } finally {
      assertThat(service.shutdown()).succeedsWithin(TIMEOUT);
    }
  }

  @Test
  void getWithoutInitializeIsNoop() {
    assertThat(BeaconSDK.isInitialized()).isFalse();

    TelemetryService service = BeaconSDK.get();

    assertThat(service).isInstanceOf(NoopTelemetryService.class);
    assertThat(service.getConfig().isEnabled()).isFalse();
  }

  @Test
  void initializeIsOncePerProcess() {
    HostSettings settings = HostSettings.builder().enabled(true).build();

    TelemetryService first = BeaconSDK.initialize(settings, "2.0.0", "session-a", "off");
    TelemetryService second = BeaconSDK.initialize(settings, "3.0.0", "session-b", null);

    assertThat(BeaconSDK.isInitialized()).isTrue();
    assertThat(second).isSameAs(first);
    assertThat(BeaconSDK.get()).isSameAs(first);
    assertThat(first.getConfig().isEnabled()).isFalse();
    assertThat(first.getConfig().getSessionId()).isEqualTo("session-a");
    assertThat(appender.list)
        .filteredOn(event -> event.getLevel() == Level.WARN)
        .hasSize(1);

    assertThat(BeaconSDK.shutdown()).succeedsWithin(TIMEOUT);
    assertThat(BeaconSDK.isInitialized()).isFalse();
  }

  @Test
  void shutdownSwallowsServiceErrors() {
    assertThat(BeaconSDK.shutdown(new FailingShutdownService(true))).succeedsWithin(TIMEOUT);
    assertThat(BeaconSDK.shutdown(new FailingShutdownService(false))).succeedsWithin(TIMEOUT);
    assertThat(appender.list)
        .filteredOn(event -> event.getLevel() == Level.ERROR)
        .hasSize(2);
  }

  private static class FailingShutdownService implements TelemetryService {
    private final TelemetryService delegate =
        new NoopTelemetryService(TelemetryConfig.disabled("", ""));
    private final boolean throwDirectly;

    FailingShutdownService(boolean throwDirectly) {
      this.throwDirectly = throwDirectly;
    }

    @Override
    public TelemetryConfig getConfig() {
      return delegate.getConfig();
    }

    @Override
    public SpanHandle startSpan(String name, SpanOptions options) {
      return delegate.startSpan(name, options);
    }

    @Override
    public <T> T startActiveSpan(String name, SpanOptions options, Function<SpanHandle, T> fn) {
      return delegate.startActiveSpan(name, options, fn);
    }

    @Override
    public <T> CompletableFuture<T> startActiveSpanAsync(
        String name, SpanOptions options, Function<SpanHandle, ? extends CompletionStage<T>> fn) {
      return delegate.startActiveSpanAsync(name, options, fn);
    }

    @Override
    public void recordMetric(String name, double value, Map<String, ?> attributes) {}

    @Override
    public void incrementCounter(String name, long value, Map<String, ?> attributes) {}

    @Override
    public void emitLogRecord(String body, Map<String, ?> attributes) {}

    @Override
    public CompletableFuture<Void> flush() {
      return delegate.flush();
    }

    @Override
    public CompletableFuture<Void> shutdown() {
      IllegalStateException error = new IllegalStateException("already closed");
      if (throwDirectly) {
        throw error;
      }
      return CompletableFuture.failedFuture(error);
    }
  }
}
