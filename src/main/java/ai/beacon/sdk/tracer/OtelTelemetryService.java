package ai.beacon.sdk.tracer;

import ai.beacon.sdk.api.SpanHandle;
import ai.beacon.sdk.api.SpanOptions;
import ai.beacon.sdk.api.TelemetryService;
import ai.beacon.sdk.config.TelemetryConfig;
import ai.beacon.sdk.constants.BeaconConstants;
import ai.beacon.sdk.exporter.DefaultExporterFactory;
import ai.beacon.sdk.exporter.ExporterFactory;
import ai.beacon.sdk.exporter.ExporterSet;
import ai.beacon.sdk.types.ServiceState;
import ai.beacon.sdk.utils.AttributeUtils;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.logs.Logger;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.SdkLoggerProvider;
import io.opentelemetry.sdk.logs.export.BatchLogRecordProcessor;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.resources.ResourceBuilder;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry-backed {@link TelemetryService}.
 *
 * <p>The SDK is built asynchronously right after construction. Calls made before it is ready are
 * queued (up to a fixed capacity) and replayed in call order once it is; if initialization fails
 * the queue is discarded and the service stays a no-op. No public method blocks or throws.
 */
public class OtelTelemetryService implements TelemetryService {
  private static final org.slf4j.Logger logger =
      LoggerFactory.getLogger(OtelTelemetryService.class);

  private final TelemetryConfig config;
  private final ExporterFactory exporterFactory;
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  private final Object lock = new Object();
  private final OperationBuffer buffer;
  // Unbound span handles from buffered starts; discarded if their start never replays
  private final List<BufferedSpanHandle> bufferedHandles = new ArrayList<>();
  private final CompletableFuture<ServiceState> initialization = new CompletableFuture<>();

  private volatile ServiceState state = ServiceState.UNINITIALIZED;
  private volatile boolean shutdownRequested;
  private volatile CompletableFuture<Void> shutdownFuture;

  // Set once, before the buffer is drained
  private volatile OpenTelemetrySdk sdk;
  private volatile Tracer tracer;
  private volatile Logger otelLogger;
  private volatile MetricInstrumentCache metrics;

  public OtelTelemetryService(TelemetryConfig config) {
    this(config, new DefaultExporterFactory());
  }

  public OtelTelemetryService(TelemetryConfig config, ExporterFactory exporterFactory) {
    this(config, exporterFactory, null, BeaconConstants.MAX_BUFFER_SIZE);
  }

  /**
   * @param executor runs initialization and buffer draining; when null a private daemon thread is
   *     used and stopped on {@link #shutdown()}
   * @param bufferCapacity maximum number of operations queued before the backend is ready
   */
  public OtelTelemetryService(
      TelemetryConfig config, ExporterFactory exporterFactory, Executor executor, int bufferCapacity) {
    this.config = config;
    this.exporterFactory = exporterFactory;
    this.buffer = new OperationBuffer(bufferCapacity);

    if (!config.isEnabled()) {
      this.ownedExecutor = null;
      this.executor = null;
      initialization.complete(ServiceState.UNINITIALIZED);
      return;
    }

    if (executor != null) {
      this.ownedExecutor = null;
      this.executor = executor;
    } else {
      this.ownedExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, BeaconConstants.INIT_THREAD_NAME);
                t.setDaemon(true);
                return t;
              });
      this.executor = ownedExecutor;
    }

    state = ServiceState.INITIALIZING;
    runOnExecutor(this::initialize);
  }

  @Override
  public TelemetryConfig getConfig() {
    return config;
  }

  /** Current lifecycle state */
  public ServiceState getState() {
    return state;
  }

  /** Completes with the state initialization ended in; never completes exceptionally */
  public CompletableFuture<ServiceState> whenInitialized() {
    return initialization.thenApply(Function.identity());
  }

  int bufferedOperationCount() {
    synchronized (lock) {
      return buffer.size();
    }
  }

  // Span API

  @Override
  public SpanHandle startSpan(String name, SpanOptions options) {
    SpanOptions spanOptions = options != null ? options : SpanOptions.defaults();
    if (isReady()) {
      return createSpan(name, spanOptions, null, null);
    }

    Context parent = Context.current();
    Instant startTime = Instant.now();
    BufferedSpanHandle handle = new BufferedSpanHandle();
    switch (defer(() -> handle.bind(createSpan(name, spanOptions, parent, startTime)), handle)) {
      case APPLY_NOW:
        return createSpan(name, spanOptions, null, null);
      case BUFFERED:
        return handle;
      default:
        return NoopSpanHandle.INSTANCE;
    }
  }

  @Override
  public <T> T startActiveSpan(String name, SpanOptions options, Function<SpanHandle, T> fn) {
    SpanHandle handle = startSpan(name, options);
    Scope scope = makeCurrent(handle);
    try {
      return fn.apply(handle);
    } finally {
      closeQuietly(scope);
      handle.end();
    }
  }

  @Override
  public <T> CompletableFuture<T> startActiveSpanAsync(
      String name, SpanOptions options, Function<SpanHandle, ? extends CompletionStage<T>> fn) {
    SpanHandle handle = startSpan(name, options);
    Scope scope = makeCurrent(handle);
    CompletionStage<T> stage;
    try {
      stage = fn.apply(handle);
    } catch (RuntimeException e) {
      handle.end();
      return CompletableFuture.failedFuture(e);
    } catch (Error e) {
      handle.end();
      throw e;
    } finally {
      closeQuietly(scope);
    }

    if (stage == null) {
      handle.end();
      return CompletableFuture.completedFuture(null);
    }
    CompletableFuture<T> result = new CompletableFuture<>();
    stage.whenComplete(
        (value, error) -> {
          handle.end();
          if (error != null) {
            result.completeExceptionally(error);
          } else {
            result.complete(value);
          }
        });
    return result;
  }

  // Metric API

  @Override
  public void recordMetric(String name, double value, Map<String, ?> attributes) {
    try {
      Attributes attrs = AttributeUtils.toAttributes(attributes);
      if (isReady()) {
        applyRecordMetric(name, value, attrs);
        return;
      }
      if (defer(() -> applyRecordMetric(name, value, attrs)) == Deferral.APPLY_NOW) {
        applyRecordMetric(name, value, attrs);
      }
    } catch (RuntimeException e) {
      logger.debug("{} Failed to record metric {}", BeaconConstants.LOG_PREFIX, name, e);
    }
  }

  @Override
  public void incrementCounter(String name, long value, Map<String, ?> attributes) {
    try {
      Attributes attrs = AttributeUtils.toAttributes(attributes);
      if (isReady()) {
        applyIncrementCounter(name, value, attrs);
        return;
      }
      if (defer(() -> applyIncrementCounter(name, value, attrs)) == Deferral.APPLY_NOW) {
        applyIncrementCounter(name, value, attrs);
      }
    } catch (RuntimeException e) {
      logger.debug("{} Failed to increment counter {}", BeaconConstants.LOG_PREFIX, name, e);
    }
  }

  // Log API

  @Override
  public void emitLogRecord(String body, Map<String, ?> attributes) {
    try {
      Attributes attrs = AttributeUtils.toAttributes(attributes);
      if (isReady()) {
        applyEmitLogRecord(body, attrs, Instant.now());
        return;
      }
      Instant timestamp = Instant.now();
      if (defer(() -> applyEmitLogRecord(body, attrs, timestamp)) == Deferral.APPLY_NOW) {
        applyEmitLogRecord(body, attrs, timestamp);
      }
    } catch (RuntimeException e) {
      logger.debug("{} Failed to emit log record", BeaconConstants.LOG_PREFIX, e);
    }
  }

  // Lifecycle

  @Override
  public CompletableFuture<Void> flush() {
    OpenTelemetrySdk current = sdk;
    if (current == null) {
      return CompletableFuture.completedFuture(null);
    }
    try {
      return toFuture(
          CompletableResultCode.ofAll(
              Arrays.asList(
                  current.getSdkTracerProvider().forceFlush(),
                  current.getSdkLoggerProvider().forceFlush(),
                  current.getSdkMeterProvider().forceFlush())),
          "flush");
    } catch (RuntimeException e) {
      logger.warn("{} Error flushing telemetry", BeaconConstants.LOG_PREFIX, e);
      return CompletableFuture.completedFuture(null);
    }
  }

  @Override
  public CompletableFuture<Void> shutdown() {
    int discarded;
    synchronized (lock) {
      if (shutdownFuture != null) {
        return shutdownFuture;
      }
      shutdownRequested = true;
      discarded = discardBuffered();
      shutdownFuture = new CompletableFuture<>();
    }
    if (discarded > 0) {
      logger.debug(
          "{} Shutdown discarded {} buffered operations", BeaconConstants.LOG_PREFIX, discarded);
    }

    CompletableFuture<Void> result = shutdownFuture;
    flush()
        .thenCompose(ignored -> shutdownSdk())
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                logger.warn("{} Error during telemetry shutdown", BeaconConstants.LOG_PREFIX, error);
              }
              if (ownedExecutor != null) {
                ownedExecutor.shutdown();
              }
              result.complete(null);
            });
    return result;
  }

  // Initialization

  private void initialize() {
    CompletableFuture<ExporterSet> exporters;
    try {
      exporters = exporterFactory.create(config);
      if (exporters == null) {
        throw new IllegalStateException("Exporter factory returned no exporters");
      }
    } catch (Exception | LinkageError e) {
      fail(e);
      return;
    }

    exporters.whenComplete(
        (exporterSet, error) -> {
          if (error != null) {
            fail(unwrap(error));
          } else {
            runOnExecutor(() -> completeInitialization(exporterSet));
          }
        });
  }

  private void completeInitialization(ExporterSet exporters) {
    if (shutdownRequested) {
      abandon(exporters.shutdown());
      return;
    }

    OpenTelemetrySdk built;
    try {
      built = buildSdk(exporters);
    } catch (Exception | LinkageError e) {
      exporters.shutdown();
      fail(e);
      return;
    }

    synchronized (lock) {
      if (!shutdownRequested) {
        sdk = built;
        tracer = built.getTracer(config.getServiceName(), config.getServiceVersion());
        metrics =
            new MetricInstrumentCache(
                built
                    .getMeterProvider()
                    .meterBuilder(config.getServiceName())
                    .setInstrumentationVersion(config.getServiceVersion())
                    .build());
        otelLogger =
            built
                .getLogsBridge()
                .loggerBuilder(config.getServiceName())
                .setInstrumentationVersion(config.getServiceVersion())
                .build();
      }
    }
    if (sdk == null) {
      abandon(built.shutdown());
      return;
    }

    registerGlobal(built);
    logger.debug("{} OpenTelemetry SDK initialized", BeaconConstants.LOG_PREFIX);
    drainNextChunk();
  }

  private OpenTelemetrySdk buildSdk(ExporterSet exporters) {
    ResourceBuilder resourceBuilder =
        Resource.getDefault().toBuilder()
            .put(BeaconConstants.SERVICE_NAME_ATTRIBUTE, config.getServiceName())
            .put(BeaconConstants.SERVICE_VERSION_ATTRIBUTE, config.getServiceVersion())
            .put(BeaconConstants.SESSION_ID_ATTRIBUTE, config.getSessionId());
    config.getResourceAttributes().forEach(resourceBuilder::put);
    Resource resource = resourceBuilder.build();

    Duration batchDelay = Duration.ofMillis(config.getBatchScheduleDelayMillis());

    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(
                BatchSpanProcessor.builder(
                        new DiagnosticSpanExporter(
                            exporters.getSpanExporter(), config.getExporterType().getId()))
                    .setScheduleDelay(batchDelay)
                    .build())
            .build();

    SdkLoggerProvider loggerProvider =
        SdkLoggerProvider.builder()
            .setResource(resource)
            .addLogRecordProcessor(
                BatchLogRecordProcessor.builder(exporters.getLogExporter())
                    .setScheduleDelay(batchDelay)
                    .build())
            .build();

    SdkMeterProvider meterProvider =
        SdkMeterProvider.builder()
            .setResource(resource)
            .registerMetricReader(
                PeriodicMetricReader.builder(exporters.getMetricExporter())
                    .setInterval(Duration.ofMillis(config.getMetricExportIntervalMillis()))
                    .build())
            .build();

    return OpenTelemetrySdk.builder()
        .setTracerProvider(tracerProvider)
        .setLoggerProvider(loggerProvider)
        .setMeterProvider(meterProvider)
        .build();
  }

  private void registerGlobal(OpenTelemetrySdk built) {
    try {
      GlobalOpenTelemetry.set(built);
    } catch (IllegalStateException e) {
      // Another instance is already global; this service keeps using its own
      logger.debug("{} Global OpenTelemetry already set", BeaconConstants.LOG_PREFIX);
    }
  }

  private void drainNextChunk() {
    List<Runnable> chunk = null;
    synchronized (lock) {
      if (shutdownRequested) {
        state = ServiceState.FAILED;
        discardBuffered();
      } else {
        chunk = buffer.takeChunk(BeaconConstants.DRAIN_CHUNK_SIZE);
        if (chunk.isEmpty()) {
          state = ServiceState.READY;
          bufferedHandles.clear();
        }
      }
    }
    if (chunk == null) {
      logger.debug("{} Telemetry shut down while draining", BeaconConstants.LOG_PREFIX);
      initialization.complete(ServiceState.FAILED);
      return;
    }
    if (chunk.isEmpty()) {
      logger.debug("{} Telemetry ready", BeaconConstants.LOG_PREFIX);
      initialization.complete(ServiceState.READY);
      return;
    }

    for (Runnable operation : chunk) {
      try {
        operation.run();
      } catch (RuntimeException e) {
        logger.debug("{} Buffered telemetry operation failed", BeaconConstants.LOG_PREFIX, e);
      }
    }
    // Yield between chunks
    runOnExecutor(this::drainNextChunk);
  }

  private void fail(Throwable error) {
    int discarded;
    synchronized (lock) {
      state = ServiceState.FAILED;
      discarded = discardBuffered();
    }
    logger.error(
        "{} Failed to initialize telemetry, {} buffered operations discarded",
        BeaconConstants.LOG_PREFIX,
        discarded,
        error);
    initialization.complete(ServiceState.FAILED);
  }

  // Shut down before initialization finished: release what was built and stay inert
  private void abandon(CompletableResultCode release) {
    synchronized (lock) {
      state = ServiceState.FAILED;
      discardBuffered();
    }
    logger.debug("{} Telemetry shut down before initialization completed", BeaconConstants.LOG_PREFIX);
    release.whenComplete(() -> initialization.complete(ServiceState.FAILED));
  }

  // Caller holds the lock
  private int discardBuffered() {
    for (BufferedSpanHandle handle : bufferedHandles) {
      handle.discard();
    }
    bufferedHandles.clear();
    return buffer.clear();
  }

  private void runOnExecutor(Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      if (shutdownRequested) {
        task.run();
      } else {
        fail(e);
      }
    }
  }

  // Deferral

  private enum Deferral {
    APPLY_NOW,
    BUFFERED,
    DROPPED
  }

  private Deferral defer(Runnable operation) {
    return defer(operation, null);
  }

  private Deferral defer(Runnable operation, BufferedSpanHandle handle) {
    synchronized (lock) {
      if (shutdownRequested) {
        return Deferral.DROPPED;
      }
      if (state == ServiceState.READY) {
        return Deferral.APPLY_NOW;
      }
      if (state == ServiceState.INITIALIZING && buffer.offer(operation)) {
        if (handle != null) {
          bufferedHandles.add(handle);
        }
        return Deferral.BUFFERED;
      }
      return Deferral.DROPPED;
    }
  }

  private boolean isReady() {
    return state == ServiceState.READY && !shutdownRequested;
  }

  // Backend operations

  private SpanHandle createSpan(
      String name, SpanOptions options, Context parent, Instant startTime) {
    try {
      SpanBuilder builder =
          tracer
              .spanBuilder(name)
              .setSpanKind(options.getKind().toOtel())
              .setAllAttributes(AttributeUtils.toAttributes(options.getAttributes()));
      if (parent != null) {
        builder.setParent(parent);
      }
      if (startTime != null) {
        builder.setStartTimestamp(startTime);
      }
      return new OtelSpanHandle(builder.startSpan());
    } catch (RuntimeException e) {
      logger.debug("{} Failed to start span {}", BeaconConstants.LOG_PREFIX, name, e);
      return NoopSpanHandle.INSTANCE;
    }
  }

  private void applyRecordMetric(String name, double value, Attributes attributes) {
    metrics.record(name, value, attributes);
  }

  private void applyIncrementCounter(String name, long value, Attributes attributes) {
    metrics.add(name, value, attributes);
  }

  private void applyEmitLogRecord(String body, Attributes attributes, Instant timestamp) {
    otelLogger
        .logRecordBuilder()
        .setTimestamp(timestamp)
        .setBody(body != null ? body : "")
        .setAllAttributes(attributes)
        .emit();
  }

  private static Scope makeCurrent(SpanHandle handle) {
    if (handle instanceof OtelSpanHandle) {
      return ((OtelSpanHandle) handle).getSpan().makeCurrent();
    }
    return null;
  }

  private static void closeQuietly(Scope scope) {
    if (scope != null) {
      scope.close();
    }
  }

  private CompletableFuture<Void> shutdownSdk() {
    OpenTelemetrySdk current = sdk;
    if (current == null) {
      return CompletableFuture.completedFuture(null);
    }
    try {
      return toFuture(current.shutdown(), "shutdown");
    } catch (RuntimeException e) {
      logger.warn("{} Error shutting down OpenTelemetry SDK", BeaconConstants.LOG_PREFIX, e);
      return CompletableFuture.completedFuture(null);
    }
  }

  private static CompletableFuture<Void> toFuture(CompletableResultCode code, String operation) {
    CompletableFuture<Void> future = new CompletableFuture<>();
    code.whenComplete(
        () -> {
          if (!code.isSuccess()) {
            logger.warn(
                "{} Telemetry {} did not complete successfully",
                BeaconConstants.LOG_PREFIX,
                operation);
          }
          future.complete(null);
        });
    return future;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
