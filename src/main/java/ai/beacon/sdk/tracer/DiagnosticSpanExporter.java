package ai.beacon.sdk.tracer;

import ai.beacon.sdk.constants.BeaconConstants;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link SpanExporter} to report export results.
 *
 * <p>Logs once at info on the first successful export and at warn on every failure. The
 * delegate's result is returned unchanged.
 */
public class DiagnosticSpanExporter implements SpanExporter {
  private static final Logger logger = LoggerFactory.getLogger(DiagnosticSpanExporter.class);

  private final SpanExporter delegate;
  private final String exporterType;
  private final AtomicBoolean firstSuccessLogged = new AtomicBoolean(false);

  public DiagnosticSpanExporter(SpanExporter delegate, String exporterType) {
    this.delegate = delegate;
    this.exporterType = exporterType;
  }

  @Override
  public CompletableResultCode export(Collection<SpanData> spans) {
    int count = spans.size();
    CompletableResultCode result = delegate.export(spans);
    result.whenComplete(
        () -> {
          if (result.isSuccess()) {
            if (firstSuccessLogged.compareAndSet(false, true)) {
              logger.info(
                  "{} First span batch exported successfully via {} ({} spans)",
                  BeaconConstants.LOG_PREFIX,
                  exporterType,
                  count);
            }
          } else {
            Throwable error = result.getFailureThrowable();
            logger.warn(
                "{} Span export failed via {}: {}",
                BeaconConstants.LOG_PREFIX,
                exporterType,
                error != null ? error.toString() : "unknown error");
          }
        });
    return result;
  }

  @Override
  public CompletableResultCode flush() {
    return delegate.flush();
  }

  @Override
  public CompletableResultCode shutdown() {
    return delegate.shutdown();
  }

  @Override
  public String toString() {
    return "DiagnosticSpanExporter{delegate=" + delegate + ", exporterType=" + exporterType + "}";
  }
}
