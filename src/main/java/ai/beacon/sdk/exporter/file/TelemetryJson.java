package ai.beacon.sdk.exporter.file;

import ai.beacon.sdk.utils.AttributeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.sdk.logs.data.LogRecordData;
import io.opentelemetry.sdk.metrics.data.DoublePointData;
import io.opentelemetry.sdk.metrics.data.ExponentialHistogramPointData;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.PointData;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON rendering of spans, log records and metrics for the file exporters */
public final class TelemetryJson {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private TelemetryJson() {
    // Utility class
  }

  /** Serialize to a single line; a value that cannot be serialized becomes {@code {}} */
  public static String safeStringify(Object data) {
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException | RuntimeException e) {
      return "{}";
    }
  }

  public static Map<String, Object> spanToMap(SpanData span) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", span.getName());
    data.put("kind", span.getKind().name());
    data.put("traceId", span.getTraceId());
    data.put("spanId", span.getSpanId());
    data.put(
        "parentSpanId", span.getParentSpanContext().isValid() ? span.getParentSpanId() : null);
    data.put("startTimeUnixNano", span.getStartEpochNanos());
    data.put("endTimeUnixNano", span.getEndEpochNanos());
    data.put("attributes", AttributeUtils.toMap(span.getAttributes()));

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("code", span.getStatus().getStatusCode().name());
    if (!span.getStatus().getDescription().isEmpty()) {
      status.put("message", span.getStatus().getDescription());
    }
    data.put("status", status);

    List<Map<String, Object>> events = new ArrayList<>();
    for (EventData event : span.getEvents()) {
      Map<String, Object> eventData = new LinkedHashMap<>();
      eventData.put("name", event.getName());
      eventData.put("timeUnixNano", event.getEpochNanos());
      eventData.put("attributes", AttributeUtils.toMap(event.getAttributes()));
      events.add(eventData);
    }
    data.put("events", events);
    data.put("instrumentationScope", span.getInstrumentationScopeInfo().getName());
    data.put("resource", resourceToMap(span.getResource()));
    return data;
  }

  @SuppressWarnings("deprecation")
  public static Map<String, Object> logRecordToMap(LogRecordData log) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("timeUnixNano", log.getTimestampEpochNanos());
    data.put("observedTimeUnixNano", log.getObservedTimestampEpochNanos());
    data.put("severityNumber", log.getSeverity().getSeverityNumber());
    data.put("severityText", log.getSeverityText());
    data.put("body", log.getBody().asString());
    data.put("attributes", AttributeUtils.toMap(log.getAttributes()));
    SpanContext spanContext = log.getSpanContext();
    if (spanContext.isValid()) {
      data.put("traceId", spanContext.getTraceId());
      data.put("spanId", spanContext.getSpanId());
    }
    data.put("instrumentationScope", log.getInstrumentationScopeInfo().getName());
    data.put("resource", resourceToMap(log.getResource()));
    return data;
  }

  /** One export batch of metrics as a single object */
  public static Map<String, Object> metricsToMap(Collection<MetricData> metrics) {
    Map<String, Object> data = new LinkedHashMap<>();
    Resource resource = null;
    List<Map<String, Object>> rendered = new ArrayList<>();
    for (MetricData metric : metrics) {
      if (resource == null) {
        resource = metric.getResource();
      }
      rendered.add(metricToMap(metric));
    }
    data.put("resource", resource != null ? resourceToMap(resource) : new LinkedHashMap<>());
    data.put("metrics", rendered);
    return data;
  }

  static Map<String, Object> metricToMap(MetricData metric) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", metric.getName());
    data.put("description", metric.getDescription());
    data.put("unit", metric.getUnit());
    data.put("type", metric.getType().name());
    data.put("instrumentationScope", metric.getInstrumentationScopeInfo().getName());

    List<Map<String, Object>> points = new ArrayList<>();
    for (PointData point : metric.getData().getPoints()) {
      points.add(pointToMap(point));
    }
    data.put("points", points);
    return data;
  }

  private static Map<String, Object> pointToMap(PointData point) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("startTimeUnixNano", point.getStartEpochNanos());
    data.put("timeUnixNano", point.getEpochNanos());
    data.put("attributes", AttributeUtils.toMap(point.getAttributes()));
    if (point instanceof LongPointData) {
      data.put("value", ((LongPointData) point).getValue());
    } else if (point instanceof DoublePointData) {
      data.put("value", ((DoublePointData) point).getValue());
    } else if (point instanceof HistogramPointData) {
      HistogramPointData histogram = (HistogramPointData) point;
      data.put("count", histogram.getCount());
      data.put("sum", histogram.getSum());
      if (histogram.hasMin()) {
        data.put("min", histogram.getMin());
      }
      if (histogram.hasMax()) {
        data.put("max", histogram.getMax());
      }
      data.put("boundaries", histogram.getBoundaries());
      data.put("counts", histogram.getCounts());
    } else if (point instanceof ExponentialHistogramPointData) {
      ExponentialHistogramPointData histogram = (ExponentialHistogramPointData) point;
      data.put("count", histogram.getCount());
      data.put("sum", histogram.getSum());
      data.put("scale", histogram.getScale());
    }
    return data;
  }

  private static Map<String, Object> resourceToMap(Resource resource) {
    return AttributeUtils.toMap(resource.getAttributes());
  }
}
