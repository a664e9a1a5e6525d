package ai.beacon.sdk.utils;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between plain maps and OpenTelemetry {@link Attributes} */
public final class AttributeUtils {

  private AttributeUtils() {
    // Utility class
  }

  /**
   * Convert a map of attribute values. Strings, integral numbers, floating point numbers, booleans
   * and string collections keep their type; anything else is stored as its {@code toString()}.
   * Null keys and values are skipped.
   */
  public static Attributes toAttributes(Map<String, ?> data) {
    if (data == null || data.isEmpty()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (Map.Entry<String, ?> entry : data.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        put(builder, entry.getKey(), entry.getValue());
      }
    }
    return builder.build();
  }

  /** Store a map in a span as attributes, skipping null values */
  public static void storeInSpan(Map<String, ?> data, Span span) {
    if (data == null || data.isEmpty()) {
      return;
    }
    Attributes attributes = toAttributes(data);
    if (!attributes.isEmpty()) {
      span.setAllAttributes(attributes);
    }
  }

  /** Plain map view of attributes keyed by attribute name, in iteration order */
  public static Map<String, Object> toMap(Attributes attributes) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (attributes != null) {
      attributes.forEach((key, value) -> result.put(key.getKey(), value));
    }
    return result;
  }

  private static void put(AttributesBuilder builder, String key, Object value) {
    if (value instanceof String) {
      builder.put(key, (String) value);
    } else if (value instanceof Boolean) {
      builder.put(key, (Boolean) value);
    } else if (value instanceof Double || value instanceof Float) {
      builder.put(key, ((Number) value).doubleValue());
    } else if (value instanceof Number) {
      builder.put(key, ((Number) value).longValue());
    } else if (value instanceof String[]) {
      builder.put(AttributeKey.stringArrayKey(key), Arrays.asList((String[]) value));
    } else if (value instanceof Collection) {
      List<String> values = new ArrayList<>();
      for (Object item : (Collection<?>) value) {
        values.add(String.valueOf(item));
      }
      builder.put(AttributeKey.stringArrayKey(key), values);
    } else {
      builder.put(key, value.toString());
    }
  }
}
