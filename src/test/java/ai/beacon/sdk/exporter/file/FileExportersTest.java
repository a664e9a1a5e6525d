package ai.beacon.sdk.exporter.file;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.SdkLoggerProvider;
import io.opentelemetry.sdk.logs.export.SimpleLogRecordProcessor;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileExportersTest {
  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final Resource RESOURCE =
      Resource.create(Attributes.of(AttributeKey.stringKey("service.name"), "file-test"));

  @TempDir Path tempDir;

  private static List<JsonNode> readLines(Path path) throws IOException {
    List<JsonNode> nodes = new ArrayList<>();
    for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
      nodes.add(objectMapper.readTree(line));
    }
    return nodes;
  }

  private static void writeSpans(Path path, String... names) throws IOException {
    FileSpanExporter exporter = new FileSpanExporter(path);
    try (SdkTracerProvider provider =
        SdkTracerProvider.builder()
            .setResource(RESOURCE)
            .addSpanProcessor(SimpleSpanProcessor.create(exporter))
            .build()) {
      for (String name : names) {
        provider.get("file-test").spanBuilder(name).startSpan().end();
      }
    }
  }

  @Test
  void eachSpanIsOneJsonLineInOrder() throws IOException {
    Path path = tempDir.resolve("spans.jsonl");

    writeSpans(path, "first", "second", "third");

    List<JsonNode> lines = readLines(path);
    assertThat(lines).hasSize(3);
    assertThat(lines)
        .extracting(node -> node.get("name").asText())
        .containsExactly("first", "second", "third");
    JsonNode first = lines.get(0);
    assertThat(first.get("kind").asText()).isEqualTo("INTERNAL");
    assertThat(first.get("traceId").asText()).hasSize(32);
    assertThat(first.get("spanId").asText()).hasSize(16);
    assertThat(first.get("parentSpanId").isNull()).isTrue();
    assertThat(first.get("status").get("code").asText()).isEqualTo("UNSET");
    assertThat(first.get("resource").get("service.name").asText()).isEqualTo("file-test");
  }

  @Test
  void fileIsAppendedAcrossExporters() throws IOException {
    Path path = tempDir.resolve("append.jsonl");

    writeSpans(path, "run-1");
    writeSpans(path, "run-2");

    assertThat(readLines(path))
        .extracting(node -> node.get("name").asText())
        .containsExactly("run-1", "run-2");
  }

  @Test
  void childSpanRecordsParentAndAttributes() throws IOException {
    Path path = tempDir.resolve("child.jsonl");
    FileSpanExporter exporter = new FileSpanExporter(path);
    try (SdkTracerProvider provider =
        SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build()) {
      Span parent = provider.get("file-test").spanBuilder("parent").startSpan();
      try (Scope ignored = parent.makeCurrent()) {
        provider
            .get("file-test")
            .spanBuilder("child")
            .setAttribute("count", 2L)
            .startSpan()
            .addEvent("checkpoint")
            .end();
      }
      parent.end();
    }

    List<JsonNode> lines = readLines(path);
    JsonNode child = lines.get(0);
    JsonNode parent = lines.get(1);
    assertThat(child.get("parentSpanId").asText()).isEqualTo(parent.get("spanId").asText());
    assertThat(child.get("attributes").get("count").asLong()).isEqualTo(2L);
    assertThat(child.get("events").get(0).get("name").asText()).isEqualTo("checkpoint");
  }

  @Test
  void logRecordsAreOneLineEach() throws IOException {
    Path path = tempDir.resolve("logs.jsonl");
    FileLogRecordExporter exporter = new FileLogRecordExporter(path);
    try (SdkLoggerProvider provider =
        SdkLoggerProvider.builder()
            .setResource(RESOURCE)
            .addLogRecordProcessor(SimpleLogRecordProcessor.create(exporter))
            .build()) {
      provider
          .get("file-test")
          .logRecordBuilder()
          .setBody("hello")
          .setAttribute(AttributeKey.stringKey("user"), "u-1")
          .emit();
      provider.get("file-test").logRecordBuilder().setBody("world").emit();
    }

    List<JsonNode> lines = readLines(path);
    assertThat(lines)
        .extracting(node -> node.get("body").asText())
        .containsExactly("hello", "world");
    assertThat(lines.get(0).get("attributes").get("user").asText()).isEqualTo("u-1");
    assertThat(lines.get(0).get("instrumentationScope").asText()).isEqualTo("file-test");
  }

  @Test
  void metricBatchIsOneLine() throws IOException {
    Path path = tempDir.resolve("metrics.jsonl");
    FileMetricExporter exporter = new FileMetricExporter(path);
    try (SdkMeterProvider provider =
        SdkMeterProvider.builder()
            .setResource(RESOURCE)
            .registerMetricReader(PeriodicMetricReader.create(exporter))
            .build()) {
      provider.get("file-test").counterBuilder("requests").build().add(3);
      provider.get("file-test").histogramBuilder("latency").build().record(12.5);
      provider.forceFlush().join(5, TimeUnit.SECONDS);
    }

    List<JsonNode> lines = readLines(path);
    // forceFlush and the final export on close
    assertThat(lines).isNotEmpty();
    JsonNode batch = lines.get(0);
    assertThat(batch.get("resource").get("service.name").asText()).isEqualTo("file-test");
    List<String> names = new ArrayList<>();
    for (JsonNode metric : batch.get("metrics")) {
      names.add(metric.get("name").asText());
      if (metric.get("name").asText().equals("requests")) {
        assertThat(metric.get("points").get(0).get("value").asLong()).isEqualTo(3L);
      } else {
        assertThat(metric.get("points").get(0).get("count").asLong()).isEqualTo(1L);
        assertThat(metric.get("points").get(0).get("sum").asDouble()).isEqualTo(12.5);
      }
    }
    assertThat(names).containsExactlyInAnyOrder("requests", "latency");
  }

  @Test
  void exportAfterShutdownFails() throws IOException {
    FileSpanExporter exporter = new FileSpanExporter(tempDir.resolve("closed.jsonl"));

    assertThat(exporter.shutdown().isSuccess()).isTrue();

    CompletableResultCode result = exporter.export(new ArrayList<>());
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getFailureThrowable()).isInstanceOf(IOException.class);
    assertThat(exporter.shutdown().isSuccess()).isTrue();
  }

  @Test
  void unserializableValueBecomesEmptyObject() {
    Object selfReferencing =
        new Object() {
          @SuppressWarnings("unused")
          public Object getSelf() {
            return this;
          }
        };

    assertThat(TelemetryJson.safeStringify(selfReferencing)).isEqualTo("{}");
  }

  @Test
  void writerCreatesParentDirectories() throws IOException {
    Path path = tempDir.resolve("a/b/c.jsonl");
    try (JsonLinesFileWriter writer = new JsonLinesFileWriter(path)) {
      writer.writeLines(List.of("{\"n\":1}", "{\"n\":2}"));
      assertThat(writer.isClosed()).isFalse();
    }

    assertThat(Files.readAllLines(path)).containsExactly("{\"n\":1}", "{\"n\":2}");
  }

  @Test
  void sharedWriterStaysOpenUntilLastExporterShutsDown() throws IOException {
    Path path = tempDir.resolve("shared.jsonl");
    FileSpanExporter spanExporter;
    FileLogRecordExporter logExporter;
    try (JsonLinesFileWriter writer = new JsonLinesFileWriter(path)) {
      spanExporter = new FileSpanExporter(writer);
      logExporter = new FileLogRecordExporter(writer);
    }

    assertThat(spanExporter.shutdown().isSuccess()).isTrue();
    assertThat(spanExporter.shutdown().isSuccess()).isTrue();
    assertThat(logExporter.export(new ArrayList<>()).isSuccess()).isTrue();

    assertThat(logExporter.shutdown().isSuccess()).isTrue();
    CompletableResultCode afterClose = logExporter.export(new ArrayList<>());
    assertThat(afterClose.isSuccess()).isFalse();
    assertThat(afterClose.getFailureThrowable()).isInstanceOf(IOException.class);
  }

  @Test
  void concurrentWritersOnOnePathNeverTearLines() throws Exception {
    Path path = tempDir.resolve("concurrent.jsonl");
    String payload = "x".repeat(20_000);
    int writesPerThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try (JsonLinesFileWriter writer = new JsonLinesFileWriter(path)) {
      List<Future<?>> results = new ArrayList<>();
      for (String signal : List.of("span", "log")) {
        JsonLinesFileWriter shared = writer.retain();
        results.add(
            pool.submit(
                () -> {
                  try (JsonLinesFileWriter own = shared) {
                    for (int i = 0; i < writesPerThread; i++) {
                      own.writeLines(
                          List.of(
                              "{\"signal\":\"" + signal + "\",\"payload\":\"" + payload + "\"}"));
                    }
                  }
                  return null;
                }));
      }
      for (Future<?> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    List<JsonNode> lines = readLines(path);
    assertThat(lines).hasSize(2 * writesPerThread);
    assertThat(lines)
        .allSatisfy(node -> assertThat(node.get("payload").asText()).hasSize(payload.length()));
  }
}
