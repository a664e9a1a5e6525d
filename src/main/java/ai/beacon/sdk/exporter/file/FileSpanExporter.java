package ai.beacon.sdk.exporter.file;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** Writes each finished span as one JSON line */
public class FileSpanExporter implements SpanExporter {
  private final JsonLinesFileWriter writer;
  private final AtomicBoolean released = new AtomicBoolean();

  public FileSpanExporter(Path path) throws IOException {
    this.writer = new JsonLinesFileWriter(path);
  }

  /** Writes through a writer shared with other exporters, taking a reference to it. */
  public FileSpanExporter(JsonLinesFileWriter writer) {
    this.writer = writer.retain();
  }

  @Override
  public CompletableResultCode export(Collection<SpanData> spans) {
    List<String> lines = new ArrayList<>(spans.size());
    for (SpanData span : spans) {
      lines.add(TelemetryJson.safeStringify(TelemetryJson.spanToMap(span)));
    }
    try {
      writer.writeLines(lines);
      return CompletableResultCode.ofSuccess();
    } catch (IOException e) {
      return CompletableResultCode.ofExceptionalFailure(e);
    }
  }

  @Override
  public CompletableResultCode flush() {
    return CompletableResultCode.ofSuccess();
  }

  @Override
  public CompletableResultCode shutdown() {
    return FileExporters.release(writer, released);
  }

  @Override
  public String toString() {
    return "FileSpanExporter{path=" + writer.getPath() + "}";
  }
}
