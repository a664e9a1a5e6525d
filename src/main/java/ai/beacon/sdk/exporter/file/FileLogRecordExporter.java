package ai.beacon.sdk.exporter.file;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.data.LogRecordData;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/** Writes each log record as one JSON line */
public class FileLogRecordExporter implements LogRecordExporter {
  private final JsonLinesFileWriter writer;
  private final AtomicBoolean released = new AtomicBoolean();

  public FileLogRecordExporter(Path path) throws IOException {
    this.writer = new JsonLinesFileWriter(path);
  }

  /** Writes through a writer shared with other exporters, taking a reference to it. */
  public FileLogRecordExporter(JsonLinesFileWriter writer) {
    this.writer = writer.retain();
  }

  @Override
  public CompletableResultCode export(Collection<LogRecordData> logs) {
    List<String> lines = new ArrayList<>(logs.size());
    for (LogRecordData log : logs) {
      lines.add(TelemetryJson.safeStringify(TelemetryJson.logRecordToMap(log)));
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
    return "FileLogRecordExporter{path=" + writer.getPath() + "}";
  }
}
