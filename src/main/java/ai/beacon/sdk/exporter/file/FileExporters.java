package ai.beacon.sdk.exporter.file;

import io.opentelemetry.sdk.common.CompletableResultCode;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

final class FileExporters {

  private FileExporters() {
    // Utility class
  }

  /** Gives back the exporter's reference to a shared writer, once per exporter. */
  static CompletableResultCode release(JsonLinesFileWriter writer, AtomicBoolean released) {
    if (!released.compareAndSet(false, true)) {
      return CompletableResultCode.ofSuccess();
    }
    try {
      writer.close();
      return CompletableResultCode.ofSuccess();
    } catch (IOException e) {
      return CompletableResultCode.ofExceptionalFailure(e);
    }
  }
}
