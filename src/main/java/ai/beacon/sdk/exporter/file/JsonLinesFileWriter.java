package ai.beacon.sdk.exporter.file;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Append-only writer for newline-delimited JSON.
 *
 * <p>The file is opened in append mode so repeated runs accumulate. Every {@link #writeLines}
 * call is flushed before it returns.
 *
 * <p>One instance may be shared by several exporters writing to the same path, so that whole
 * batches from different signals never interleave. Each sharer takes a reference with {@link
 * #retain()} and gives it back with {@link #close()}. The file is closed with the last reference.
 */
public class JsonLinesFileWriter implements Closeable {
  private final Path path;
  private final BufferedWriter writer;
  private int references = 1;
  private boolean closed;

  public JsonLinesFileWriter(Path path) throws IOException {
    this.path = path;
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.writer =
        Files.newBufferedWriter(
            path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  public Path getPath() {
    return path;
  }

  public synchronized void writeLines(List<String> lines) throws IOException {
    if (closed) {
      throw new IOException("Writer for " + path + " is closed");
    }
    for (String line : lines) {
      writer.write(line);
      writer.write('\n');
    }
    writer.flush();
  }

  /**
   * Takes another reference to this writer.
   *
   * @throws IllegalStateException if the writer is already closed
   */
  public synchronized JsonLinesFileWriter retain() {
    if (closed) {
      throw new IllegalStateException("Writer for " + path + " is closed");
    }
    references++;
    return this;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    references--;
    if (references > 0) {
      return;
    }
    closed = true;
    writer.close();
  }
}
