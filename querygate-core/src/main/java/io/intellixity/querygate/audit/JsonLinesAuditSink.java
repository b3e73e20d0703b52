package io.intellixity.querygate.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/** Append-only JSON-lines file. Each record is flushed before {@link #append} returns. */
public final class JsonLinesAuditSink implements AuditSink, Closeable {
  private final ObjectMapper json = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private final Path file;
  private final BufferedWriter out;

  public JsonLinesAuditSink(Path file) {
    this.file = file;
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot open audit file " + file, e);
    }
  }

  @Override
  public void append(AuditRecord record) {
    try {
      String line = json.writeValueAsString(record);
      synchronized (out) {
        out.write(line);
        out.newLine();
        out.flush();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append audit record " + record.recordId(), e);
    }
  }

  /** Reads the file back; used by tests and offline verification. */
  public List<AuditRecord> readAll() {
    try {
      List<AuditRecord> records = new ArrayList<>();
      for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
        if (!line.isBlank()) records.add(json.readValue(line, AuditRecord.class));
      }
      return records;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read audit file " + file, e);
    }
  }

  @Override
  public void close() throws IOException {
    synchronized (out) {
      out.close();
    }
  }
}
