package io.intellixity.querygate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes each record as one JSON line to the {@code querygate.audit} logger. */
public final class Slf4jAuditSink implements AuditSink {
  private static final Logger audit = LoggerFactory.getLogger("querygate.audit");

  private final ObjectMapper json = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  @Override
  public void append(AuditRecord record) {
    try {
      audit.info(json.writeValueAsString(record));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize audit record " + record.recordId(), e);
    }
  }
}
