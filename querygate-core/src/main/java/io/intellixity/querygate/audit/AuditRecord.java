package io.intellixity.querygate.audit;

import java.time.Instant;
import java.util.*;

/**
 * One immutable stage transition of one request.
 * <p>
 * {@code payloadHash} covers every other field; {@code previousHash} is the payload hash of the
 * preceding record of the same request (empty for the first one).
 */
public record AuditRecord(String recordId,
                          String requestId,
                          int sequence,
                          AuditStage stage,
                          String userId,
                          String tenant,
                          Set<String> roles,
                          Instant timestamp,
                          Map<String, Object> summary,
                          String previousHash,
                          String payloadHash) {
  public AuditRecord {
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(timestamp, "timestamp");
    roles = roles == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(roles));
    summary = summary == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(summary));
    previousHash = previousHash == null ? "" : previousHash;
    Objects.requireNonNull(payloadHash, "payloadHash");
  }
}
