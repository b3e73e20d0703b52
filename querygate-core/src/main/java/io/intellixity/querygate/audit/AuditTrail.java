package io.intellixity.querygate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.util.Hashes;

import java.time.Instant;
import java.util.*;

/**
 * Hash-chained audit writer.
 * <p>
 * Chains are per request, so concurrent requests never contend with each other; only the sink sees
 * appends from every request.
 */
public final class AuditTrail {
  private final AuditSink sink;
  private final ObjectMapper canonical;

  public AuditTrail(AuditSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.canonical = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  public RequestAudit forRequest(String requestId) {
    return new RequestAudit(Objects.requireNonNull(requestId, "requestId"));
  }

  /** True when every record's hash matches its content and links to its predecessor. */
  public boolean verifyChain(List<AuditRecord> records) {
    String prev = "";
    int seq = 0;
    for (AuditRecord r : records) {
      if (r.sequence() != seq++) return false;
      if (!prev.equals(r.previousHash())) return false;
      String expected = hash(r.requestId(), r.sequence(), r.stage(), r.userId(), r.tenant(), r.roles(),
          r.timestamp(), r.summary(), r.previousHash());
      if (!expected.equals(r.payloadHash())) return false;
      prev = r.payloadHash();
    }
    return true;
  }

  private String hash(String requestId, int sequence, AuditStage stage, String userId, String tenant,
                      Set<String> roles, Instant ts, Map<String, Object> summary, String previousHash) {
    Map<String, Object> m = new TreeMap<>();
    m.put("requestId", requestId);
    m.put("sequence", sequence);
    m.put("stage", stage.name());
    m.put("userId", userId);
    m.put("tenant", tenant);
    m.put("roles", new TreeSet<>(roles));
    m.put("timestamp", ts.toString());
    m.put("summary", new TreeMap<>(summary));
    m.put("previousHash", previousHash);
    try {
      return Hashes.sha256Hex(canonical.writeValueAsBytes(m));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Audit summary is not serializable: " + e.getOriginalMessage(), e);
    }
  }

  /** Audit handle bound to one request. */
  public final class RequestAudit {
    private final String requestId;
    private int sequence;
    private String previousHash = "";

    private RequestAudit(String requestId) {
      this.requestId = requestId;
    }

    public String requestId() { return requestId; }

    public synchronized AuditRecord record(AuditStage stage, Map<String, Object> payloadSummary,
                                           Identity identity, Instant timestamp) {
      Objects.requireNonNull(stage, "stage");
      Objects.requireNonNull(timestamp, "timestamp");
      Map<String, Object> summary = payloadSummary == null ? Map.of() : new TreeMap<>(payloadSummary);
      String userId = identity == null ? null : identity.userId();
      String tenant = identity == null ? null : identity.tenant();
      Set<String> roles = identity == null ? Set.of() : identity.roles();

      String h = hash(requestId, sequence, stage, userId, tenant, roles, timestamp, summary, previousHash);
      AuditRecord r = new AuditRecord(requestId + "-" + sequence, requestId, sequence, stage,
          userId, tenant, roles, timestamp, summary, previousHash, h);
      sink.append(r);
      sequence++;
      previousHash = h;
      return r;
    }
  }
}
