package io.intellixity.querygate.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/** Keeps every record in memory, keyed by request id. */
public final class InMemoryAuditSink implements AuditSink {
  private final ConcurrentLinkedQueue<AuditRecord> all = new ConcurrentLinkedQueue<>();
  private final Map<String, ConcurrentLinkedQueue<AuditRecord>> byRequest = new ConcurrentHashMap<>();

  @Override
  public void append(AuditRecord record) {
    all.add(record);
    byRequest.computeIfAbsent(record.requestId(), k -> new ConcurrentLinkedQueue<>()).add(record);
  }

  public List<AuditRecord> records() { return List.copyOf(all); }

  public List<AuditRecord> recordsFor(String requestId) {
    ConcurrentLinkedQueue<AuditRecord> q = byRequest.get(requestId);
    return q == null ? List.of() : new ArrayList<>(q);
  }

  public boolean hasStage(String requestId, AuditStage stage) {
    for (AuditRecord r : recordsFor(requestId)) {
      if (r.stage() == stage) return true;
    }
    return false;
  }
}
