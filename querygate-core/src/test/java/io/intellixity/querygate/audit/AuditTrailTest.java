package io.intellixity.querygate.audit;

import io.intellixity.querygate.model.Identity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class AuditTrailTest {
  private static final Identity ANALYST = new Identity("u1", "t1", Set.of("analyst"), Set.of());

  @Test
  void chainsRecordsPerRequest() {
    InMemoryAuditSink sink = new InMemoryAuditSink();
    AuditTrail trail = new AuditTrail(sink);

    AuditTrail.RequestAudit a = trail.forRequest("req-a");
    AuditTrail.RequestAudit b = trail.forRequest("req-b");
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    a.record(AuditStage.CLASSIFICATION, Map.of("category", "DATA_QUERY"), ANALYST, now);
    b.record(AuditStage.CLASSIFICATION, Map.of("category", "SAFE_KNOWLEDGE"), ANALYST, now);
    a.record(AuditStage.DECISION, Map.of("outcome", "ALLOW_WITH_AUTH"), ANALYST, now.plusMillis(3));

    List<AuditRecord> ra = sink.recordsFor("req-a");
    assertEquals(2, ra.size());
    assertEquals("", ra.get(0).previousHash());
    assertEquals(ra.get(0).payloadHash(), ra.get(1).previousHash());
    assertEquals(1, sink.recordsFor("req-b").size());
    assertTrue(trail.verifyChain(ra));
    assertTrue(sink.hasStage("req-a", AuditStage.DECISION));
    assertFalse(sink.hasStage("req-b", AuditStage.DECISION));
  }

  @Test
  void detectsTampering() {
    InMemoryAuditSink sink = new InMemoryAuditSink();
    AuditTrail trail = new AuditTrail(sink);
    AuditTrail.RequestAudit a = trail.forRequest("req");
    Instant now = Instant.now();
    a.record(AuditStage.CLASSIFICATION, Map.of("category", "OUT_OF_SCOPE"), ANALYST, now);
    a.record(AuditStage.DECISION, Map.of("outcome", "DENY"), ANALYST, now);

    List<AuditRecord> records = new ArrayList<>(sink.recordsFor("req"));
    AuditRecord d = records.get(1);
    records.set(1, new AuditRecord(d.recordId(), d.requestId(), d.sequence(), d.stage(), d.userId(), d.tenant(),
        d.roles(), d.timestamp(), Map.of("outcome", "ALLOW_WITH_AUTH"), d.previousHash(), d.payloadHash()));
    assertFalse(trail.verifyChain(records));
  }

  @Test
  void jsonLinesSinkRoundTripsAndVerifies(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("audit.jsonl");
    AuditTrail trail;
    try (JsonLinesAuditSink sink = new JsonLinesAuditSink(file)) {
      trail = new AuditTrail(sink);
      AuditTrail.RequestAudit a = trail.forRequest("req-1");
      a.record(AuditStage.CLASSIFICATION, Map.of("category", "DATA_QUERY", "confidence", "0.9"), ANALYST,
          Instant.parse("2026-03-01T10:00:00Z"));
      a.record(AuditStage.DECISION, Map.of("outcome", "DENY"), ANALYST, Instant.parse("2026-03-01T10:00:01Z"));

      List<AuditRecord> back = sink.readAll();
      assertEquals(2, back.size());
      assertEquals(AuditStage.DECISION, back.get(1).stage());
      assertTrue(trail.verifyChain(back));
    }
  }
}
