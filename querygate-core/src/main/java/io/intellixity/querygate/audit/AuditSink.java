package io.intellixity.querygate.audit;

/** Append-only destination for audit records. Implementations must accept concurrent appends. */
@FunctionalInterface
public interface AuditSink {
  void append(AuditRecord record);
}
