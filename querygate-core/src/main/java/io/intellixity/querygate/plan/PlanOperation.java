package io.intellixity.querygate.plan;

import java.util.Locale;

/** Verb requested by a candidate plan. Only {@link #isReadOnly() read-only} verbs may execute. */
public enum PlanOperation {
  SELECT(true),
  AGGREGATE(true),
  INSERT(false),
  UPDATE(false),
  DELETE(false),
  UPSERT(false),
  DDL(false),
  ADMIN(false),
  UNKNOWN(false);

  private final boolean readOnly;

  PlanOperation(boolean readOnly) {
    this.readOnly = readOnly;
  }

  public boolean isReadOnly() { return readOnly; }

  /** Maps a free-form verb to an operation; unrecognized verbs become {@link #UNKNOWN}. */
  public static PlanOperation parse(String verb) {
    if (verb == null || verb.isBlank()) return SELECT;
    return switch (verb.trim().toLowerCase(Locale.ROOT)) {
      case "select", "read", "find", "query" -> SELECT;
      case "aggregate", "count", "group" -> AGGREGATE;
      case "insert", "create_row" -> INSERT;
      case "update", "modify", "set" -> UPDATE;
      case "delete", "remove", "truncate" -> DELETE;
      case "upsert", "merge", "replace" -> UPSERT;
      case "create", "drop", "alter", "rename" -> DDL;
      case "grant", "revoke", "admin", "exec", "execute" -> ADMIN;
      default -> UNKNOWN;
    };
  }
}
