package io.intellixity.querygate.schema;

public final class SchemaSnapshotNotFoundException extends RuntimeException {
  public SchemaSnapshotNotFoundException(String message) {
    super(message);
  }
}
