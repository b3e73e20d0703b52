package io.intellixity.querygate.spi;

/** Marker for a source-native statement produced by {@link SourceAdapter#translate}. */
public interface NativeStatement {
  /** Statement text without bound values, safe for DEBUG logs and audit summaries. */
  String describe();
}
