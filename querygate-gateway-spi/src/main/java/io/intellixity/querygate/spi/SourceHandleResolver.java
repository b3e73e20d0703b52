package io.intellixity.querygate.spi;

/** Application-implemented lookup from data source id to its runtime handle. */
@FunctionalInterface
public interface SourceHandleResolver {
  SourceHandle<?> resolve(String sourceFamily, String dataSourceId);
}
