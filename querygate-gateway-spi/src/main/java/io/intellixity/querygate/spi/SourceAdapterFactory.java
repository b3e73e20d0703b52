package io.intellixity.querygate.spi;

@FunctionalInterface
public interface SourceAdapterFactory {
  SourceAdapter<?> create(String sourceFamily, SourceHandle<?> handle);
}
