package io.intellixity.querygate.spi;

import io.intellixity.querygate.util.LruTtlCache;

import java.util.Objects;

/**
 * Cache-backed resolver that turns (sourceFamily, dataSourceId) into a cached {@link SourceAdapter}.
 * <p>
 * Caches handles by (sourceFamily, dataSourceId) and adapters by (sourceFamily, handle.id). Loaders
 * run outside the cache lock.
 */
public final class SourceAdapterResolver {
  private final SourceHandleResolver handleResolver;
  private final SourceAdapterFactory adapterFactory;

  private final LruTtlCache<HandleKey, SourceHandle<?>> handles;
  private final LruTtlCache<AdapterKey, SourceAdapter<?>> adapters;

  public SourceAdapterResolver(SourceHandleResolver handleResolver,
                               SourceAdapterFactory adapterFactory,
                               int maxEntries,
                               long ttlMillis) {
    this.handleResolver = Objects.requireNonNull(handleResolver, "handleResolver");
    this.adapterFactory = Objects.requireNonNull(adapterFactory, "adapterFactory");
    this.handles = new LruTtlCache<>(maxEntries, ttlMillis, 0);
    this.adapters = new LruTtlCache<>(maxEntries, ttlMillis, 0);
  }

  public SourceAdapter<?> resolve(String sourceFamily, String dataSourceId) {
    Objects.requireNonNull(sourceFamily, "sourceFamily");
    Objects.requireNonNull(dataSourceId, "dataSourceId");
    String family = sourceFamily.trim();
    if (family.isEmpty()) throw new IllegalArgumentException("sourceFamily is blank");

    HandleKey hk = new HandleKey(family, dataSourceId);
    SourceHandle<?> handle = handles.getOrCompute(hk, () -> handleResolver.resolve(family, dataSourceId));
    if (handle == null) throw new IllegalStateException("SourceHandleResolver returned null for " + hk);

    AdapterKey ak = new AdapterKey(family, handle.id());
    SourceAdapter<?> adapter = adapters.getOrCompute(ak, () -> adapterFactory.create(family, handle));
    if (adapter == null) throw new IllegalStateException("SourceAdapterFactory returned null for " + ak);
    if (!family.equals(adapter.family())) {
      throw new IllegalStateException("Adapter family '" + adapter.family() + "' does not serve '" + family + "'");
    }
    return adapter;
  }

  private record HandleKey(String sourceFamily, String dataSourceId) {}
  private record AdapterKey(String sourceFamily, String handleId) {}
}
