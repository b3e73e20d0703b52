package io.intellixity.querygate.server.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.querygate.jdbc.JdbcHandle;
import io.intellixity.querygate.jdbc.JdbcSourceAdapter;
import io.intellixity.querygate.mongo.MongoHandle;
import io.intellixity.querygate.mongo.MongoSourceAdapter;
import io.intellixity.querygate.spi.SourceHandle;
import io.intellixity.querygate.spi.SourceHandleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves configured data sources to live handles: one read-only Hikari pool per relational source and
 * one {@link MongoClient} per document source, created on first use and closed with the context.
 */
public final class DataSourceHandles implements SourceHandleResolver, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DataSourceHandles.class);

  private final Map<String, QuerygateProperties.DataSourceProps> sources;
  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();
  private final Map<String, MongoClient> mongoClients = new ConcurrentHashMap<>();

  public DataSourceHandles(Map<String, QuerygateProperties.DataSourceProps> sources) {
    this.sources = Map.copyOf(Objects.requireNonNull(sources, "sources"));
  }

  @Override
  public SourceHandle<?> resolve(String sourceFamily, String dataSourceId) {
    Objects.requireNonNull(sourceFamily, "sourceFamily");
    QuerygateProperties.DataSourceProps p = sources.get(dataSourceId);
    if (p == null) throw new IllegalArgumentException("Unknown data source: " + dataSourceId);
    if (!Objects.equals(p.getFamily(), sourceFamily)) {
      throw new IllegalArgumentException("Data source " + dataSourceId + " is configured as family=" + p.getFamily()
          + " but the schema says " + sourceFamily);
    }
    return switch (sourceFamily) {
      case JdbcSourceAdapter.FAMILY -> new JdbcHandle("jdbc:" + dataSourceId,
          pools.computeIfAbsent(dataSourceId, k -> pool(k, p)), p.getSchema());
      case MongoSourceAdapter.FAMILY -> new MongoHandle("mongo:" + dataSourceId,
          mongoClients.computeIfAbsent(dataSourceId, k -> mongo(k, p)), p.getDatabase());
      default -> throw new IllegalArgumentException("Unsupported source family: " + sourceFamily);
    };
  }

  private static HikariDataSource pool(String id, QuerygateProperties.DataSourceProps p) {
    if (p.getJdbcUrl() == null || p.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing jdbcUrl for data source " + id);
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("querygate-" + id);
    hc.setJdbcUrl(p.getJdbcUrl());
    hc.setUsername(p.getUsername());
    hc.setPassword(p.getPassword());
    hc.setMaximumPoolSize(p.getMaxPoolSize());
    hc.setReadOnly(true);
    hc.setAutoCommit(false);
    log.info("querygate.datasource op=open_pool id={} maxPoolSize={}", id, p.getMaxPoolSize());
    return new HikariDataSource(hc);
  }

  private static MongoClient mongo(String id, QuerygateProperties.DataSourceProps p) {
    if (p.getMongoUri() == null || p.getMongoUri().isBlank()) {
      throw new IllegalArgumentException("Missing mongoUri for data source " + id);
    }
    log.info("querygate.datasource op=open_mongo id={} database={}", id, p.getDatabase());
    return MongoClients.create(p.getMongoUri());
  }

  @Override
  public void close() {
    pools.forEach((id, ds) -> ds.close());
    mongoClients.forEach((id, c) -> c.close());
    pools.clear();
    mongoClients.clear();
  }
}
