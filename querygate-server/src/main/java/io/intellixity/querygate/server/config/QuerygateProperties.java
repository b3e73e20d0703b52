package io.intellixity.querygate.server.config;

import io.intellixity.querygate.model.IntentCategory;
import io.intellixity.querygate.spi.MaskingStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "querygate")
public class QuerygateProperties {
  private final Model model = new Model();
  private final Classifier classifier = new Classifier();
  private final Execution execution = new Execution();
  private final Policy policy = new Policy();
  private final Schema schema = new Schema();
  private final Audit audit = new Audit();
  /** Sensitivity tag to masking strategy; untagged entries fall back to REDACT. */
  private final Map<String, MaskingStrategy> masking = new HashMap<>();
  /** Sensitivity tag to the entitlement that unlocks it; unmapped tags require an entitlement of the same name. */
  private final Map<String, String> tagEntitlements = new HashMap<>();
  /** Data source id to connection settings. */
  private final Map<String, DataSourceProps> dataSources = new LinkedHashMap<>();

  public Model getModel() { return model; }
  public Classifier getClassifier() { return classifier; }
  public Execution getExecution() { return execution; }
  public Policy getPolicy() { return policy; }
  public Schema getSchema() { return schema; }
  public Audit getAudit() { return audit; }
  public Map<String, MaskingStrategy> getMasking() { return masking; }
  public Map<String, String> getTagEntitlements() { return tagEntitlements; }
  public Map<String, DataSourceProps> getDataSources() { return dataSources; }

  public static class Model {
    /** OpenAI-compatible base URL; when blank the keyword classifier is used and no plans can be generated. */
    private String baseUrl;
    private String apiKey;
    private String name = "gpt-4o-mini";
    /** Connect and read timeout of every model call. */
    private Duration timeout = Duration.ofSeconds(20);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public boolean isConfigured() { return baseUrl != null && !baseUrl.isBlank(); }
  }

  public static class Classifier {
    private Duration timeout = Duration.ofSeconds(5);
    private Map<String, IntentCategory> aliases = new HashMap<>();

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Map<String, IntentCategory> getAliases() { return aliases; }
    public void setAliases(Map<String, IntentCategory> aliases) { this.aliases = aliases; }
  }

  public static class Execution {
    private Duration timeout = Duration.ofSeconds(10);
    private int maxRows = 1000;
    private int maxRetries = 1;
    private Duration retryBackoff = Duration.ofMillis(200);
    private int adapterCacheSize = 64;
    private Duration adapterCacheTtl = Duration.ofMinutes(10);

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) { this.maxRows = maxRows; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    public int getAdapterCacheSize() { return adapterCacheSize; }
    public void setAdapterCacheSize(int adapterCacheSize) { this.adapterCacheSize = adapterCacheSize; }
    public Duration getAdapterCacheTtl() { return adapterCacheTtl; }
    public void setAdapterCacheTtl(Duration adapterCacheTtl) { this.adapterCacheTtl = adapterCacheTtl; }
  }

  public static class Policy {
    /** Filesystem path of the policy table; when blank the bundled classpath table is used. */
    private String path;

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
  }

  public static class Schema {
    /** Filesystem path of the schema snapshots; when blank the bundled classpath fixture is used. */
    private String path;
    private Duration cacheTtl = Duration.ofMinutes(1);

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
  }

  public static class Audit {
    /** JSON-lines audit file; when blank records go to the {@code querygate.audit} logger. */
    private String file;

    public String getFile() { return file; }
    public void setFile(String file) { this.file = file; }
  }

  public static class DataSourceProps {
    private String family;
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maxPoolSize = 10;
    private String mongoUri;
    private String database;

    public String getFamily() { return family; }
    public void setFamily(String family) { this.family = family; }
    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public String getMongoUri() { return mongoUri; }
    public void setMongoUri(String mongoUri) { this.mongoUri = mongoUri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }
}
