package io.intellixity.querygate.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querygate.audit.AuditSink;
import io.intellixity.querygate.audit.AuditTrail;
import io.intellixity.querygate.audit.JsonLinesAuditSink;
import io.intellixity.querygate.audit.Slf4jAuditSink;
import io.intellixity.querygate.jdbc.JdbcSourceAdapter;
import io.intellixity.querygate.jdbc.JdbcSourceAdapters;
import io.intellixity.querygate.jdbc.postgres.PostgresDialect;
import io.intellixity.querygate.mongo.MongoSourceAdapter;
import io.intellixity.querygate.mongo.MongoSourceAdapters;
import io.intellixity.querygate.pipeline.CachingSchemaCatalog;
import io.intellixity.querygate.pipeline.IntentGatedPipeline;
import io.intellixity.querygate.pipeline.RetryPolicy;
import io.intellixity.querygate.pipeline.intent.IntentClassifier;
import io.intellixity.querygate.pipeline.intent.KeywordIntentClassifier;
import io.intellixity.querygate.pipeline.intent.ModelIntentClassifier;
import io.intellixity.querygate.pipeline.model.ModelClient;
import io.intellixity.querygate.pipeline.plan.ModelPlanGenerator;
import io.intellixity.querygate.pipeline.plan.PlanGenerationException;
import io.intellixity.querygate.pipeline.plan.PlanGenerator;
import io.intellixity.querygate.pipeline.response.DefaultResponseSynthesizer;
import io.intellixity.querygate.pipeline.response.ResponseSynthesizer;
import io.intellixity.querygate.policy.DefaultPolicyDecisionEngine;
import io.intellixity.querygate.policy.FilePolicyTableSource;
import io.intellixity.querygate.policy.PolicyTableLoader;
import io.intellixity.querygate.policy.PolicyTableSource;
import io.intellixity.querygate.schema.InMemorySchemaCatalog;
import io.intellixity.querygate.schema.SchemaCatalog;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.schema.SchemaSnapshotLoader;
import io.intellixity.querygate.server.model.HttpModelClient;
import io.intellixity.querygate.spi.*;
import io.intellixity.querygate.validation.PlanValidator;
import io.intellixity.querygate.validation.SensitivityEntitlements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(QuerygateProperties.class)
public class QuerygateConfig {
  private static final Logger log = LoggerFactory.getLogger(QuerygateConfig.class);

  @Bean
  public SchemaCatalog schemaCatalog(QuerygateProperties props) throws IOException {
    SchemaSnapshotLoader loader = new SchemaSnapshotLoader();
    String path = props.getSchema().getPath();
    List<SchemaSnapshot> snapshots;
    if (path != null && !path.isBlank()) {
      snapshots = loader.load(Path.of(path));
    } else {
      try (InputStream in = new ClassPathResource("schema-snapshots.yml").getInputStream()) {
        snapshots = loader.load(in);
      }
    }
    log.info("querygate.config op=schema snapshots={}", snapshots.size());
    return new CachingSchemaCatalog(new InMemorySchemaCatalog(snapshots), 256,
        props.getSchema().getCacheTtl().toMillis());
  }

  @Bean
  public PolicyTableSource policyTableSource(QuerygateProperties props) {
    PolicyTableLoader loader = new PolicyTableLoader();
    String path = props.getPolicy().getPath();
    if (path != null && !path.isBlank()) return new FilePolicyTableSource(Path.of(path), loader);
    try (InputStream in = new ClassPathResource("policy-table.yml").getInputStream()) {
      return PolicyTableSource.of(loader.load(in));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read bundled policy table", e);
    }
  }

  @Bean
  public AuditSink auditSink(QuerygateProperties props) {
    String file = props.getAudit().getFile();
    return (file == null || file.isBlank()) ? new Slf4jAuditSink() : new JsonLinesAuditSink(Path.of(file));
  }

  @Bean
  public SensitivityEntitlements sensitivityEntitlements(QuerygateProperties props) {
    return new SensitivityEntitlements(props.getTagEntitlements());
  }

  @Bean
  public RowMasker rowMasker(QuerygateProperties props) {
    return new RowMasker(props.getMasking(), MaskingStrategy.REDACT);
  }

  @Bean(destroyMethod = "close")
  public DataSourceHandles dataSourceHandles(QuerygateProperties props) {
    return new DataSourceHandles(props.getDataSources());
  }

  @Bean
  public SourceAdapterFactory sourceAdapterFactory(RowMasker masker, SensitivityEntitlements entitlements) {
    PostgresDialect dialect = new PostgresDialect();
    return (family, handle) -> switch (family) {
      case JdbcSourceAdapter.FAMILY -> JdbcSourceAdapters.create(handle, dialect, masker, entitlements);
      case MongoSourceAdapter.FAMILY -> MongoSourceAdapters.create(handle, masker, entitlements);
      default -> throw new IllegalArgumentException("Unsupported source family: " + family);
    };
  }

  @Bean
  public SourceAdapterResolver sourceAdapterResolver(DataSourceHandles handles,
                                                     SourceAdapterFactory factory,
                                                     QuerygateProperties props) {
    QuerygateProperties.Execution ex = props.getExecution();
    return new SourceAdapterResolver(handles, factory, ex.getAdapterCacheSize(), ex.getAdapterCacheTtl().toMillis());
  }

  @Bean(destroyMethod = "close")
  public ExecutionGateway executionGateway(SourceAdapterResolver resolver, QuerygateProperties props) {
    QuerygateProperties.Execution ex = props.getExecution();
    return new ExecutionGateway(resolver, new ExecutionLimits(ex.getTimeout(), ex.getMaxRows()));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService classifierExecutor() {
    return Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "querygate-classifier");
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public IntentGatedPipeline intentGatedPipeline(QuerygateProperties props,
                                                 ObjectMapper mapper,
                                                 ObjectProvider<RestClient.Builder> restClients,
                                                 SchemaCatalog catalog,
                                                 PolicyTableSource policySource,
                                                 AuditSink auditSink,
                                                 SensitivityEntitlements entitlements,
                                                 ExecutionGateway gateway,
                                                 ExecutorService classifierExecutor) {
    QuerygateProperties.Model m = props.getModel();
    QuerygateProperties.Execution ex = props.getExecution();

    IntentClassifier classifier;
    PlanGenerator generator;
    ResponseSynthesizer synthesizer;
    if (m.isConfigured()) {
      RestClient.Builder builder = restClients.getIfAvailable(RestClient::builder)
          .requestFactory(HttpModelClient.requestFactory(m.getTimeout()));
      ModelClient model = HttpModelClient.create(builder, m.getBaseUrl(), m.getApiKey(), m.getName());
      classifier = new ModelIntentClassifier(model, mapper, props.getClassifier().getTimeout(),
          props.getClassifier().getAliases(), RetryPolicy.once(ex.getRetryBackoff()), classifierExecutor);
      generator = new ModelPlanGenerator(model, mapper, catalog, props.getDataSources().keySet());
      synthesizer = new DefaultResponseSynthesizer(model);
    } else {
      log.warn("querygate.config op=model status=unconfigured classifier=keyword plans=disabled");
      classifier = KeywordIntentClassifier.defaults();
      generator = (query, intent, scope) -> {
        throw new PlanGenerationException("no plan model configured");
      };
      synthesizer = new DefaultResponseSynthesizer();
    }

    return IntentGatedPipeline.builder()
        .classifier(classifier)
        .policyEngine(new DefaultPolicyDecisionEngine())
        .policySource(policySource)
        .planGenerator(generator)
        .catalog(catalog)
        .validator(new PlanValidator(entitlements))
        .gateway(gateway)
        .synthesizer(synthesizer)
        .audit(new AuditTrail(auditSink))
        .executionRetry(new RetryPolicy(ex.getMaxRetries(), ex.getRetryBackoff()))
        .build();
  }
}
