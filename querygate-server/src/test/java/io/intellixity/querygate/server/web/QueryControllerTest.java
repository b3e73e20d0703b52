package io.intellixity.querygate.server.web;

import io.intellixity.querygate.audit.AuditTrail;
import io.intellixity.querygate.audit.InMemoryAuditSink;
import io.intellixity.querygate.model.IntentCategory;
import io.intellixity.querygate.pipeline.IntentGatedPipeline;
import io.intellixity.querygate.pipeline.intent.KeywordIntentClassifier;
import io.intellixity.querygate.pipeline.plan.PlanGenerationException;
import io.intellixity.querygate.pipeline.response.DefaultResponseSynthesizer;
import io.intellixity.querygate.policy.CategoryPolicy;
import io.intellixity.querygate.policy.DefaultPolicyDecisionEngine;
import io.intellixity.querygate.policy.Grant;
import io.intellixity.querygate.policy.PolicyTable;
import io.intellixity.querygate.policy.PolicyTableSource;
import io.intellixity.querygate.schema.InMemorySchemaCatalog;
import io.intellixity.querygate.spi.ExecutionGateway;
import io.intellixity.querygate.spi.ExecutionLimits;
import io.intellixity.querygate.spi.SourceAdapterResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class QueryControllerTest {
  private final InMemoryAuditSink sink = new InMemoryAuditSink();
  private ExecutionGateway gateway;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    SourceAdapterResolver unreachable = new SourceAdapterResolver(
        (family, id) -> {
          throw new AssertionError("no data source may be resolved in these tests");
        },
        (family, handle) -> {
          throw new AssertionError("no adapter may be created in these tests");
        }, 4, 1_000);
    gateway = new ExecutionGateway(unreachable, new ExecutionLimits(Duration.ofSeconds(1), 10));
    IntentGatedPipeline pipeline = IntentGatedPipeline.builder()
        .classifier(KeywordIntentClassifier.defaults())
        .policyEngine(new DefaultPolicyDecisionEngine())
        .policySource(PolicyTableSource.of(PolicyTable.of(1, 0.7,
            CategoryPolicy.noData(IntentCategory.SAFE_KNOWLEDGE),
            CategoryPolicy.authorized(IntentCategory.DATA_QUERY, new Grant(Set.of("analyst"), Set.of("cost_center"))),
            CategoryPolicy.outOfScope(IntentCategory.OUT_OF_SCOPE))))
        .planGenerator((q, i, s) -> {
          throw new PlanGenerationException("offline");
        })
        .catalog(new InMemorySchemaCatalog())
        .gateway(gateway)
        .synthesizer(new DefaultResponseSynthesizer())
        .audit(new AuditTrail(sink))
        .build();
    mvc = MockMvcBuilders.standaloneSetup(new QueryController(pipeline))
        .addFilters(new IdentityFilter())
        .build();
  }

  @AfterEach
  void tearDown() {
    gateway.close();
  }

  @Test
  void knowledgeQuestionIsAnsweredWithoutData() throws Exception {
    mvc.perform(post("/api/queries")
            .header(IdentityFilter.USER_HEADER, "ana")
            .header(IdentityFilter.TENANT_HEADER, "acme")
            .header(IdentityFilter.ROLES_HEADER, "analyst")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"queryText\": \"What is variance?\", \"conversationContext\": []}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.decisionOutcome").value("ALLOW_NO_DATA"))
        .andExpect(jsonPath("$.auditId").isNotEmpty());
    assertEquals(3, sink.records().size());
  }

  @Test
  void guestDataQueryIsRefused() throws Exception {
    mvc.perform(post("/api/queries")
            .header(IdentityFilter.USER_HEADER, "gus")
            .header(IdentityFilter.TENANT_HEADER, "acme")
            .header(IdentityFilter.ROLES_HEADER, "guest")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"queryText\": \"Show variance for cost center 101\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.decisionOutcome").value("DENY"))
        .andExpect(jsonPath("$.reasonCode").value("INSUFFICIENT_ENTITLEMENT"));
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mvc.perform(post("/api/queries")
            .header(IdentityFilter.USER_HEADER, "ana")
            .header(IdentityFilter.TENANT_HEADER, "acme")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"queryText\": \"  \"}"))
        .andExpect(status().isBadRequest());
    assertTrue(sink.records().isEmpty());
  }

  @Test
  void missingIdentityIsUnauthorized() throws Exception {
    mvc.perform(post("/api/queries")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"queryText\": \"What is variance?\"}"))
        .andExpect(status().isUnauthorized());
  }
}
