package io.intellixity.querygate.server.web;

import io.intellixity.querygate.model.ConversationContext;
import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.model.Outcome;
import io.intellixity.querygate.model.UserQuery;
import io.intellixity.querygate.pipeline.IntentGatedPipeline;
import io.intellixity.querygate.pipeline.PipelineResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/queries")
public final class QueryController {
  private final IntentGatedPipeline pipeline;

  public QueryController(IntentGatedPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public record QueryRequest(String queryText, List<String> conversationContext) {}

  public record QueryResponse(String responseText, Outcome decisionOutcome, String reasonCode, String auditId) {}

  @PostMapping
  public ResponseEntity<QueryResponse> submit(@RequestBody QueryRequest req,
                                              @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity) {
    if (req == null || req.queryText() == null || req.queryText().isBlank()) {
      return ResponseEntity.badRequest().build();
    }
    UserQuery query = new UserQuery(UUID.randomUUID().toString(), req.queryText(),
        new ConversationContext(req.conversationContext()), identity);
    PipelineResponse r = pipeline.handle(query);
    return ResponseEntity.ok(new QueryResponse(r.responseText(), r.decisionOutcome(), r.reasonCode().name(), r.auditId()));
  }
}
