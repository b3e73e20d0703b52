package io.intellixity.querygate.pipeline.response;

import io.intellixity.querygate.model.*;
import io.intellixity.querygate.pipeline.model.ModelClient;
import io.intellixity.querygate.pipeline.model.ModelClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Default wording for every outcome.
 * <ul>
 *   <li>ALLOW_NO_DATA: a general answer from the model under an instruction forbidding enterprise data,
 *       or a fixed notice when no model is configured or it fails.</li>
 *   <li>ALLOW_WITH_AUTH: a plain-text table of the masked rows.</li>
 *   <li>DENY: an explicit refusal naming the reason category and nothing about the schema.</li>
 * </ul>
 */
public final class DefaultResponseSynthesizer implements ResponseSynthesizer {
  private static final Logger log = LoggerFactory.getLogger(DefaultResponseSynthesizer.class);

  static final String NO_DATA_INSTRUCTIONS = String.join("\n",
      "Answer with general, public knowledge only.",
      "You have no access to enterprise data. Do not reference, guess or invent any company-specific",
      "figures, records, names, accounts or identifiers.");

  static final String NO_DATA_FALLBACK =
      "This is a general-knowledge question. No enterprise data was consulted for this answer.";

  private static final int MAX_RENDERED_ROWS = 50;

  private final ModelClient knowledgeModel;

  public DefaultResponseSynthesizer(ModelClient knowledgeModel) {
    this.knowledgeModel = knowledgeModel;
  }

  public DefaultResponseSynthesizer() {
    this(null);
  }

  @Override
  public String synthesize(PolicyDecision decision, ExecutionResult result, UserQuery query) {
    Objects.requireNonNull(decision, "decision");
    return switch (decision.outcome()) {
      case ALLOW_NO_DATA -> generalAnswer(query);
      case ALLOW_WITH_AUTH -> (result == null) ? refusal(ReasonCode.EXECUTION_FAILED) : table(result);
      case DENY -> refusal(decision.reasonCode());
    };
  }

  private String generalAnswer(UserQuery query) {
    if (knowledgeModel == null || query == null) return NO_DATA_FALLBACK;
    try {
      String answer = knowledgeModel.complete(NO_DATA_INSTRUCTIONS, query.text());
      return (answer == null || answer.isBlank()) ? NO_DATA_FALLBACK : answer.trim();
    } catch (ModelClientException e) {
      log.warn("querygate.response knowledge_model_failed requestId={} cause={}", query.requestId(), e.toString());
      return NO_DATA_FALLBACK;
    }
  }

  static String refusal(ReasonCode reason) {
    return switch (reason) {
      case PLAN_REJECTED -> "Request denied: I cannot complete this request.";
      case EXECUTION_FAILED -> "Request failed: the data source could not complete this request. Please try again later.";
      default -> "Request denied: " + reason.description() + ".";
    };
  }

  private static String table(ExecutionResult r) {
    StringBuilder sb = new StringBuilder();
    sb.append(r.rowCount()).append(r.rowCount() == 1 ? " row" : " rows");
    if (r.truncated()) sb.append(" (truncated to the row limit)");
    sb.append(":\n");
    sb.append(String.join(" | ", r.columns())).append('\n');
    int n = 0;
    for (Map<String, Object> row : r.rows()) {
      if (n++ == MAX_RENDERED_ROWS) {
        sb.append("... ").append(r.rowCount() - MAX_RENDERED_ROWS).append(" more\n");
        break;
      }
      List<String> cells = new ArrayList<>();
      for (String c : r.columns()) cells.add(String.valueOf(row.get(c)));
      sb.append(String.join(" | ", cells)).append('\n');
    }
    if (!r.maskedColumns().isEmpty()) {
      sb.append("Masked: ").append(String.join(", ", r.maskedColumns())).append('\n');
    }
    return sb.toString().trim();
  }
}
