package io.intellixity.querygate.pipeline;

import io.intellixity.querygate.model.Outcome;
import io.intellixity.querygate.model.ReasonCode;

import java.util.Objects;

/** What the caller gets back: the text, the final outcome and the id of the request's audit chain. */
public record PipelineResponse(String responseText, Outcome decisionOutcome, ReasonCode reasonCode, String auditId) {
  public PipelineResponse {
    Objects.requireNonNull(responseText, "responseText");
    Objects.requireNonNull(decisionOutcome, "decisionOutcome");
    Objects.requireNonNull(reasonCode, "reasonCode");
    Objects.requireNonNull(auditId, "auditId");
  }
}
