package io.intellixity.querygate.pipeline.response;

import io.intellixity.querygate.model.ExecutionResult;
import io.intellixity.querygate.model.PolicyDecision;
import io.intellixity.querygate.model.UserQuery;

/** Turns a decision, and for authorized requests the already-masked result, into user-facing text. */
@FunctionalInterface
public interface ResponseSynthesizer {
  /**
   * @param result masked execution result; null unless the decision is ALLOW_WITH_AUTH and execution succeeded
   */
  String synthesize(PolicyDecision decision, ExecutionResult result, UserQuery query);
}
