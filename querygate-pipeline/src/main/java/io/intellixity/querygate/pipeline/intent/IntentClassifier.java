package io.intellixity.querygate.pipeline.intent;

import io.intellixity.querygate.model.ConversationContext;
import io.intellixity.querygate.model.Intent;

/**
 * Advisory classification of query text. Takes no identity and holds no data capability.
 * Implementations must never throw: every failure resolves to {@link Intent#failClosed(String)}.
 */
@FunctionalInterface
public interface IntentClassifier {
  Intent classify(String queryText, ConversationContext context);
}
