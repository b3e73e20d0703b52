package io.intellixity.querygate.model;

import java.util.Objects;

/** One inbound request: raw text, bounded context and the requesting identity. Immutable. */
public record UserQuery(String requestId, String text, ConversationContext context, Identity identity) {
  public UserQuery {
    Objects.requireNonNull(requestId, "requestId");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(identity, "identity");
    context = context == null ? ConversationContext.empty() : context;
  }
}
