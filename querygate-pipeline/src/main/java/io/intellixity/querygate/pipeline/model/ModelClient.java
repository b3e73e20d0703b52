package io.intellixity.querygate.pipeline.model;

/**
 * Port to a hosted language model. Implementations hold no data-source capability: they see only the
 * text they are handed.
 */
@FunctionalInterface
public interface ModelClient {
  /**
   * Single-turn completion.
   *
   * @param instructions system-level instructions
   * @param input        user-level content
   * @return raw model text
   * @throws ModelClientException on transport or provider failure
   */
  String complete(String instructions, String input);
}
