package io.intellixity.querygate.pipeline.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ModelOutputsTest {
  @Test
  void extractsOutermostObject() {
    assertEquals("{\"a\": {\"b\": 1}}", ModelOutputs.extractJsonObject("```json\n{\"a\": {\"b\": 1}}\n```"));
    assertEquals("{\"a\": 1}", ModelOutputs.extractJsonObject("Sure! {\"a\": 1} Hope that helps."));
  }

  @Test
  void rejectsNonObjects() {
    assertThrows(ModelClientException.class, () -> ModelOutputs.extractJsonObject(null));
    assertThrows(ModelClientException.class, () -> ModelOutputs.extractJsonObject("[1, 2]"));
    assertThrows(ModelClientException.class, () -> ModelOutputs.readObject(new ObjectMapper(), "{\"a\": }"));
  }
}
