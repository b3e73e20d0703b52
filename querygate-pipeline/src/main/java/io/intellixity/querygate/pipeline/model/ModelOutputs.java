package io.intellixity.querygate.pipeline.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Helpers for turning raw model text into JSON. */
public final class ModelOutputs {
  private ModelOutputs() {}

  /** Strips a surrounding markdown code fence and anything outside the outermost JSON object. */
  public static String extractJsonObject(String raw) {
    if (raw == null) throw new ModelClientException("empty model output");
    String s = raw.trim();
    if (s.startsWith("```")) {
      int nl = s.indexOf('\n');
      s = (nl < 0) ? "" : s.substring(nl + 1);
      int fence = s.lastIndexOf("```");
      if (fence >= 0) s = s.substring(0, fence);
      s = s.trim();
    }
    int start = s.indexOf('{');
    int end = s.lastIndexOf('}');
    if (start < 0 || end < start) throw new ModelClientException("no JSON object in model output");
    return s.substring(start, end + 1);
  }

  public static JsonNode readObject(ObjectMapper mapper, String raw) {
    try {
      JsonNode n = mapper.readTree(extractJsonObject(raw));
      if (n == null || !n.isObject()) throw new ModelClientException("model output is not a JSON object");
      return n;
    } catch (JsonProcessingException e) {
      throw new ModelClientException("malformed model JSON: " + e.getOriginalMessage(), e);
    }
  }
}
