package io.intellixity.querygate.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.querygate.model.IntentCategory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parses a policy table from YAML (JSON is accepted as well):
 * <pre>
 * version: 7
 * confidenceThreshold: 0.7
 * categories:
 *   SAFE_KNOWLEDGE: { disposition: NO_DATA }
 *   DATA_QUERY:
 *     disposition: REQUIRES_AUTHORIZATION
 *     grants:
 *       - roles: [analyst]
 *         resourceClasses: [cost_center]
 *   OUT_OF_SCOPE: { disposition: OUT_OF_SCOPE }
 * </pre>
 * Unknown categories, dispositions or keys are rejected rather than ignored.
 */
public final class PolicyTableLoader {
  private static final Set<String> TOP_KEYS = Set.of("version", "confidenceThreshold", "categories");
  private static final Set<String> ENTRY_KEYS = Set.of("disposition", "grants");
  private static final Set<String> GRANT_KEYS = Set.of("roles", "resourceClasses");

  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  public PolicyTable load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new PolicyTableException("Failed to read policy table " + file, e);
    }
  }

  public PolicyTable load(InputStream in) {
    JsonNode root;
    try {
      root = yaml.readTree(in);
    } catch (IOException e) {
      throw new PolicyTableException("Policy table is not valid YAML/JSON", e);
    }
    if (root == null || !root.isObject()) throw new PolicyTableException("Policy table must be a mapping");
    checkKeys(root, TOP_KEYS, "policy table");

    JsonNode v = root.get("version");
    if (v == null || !v.canConvertToLong()) throw new PolicyTableException("Policy table requires numeric 'version'");
    JsonNode t = root.get("confidenceThreshold");
    if (t == null || !t.isNumber()) throw new PolicyTableException("Policy table requires numeric 'confidenceThreshold'");

    Map<IntentCategory, CategoryPolicy> categories = new EnumMap<>(IntentCategory.class);
    JsonNode cats = root.path("categories");
    for (Iterator<Map.Entry<String, JsonNode>> it = cats.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      IntentCategory category = parseEnum(IntentCategory.class, e.getKey(), "category");
      categories.put(category, entry(category, e.getValue()));
    }
    return new PolicyTable(v.asLong(), t.asDouble(), categories);
  }

  private static CategoryPolicy entry(IntentCategory category, JsonNode n) {
    checkKeys(n, ENTRY_KEYS, "category " + category);
    JsonNode d = n.get("disposition");
    if (d == null) throw new PolicyTableException("Category " + category + " requires 'disposition'");
    Disposition disposition = parseEnum(Disposition.class, d.asText(), "disposition");
    List<Grant> grants = new ArrayList<>();
    for (JsonNode g : n.path("grants")) {
      checkKeys(g, GRANT_KEYS, "grant of " + category);
      grants.add(new Grant(strings(g.path("roles")), strings(g.path("resourceClasses"))));
    }
    return new CategoryPolicy(category, disposition, grants);
  }

  private static Set<String> strings(JsonNode arr) {
    Set<String> out = new LinkedHashSet<>();
    for (JsonNode x : arr) {
      String s = x.asText().trim();
      if (!s.isEmpty()) out.add(s);
    }
    return out;
  }

  private static void checkKeys(JsonNode n, Set<String> allowed, String where) {
    if (!n.isObject()) throw new PolicyTableException(where + " must be a mapping");
    for (Iterator<String> it = n.fieldNames(); it.hasNext(); ) {
      String k = it.next();
      if (!allowed.contains(k)) throw new PolicyTableException("Unknown key '" + k + "' in " + where);
    }
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String what) {
    try {
      return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new PolicyTableException("Unknown " + what + ": " + raw, e);
    }
  }
}
