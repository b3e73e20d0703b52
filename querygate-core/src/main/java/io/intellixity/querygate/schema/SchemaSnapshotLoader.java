package io.intellixity.querygate.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads schema snapshot fixtures from YAML:
 * <pre>
 * snapshots:
 *   - dataSource: finance_pg
 *     family: jdbc
 *     version: 3
 *     resources:
 *       cost_center_variance:
 *         class: cost_center
 *         owner: fpna
 *         columns:
 *           cost_center_id: { type: string }
 *           salary: { type: decimal, tags: [PII] }
 * </pre>
 */
public final class SchemaSnapshotLoader {
  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  public List<SchemaSnapshot> load(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema snapshots: " + file, e);
    }
  }

  public List<SchemaSnapshot> load(InputStream in) throws IOException {
    JsonNode root = yaml.readTree(in);
    if (root == null || !root.has("snapshots")) return List.of();
    List<SchemaSnapshot> out = new ArrayList<>();
    for (JsonNode s : root.get("snapshots")) {
      String ds = required(s, "dataSource");
      String family = required(s, "family");
      long version = s.path("version").asLong(0);
      Map<String, ResourceDef> resources = new LinkedHashMap<>();
      JsonNode res = s.path("resources");
      for (Iterator<Map.Entry<String, JsonNode>> it = res.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        resources.put(e.getKey(), resource(e.getKey(), e.getValue()));
      }
      out.add(new SchemaSnapshot(ds, family, version, resources));
    }
    return out;
  }

  private static ResourceDef resource(String name, JsonNode n) {
    String cls = n.hasNonNull("class") ? n.get("class").asText() : name;
    String owner = n.hasNonNull("owner") ? n.get("owner").asText() : null;
    Map<String, ColumnDef> cols = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = n.path("columns").fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode c = e.getValue();
      Set<String> tags = new LinkedHashSet<>();
      for (JsonNode t : c.path("tags")) tags.add(t.asText());
      cols.put(e.getKey(), new ColumnDef(e.getKey(), c.path("type").asText(null), tags));
    }
    return new ResourceDef(name, cls, owner, cols);
  }

  private static String required(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull() || v.asText().isBlank()) {
      throw new IllegalArgumentException("Schema snapshot requires '" + field + "'");
    }
    return v.asText();
  }
}
