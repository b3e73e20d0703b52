package io.intellixity.querygate.spi;

import io.intellixity.querygate.model.Identity;
import io.intellixity.querygate.schema.ColumnDef;
import io.intellixity.querygate.schema.ResourceDef;
import io.intellixity.querygate.schema.SchemaSnapshot;
import io.intellixity.querygate.validation.SensitivityEntitlements;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class RowMaskerTest {
  private static final SchemaSnapshot SNAPSHOT = SchemaSnapshot.of("crm", "mongo", 2,
      ResourceDef.of("customers", "customer", "sales",
          ColumnDef.of("name", "string"),
          ColumnDef.of("email", "string", "PII"),
          ColumnDef.of("ssn", "string", "PII", "GOV_ID")));

  private static List<Map<String, Object>> row() {
    Map<String, Object> r = new LinkedHashMap<>();
    r.put("name", "Ada");
    r.put("email", "ada@example.com");
    r.put("ssn", "123-45-6789");
    return List.of(r);
  }

  @Test
  void strongestStrategyWinsPerColumn() {
    RowMasker masker = new RowMasker(Map.of("pii", MaskingStrategy.HASH, "GOV_ID", MaskingStrategy.NULLIFY), MaskingStrategy.REDACT);
    Map<String, Object> out = masker.mask(row(), SNAPSHOT, "customers", Identity.of("u", "t", Set.of()),
        SensitivityEntitlements.identity()).get(0);

    assertEquals("Ada", out.get("name"));
    assertTrue(String.valueOf(out.get("email")).startsWith("sha256:"));
    assertTrue(out.containsKey("ssn"));
    assertNull(out.get("ssn"));
  }

  @Test
  void entitledColumnsPassThroughUntouched() {
    Identity piiReader = new Identity("u", "t", Set.of(), Set.of("PII"));
    List<Map<String, Object>> in = row();
    Map<String, Object> out = RowMasker.redacting().mask(in, SNAPSHOT, "customers", piiReader,
        SensitivityEntitlements.identity()).get(0);

    assertEquals("ada@example.com", out.get("email"));
    assertEquals("***", out.get("ssn"));
    assertEquals("123-45-6789", in.get(0).get("ssn"));
  }
}
