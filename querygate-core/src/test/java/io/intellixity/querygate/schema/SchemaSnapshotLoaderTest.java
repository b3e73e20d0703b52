package io.intellixity.querygate.schema;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaSnapshotLoaderTest {
  @Test
  void loadsTagsAndClasses() throws Exception {
    List<SchemaSnapshot> snapshots;
    try (InputStream in = getClass().getResourceAsStream("/schema-fixture.yml")) {
      snapshots = new SchemaSnapshotLoader().load(in);
    }
    assertEquals(1, snapshots.size());
    SchemaSnapshot s = snapshots.get(0);
    assertEquals("finance_pg", s.dataSourceId());
    assertEquals("jdbc", s.sourceFamily());
    assertEquals(4, s.version());

    ResourceDef payroll = s.resource("payroll");
    assertEquals("hr", payroll.resourceClass());
    assertEquals(Set.of("PII"), payroll.column("salary").sensitivityTags());
    assertFalse(payroll.column("employee_id").isSensitive());
    assertEquals(Set.of("PII"), s.sensitivityTags());
  }
}
