package io.intellixity.querygate.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.ReadPreference;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import io.intellixity.querygate.spi.*;
import io.intellixity.querygate.validation.SensitivityEntitlements;
import io.intellixity.querygate.validation.ValidatedPlan;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Document adapter over the MongoDB sync driver.
 * <p>
 * Only {@code find} and {@code aggregate} are ever issued, and the renderer never emits write stages.
 * The server enforces the deadline through {@code maxTime}; cancellation closes the open cursor.
 */
public final class MongoSourceAdapter extends AbstractSourceAdapter<MongoStatement, MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoSourceAdapter.class);

  public static final String FAMILY = "mongo";

  private final MongoDatabase db;

  public MongoSourceAdapter(MongoHandle handle, RowMasker masker, SensitivityEntitlements entitlements) {
    super(handle, masker, entitlements);
    this.db = handle.client().getDatabase(handle.database()).withReadPreference(ReadPreference.secondaryPreferred());
  }

  public MongoSourceAdapter(MongoHandle handle) {
    this(handle, null, null);
  }

  @Override public String family() { return FAMILY; }

  @Override
  public MongoStatement translate(ValidatedPlan plan) {
    return MongoPlanRenderer.render(plan.plan());
  }

  @Override
  public List<Map<String, Object>> run(MongoStatement st, ExecutionLimits limits, CancellationToken token) {
    token.throwIfCancelled();
    long start = System.nanoTime();
    long maxTimeMs = limits.timeout().toMillis();
    int cap = effectiveLimit(st.limit(), limits.fetchSize());
    if (log.isDebugEnabled()) {
      log.debug("querygate.mongo op={} handleId={} database={} stmt={}", st.kind(), handle().id(), handle().database(), st.describe());
    }

    MongoCollection<Document> col = db.getCollection(st.collection());
    List<Map<String, Object>> out = new ArrayList<>();
    try {
      MongoCursor<Document> cursor;
      if (st.kind() == MongoStatement.Kind.AGGREGATE) {
        List<Document> pipeline = new ArrayList<>(st.pipeline());
        pipeline.add(new Document("$limit", cap));
        cursor = col.aggregate(pipeline).maxTime(maxTimeMs, TimeUnit.MILLISECONDS).iterator();
      } else {
        var find = col.find(st.filter()).maxTime(maxTimeMs, TimeUnit.MILLISECONDS).limit(cap);
        if (st.projection() != null && !st.projection().isEmpty()) find = find.projection(st.projection());
        if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
        cursor = find.iterator();
      }
      try (MongoCursor<Document> c = cursor) {
        token.onCancel(c::close);
        while (out.size() < cap && c.hasNext()) out.add(toRow(c.next()));
      }
    } catch (MongoException e) {
      if (token.isCancelled()) throw new GatewayExecutionException("mongo cursor cancelled", true, e);
      throw new GatewayExecutionException("mongo failure code=" + e.getCode() + ": " + e.getMessage(), isTransient(e), e);
    } catch (IllegalStateException e) {
      // driver raises this when the cursor was closed under us by cancellation
      if (token.isCancelled()) throw new GatewayExecutionException("mongo cursor cancelled", true, e);
      throw e;
    }

    if (log.isDebugEnabled()) {
      log.debug("querygate.mongo_done op={} durationMs={} rows={}", st.kind(), (System.nanoTime() - start) / 1_000_000.0, out.size());
    }
    return out;
  }

  static boolean isTransient(MongoException e) {
    return e instanceof MongoExecutionTimeoutException
        || e instanceof MongoSocketException
        || e instanceof MongoTimeoutException
        || e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);
  }

  static int effectiveLimit(Integer planLimit, int fetchSize) {
    return (planLimit == null || planLimit <= 0) ? fetchSize : Math.min(planLimit, fetchSize);
  }

  private static Map<String, Object> toRow(Document d) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : d.entrySet()) row.put(e.getKey(), toJava(e.getValue()));
    return row;
  }

  private static Object toJava(Object v) {
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Date date) return date.toInstant();
    if (v instanceof Document nested) return toRow(nested);
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>(list.size());
      for (Object o : list) out.add(toJava(o));
      return out;
    }
    return v;
  }
}
