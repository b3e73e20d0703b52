package io.intellixity.querygate.mongo;

import io.intellixity.querygate.spi.NativeStatement;
import org.bson.Document;

import java.util.List;
import java.util.Objects;

/** Backend-native statement representation for MongoDB. Read-only kinds only. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    List<Document> pipeline,
    Document sort,
    Integer limit
) implements NativeStatement {
  public enum Kind {
    FIND,
    AGGREGATE
  }

  public MongoStatement {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(collection, "collection");
    filter = filter == null ? new Document() : filter;
    pipeline = pipeline == null ? List.of() : List.copyOf(pipeline);
  }

  @Override
  public String describe() {
    if (kind == Kind.AGGREGATE) {
      return "AGGREGATE " + collection + " stages=" + pipeline.stream().map(d -> d.keySet().iterator().next()).toList();
    }
    return "FIND " + collection + " filterKeys=" + filter.keySet()
        + (projection == null ? "" : " projection=" + projection.keySet())
        + (limit == null ? "" : " limit=" + limit);
  }
}
