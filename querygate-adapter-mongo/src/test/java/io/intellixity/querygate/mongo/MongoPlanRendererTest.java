package io.intellixity.querygate.mongo;

import io.intellixity.querygate.plan.*;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.querygate.plan.PlanFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class MongoPlanRendererTest {
  @Test
  void findWithProjectionSortAndLimit() {
    ExecutionPlan plan = ExecutionPlan.select("crm_mongo", "accounts")
        .withProjection(List.of("name", "region"))
        .withFilter(and(eq("region", "EU"), ge("arr", 1000)))
        .withSort(List.of(new SortField("arr", SortField.Direction.DESC)))
        .withLimit(10);

    MongoStatement st = MongoPlanRenderer.render(plan);
    assertEquals(MongoStatement.Kind.FIND, st.kind());
    assertEquals("accounts", st.collection());
    assertEquals(Document.parse("{$and: [{region: 'EU'}, {arr: {$gte: 1000}}]}"), st.filter());
    assertEquals(Document.parse("{name: 1, region: 1, _id: 0}"), st.projection());
    assertEquals(Document.parse("{arr: -1}"), st.sort());
    assertEquals(10, st.limit());
  }

  @Test
  void notGroupsUseDeMorganAndNor() {
    Document d = MongoPlanRenderer.toBson(not(or(eq("a", 1), in("b", List.of(2, 3)))));
    assertEquals(Document.parse("{$and: [{$nor: [{a: 1}]}, {$nor: [{b: {$in: [2, 3]}}]}]}"), d);
  }

  @Test
  void likeBecomesAnchoredRegexWithQuotedLiterals() {
    Document d = MongoPlanRenderer.likePositive("code", "A.1%_");
    assertEquals("^\\QA.1\\E.*.$", d.get("code", Document.class).getString("$regex"));
  }

  @Test
  void groupedPlanBuildsPipeline() {
    ExecutionPlan plan = ExecutionPlan.select("crm_mongo", "accounts")
        .withFilter(eq("region", "EU"))
        .withAggregation(Aggregation.groupBy(List.of("segment"),
            Aggregate.of(AggregateFunction.SUM, "arr"), Aggregate.count()))
        .withSort(List.of(new SortField("sum_arr", SortField.Direction.DESC)))
        .withLimit(5);

    MongoStatement st = MongoPlanRenderer.render(plan);
    assertEquals(MongoStatement.Kind.AGGREGATE, st.kind());
    assertEquals(List.of(
        Document.parse("{$match: {region: 'EU'}}"),
        Document.parse("{$group: {_id: {segment: '$segment'}, sum_arr: {$sum: '$arr'}, count: {$sum: 1}}}"),
        Document.parse("{$project: {_id: 0, segment: '$_id.segment', sum_arr: 1, count: 1}}"),
        Document.parse("{$sort: {sum_arr: -1}}"),
        Document.parse("{$limit: 5}")), st.pipeline());
    assertEquals("AGGREGATE accounts stages=[$match, $group, $project, $sort, $limit]", st.describe());
  }

  @Test
  void rangeRequiresBothBounds() {
    assertThrows(IllegalArgumentException.class, () -> MongoPlanRenderer.toBson(range("arr", 1, null)));
  }
}
