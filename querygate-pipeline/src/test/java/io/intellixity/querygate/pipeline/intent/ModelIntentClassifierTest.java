package io.intellixity.querygate.pipeline.intent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.querygate.model.ConversationContext;
import io.intellixity.querygate.model.Intent;
import io.intellixity.querygate.model.IntentCategory;
import io.intellixity.querygate.pipeline.RetryPolicy;
import io.intellixity.querygate.pipeline.model.ModelClient;
import io.intellixity.querygate.pipeline.model.ModelClientException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class ModelIntentClassifierTest {
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final ObjectMapper mapper = new ObjectMapper();

  @AfterEach
  void shutdown() {
    executor.shutdownNow();
  }

  private ModelIntentClassifier classifier(ModelClient model, RetryPolicy retry, Duration timeout) {
    return new ModelIntentClassifier(model, mapper, timeout,
        Map.of("fpna_data_query", IntentCategory.DATA_QUERY), retry, executor);
  }

  @Test
  void parsesFencedAnswerAndMapsAliases() {
    ModelClient model = (instructions, input) ->
        "```json\n{\"category\": \"FPNA_DATA_QUERY\", \"confidence\": 0.92, \"rationale\": \"cost center figures\"}\n```";
    Intent intent = classifier(model, RetryPolicy.none(), Duration.ofSeconds(2))
        .classify("Show variance for cost center 101", ConversationContext.empty());

    assertEquals(IntentCategory.DATA_QUERY, intent.category());
    assertEquals(0.92, intent.confidence(), 1e-9);
    assertEquals("cost center figures", intent.rationale());
  }

  @Test
  void unknownLabelIsCoercedToOutOfScope() {
    ModelClient model = (i, in) -> "{\"category\": \"ADMIN_OVERRIDE\", \"confidence\": 0.99}";
    Intent intent = classifier(model, RetryPolicy.none(), Duration.ofSeconds(2)).classify("x", null);

    assertEquals(IntentCategory.OUT_OF_SCOPE, intent.category());
    assertEquals(0.99, intent.confidence(), 1e-9);
  }

  @Test
  void malformedAnswersFailClosed() {
    ModelIntentClassifier c = classifier((i, in) -> "not json at all", RetryPolicy.none(), Duration.ofSeconds(2));
    assertFailClosed(c.classify("x", null));

    c = classifier((i, in) -> "{\"category\": \"DATA_QUERY\", \"confidence\": \"high\"}", RetryPolicy.none(), Duration.ofSeconds(2));
    assertFailClosed(c.classify("x", null));

    c = classifier((i, in) -> "{\"category\": \"DATA_QUERY\", \"confidence\": 1.7}", RetryPolicy.none(), Duration.ofSeconds(2));
    assertFailClosed(c.classify("x", null));

    c = classifier((i, in) -> "{\"confidence\": 0.9}", RetryPolicy.none(), Duration.ofSeconds(2));
    assertFailClosed(c.classify("x", null));
  }

  @Test
  void modelErrorIsRetriedThenSucceeds() {
    AtomicInteger calls = new AtomicInteger();
    ModelClient model = (i, in) -> {
      if (calls.incrementAndGet() == 1) throw new ModelClientException("503");
      return "{\"category\": \"SAFE_KNOWLEDGE\", \"confidence\": 0.9}";
    };
    Intent intent = classifier(model, RetryPolicy.once(Duration.ZERO), Duration.ofSeconds(2)).classify("What is EBITDA?", null);

    assertEquals(IntentCategory.SAFE_KNOWLEDGE, intent.category());
    assertEquals(2, calls.get());
  }

  @Test
  void timeoutFailsClosed() {
    CountDownLatch never = new CountDownLatch(1);
    ModelClient slow = (i, in) -> {
      try {
        never.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return "{\"category\": \"DATA_QUERY\", \"confidence\": 0.99}";
    };
    Intent intent = classifier(slow, RetryPolicy.none(), Duration.ofMillis(50)).classify("Show totals", null);

    assertFailClosed(intent);
  }

  @Test
  void contextIsRenderedBeforeTheRequest() {
    AtomicReference<String> seen = new AtomicReference<>();
    ModelClient model = (i, in) -> {
      seen.set(in);
      return "{\"category\": \"DATA_QUERY\", \"confidence\": 0.8}";
    };
    classifier(model, RetryPolicy.none(), Duration.ofSeconds(2))
        .classify("and for 102?", new ConversationContext(List.of("Show variance for cost center 101")));

    assertTrue(seen.get().startsWith("Previous turns:"));
    assertTrue(seen.get().endsWith("Request:\nand for 102?"));
  }

  private static void assertFailClosed(Intent intent) {
    assertEquals(IntentCategory.OUT_OF_SCOPE, intent.category());
    assertEquals(0.0, intent.confidence());
  }
}
