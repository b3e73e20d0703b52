package io.intellixity.querygate.pipeline.intent;

import io.intellixity.querygate.model.ConversationContext;
import io.intellixity.querygate.model.Intent;
import io.intellixity.querygate.model.IntentCategory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic rule-based classifier. Rules are tried in order and the first match wins; with no
 * match the query is OUT_OF_SCOPE with confidence 0. Conversation context is ignored.
 */
public final class KeywordIntentClassifier implements IntentClassifier {
  public record Rule(IntentCategory category, double confidence, Pattern pattern) {
    public Rule {
      Objects.requireNonNull(category, "category");
      Objects.requireNonNull(pattern, "pattern");
    }

    public static Rule words(IntentCategory category, double confidence, String... phrases) {
      StringBuilder re = new StringBuilder("\\b(?:");
      for (int i = 0; i < phrases.length; i++) {
        if (i > 0) re.append('|');
        re.append(Pattern.quote(phrases[i].toLowerCase(Locale.ROOT)));
      }
      re.append(")");
      return new Rule(category, confidence, Pattern.compile(re.toString()));
    }
  }

  private final List<Rule> rules;

  public KeywordIntentClassifier(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  /** Injection phrases first, then analysis, data and knowledge cues. */
  public static KeywordIntentClassifier defaults() {
    return new KeywordIntentClassifier(List.of(
        Rule.words(IntentCategory.OUT_OF_SCOPE, 0.95,
            "ignore access", "ignore previous", "ignore all", "bypass", "override policy", "disable security",
            "drop table", "delete from", "grant me"),
        Rule.words(IntentCategory.ANALYSIS, 0.8,
            "compare", "trend", "breakdown", "analy", "forecast", "why did", "year over year"),
        Rule.words(IntentCategory.DATA_QUERY, 0.85,
            "show", "list", "how many", "total", "sum of", "give me", "fetch", "report"),
        Rule.words(IntentCategory.SAFE_KNOWLEDGE, 0.9,
            "what is", "what are", "define", "explain", "meaning of", "how does")));
  }

  @Override
  public Intent classify(String queryText, ConversationContext context) {
    if (queryText == null || queryText.isBlank()) return Intent.failClosed("empty query");
    String text = queryText.toLowerCase(Locale.ROOT);
    for (Rule r : rules) {
      if (r.pattern().matcher(text).find()) {
        return new Intent(r.category(), r.confidence(), "matched " + r.pattern().pattern());
      }
    }
    return Intent.failClosed("no rule matched");
  }
}
