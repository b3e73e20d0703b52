package io.intellixity.querygate.model;

import java.util.ArrayList;
import java.util.List;

/** Prior conversation turns handed to the classifier. Bounded to the most recent {@link #MAX_TURNS}. */
public record ConversationContext(List<String> turns) {
  public static final int MAX_TURNS = 10;
  public static final int MAX_TURN_CHARS = 2_000;

  public ConversationContext {
    List<String> src = turns == null ? List.of() : turns;
    int from = Math.max(0, src.size() - MAX_TURNS);
    List<String> kept = new ArrayList<>();
    for (String t : src.subList(from, src.size())) {
      if (t == null) continue;
      kept.add(t.length() > MAX_TURN_CHARS ? t.substring(0, MAX_TURN_CHARS) : t);
    }
    turns = List.copyOf(kept);
  }

  public static ConversationContext empty() { return new ConversationContext(List.of()); }

  public boolean isEmpty() { return turns.isEmpty(); }
}
