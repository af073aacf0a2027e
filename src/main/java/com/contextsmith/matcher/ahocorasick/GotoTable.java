package com.contextsmith.matcher.ahocorasick;

import static com.google.common.base.Preconditions.checkState;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * A sparse transition table of a trie node: symbol to child state id.
 *
 * <p>After compilation a table may be referenced by several nodes (a node
 * without explicit children borrows the table of its failure state). Such
 * a table is frozen and can no longer be written; so is the root table once
 * compilation starts.</p>
 */
class GotoTable<S> {
  // Hash tables are rebuilt with this many buckets per entry on compaction.
  static final int COMPACT_SIZE_MULTIPLIER = 2;

  private Map<S, Integer> transitions;
  private boolean isFrozen;

  GotoTable() {
    this.transitions = new HashMap<>();
    this.isFrozen = false;
  }

  /**
   * Returns the target state of {@code symbol}, or -1 if there is no edge.
   */
  int get(S symbol) {
    Integer stateId = this.transitions.get(symbol);
    return (stateId == null) ? -1 : stateId.intValue();
  }

  boolean contains(S symbol) {
    return this.transitions.containsKey(symbol);
  }

  Set<Map.Entry<S, Integer>> entries() {
    return this.transitions.entrySet();
  }

  void put(S symbol, int stateId) {
    checkState(!this.isFrozen, "A frozen goto table cannot be modified");
    this.transitions.put(symbol, stateId);
  }

  /**
   * Copies every edge of {@code other} whose symbol is missing here.
   * Explicit edges of this table always win.
   */
  void extendWith(GotoTable<S> other) {
    checkState(!this.isFrozen, "A frozen goto table cannot be modified");
    for (Map.Entry<S, Integer> entry : other.transitions.entrySet()) {
      this.transitions.putIfAbsent(entry.getKey(), entry.getValue());
    }
  }

  void freeze() {
    this.isFrozen = true;
  }

  boolean isFrozen() {
    return this.isFrozen;
  }

  int size() {
    return this.transitions.size();
  }

  /**
   * Rebuilds the backing hash table so that its load factor is at most 0.5.
   * The content is unchanged, so this is allowed on frozen tables.
   */
  void compact() {
    Map<S, Integer> compacted =
        new HashMap<>(Math.max(1, this.transitions.size() * COMPACT_SIZE_MULTIPLIER));
    compacted.putAll(this.transitions);
    this.transitions = compacted;
  }
}
