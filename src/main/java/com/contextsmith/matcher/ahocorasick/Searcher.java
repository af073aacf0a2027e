package com.contextsmith.matcher.ahocorasick;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
   Iterator over the matches of a running scan. Symbols are consumed
   lazily, only as far as needed to produce the next match.
 */
public class Searcher<K, S> implements Iterator<PatternMatch<K>> {
  private final AhoCorasickAutomaton<K, S> automaton;
  private final Iterator<? extends S> symbols;
  // Matches found at the last consumed position, not yet returned.
  private final PatternMatches<K> pending;
  private int pendingIndex;
  private int stateId;
  private long position;

  Searcher(AhoCorasickAutomaton<K, S> automaton,
           Iterator<? extends S> symbols, boolean includeSuffixes) {
    this.automaton = automaton;
    this.symbols = symbols;
    this.pending = new PatternMatches<>(includeSuffixes);
    this.pendingIndex = 0;
    this.stateId = AhoCorasickAutomaton.ROOT_STATE;
    this.position = 0;
  }

  /**
   * Returns the state reached after the last consumed symbol.
   */
  public int getStateId() {
    return this.stateId;
  }

  @Override
  public boolean hasNext() {
    if (this.pendingIndex < this.pending.size()) return true;
    continueSearch();
    return this.pendingIndex < this.pending.size();
  }

  @Override
  public PatternMatch<K> next() {
    if (!hasNext()) throw new NoSuchElementException();
    return this.pending.get(this.pendingIndex++);
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  // Consumes symbols until at least one match is pending or input ends.
  private void continueSearch() {
    this.pending.clear();
    this.pendingIndex = 0;
    while (this.pending.isEmpty() && this.symbols.hasNext()) {
      this.stateId = this.automaton.nextState(
          this.stateId, this.symbols.next(), this.pending, this.position++);
    }
  }
}
