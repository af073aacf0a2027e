package com.contextsmith.matcher.ahocorasick;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, append-only accumulator of {@link PatternMatch}es.
 *
 * <p>The accumulator is tagged at construction with whether it holds
 * suffix-expanded matches, i.e. whether every match is followed by the
 * shorter dictionary patterns ending at the same position. The automaton
 * honours the tag while scanning, and
 * {@link AhoCorasickAutomaton#completeWithSuffixMatches} checks it.</p>
 */
public class PatternMatches<K> implements Iterable<PatternMatch<K>> {
  private final List<PatternMatch<K>> matches;
  private final boolean includeSuffixes;

  public PatternMatches() {
    this(true);
  }

  public PatternMatches(boolean includeSuffixes) {
    this.matches = new ArrayList<>();
    this.includeSuffixes = includeSuffixes;
  }

  public void add(PatternMatch<K> match) {
    this.matches.add(match);
  }

  public void add(K pattern, long endPosition) {
    this.matches.add(new PatternMatch<>(pattern, endPosition));
  }

  public List<PatternMatch<K>> asList() {
    return Collections.unmodifiableList(this.matches);
  }

  public void clear() {
    this.matches.clear();
  }

  public PatternMatch<K> get(int index) {
    return this.matches.get(index);
  }

  public boolean includesSuffixes() {
    return this.includeSuffixes;
  }

  public boolean isEmpty() {
    return this.matches.isEmpty();
  }

  @Override
  public Iterator<PatternMatch<K>> iterator() {
    return asList().iterator();
  }

  public int size() {
    return this.matches.size();
  }

  @Override
  public String toString() {
    return this.matches.toString();
  }

  // Drops every match appended after the first 'size' ones.
  void truncate(int size) {
    this.matches.subList(size, this.matches.size()).clear();
  }
}
