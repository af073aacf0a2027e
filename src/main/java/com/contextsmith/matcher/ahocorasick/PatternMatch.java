package com.contextsmith.matcher.ahocorasick;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * A dictionary pattern found in a scanned sequence: the key of the pattern
 * and the position of its last symbol.
 */
public class PatternMatch<K> {
  private final K pattern;
  private final long endPosition;

  public PatternMatch(K pattern, long endPosition) {
    this.pattern = checkNotNull(pattern, "Pattern key cannot be null");
    this.endPosition = endPosition;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    PatternMatch<?> other = (PatternMatch<?>) obj;
    return this.endPosition == other.endPosition &&
           this.pattern.equals(other.pattern);
  }

  /**
   * Returns the position (0-based) of the last symbol of the match.
   */
  public long getEndPosition() {
    return this.endPosition;
  }

  /**
   * Returns the key the matched pattern was registered with.
   */
  public K getPattern() {
    return this.pattern;
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.pattern, this.endPosition);
  }

  @Override
  public String toString() {
    return String.format("%s@%d", this.pattern, this.endPosition);
  }
}
