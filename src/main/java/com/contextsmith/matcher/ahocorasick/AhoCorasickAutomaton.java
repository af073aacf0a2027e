package com.contextsmith.matcher.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
   <p>An implementation of the <a
   href="http://portal.acm.org/citation.cfm?id=360855&dl=ACM&coll=GUIDE"
   target="_blank">Aho-Corasick</a> automaton over an arbitrary alphabet.
   Symbols can be any value with proper {@code equals} and {@code hashCode};
   transitions are kept in sparse hash tables.</p>

   <p>The object starts as a trie to which patterns are added. After
   {@link #compile()} it becomes an automaton with a total transition
   function, and it can no longer be modified. Nodes, goto tables and
   patterns live in three dense lists and refer to each other by index.</p>

   <p>
   Example usage:
   <code><pre>
       AhoCorasickAutomaton&lt;Integer, String&gt; automaton = new AhoCorasickAutomaton&lt;&gt;();
       automaton.addPattern(0, "hello");
       automaton.addPattern(1, "world");
       automaton.addPattern(2, "hello", "world");
       automaton.compile();

       PatternMatches&lt;Integer&gt; matches = new PatternMatches&lt;&gt;(true);
       int state = AhoCorasickAutomaton.ROOT_STATE;
       long pos = 0;
       for (String word : "hello world string".split(" ")) {
         state = automaton.nextState(state, word, matches, pos++);
       }
       // matches: [0@0, 2@1, 1@1]
   </pre></code>
   </p>

   <p>Queries on a compiled automaton do not modify it and may run
   concurrently. Everything else must be externally synchronized.</p>
 */
public class AhoCorasickAutomaton<K, S> {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasickAutomaton.class);

  public static final int ROOT_STATE = 0;

  // Ids are non-negative ints; the last value is never handed out.
  static final int MAX_ID = Integer.MAX_VALUE;
  // Absent goto table, pattern or edge. Never stored outside this package.
  static final int NONE = -1;

  private static class Node {
    int gotoId;
    int patternId;

    Node(int gotoId, int patternId) {
      this.gotoId = gotoId;
      this.patternId = patternId;
    }

    boolean hasGoto() {
      return this.gotoId != NONE;
    }

    boolean hasPattern() {
      return this.patternId != NONE;
    }
  }

  private static class BfsEntry {
    final int failStateId;
    final int currStateId;

    BfsEntry(int failStateId, int currStateId) {
      this.failStateId = failStateId;
      this.currStateId = currStateId;
    }
  }

  private boolean isCompiled;
  private final ArrayList<Node> stateIdToNode;
  private final ArrayList<GotoTable<S>> gotoIdToGoto;
  private final ArrayList<K> patternIdToKey;
  private final ArrayList<Integer> patternIdToLength;
  private int[] patternIdToSuffixPatternId;
  private Map<K, Integer> patternKeyToPatternId;

  /**
   * Creates an empty trie, made only of the root state.
   */
  public AhoCorasickAutomaton() {
    this.isCompiled = false;
    this.stateIdToNode = new ArrayList<>();
    this.gotoIdToGoto = new ArrayList<>();
    this.patternIdToKey = new ArrayList<>();
    this.patternIdToLength = new ArrayList<>();
    this.patternIdToSuffixPatternId = new int[0];
    this.patternKeyToPatternId = new HashMap<>();

    // The root owns goto table 0, which becomes the default table.
    this.gotoIdToGoto.add(new GotoTable<>());
    this.stateIdToNode.add(new Node(0, NONE));
  }

  /**
   * Adds a new pattern to the trie.
   *
   * @param key the value reported when the pattern is matched
   * @param symbols the non-empty sequence of symbols of the pattern
   * @throws IllegalStateException if the automaton is compiled
   * @throws IllegalArgumentException if the key or the sequence was
   *     already added, or if the sequence is empty
   */
  public void addPattern(K key, Iterable<? extends S> symbols) {
    checkState(!this.isCompiled,
        "This method cannot be called after the automaton has been compiled");
    checkNotNull(key, "Pattern key cannot be null");
    checkNotNull(symbols, "Pattern cannot be null");
    // Copy first so that a null symbol fails before the trie is touched.
    addPatternCore(key, ImmutableList.copyOf(symbols));
  }

  @SafeVarargs
  public final void addPattern(K key, S... symbols) {
    checkNotNull(symbols, "Pattern cannot be null");
    addPattern(key, Arrays.asList(symbols));
  }

  /**
   * Compiles the trie into an automaton. Calling it again has no effect.
   */
  public void compile() {
    if (this.isCompiled) return;
    Stopwatch stopwatch = Stopwatch.createStarted();
    compileCore();
    this.isCompiled = true;
    log.debug("Compiled {} pattern(s) into {} state(s) and {} goto table(s) in {}",
        getPatternCount(), getStateCount(), getGotoTableCount(), stopwatch);
  }

  /**
   * Appends to {@code dstMatches} every match of {@code srcMatches}, each
   * one followed by the shorter dictionary patterns ending at the same
   * position. The result equals what a scan with suffixes would produce.
   * If a key is unknown, {@code dstMatches} is restored to its initial
   * content before the exception is thrown.
   *
   * @param srcMatches matches collected without suffixes
   * @param dstMatches an accumulator that includes suffixes
   */
  public void completeWithSuffixMatches(PatternMatches<K> srcMatches,
                                        PatternMatches<K> dstMatches) {
    checkArgument(!srcMatches.includesSuffixes(),
        "The source matches must not include the suffixes");
    checkArgument(dstMatches.includesSuffixes(),
        "The destination matches must include the suffixes");

    int dstInitialSize = dstMatches.size();
    for (PatternMatch<K> match : srcMatches) {
      Integer patternId = this.patternKeyToPatternId.get(match.getPattern());
      if (patternId == null) {
        dstMatches.truncate(dstInitialSize);
        throw new IllegalArgumentException(String.format(
            "The pattern %s of the source matches has not been found",
            match.getPattern()));
      }
      dstMatches.add(match);
      addSuffixMatches(patternId, match.getEndPosition(), dstMatches);
    }
  }

  public boolean containsKey(K key) {
    return this.patternKeyToPatternId.containsKey(key);
  }

  public int getGotoTableCount() {
    return this.gotoIdToGoto.size();
  }

  public int getPatternCount() {
    return this.patternIdToKey.size();
  }

  /**
   * Returns the keys of all the patterns, in insertion order.
   */
  public List<K> getPatternKeys() {
    return Collections.unmodifiableList(this.patternIdToKey);
  }

  /**
   * Returns the number of symbols of the pattern registered with {@code key}.
   */
  public int getPatternLength(K key) {
    Integer patternId = this.patternKeyToPatternId.get(key);
    checkArgument(patternId != null, "The pattern %s has not been found", key);
    return this.patternIdToLength.get(patternId);
  }

  public int getStateCount() {
    return this.stateIdToNode.size();
  }

  public boolean isCompiled() {
    return this.isCompiled;
  }

  /**
   * Returns the state reached from {@code stateId} with {@code symbol}.
   * The result is only meaningful on a compiled automaton.
   */
  public int nextState(int stateId, S symbol) {
    return transition(stateId, symbol);
  }

  /**
   * Like {@link #nextState(int, Object)}, and appends to {@code keys} the
   * pattern recognized at the next state followed by all its dictionary
   * suffixes, longest first.
   */
  public int nextState(int stateId, S symbol, Collection<? super K> keys) {
    int nextStateId = transition(stateId, symbol);
    int patternId = this.stateIdToNode.get(nextStateId).patternId;
    while (patternId != NONE) {
      keys.add(this.patternIdToKey.get(patternId));
      patternId = suffixOf(patternId);
    }
    return nextStateId;
  }

  /**
   * Like {@link #nextState(int, Object)}, and appends to {@code matches}
   * the pattern recognized at the next state, at {@code position}. If the
   * accumulator includes suffixes, the shorter dictionary patterns ending
   * there follow, longest first.
   */
  public int nextState(int stateId, S symbol, PatternMatches<K> matches,
                       long position) {
    int nextStateId = transition(stateId, symbol);
    int patternId = this.stateIdToNode.get(nextStateId).patternId;
    if (patternId != NONE) {
      matches.add(this.patternIdToKey.get(patternId), position);
      if (matches.includesSuffixes()) {
        addSuffixMatches(patternId, position, matches);
      }
    }
    return nextStateId;
  }

  /**
   * Reduces the memory footprint of the internal data structures. Hash
   * tables are rebuilt with a load factor of at most 0.5.
   */
  public void reduceMemoryFootprint() {
    checkState(this.isCompiled,
        "This method cannot be called before the automaton has been compiled");

    this.stateIdToNode.trimToSize();
    this.gotoIdToGoto.trimToSize();
    this.patternIdToKey.trimToSize();
    this.patternIdToLength.trimToSize();

    Map<K, Integer> compacted = new HashMap<>(Math.max(1,
        this.patternKeyToPatternId.size() * GotoTable.COMPACT_SIZE_MULTIPLIER));
    compacted.putAll(this.patternKeyToPatternId);
    this.patternKeyToPatternId = compacted;
    for (GotoTable<S> table : this.gotoIdToGoto) {
      table.compact();
    }
    log.debug("Compacted {} goto table(s)", this.gotoIdToGoto.size());
  }

  /**
   * Reserves enough space for the given number of patterns.
   */
  public void reserve(int numPatterns) {
    checkState(!this.isCompiled,
        "This method cannot be called after the automaton has been compiled");
    if (numPatterns < 1) numPatterns = 1;

    this.stateIdToNode.ensureCapacity(numPatterns);
    this.gotoIdToGoto.ensureCapacity(numPatterns);
    this.patternIdToKey.ensureCapacity(numPatterns);
    this.patternIdToLength.ensureCapacity(numPatterns);
    if (numPatterns > this.patternKeyToPatternId.size()) {
      Map<K, Integer> reserved = Maps.newHashMapWithExpectedSize(numPatterns);
      reserved.putAll(this.patternKeyToPatternId);
      this.patternKeyToPatternId = reserved;
    }
  }

  /**
   * Starts a new scan of {@code symbols} from the root, and returns an
   * Iterator of the matches. Positions start at 0.
   */
  public Iterator<PatternMatch<K>> search(Iterable<? extends S> symbols,
                                          boolean includeSuffixes) {
    checkState(this.isCompiled,
        "Can't start search until compile() is called.");
    return new Searcher<K, S>(this, symbols.iterator(), includeSuffixes);
  }

  // Returns the goto table id of a state, or NONE. Package protected for tests.
  int getGotoId(int stateId) {
    return this.stateIdToNode.get(stateId).gotoId;
  }

  private void addPatternCore(K key, List<S> pattern) {
    checkArgument(!this.patternKeyToPatternId.containsKey(key),
        "The key %s has already been inserted", key);
    checkArgument(!pattern.isEmpty(), "Pattern must be non empty");
    if (this.patternIdToKey.size() == MAX_ID) {
      throw new IllegalStateException("Too many patterns have been inserted");
    }

    Node currNode = this.stateIdToNode.get(ROOT_STATE);
    for (S symbol : pattern) {
      // Check if the node has a goto table, otherwise create it.
      if (!currNode.hasGoto()) {
        currNode.gotoId = newGotoTable();
      }
      GotoTable<S> gotoTable = this.gotoIdToGoto.get(currNode.gotoId);

      // Follow the edge if it exists, otherwise create it with its target.
      int nextStateId = gotoTable.get(symbol);
      if (nextStateId == NONE) {
        nextStateId = newState();
        gotoTable.put(symbol, nextStateId);
      }
      currNode = this.stateIdToNode.get(nextStateId);
    }

    // Only existing edges have been followed if the pattern is already in.
    checkArgument(!currNode.hasPattern(),
        "The given pattern was already inside the automaton");

    int patternId = this.patternIdToKey.size();
    this.patternIdToKey.add(key);
    this.patternIdToLength.add(pattern.size());
    this.patternKeyToPatternId.put(key, patternId);
    currNode.patternId = patternId;
  }

  private void addSuffixMatches(int patternId, long position,
                                PatternMatches<K> matches) {
    for (int suffixId = suffixOf(patternId); suffixId != NONE;
         suffixId = suffixOf(suffixId)) {
      matches.add(this.patternIdToKey.get(suffixId), position);
    }
  }

  /**
   * Breadth-first over the trie, so that the failure state of every node
   * is final before any deeper node reads it. For each node this:
   * 1) merges the output of the failure state, 2) enqueues the children
   * with their failure states, 3) extends or borrows the goto table of the
   * failure state.
   */
  private void compileCore() {
    this.patternIdToSuffixPatternId = new int[this.patternIdToKey.size()];
    Arrays.fill(this.patternIdToSuffixPatternId, NONE);

    GotoTable<S> rootGotoTable =
        this.gotoIdToGoto.get(this.stateIdToNode.get(ROOT_STATE).gotoId);
    // The root table is the default for every state: read-only from here on.
    rootGotoTable.freeze();

    Queue<BfsEntry> bfsQueue = new ArrayDeque<>();
    for (Map.Entry<S, Integer> edge : rootGotoTable.entries()) {
      bfsQueue.add(new BfsEntry(ROOT_STATE, edge.getValue()));
    }

    while (!bfsQueue.isEmpty()) {
      BfsEntry entry = bfsQueue.remove();
      Node failNode = this.stateIdToNode.get(entry.failStateId);
      Node currNode = this.stateIdToNode.get(entry.currStateId);
      GotoTable<S> failGotoTable =
          failNode.hasGoto() ? this.gotoIdToGoto.get(failNode.gotoId) : null;
      GotoTable<S> currGotoTable =
          currNode.hasGoto() ? this.gotoIdToGoto.get(currNode.gotoId) : null;

      // 1) Borrow the pattern of the fail node, or link to it as a suffix.
      if (failNode.hasPattern()) {
        if (currNode.hasPattern()) {
          if (this.patternIdToSuffixPatternId[currNode.patternId] != NONE) {
            throw new AssertionError(
                "The suffix link of pattern " + currNode.patternId + " already exists");
          }
          this.patternIdToSuffixPatternId[currNode.patternId] = failNode.patternId;
        } else {
          currNode.patternId = failNode.patternId;
        }
      }

      // 2) Enqueue the explicit children. Same as pairing each child with
      // transition(failStateId, symbol), without the recursion.
      if (currGotoTable != null) {
        for (Map.Entry<S, Integer> edge : currGotoTable.entries()) {
          S symbol = edge.getKey();
          int childFailStateId = NONE;
          if (failGotoTable != null) {
            childFailStateId = failGotoTable.get(symbol);
          }
          if (childFailStateId == NONE && failGotoTable != rootGotoTable) {
            childFailStateId = rootGotoTable.get(symbol);
          }
          if (childFailStateId == NONE) {
            childFailStateId = ROOT_STATE;
          }
          bfsQueue.add(new BfsEntry(childFailStateId, edge.getValue()));
        }
      }

      // 3) Inherit the edges of the fail node. The root is skipped: its
      // table is the default anyway and copying it would waste memory.
      if (entry.failStateId != ROOT_STATE && failGotoTable != null) {
        if (currGotoTable != null) {
          currGotoTable.extendWith(failGotoTable);
        } else {
          // No explicit children to shadow, so the table can be shared.
          failGotoTable.freeze();
          currNode.gotoId = failNode.gotoId;
        }
      }
    }
  }

  private int lookup(int stateId, S symbol) {
    Node node = this.stateIdToNode.get(stateId);
    if (!node.hasGoto()) return NONE;
    return this.gotoIdToGoto.get(node.gotoId).get(symbol);
  }

  private int newGotoTable() {
    int gotoId = this.gotoIdToGoto.size();
    if (gotoId == MAX_ID) {
      throw new IllegalStateException("Too many branches have been inserted in the trie");
    }
    this.gotoIdToGoto.add(new GotoTable<>());
    return gotoId;
  }

  private int newState() {
    int stateId = this.stateIdToNode.size();
    if (stateId == MAX_ID) {
      throw new IllegalStateException("Too many nodes have been inserted in the automaton");
    }
    this.stateIdToNode.add(new Node(NONE, NONE));
    return stateId;
  }

  // The suffix chain only exists after compilation.
  private int suffixOf(int patternId) {
    if (patternId >= this.patternIdToSuffixPatternId.length) return NONE;
    return this.patternIdToSuffixPatternId[patternId];
  }

  // A missing edge restarts from the root; at most one extra lookup.
  private int transition(int stateId, S symbol) {
    checkElementIndex(stateId, this.stateIdToNode.size(), "state id");
    int nextStateId = lookup(stateId, symbol);
    if (nextStateId != NONE) return nextStateId;
    if (stateId == ROOT_STATE) return ROOT_STATE;
    nextStateId = lookup(ROOT_STATE, symbol);
    return (nextStateId == NONE) ? ROOT_STATE : nextStateId;
  }
}
