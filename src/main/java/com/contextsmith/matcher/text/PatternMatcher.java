package com.contextsmith.matcher.text;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.matcher.ahocorasick.AhoCorasickAutomaton;
import com.contextsmith.matcher.ahocorasick.PatternMatch;
import com.contextsmith.matcher.ahocorasick.PatternMatches;
import com.contextsmith.matcher.buffer.BufferManager;
import com.contextsmith.matcher.buffer.DataBlock;
import com.contextsmith.matcher.utils.FileUtil;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * Matches a dictionary of textual patterns against texts. Texts are split
 * into words (or bytes, see {@link TokenizationMode}), every distinct word
 * of the dictionary gets a dense identifier, and the identifiers are fed
 * to an {@link AhoCorasickAutomaton}. Positions of matches count words.
 *
 * <p>Pattern texts and dictionary words are copied once into a
 * {@link BufferManager}; lookups during a scan use views of the input and
 * copy nothing.</p>
 */
public class PatternMatcher<K> {
  private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

  public static final int MAX_PATTERN_WORDS = (1 << Short.SIZE) - 1;
  // Given to the words of a text that no pattern contains.
  static final int UNKNOWN_WORD_ID = 0;

  /**
   * Creates a matcher with the patterns of a dictionary. See
   * {@link PatternLineProcessor} for the format. The matcher is not
   * compiled.
   */
  public static PatternMatcher<String> loadDictionary(
      String dataPath, MatcherConfiguration configuration) throws IOException {
    PatternMatcher<String> matcher = new PatternMatcher<>(configuration);
    log.info("Loading patterns from: {}", dataPath);
    Stopwatch stopwatch = Stopwatch.createStarted();
    int numPatterns = FileUtil.findResourceAsCharSource(dataPath)
        .readLines(new PatternLineProcessor(matcher));
    log.info("Loaded {} pattern(s) in {}", numPatterns, stopwatch);
    return matcher;
  }

  private final MatcherConfiguration configuration;
  private final AhoCorasickAutomaton<K, Integer> automaton;
  private final BufferManager bufferManager;
  private final WordTokenizer tokenizer;
  private Set<DataBlock> patternSet;
  private Map<DataBlock, Integer> wordToWordId;

  public PatternMatcher() {
    this(MatcherConfiguration.defaults());
  }

  public PatternMatcher(MatcherConfiguration configuration) {
    this.configuration = checkNotNull(configuration).validate();
    this.automaton = new AhoCorasickAutomaton<>();
    this.bufferManager = new BufferManager(configuration.getBufferBlockSize());
    this.tokenizer = new WordTokenizer(configuration);
    this.patternSet = new HashSet<>();
    this.wordToWordId = new HashMap<>();

    if (configuration.getExpectedPatterns() > 0) {
      reserve(configuration.getExpectedPatterns());
    }
  }

  /**
   * Adds a pattern. Nothing is stored unless the pattern is accepted.
   *
   * @throws IllegalStateException if the matcher is compiled
   * @throws IllegalArgumentException if the key or the text was already
   *     added, if the text has no word, or if another text with the same
   *     words was already added
   */
  public void addPattern(K key, String pattern) {
    checkNotNull(key, "Pattern key cannot be null");
    checkNotNull(pattern, "Pattern cannot be null");
    checkState(!this.automaton.isCompiled(),
        "Can't add patterns after compile() is called.");

    DataBlock text = DataBlock.wrap(pattern.getBytes(StandardCharsets.UTF_8));
    checkArgument(!this.patternSet.contains(text),
        "This pattern has been already inserted: '%s'", pattern);

    List<DataBlock> words = this.tokenizer.tokenize(text);
    checkArgument(!words.isEmpty(), "Pattern has no words: '%s'", pattern);
    checkArgument(words.size() <= MAX_PATTERN_WORDS,
        "Pattern has more than %s words", MAX_PATTERN_WORDS);

    // New words get tentative ids, committed once the automaton accepts.
    Map<DataBlock, Integer> newWords = new LinkedHashMap<>();
    List<Integer> wordIds = new ArrayList<>(words.size());
    for (DataBlock word : words) {
      Integer wordId = this.wordToWordId.get(word);
      if (wordId == null) wordId = newWords.get(word);
      if (wordId == null) {
        wordId = this.wordToWordId.size() + newWords.size() + 1;
        newWords.put(word, wordId);
      }
      wordIds.add(wordId);
    }
    this.automaton.addPattern(key, wordIds);

    DataBlock stored = this.bufferManager.allocate(text.toByteArray());
    this.patternSet.add(stored);
    if (!newWords.isEmpty()) {
      // Key the table with views of the stored copy, not of the caller's text.
      for (DataBlock word : this.tokenizer.tokenize(stored)) {
        Integer wordId = newWords.remove(word);
        if (wordId != null) this.wordToWordId.put(word, wordId);
      }
    }
  }

  /**
   * Compiles the underlying automaton, then reduces its memory footprint
   * unless the configuration says otherwise.
   */
  public void compile() {
    if (this.automaton.isCompiled()) return;
    log.info("Compiling aho-corasick automaton... ");
    Stopwatch stopwatch = Stopwatch.createStarted();
    this.automaton.compile();
    if (this.configuration.isCompactOnCompile()) {
      this.automaton.reduceMemoryFootprint();
    }
    log.info("Finished compilation of {} pattern(s) in {}",
        this.automaton.getPatternCount(), stopwatch);
  }

  public void completeWithSuffixMatches(PatternMatches<K> srcMatches,
                                        PatternMatches<K> dstMatches) {
    this.automaton.completeWithSuffixMatches(srcMatches, dstMatches);
  }

  /**
   * Appends to {@code matches} every pattern found in {@code text}, in
   * order of end position and, at the same position, longest first.
   */
  public void findPatterns(String text, PatternMatches<K> matches) {
    checkNotNull(text);
    checkState(this.automaton.isCompiled(),
        "Can't search patterns until compile() is called.");

    int stateId = AhoCorasickAutomaton.ROOT_STATE;
    long pos = 0;
    for (int wordId : toWordIds(text)) {
      stateId = this.automaton.nextState(stateId, wordId, matches, pos++);
    }
  }

  public MatcherConfiguration getConfiguration() {
    return this.configuration;
  }

  /**
   * Returns the number of words of the pattern added with {@code key}.
   */
  public int getPatternLength(K key) {
    return this.automaton.getPatternLength(key);
  }

  public Map<K, Integer> getPatternLengthMap() {
    ImmutableMap.Builder<K, Integer> builder = ImmutableMap.builder();
    for (K key : this.automaton.getPatternKeys()) {
      builder.put(key, this.automaton.getPatternLength(key));
    }
    return builder.build();
  }

  public Set<DataBlock> getPatternSet() {
    return Collections.unmodifiableSet(this.patternSet);
  }

  public int getWordCount() {
    return this.wordToWordId.size();
  }

  public boolean isCompiled() {
    return this.automaton.isCompiled();
  }

  public void reserve(int numPatterns) {
    this.automaton.reserve(numPatterns);
    if (this.patternSet.isEmpty()) {
      this.patternSet = Sets.newHashSetWithExpectedSize(numPatterns);
    }
    if (this.wordToWordId.isEmpty()) {
      this.wordToWordId = Maps.newHashMapWithExpectedSize(numPatterns);
    }
  }

  /**
   * Starts a lazy scan of {@code text}; same matches as
   * {@link #findPatterns}.
   */
  public Iterator<PatternMatch<K>> search(String text, boolean includeSuffixes) {
    checkNotNull(text);
    return this.automaton.search(toWordIds(text), includeSuffixes);
  }

  private List<Integer> toWordIds(String text) {
    DataBlock textBlock = DataBlock.wrap(text.getBytes(StandardCharsets.UTF_8));
    return Lists.transform(this.tokenizer.tokenize(textBlock), word -> {
      Integer wordId = this.wordToWordId.get(word);
      return (wordId == null) ? UNKNOWN_WORD_ID : wordId;
    });
  }
}
