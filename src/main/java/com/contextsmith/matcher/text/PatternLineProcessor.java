package com.contextsmith.matcher.text;

import java.util.Iterator;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.matcher.utils.ProcessUtil;
import com.google.common.base.Splitter;
import com.google.common.io.LineProcessor;

/**
 * Adds the patterns of a dictionary to a {@link PatternMatcher}, one per
 * line: {@code key<TAB>pattern}, or just {@code pattern}, in which case
 * the pattern is its own key. Blank lines and lines starting with '#' are
 * ignored. Rejected entries are logged and skipped. The result is the
 * number of patterns added.
 */
public class PatternLineProcessor implements LineProcessor<Integer> {
  private static final Logger log = LoggerFactory.getLogger(PatternLineProcessor.class);

  public static final String COMMENT_PREFIX = "#";
  private static final int PROGRESS_INTERVAL = 10000;

  private final PatternMatcher<String> matcher;
  private int numLines;
  private int numPatterns;

  public PatternLineProcessor(PatternMatcher<String> matcher) {
    this.matcher = matcher;
    this.numLines = 0;
    this.numPatterns = 0;
  }

  @Override
  public Integer getResult() {
    return this.numPatterns;
  }

  @Override
  public boolean processLine(String line) {
    ++this.numLines;
    if (StringUtils.isBlank(line) || line.trim().startsWith(COMMENT_PREFIX)) {
      return true;
    }

    Iterator<String> iter = Splitter.on('\t').trimResults().limit(2).split(line).iterator();
    String first = iter.next();
    String key = first;
    String pattern = iter.hasNext() ? iter.next() : first;
    if (StringUtils.isEmpty(key) || StringUtils.isBlank(pattern)) {
      log.warn("Line {}: invalid entry, skipping: {}", this.numLines, line);
      return true;
    }

    try {
      this.matcher.addPattern(key, pattern);
    } catch (IllegalArgumentException e) {
      log.warn("Line {}: {}, skipping", this.numLines, e.getMessage());
      return true;
    }
    ++this.numPatterns;
    log.trace("Added pattern {}: \"{}\"", key, pattern);

    if (this.numPatterns % PROGRESS_INTERVAL == 0) {
      log.info("{}. {}, Storing: {}", this.numPatterns,
          ProcessUtil.getHeapConsumption(), pattern);
    }
    return true;
  }
}
