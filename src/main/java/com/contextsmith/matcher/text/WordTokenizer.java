package com.contextsmith.matcher.text;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.contextsmith.matcher.buffer.DataBlock;

/**
 * Splits a text into the views of its symbols, without copying.
 */
public class WordTokenizer {
  private final TokenizationMode mode;
  private final byte delimiter;

  public WordTokenizer(MatcherConfiguration configuration) {
    this(configuration.getTokenization(), configuration.getDelimiter());
  }

  public WordTokenizer(TokenizationMode mode, byte delimiter) {
    this.mode = checkNotNull(mode);
    this.delimiter = delimiter;
  }

  public TokenizationMode getMode() {
    return this.mode;
  }

  public List<DataBlock> tokenize(DataBlock text) {
    List<DataBlock> tokens = new ArrayList<>();
    if (this.mode == TokenizationMode.CHARACTER) {
      for (int i = 0; i < text.size(); ++i) {
        tokens.add(text.sub(i, 1));
      }
      return tokens;
    }

    for (int markerPos = 0, delimiterPos = 0, maxPos = text.size();
         markerPos < maxPos; markerPos = delimiterPos + 1) {
      delimiterPos = text.find(this.delimiter, markerPos);
      // Skip empty words (consecutive delimiters).
      if (markerPos >= delimiterPos) continue;
      tokens.add(text.sub(markerPos, delimiterPos - markerPos));
    }
    return tokens;
  }
}
