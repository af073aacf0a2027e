package com.contextsmith.matcher.text;

import com.google.gson.annotations.SerializedName;

/**
 * How a text is turned into the symbols fed to the automaton.
 */
public enum TokenizationMode {
  // Words separated by the delimiter byte; empty words are skipped.
  @SerializedName("word")
  WORD,
  // Every byte is a symbol, delimiters included.
  @SerializedName("character")
  CHARACTER
}
