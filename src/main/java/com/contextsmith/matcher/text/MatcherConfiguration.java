package com.contextsmith.matcher.text;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.matcher.buffer.BufferManager;
import com.contextsmith.matcher.utils.FileUtil;
import com.contextsmith.matcher.utils.StringUtil;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * JSON data object configuring a {@link PatternMatcher}. Fields missing
 * from the JSON keep their default value.
 */
public class MatcherConfiguration {
  private static final Logger log = LoggerFactory.getLogger(MatcherConfiguration.class);

  public static final String DEFAULT_RESOURCE = "pattern-matcher.json";

  private String delimiter = " ";
  private TokenizationMode tokenization = TokenizationMode.WORD;
  @SerializedName("buffer_block_size")
  private int bufferBlockSize = BufferManager.DEFAULT_BLOCK_SIZE;
  @SerializedName("compact_on_compile")
  private boolean compactOnCompile = true;
  @SerializedName("expected_patterns")
  private int expectedPatterns = 0;

  public static MatcherConfiguration defaults() {
    return new MatcherConfiguration();
  }

  public static MatcherConfiguration fromJson(String json) {
    checkNotNull(json, "Configuration cannot be null");
    MatcherConfiguration configuration;
    try {
      configuration = StringUtil.getGsonInstance().fromJson(json, MatcherConfiguration.class);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid matcher configuration: " + e.getMessage(), e);
    }
    if (configuration == null) return defaults();  // Empty document.
    return configuration.validate();
  }

  /**
   * Loads the configuration from the {@link #DEFAULT_RESOURCE} resource.
   */
  public static MatcherConfiguration load() throws IOException {
    return load(DEFAULT_RESOURCE);
  }

  /**
   * Loads the configuration from a file or a class path resource. A
   * missing resource yields the defaults.
   */
  public static MatcherConfiguration load(String path) throws IOException {
    if (!FileUtil.resourceExists(path)) {
      log.warn("No matcher configuration at {}, using defaults", path);
      return defaults();
    }
    log.info("Loading matcher configuration from: {}", path);
    return fromJson(FileUtil.findResourceAsString(path));
  }

  public int getBufferBlockSize() {
    return this.bufferBlockSize;
  }

  public byte getDelimiter() {
    return (byte) this.delimiter.charAt(0);
  }

  public int getExpectedPatterns() {
    return this.expectedPatterns;
  }

  public TokenizationMode getTokenization() {
    return this.tokenization;
  }

  public boolean isCompactOnCompile() {
    return this.compactOnCompile;
  }

  public MatcherConfiguration setBufferBlockSize(int bufferBlockSize) {
    this.bufferBlockSize = bufferBlockSize;
    return validate();
  }

  public MatcherConfiguration setCompactOnCompile(boolean compactOnCompile) {
    this.compactOnCompile = compactOnCompile;
    return this;
  }

  public MatcherConfiguration setDelimiter(char delimiter) {
    this.delimiter = String.valueOf(delimiter);
    return validate();
  }

  public MatcherConfiguration setExpectedPatterns(int expectedPatterns) {
    this.expectedPatterns = expectedPatterns;
    return validate();
  }

  public MatcherConfiguration setTokenization(TokenizationMode tokenization) {
    this.tokenization = tokenization;
    return validate();
  }

  @Override
  public String toString() {
    return StringUtil.toJson(this);
  }

  MatcherConfiguration validate() {
    checkArgument(this.delimiter != null && this.delimiter.length() == 1,
                  "Delimiter should be a single character: '%s'", this.delimiter);
    // Tokenization works on UTF-8 bytes, only ASCII is a single byte.
    checkArgument(this.delimiter.charAt(0) < 0x80,
                  "Delimiter should be an ASCII character: '%s'", this.delimiter);
    checkArgument(this.tokenization != null, "Unknown tokenization mode");
    checkArgument(this.bufferBlockSize > 0,
                  "Buffer block size should be positive: %s", this.bufferBlockSize);
    checkArgument(this.expectedPatterns >= 0,
                  "Expected patterns should not be negative: %s", this.expectedPatterns);
    return this;
  }
}
