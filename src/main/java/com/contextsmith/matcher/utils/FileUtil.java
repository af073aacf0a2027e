package com.contextsmith.matcher.utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.CharSource;
import com.google.common.io.CharStreams;

public class FileUtil {

  static final Logger log = LogManager.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  /**
   * Returns a UTF-8 {@link CharSource} over a file or class path resource.
   * Each {@code openStream()} looks the resource up again, so the source
   * can be read more than once.
   *
   * @throws FileNotFoundException if the resource does not exist
   */
  public static CharSource findResourceAsCharSource(final String filename)
      throws IOException {
    if (!resourceExists(filename)) {
      throw new FileNotFoundException("Could not locate: " + filename);
    }
    return new CharSource() {
      @Override
      public Reader openStream() throws IOException {
        InputStream stream = findResourceAsStream(filename);
        if (stream == null) throw new FileNotFoundException(filename);
        return new InputStreamReader(stream, StandardCharsets.UTF_8);
      }
    };
  }

  /**
   * Looks the file up directly first, then in the class path. Compressed
   * files are decompressed. Returns null if nothing is found.
   */
  public static InputStream findResourceAsStream(String filename)
      throws IOException {
    InputStream stream = null;

    File f = new File(filename);
    if (f.isFile()) {
      stream = new FileInputStream(f);
    } else {
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      stream = classLoader.getResourceAsStream(filename);
      if (stream == null) stream = classLoader.getResourceAsStream(f.getName());
    }
    if (stream == null) {
      log.error("Could not locate: {}", filename);
      return null;
    }
    if (filename.matches(COMPRESSED_FILE_RE)) {
      stream = new GZIPInputStream(new BufferedInputStream(stream));
    }
    return stream;
  }

  /**
   * Returns the whole resource as a string, or null if it does not exist.
   */
  public static String findResourceAsString(String filename)
      throws IOException {
    InputStream stream = findResourceAsStream(filename);
    if (stream == null) return null;
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return CharStreams.toString(reader);
    }
  }

  public static boolean resourceExists(String filename) {
    File f = new File(filename);
    if (f.isFile()) return true;
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    return classLoader.getResource(filename) != null ||
           classLoader.getResource(f.getName()) != null;
  }

  private FileUtil() {
  }
}
