package com.contextsmith.matcher.buffer;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.nio.charset.StandardCharsets;

/**
 * An immutable view over a range of a byte array, usually a block of a
 * {@link BufferManager}. Equality and hash code depend on the content, so
 * views can be used as map keys.
 */
public final class DataBlock {
  private static final int HASH_PRIME = 31;

  /**
   * Wraps {@code bytes} without copying. The caller must not modify them.
   */
  public static DataBlock wrap(byte[] bytes) {
    checkNotNull(bytes);
    return new DataBlock(bytes, 0, bytes.length);
  }

  public static DataBlock wrap(byte[] bytes, int offset, int length) {
    checkNotNull(bytes);
    checkPositionIndexes(offset, offset + length, bytes.length);
    return new DataBlock(bytes, offset, length);
  }

  private final byte[] bytes;
  private final int offset;
  private final int length;

  DataBlock(byte[] bytes, int offset, int length) {
    this.bytes = bytes;
    this.offset = offset;
    this.length = length;
  }

  public byte byteAt(int index) {
    checkPositionIndexes(index, index + 1, this.length);
    return this.bytes[this.offset + index];
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof DataBlock)) return false;
    DataBlock other = (DataBlock) obj;
    if (this.length != other.length) return false;
    int otherUpto = other.offset;
    int end = this.offset + this.length;
    for (int upto = this.offset; upto < end; ++upto, ++otherUpto) {
      if (this.bytes[upto] != other.bytes[otherUpto]) return false;
    }
    return true;
  }

  /**
   * Returns the index of the first {@code delimiter} at or after
   * {@code fromIndex}, or {@link #size()} if there is none.
   */
  public int find(byte delimiter, int fromIndex) {
    for (int i = Math.max(0, fromIndex); i < this.length; ++i) {
      if (this.bytes[this.offset + i] == delimiter) return i;
    }
    return this.length;
  }

  public int find(byte delimiter) {
    return find(delimiter, 0);
  }

  @Override
  public int hashCode() {
    int result = 0;
    int end = this.offset + this.length;
    for (int i = this.offset; i < end; ++i) {
      result = HASH_PRIME * result + this.bytes[i];
    }
    return result;
  }

  public boolean isEmpty() {
    return this.length == 0;
  }

  public int size() {
    return this.length;
  }

  /**
   * Returns a view of {@code size} bytes starting at {@code index}. The
   * bytes are shared with this view.
   */
  public DataBlock sub(int index, int size) {
    checkPositionIndexes(index, index + size, this.length);
    return new DataBlock(this.bytes, this.offset + index, size);
  }

  public byte[] toByteArray() {
    byte[] copy = new byte[this.length];
    System.arraycopy(this.bytes, this.offset, copy, 0, this.length);
    return copy;
  }

  @Override
  public String toString() {
    return utf8ToString();
  }

  public String utf8ToString() {
    return new String(this.bytes, this.offset, this.length, StandardCharsets.UTF_8);
  }
}
