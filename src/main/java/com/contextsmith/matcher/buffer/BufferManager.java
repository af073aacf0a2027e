package com.contextsmith.matcher.buffer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only arena of byte blocks. Every allocation copies the source
 * into the current block and returns a {@link DataBlock} view of the copy;
 * there is no per-allocation object besides the view itself.
 *
 * <p>Single writer: {@link #allocate} must not be called concurrently.
 * Views already handed out may be read from any thread.</p>
 */
public class BufferManager implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(BufferManager.class);

  public static final int DEFAULT_BLOCK_SIZE = 1 << 20;

  private final int blockSize;
  private final List<byte[]> blocks;
  private byte[] currentBlock;
  private int writeOffset;
  private long bytesUsed;

  public BufferManager() {
    this(DEFAULT_BLOCK_SIZE);
  }

  public BufferManager(int blockSize) {
    checkArgument(blockSize > 0, "Block size must be positive: %s", blockSize);
    this.blockSize = blockSize;
    this.blocks = new ArrayList<>();
    this.currentBlock = null;
    this.writeOffset = 0;
    this.bytesUsed = 0;
  }

  public DataBlock allocate(byte[] source) {
    checkNotNull(source);
    return allocate(source, 0, source.length);
  }

  /**
   * Copies {@code length} bytes of {@code source} from {@code offset} and
   * returns a view of the copy, valid until {@link #reset()} or
   * {@link #close()}. A request larger than the block size gets a block
   * of its own.
   */
  public DataBlock allocate(byte[] source, int offset, int length) {
    checkNotNull(source);
    checkPositionIndexes(offset, offset + length, source.length);

    if (this.currentBlock == null ||
        this.currentBlock.length - this.writeOffset < length) {
      nextBlock(Math.max(this.blockSize, length));
    }
    System.arraycopy(source, offset, this.currentBlock, this.writeOffset, length);
    DataBlock result = new DataBlock(this.currentBlock, this.writeOffset, length);
    this.writeOffset += length;
    this.bytesUsed += length;
    return result;
  }

  /**
   * Copies the UTF-8 encoding of {@code text}.
   */
  public DataBlock allocate(CharSequence text) {
    checkNotNull(text);
    return allocate(text.toString().getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Releases every block.
   */
  @Override
  public void close() {
    this.blocks.clear();
    this.currentBlock = null;
    this.writeOffset = 0;
    this.bytesUsed = 0;
  }

  public int getBlockCount() {
    return this.blocks.size();
  }

  public int getBlockSize() {
    return this.blockSize;
  }

  public long getBytesUsed() {
    return this.bytesUsed;
  }

  /**
   * Forgets every allocation, keeping the first block for reuse. Views
   * handed out before must not be used anymore.
   */
  public void reset() {
    if (this.blocks.isEmpty()) return;
    byte[] first = this.blocks.get(0);
    this.blocks.clear();
    this.blocks.add(first);
    this.currentBlock = first;
    this.writeOffset = 0;
    this.bytesUsed = 0;
  }

  private void nextBlock(int size) {
    this.currentBlock = new byte[size];
    this.blocks.add(this.currentBlock);
    this.writeOffset = 0;
    log.debug("Allocated block #{} of {} bytes", this.blocks.size(), size);
  }
}
