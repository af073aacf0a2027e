package com.contextsmith.matcher.buffer;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class BufferManagerTest {

    @Test
    public void allocationsShareBlock() {
        BufferManager manager = new BufferManager(16);
        DataBlock hello = manager.allocate("hello");
        DataBlock world = manager.allocate("world");
        assertEquals("hello", hello.utf8ToString());
        assertEquals("world", world.utf8ToString());
        assertEquals(1, manager.getBlockCount());
        assertEquals(10, manager.getBytesUsed());
    }

    @Test
    public void allocationCopiesSource() {
        BufferManager manager = new BufferManager(16);
        byte[] source = "abc".getBytes(StandardCharsets.UTF_8);
        DataBlock copy = manager.allocate(source);
        source[0] = 'z';
        assertEquals("abc", copy.utf8ToString());
    }

    @Test
    public void fullBlockStartsNewOne() {
        BufferManager manager = new BufferManager(8);
        DataBlock first = manager.allocate("abcdef");
        DataBlock second = manager.allocate("ghij");
        assertEquals(2, manager.getBlockCount());
        assertEquals("abcdef", first.utf8ToString());
        assertEquals("ghij", second.utf8ToString());
    }

    @Test
    public void oversizedRequestGetsOwnBlock() {
        BufferManager manager = new BufferManager(4);
        DataBlock big = manager.allocate("a much longer text");
        assertEquals("a much longer text", big.utf8ToString());
        assertEquals(1, manager.getBlockCount());
        manager.allocate("x");
        assertEquals(2, manager.getBlockCount());
    }

    @Test
    public void partialSource() {
        BufferManager manager = new BufferManager();
        assertEquals(BufferManager.DEFAULT_BLOCK_SIZE, manager.getBlockSize());
        byte[] source = "hello world".getBytes(StandardCharsets.UTF_8);
        assertEquals("world", manager.allocate(source, 6, 5).utf8ToString());
    }

    @Test
    public void resetKeepsFirstBlock() {
        BufferManager manager = new BufferManager(4);
        manager.allocate("abcd");
        manager.allocate("efgh");
        manager.allocate("ij");
        assertEquals(3, manager.getBlockCount());

        manager.reset();
        assertEquals(1, manager.getBlockCount());
        assertEquals(0, manager.getBytesUsed());
        assertEquals("klmn", manager.allocate("klmn").utf8ToString());
        assertEquals(1, manager.getBlockCount());
    }

    @Test
    public void closeReleasesEverything() {
        BufferManager manager = new BufferManager(4);
        manager.allocate("abc");
        manager.close();
        assertEquals(0, manager.getBlockCount());
        assertEquals(0, manager.getBytesUsed());
        assertEquals("de", manager.allocate("de").utf8ToString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void blockSizeMustBePositive() {
        new BufferManager(0);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rangeOutsideSource() {
        new BufferManager().allocate(new byte[3], 2, 2);
    }
}
