/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.github.binstream.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;
import java.util.Objects;

/**
 * A {@link SeekableByteChannel} backed by a growable byte array, for building or reading
 * buffers entirely in memory.
 * <p>
 * Writes past the current size grow the channel; a write positioned beyond the end fills the
 * gap with zeros. The size is limited to what fits in a single array.
 * <p>
 * Not thread-safe. Concurrent readers should each wrap the data in their own channel.
 */
public class MemoryChannel implements SeekableByteChannel {
    /**
     * Initial capacity used by {@link #MemoryChannel()}, from the
     * {@code binstream.memory.initial_capacity} system property.
     */
    public static final int DEFAULT_CAPACITY = Integer.getInteger("binstream.memory.initial_capacity", 256);

    private byte[] data;
    private int size;
    private long position;
    private boolean open = true;

    /**
     * Creates an empty channel with {@link #DEFAULT_CAPACITY}.
     */
    public MemoryChannel() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty channel that can hold {@code capacity} bytes before growing.
     */
    public MemoryChannel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
        }
        this.data = new byte[capacity];
    }

    private MemoryChannel(byte[] data) {
        this.data = data;
        this.size = data.length;
    }

    /**
     * Creates a channel whose contents are {@code bytes}, positioned at 0. The array is not
     * copied: writes through the channel that stay within its length modify it.
     */
    public static MemoryChannel wrap(byte[] bytes) {
        return new MemoryChannel(Objects.requireNonNull(bytes, "bytes"));
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        if (position >= size) {
            return -1;
        }
        int count = (int) Math.min(dst.remaining(), size - position);
        dst.put(data, (int) position, count);
        position += count;
        return count;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        ensureOpen();
        int count = src.remaining();
        if (position > ChannelCursor.MAX_ARRAY_LENGTH - count) {
            throw new IOException("in-memory channel cannot hold " + count + " bytes at position " + position);
        }
        long end = position + count;
        ensureCapacity((int) end);
        if (position > size) {
            // stale bytes may remain past a truncation
            Arrays.fill(data, size, (int) position, (byte) 0);
        }
        src.get(data, (int) position, count);
        position = end;
        size = Math.max(size, (int) end);
        return count;
    }

    private void ensureCapacity(int required) {
        if (required <= data.length) {
            return;
        }
        long grown = Math.max((long) data.length * 2, required);
        data = Arrays.copyOf(data, (int) Math.min(grown, ChannelCursor.MAX_ARRAY_LENGTH));
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return position;
    }

    @Override
    public MemoryChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("negative position: " + newPosition);
        }
        position = newPosition;
        return this;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return size;
    }

    @Override
    public MemoryChannel truncate(long newSize) throws IOException {
        ensureOpen();
        if (newSize < 0) {
            throw new IllegalArgumentException("negative size: " + newSize);
        }
        if (newSize < size) {
            size = (int) newSize;
        }
        if (position > newSize) {
            position = newSize;
        }
        return this;
    }

    /**
     * @return a copy of the channel contents, independent of the position
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    private void ensureOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }
}
