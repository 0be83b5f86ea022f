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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;

/**
 * Position, length and seek logic over a {@link SeekableByteChannel}, shared by
 * {@link BufferWriter} and {@link BufferReader}. Every call goes to the channel; nothing
 * about the cursor or the length is cached here.
 */
final class ChannelCursor implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ChannelCursor.class);

    // largest array most VMs will allocate
    static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    // consecutive zero-byte transfers tolerated before a channel is considered stuck
    static final int MAX_STALLED_TRANSFERS = 16;

    private final SeekableByteChannel channel;

    ChannelCursor(SeekableByteChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    long position() throws BufferException {
        return seek(0, SeekOrigin.CURRENT);
    }

    long length() throws BufferException {
        long oldPosition = position();
        long length = seek(0, SeekOrigin.END);
        if (oldPosition != length) {
            seek(oldPosition, SeekOrigin.BEGIN);
        }
        return length;
    }

    long seek(long offset, SeekOrigin origin) throws BufferException {
        Objects.requireNonNull(origin, "origin");
        long target;
        long size;
        try {
            size = channel.size();
            switch (origin) {
                case BEGIN:
                    target = offset;
                    break;
                case CURRENT:
                    target = Math.addExact(channel.position(), offset);
                    break;
                case END:
                    target = Math.addExact(size, offset);
                    break;
                default:
                    throw new AssertionError(origin);
            }
        } catch (IOException | ArithmeticException e) {
            logger.debug("Seek to {} from {} failed", offset, origin, e);
            throw BufferException.indexOutOfRange(offset, e);
        }

        if (target < 0 || target > size) {
            logger.debug("Seek to {} from {} resolves to {}, outside [0, {}]", offset, origin, target, size);
            throw BufferException.indexOutOfRange(offset, null);
        }

        try {
            if (channel.position() != target) {
                channel.position(target);
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.debug("Channel rejected position {}", target, e);
            throw BufferException.indexOutOfRange(offset, e);
        }
        return target;
    }

    /**
     * Fails with {@link BufferError#END_OF_STREAM} unless {@code count} bytes are available
     * starting at {@code offset}.
     */
    void checkAvailable(long offset, long count) throws BufferException {
        long length = length();
        if (offset > length || count > length - offset) {
            throw BufferException.endOfStream(offset, count, length);
        }
    }

    void readFully(ByteBuffer dst) throws BufferException {
        try {
            int stalled = 0;
            while (dst.hasRemaining()) {
                int read = channel.read(dst);
                if (read < 0) {
                    throw new EOFException("channel ended with " + dst.remaining() + " bytes still expected");
                }
                stalled = read == 0 ? stalled + 1 : 0;
                if (stalled > MAX_STALLED_TRANSFERS) {
                    throw new EOFException("channel made no progress with " + dst.remaining() + " bytes still expected");
                }
            }
        } catch (IOException | NonReadableChannelException e) {
            throw BufferException.readFailure(e);
        }
    }

    void writeFully(ByteBuffer src) throws BufferException {
        try {
            int stalled = 0;
            while (src.hasRemaining()) {
                int written = channel.write(src);
                stalled = written == 0 ? stalled + 1 : 0;
                if (stalled > MAX_STALLED_TRANSFERS) {
                    throw new IOException("channel made no progress with " + src.remaining() + " bytes still to write");
                }
            }
        } catch (IOException | NonWritableChannelException e) {
            throw BufferException.ioFailure("write failed", e);
        }
    }

    /**
     * Reads everything from offset 0 to the end, leaving the cursor at the end.
     */
    byte[] readAll() throws BufferException {
        long length = length();
        if (length > MAX_ARRAY_LENGTH) {
            throw BufferException.ioFailure("stream of " + length + " bytes does not fit in an array", null);
        }
        seek(0, SeekOrigin.BEGIN);
        byte[] bytes = new byte[(int) length];
        readFully(ByteBuffer.wrap(bytes));
        logger.trace("Materialized {} bytes", length);
        return bytes;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
