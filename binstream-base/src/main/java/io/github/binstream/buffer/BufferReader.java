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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads primitive values written by {@link BufferWriter} from a seekable channel.
 * <p>
 * Every fixed-size or counted read first checks that enough bytes remain before the end of
 * the stream. If they don't, it throws {@link BufferError#END_OF_STREAM} without consuming
 * anything, so the caller may seek elsewhere and carry on.
 * <p>
 * The reader owns its channel and closes it in {@link #close()}. Not thread-safe; use one
 * reader per thread, e.g. one {@link #wrap} per thread over the same array.
 */
public class BufferReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BufferReader.class);

    private final ChannelCursor cursor;
    private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(Endianness.LITTLE.byteOrder());

    /**
     * Creates a reader that takes ownership of {@code channel}, starting at its current position.
     */
    public BufferReader(SeekableByteChannel channel) {
        this.cursor = new ChannelCursor(channel);
    }

    /**
     * Creates a reader over {@code bytes}, positioned at 0. The array is not copied.
     */
    public static BufferReader wrap(byte[] bytes) {
        return new BufferReader(MemoryChannel.wrap(bytes));
    }

    /**
     * Creates a reader over the file at {@code path}, opened read-only.
     */
    public static BufferReader open(Path path) throws IOException {
        return new BufferReader(FileChannel.open(path, StandardOpenOption.READ));
    }

    /**
     * @return the current offset in the stream
     */
    public long position() throws BufferException {
        return cursor.position();
    }

    /**
     * @return the length of the stream in bytes; the position is unchanged
     */
    public long length() throws BufferException {
        return cursor.length();
    }

    /**
     * @return the number of bytes between the position and the end of the stream
     */
    public long remaining() throws BufferException {
        return cursor.length() - cursor.position();
    }

    /**
     * Moves the cursor to {@code offset} relative to {@code origin}.
     *
     * @return the new absolute position
     * @throws BufferException {@link BufferError#INDEX_OUT_OF_RANGE} if the target is before the
     *         start or past the end of the stream
     */
    public long seek(long offset, SeekOrigin origin) throws BufferException {
        return cursor.seek(offset, origin);
    }

    /**
     * Reads an unsigned byte and advances the position by one.
     *
     * @return a value in [0, 255]
     */
    public int readU8() throws BufferException {
        return Byte.toUnsignedInt(readFixed(Byte.BYTES).get());
    }

    /**
     * Reads a two-byte little-endian unsigned integer and advances the position by two.
     *
     * @return a value in [0, 65535]
     */
    public int readU16() throws BufferException {
        return Short.toUnsignedInt(readFixed(Short.BYTES).getShort());
    }

    /**
     * Reads a four-byte little-endian unsigned integer and advances the position by four.
     *
     * @return a value in [0, 2^32 - 1]
     */
    public long readU32() throws BufferException {
        return Integer.toUnsignedLong(readFixed(Integer.BYTES).getInt());
    }

    /**
     * Reads an eight-byte little-endian unsigned integer and advances the position by eight.
     * Values above {@link Long#MAX_VALUE} come back negative; use the {@code Long.*Unsigned}
     * methods to work with them.
     */
    public long readU64() throws BufferException {
        return readFixed(Long.BYTES).getLong();
    }

    /**
     * Reads a four-byte little-endian signed integer and advances the position by four.
     */
    public int readI32() throws BufferException {
        return readFixed(Integer.BYTES).getInt();
    }

    /**
     * Reads an int written by {@link BufferWriter#write7BitInt}.
     *
     * @throws BufferException {@link BufferError#IO_FAILURE} if the encoding runs past
     *         {@link SevenBitInt#MAX_BYTES} bytes; {@link BufferError#END_OF_STREAM} or
     *         {@link BufferError#READ_FAILURE} from the underlying byte reads
     */
    public int read7BitInt() throws BufferException {
        int value = 0;
        int shift = 0;
        int b;
        do {
            if (shift == SevenBitInt.MAX_BYTES * 7) {
                logger.debug("7-bit int is longer than {} bytes, stream is corrupt", SevenBitInt.MAX_BYTES);
                throw BufferException.ioFailure("malformed 7-bit int: more than " + SevenBitInt.MAX_BYTES + " bytes", null);
            }
            b = readU8();
            value |= (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        return value;
    }

    /**
     * Reads a string written by {@link BufferWriter#writeString}: a 7-bit byte count followed
     * by that many bytes of UTF-8.
     *
     * @throws BufferException {@link BufferError#IO_FAILURE} if the count is negative or the
     *         bytes are not valid UTF-8
     */
    public String readString() throws BufferException {
        int length = read7BitInt();
        if (length < 0) {
            throw BufferException.ioFailure("negative string length: " + length, null);
        }
        if (length == 0) {
            return "";
        }
        byte[] bytes = readBytes(length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            logger.debug("{} bytes of string data are not valid UTF-8", length, e);
            throw BufferException.ioFailure("string is not valid UTF-8", e);
        }
    }

    /**
     * Reads {@code count} bytes and advances the position by {@code count}.
     *
     * @throws BufferException {@link BufferError#END_OF_STREAM} if fewer than {@code count}
     *         bytes remain
     */
    public byte[] readBytes(long count) throws BufferException {
        if (count < 0) {
            throw new IllegalArgumentException("negative count: " + count);
        }
        cursor.checkAvailable(cursor.position(), count);
        if (count > ChannelCursor.MAX_ARRAY_LENGTH) {
            throw BufferException.ioFailure(count + " bytes do not fit in an array", null);
        }
        byte[] bytes = new byte[(int) count];
        cursor.readFully(ByteBuffer.wrap(bytes));
        return bytes;
    }

    /**
     * Reads {@code count} bytes starting at {@code offset} without moving the cursor: the
     * position is restored afterwards, also when the read fails.
     *
     * @throws BufferException {@link BufferError#END_OF_STREAM} if the range extends past the
     *         end of the stream
     */
    public byte[] readBytesAt(long offset, long count) throws BufferException {
        if (offset < 0) {
            throw new IllegalArgumentException("negative offset: " + offset);
        }
        if (count < 0) {
            throw new IllegalArgumentException("negative count: " + count);
        }
        cursor.checkAvailable(offset, count);

        long saved = cursor.position();
        cursor.seek(offset, SeekOrigin.BEGIN);
        byte[] bytes;
        try {
            bytes = readBytes(count);
        } catch (BufferException e) {
            try {
                cursor.seek(saved, SeekOrigin.BEGIN);
            } catch (BufferException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        cursor.seek(saved, SeekOrigin.BEGIN);
        return bytes;
    }

    @Override
    public void close() throws IOException {
        cursor.close();
    }

    private ByteBuffer readFixed(int size) throws BufferException {
        cursor.checkAvailable(cursor.position(), size);
        scratch.clear();
        scratch.limit(size);
        cursor.readFully(scratch);
        scratch.flip();
        return scratch;
    }
}
