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
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes primitive values in binary to a seekable channel, and strings as length-prefixed
 * UTF-8. Fixed-width values are little-endian.
 * <p>
 * Each write advances the channel position by the number of bytes written. Seeking back and
 * writing again overwrites earlier bytes in place, which is how headers are patched:
 * <pre>{@code
 * try (BufferWriter writer = BufferWriter.inMemory()) {
 *     writer.writeU32(0);              // placeholder for the record count
 *     int count = writeRecords(writer);
 *     writer.seek(0, SeekOrigin.BEGIN);
 *     writer.writeU32(count);
 *     byte[] bytes = writer.toByteArray();
 * }
 * }</pre>
 * The writer owns its channel and closes it in {@link #close()}. Not thread-safe.
 */
public class BufferWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BufferWriter.class);

    private final ChannelCursor cursor;
    private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(Endianness.LITTLE.byteOrder());
    private final byte[] varintScratch = new byte[SevenBitInt.MAX_BYTES];

    /**
     * Creates a writer that takes ownership of {@code channel}, starting at its current position.
     */
    public BufferWriter(SeekableByteChannel channel) {
        this.cursor = new ChannelCursor(channel);
    }

    /**
     * Creates a writer over a new, empty {@link MemoryChannel}.
     */
    public static BufferWriter inMemory() {
        return new BufferWriter(new MemoryChannel());
    }

    /**
     * Creates a writer over a new, empty {@link MemoryChannel} with the given initial capacity.
     */
    public static BufferWriter inMemory(int capacity) {
        return new BufferWriter(new MemoryChannel(capacity));
    }

    /**
     * Creates a writer over the file at {@code path}, creating it or truncating an existing one.
     * The file is opened for reading too, so that {@link #toByteArray()} works.
     */
    public static BufferWriter create(Path path) throws IOException {
        return new BufferWriter(FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE));
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
     * Returns the whole stream, from offset 0 to the end, whatever the current position.
     * Meant as the final call: the cursor is left at the end of the stream.
     */
    public byte[] toByteArray() throws BufferException {
        return cursor.readAll();
    }

    /**
     * Writes an unsigned byte.
     *
     * @param value a value in [0, 255]
     * @return 1
     */
    public int writeU8(int value) throws BufferException {
        checkUnsigned(value, 0xFFL, "u8");
        scratch.clear();
        scratch.put((byte) value);
        return flushScratch();
    }

    /**
     * Writes a two-byte unsigned integer.
     *
     * @param value a value in [0, 65535]
     * @return 2
     */
    public int writeU16(int value) throws BufferException {
        checkUnsigned(value, 0xFFFFL, "u16");
        scratch.clear();
        scratch.putShort((short) value);
        return flushScratch();
    }

    /**
     * Writes a four-byte unsigned integer.
     *
     * @param value a value in [0, 2^32 - 1]
     * @return 4
     */
    public int writeU32(long value) throws BufferException {
        checkUnsigned(value, 0xFFFF_FFFFL, "u32");
        scratch.clear();
        scratch.putInt((int) value);
        return flushScratch();
    }

    /**
     * Writes an eight-byte unsigned integer. Every bit pattern is valid; values above
     * {@link Long#MAX_VALUE} are passed as negative longs.
     *
     * @return 8
     */
    public int writeU64(long value) throws BufferException {
        scratch.clear();
        scratch.putLong(value);
        return flushScratch();
    }

    /**
     * Writes a four-byte signed integer.
     *
     * @return 4
     */
    public int writeI32(int value) throws BufferException {
        scratch.clear();
        scratch.putInt(value);
        return flushScratch();
    }

    /**
     * Writes {@code value} seven bits at a time; see {@link SevenBitInt}. Negative values are
     * written as their unsigned bit pattern and always take five bytes.
     *
     * @return the number of bytes written, 1 to 5
     */
    public int write7BitInt(int value) throws BufferException {
        int length = SevenBitInt.encode(value, varintScratch, 0);
        cursor.writeFully(ByteBuffer.wrap(varintScratch, 0, length));
        return length;
    }

    /**
     * Writes the UTF-8 byte length of {@code value} as a 7-bit int, followed by the UTF-8 bytes.
     * The empty string is the single byte {@code 0x00}.
     *
     * @return the total number of bytes written, prefix included
     * @throws BufferException {@link BufferError#IO_FAILURE} if the write fails or the string
     *         holds an unpaired surrogate
     */
    public int writeString(String value) throws BufferException {
        Objects.requireNonNull(value, "value");
        byte[] bytes = encodeUtf8(value);
        int prefix = write7BitInt(bytes.length);
        return prefix + writeBytes(bytes);
    }

    /**
     * Writes {@code value} verbatim, with no length prefix.
     *
     * @return the number of bytes written
     */
    public int writeBytes(byte[] value) throws BufferException {
        return writeBytes(value, 0, value.length);
    }

    /**
     * Writes {@code count} bytes of {@code value} starting at {@code offset}, with no length prefix.
     *
     * @return the number of bytes written
     */
    public int writeBytes(byte[] value, int offset, int count) throws BufferException {
        Objects.checkFromIndexSize(offset, count, value.length);
        cursor.writeFully(ByteBuffer.wrap(value, offset, count));
        return count;
    }

    @Override
    public void close() throws IOException {
        cursor.close();
    }

    private int flushScratch() throws BufferException {
        scratch.flip();
        int length = scratch.remaining();
        cursor.writeFully(scratch);
        return length;
    }

    private static void checkUnsigned(long value, long max, String type) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(value + " is out of range for " + type);
        }
    }

    private static byte[] encodeUtf8(String value) throws BufferException {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            logger.debug("Cannot encode string of {} chars as UTF-8", value.length(), e);
            throw BufferException.ioFailure("string cannot be encoded as UTF-8", e);
        }
    }
}
