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

import java.util.Objects;

/**
 * The 7-bit variable-length encoding of a 32-bit int: seven payload bits per byte, least
 * significant group first, with the high bit set on every byte except the last. The bit
 * pattern is treated as unsigned, so negative values always take {@link #MAX_BYTES} bytes.
 */
public final class SevenBitInt {
    /**
     * Largest number of bytes a 32-bit value encodes to. A 64-bit variant would need 10.
     */
    public static final int MAX_BYTES = 5;

    private SevenBitInt() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param value the value to measure
     * @return the number of bytes {@link #encode} produces for {@code value}
     */
    public static int encodedLength(int value) {
        int length = 1;
        int v = value;
        while ((v & ~0x7F) != 0) {
            v >>>= 7;
            length++;
        }
        return length;
    }

    /**
     * Encodes {@code value} into {@code dest} starting at {@code offset}.
     *
     * @param value the value to encode
     * @param dest the destination array, which needs room for {@link #encodedLength} bytes
     * @param offset where to start writing
     * @return the number of bytes written
     */
    public static int encode(int value, byte[] dest, int offset) {
        Objects.checkFromIndexSize(offset, encodedLength(value), dest.length);
        int v = value;
        int i = offset;
        while ((v & ~0x7F) != 0) {
            dest[i++] = (byte) (v | 0x80);
            v >>>= 7;
        }
        dest[i++] = (byte) v;
        return i - offset;
    }
}
