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

import java.nio.ByteOrder;

/**
 * Byte order of a multi-byte value.
 * <p>
 * The fixed-width codecs in this package always use {@link #LITTLE}.
 */
public enum Endianness {
    /**
     * The least significant byte is at the lowest offset, the others follow in increasing
     * order of significance.
     */
    LITTLE(ByteOrder.LITTLE_ENDIAN),
    /**
     * The most significant byte is at the lowest offset, the others follow in decreasing
     * order of significance.
     */
    BIG(ByteOrder.BIG_ENDIAN);

    private final ByteOrder byteOrder;

    Endianness(ByteOrder byteOrder) {
        this.byteOrder = byteOrder;
    }

    /**
     * @return the NIO byte order with the same layout
     */
    public ByteOrder byteOrder() {
        return byteOrder;
    }
}
