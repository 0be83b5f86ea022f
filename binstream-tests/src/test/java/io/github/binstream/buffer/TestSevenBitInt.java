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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestSevenBitInt extends RandomizedTest {

    @Test
    public void testEncodedLengthBoundaries() {
        assertEquals(1, SevenBitInt.encodedLength(0));
        assertEquals(1, SevenBitInt.encodedLength(0x7F));
        assertEquals(2, SevenBitInt.encodedLength(0x80));
        assertEquals(2, SevenBitInt.encodedLength(0x3FFF));
        assertEquals(3, SevenBitInt.encodedLength(0x4000));
        assertEquals(3, SevenBitInt.encodedLength(0x1FFFFF));
        assertEquals(4, SevenBitInt.encodedLength(0x200000));
        assertEquals(4, SevenBitInt.encodedLength(0xFFFFFFF));
        assertEquals(5, SevenBitInt.encodedLength(0x10000000));
        assertEquals(5, SevenBitInt.encodedLength(Integer.MAX_VALUE));
        assertEquals(5, SevenBitInt.encodedLength(-1));
        assertEquals(5, SevenBitInt.encodedLength(Integer.MIN_VALUE));
    }

    @Test
    public void testEncode300() {
        byte[] dest = new byte[SevenBitInt.MAX_BYTES];
        assertEquals(2, SevenBitInt.encode(300, dest, 0));
        assertArrayEquals(new byte[] {(byte) 0xAC, 0x02, 0, 0, 0}, dest);
    }

    @Test
    public void testEncodeAtOffset() {
        byte[] dest = new byte[4];
        assertEquals(1, SevenBitInt.encode(5, dest, 3));
        assertEquals(5, dest[3]);
        assertThrows(IndexOutOfBoundsException.class, () -> SevenBitInt.encode(300, dest, 3));
    }

    @Test
    public void testRoundTripIsMinimal() throws Exception {
        for (int i = 0; i < 1000; i++) {
            int value = randomBoolean() ? randomInt() : randomIntBetween(0, 1 << randomIntBetween(0, 30));
            int significantBits = 32 - Integer.numberOfLeadingZeros(value);
            int minimal = Math.max(1, (significantBits + 6) / 7);

            byte[] bytes;
            try (BufferWriter writer = BufferWriter.inMemory()) {
                assertEquals(minimal, writer.write7BitInt(value));
                bytes = writer.toByteArray();
            }
            assertEquals(minimal, bytes.length);
            assertEquals(minimal, SevenBitInt.encodedLength(value));
            for (int b = 0; b < bytes.length - 1; b++) {
                assertEquals(0x80, bytes[b] & 0x80);
            }
            assertEquals(0, bytes[bytes.length - 1] & 0x80);

            try (BufferReader reader = BufferReader.wrap(bytes)) {
                assertEquals(value, reader.read7BitInt());
                assertEquals(minimal, reader.position());
            }
        }
    }
}
