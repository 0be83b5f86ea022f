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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestMemoryChannel extends RandomizedTest {

    @Test
    public void testGrowsPastInitialCapacity() throws Exception {
        MemoryChannel channel = new MemoryChannel(0);
        byte[] data = new byte[randomIntBetween(1, 10_000)];
        getRandom().nextBytes(data);

        assertEquals(data.length, channel.write(ByteBuffer.wrap(data)));
        assertEquals(data.length, channel.size());
        assertEquals(data.length, channel.position());
        assertArrayEquals(data, channel.toByteArray());
    }

    @Test
    public void testReadReturnsMinusOneAtEnd() throws Exception {
        MemoryChannel channel = MemoryChannel.wrap(new byte[] {1, 2, 3});
        ByteBuffer dst = ByteBuffer.allocate(8);
        assertEquals(3, channel.read(dst));
        assertEquals(-1, channel.read(dst));
        channel.position(10);
        assertEquals(-1, channel.read(ByteBuffer.allocate(1)));
    }

    @Test
    public void testWritePastEndZeroFillsGap() throws Exception {
        MemoryChannel channel = new MemoryChannel();
        channel.write(ByteBuffer.wrap(new byte[] {1, 2, 3, 4}));
        channel.truncate(1);
        assertEquals(1, channel.size());
        assertEquals(1, channel.position());

        channel.position(3);
        channel.write(ByteBuffer.wrap(new byte[] {9}));
        assertArrayEquals(new byte[] {1, 0, 0, 9}, channel.toByteArray());
    }

    @Test
    public void testWrapSharesArray() throws Exception {
        byte[] backing = {1, 2, 3};
        MemoryChannel channel = MemoryChannel.wrap(backing);
        channel.position(1);
        channel.write(ByteBuffer.wrap(new byte[] {7}));
        assertArrayEquals(new byte[] {1, 7, 3}, backing);
        assertEquals(3, channel.size());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryChannel(-1));
        MemoryChannel channel = new MemoryChannel();
        assertThrows(IllegalArgumentException.class, () -> channel.position(-1));
        assertThrows(IllegalArgumentException.class, () -> channel.truncate(-1));
    }

    @Test
    public void testClosedChannelRejectsOperations() throws Exception {
        MemoryChannel channel = new MemoryChannel();
        channel.close();
        assertFalse(channel.isOpen());
        assertThrows(ClosedChannelException.class, () -> channel.read(ByteBuffer.allocate(1)));
        assertThrows(ClosedChannelException.class, () -> channel.write(ByteBuffer.allocate(1)));
        assertThrows(ClosedChannelException.class, channel::size);
        assertThrows(ClosedChannelException.class, channel::position);
    }

    @Test
    public void testWriteAtHugePositionIsRejected() throws Exception {
        MemoryChannel channel = new MemoryChannel();
        channel.write(ByteBuffer.wrap(new byte[] {1, 2}));

        channel.position(Long.MAX_VALUE);
        assertThrows(IOException.class, () -> channel.write(ByteBuffer.wrap(new byte[] {1})));
        channel.position(Integer.MAX_VALUE);
        assertThrows(IOException.class, () -> channel.write(ByteBuffer.wrap(new byte[] {1})));

        assertEquals(2, channel.size());
        assertArrayEquals(new byte[] {1, 2}, channel.toByteArray());
    }
}
