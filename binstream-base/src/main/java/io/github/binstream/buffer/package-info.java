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


/**
 * Cursor-based binary encoding and decoding over seekable byte channels.
 * <p>
 * {@link io.github.binstream.buffer.BufferWriter} writes fixed-width little-endian integers,
 * 7-bit variable-length ints, length-prefixed UTF-8 strings and raw byte blocks;
 * {@link io.github.binstream.buffer.BufferReader} reads them back with a bounds check before
 * every read. Neither defines any framing or schema: a record is read back by issuing the same
 * sequence of typed reads as the writes that produced it.
 *
 * <h2>Wire layout</h2>
 * <table>
 *   <caption>Encodings</caption>
 *   <tr><th>Type</th><th>Layout</th></tr>
 *   <tr><td>u8</td><td>1 byte</td></tr>
 *   <tr><td>u16, u32, i32, u64</td><td>2, 4, 4, 8 bytes, least significant byte first</td></tr>
 *   <tr><td>7-bit int</td><td>1 to 5 bytes, 7 payload bits each, high bit set on all but the last</td></tr>
 *   <tr><td>string</td><td>7-bit UTF-8 byte count, then the UTF-8 bytes</td></tr>
 *   <tr><td>byte block</td><td>verbatim, no length prefix</td></tr>
 * </table>
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * byte[] bytes;
 * try (BufferWriter writer = BufferWriter.inMemory()) {
 *     writer.writeU32(9001);
 *     writer.writeString("Hello World!");
 *     bytes = writer.toByteArray();
 * }
 * try (BufferReader reader = BufferReader.wrap(bytes)) {
 *     long id = reader.readU32();
 *     String greeting = reader.readString();
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 * Every fallible operation throws {@link io.github.binstream.buffer.BufferException}, whose
 * {@link io.github.binstream.buffer.BufferException#error()} tells an exhausted stream
 * ({@code END_OF_STREAM}) apart from a failing channel ({@code READ_FAILURE}), a rejected seek
 * ({@code INDEX_OUT_OF_RANGE}) and write failures or corrupt data ({@code IO_FAILURE}).
 *
 * <h2>Thread Safety</h2>
 * Writers, readers and {@link io.github.binstream.buffer.MemoryChannel} are <b>not thread-safe</b>.
 */
package io.github.binstream.buffer;
