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

/**
 * The kinds of failure a {@link BufferWriter} or {@link BufferReader} can report.
 */
public enum BufferError {
    /**
     * A seek could not be satisfied by the underlying channel. The requested offset is
     * available from {@link BufferException#index()}.
     */
    INDEX_OUT_OF_RANGE,
    /**
     * Fewer bytes remain before the end of the stream than the read requires. Raised before
     * the channel is touched, so nothing is consumed.
     */
    END_OF_STREAM,
    /**
     * The channel failed to deliver bytes that the stream length says are there. The
     * lower-level exception is kept as the cause.
     */
    READ_FAILURE,
    /**
     * A write failed, or the decoded data is malformed (an over-long 7-bit int, a negative
     * string length, or invalid UTF-8).
     */
    IO_FAILURE
}
