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
import java.util.Objects;

/**
 * Signals a failed buffer operation. Callers distinguish the failure with {@link #error()}:
 * <pre>{@code
 * try {
 *     value = reader.readU32();
 * } catch (BufferException e) {
 *     if (e.error() != BufferError.END_OF_STREAM) {
 *         throw e;
 *     }
 *     // truncated record, stop here
 * }
 * }</pre>
 */
public class BufferException extends IOException {
    private static final long serialVersionUID = 1L;

    private final BufferError error;
    private final long index;

    BufferException(BufferError error, long index, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error);
        this.index = index;
    }

    static BufferException indexOutOfRange(long index, Throwable cause) {
        return new BufferException(BufferError.INDEX_OUT_OF_RANGE, index, "index out of range: " + index, cause);
    }

    static BufferException endOfStream(long position, long required, long length) {
        return new BufferException(BufferError.END_OF_STREAM, 0,
                String.format("end of stream: %d bytes required at position %d, stream length is %d", required, position, length),
                null);
    }

    static BufferException readFailure(Throwable cause) {
        return new BufferException(BufferError.READ_FAILURE, 0, "read failed: " + cause, cause);
    }

    static BufferException ioFailure(String message, Throwable cause) {
        return new BufferException(BufferError.IO_FAILURE, 0, message, cause);
    }

    /**
     * @return the kind of failure
     */
    public BufferError error() {
        return error;
    }

    /**
     * The offset passed to the rejected seek. Only meaningful for
     * {@link BufferError#INDEX_OUT_OF_RANGE}; zero otherwise.
     */
    public long index() {
        return index;
    }
}
