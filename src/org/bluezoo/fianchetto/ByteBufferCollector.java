/*
 * ByteBufferCollector.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Fianchetto, a PDF reading library.
 *
 * Fianchetto is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Fianchetto is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Fianchetto.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fianchetto;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * The end of a decoding pipeline: gathers the decoded bytes of one stream
 * in a heap buffer that grows as needed.
 * <p>
 * {@link ObjectReader} sizes it from the encoded length and copies the
 * result out with {@link #toByteArray()} once the pipeline is closed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ByteBufferCollector implements StreamConsumer {

    private static final int INITIAL_CAPACITY = 8192;

    private ByteBuffer buffer;
    private boolean open = true;

    /**
     * Creates a new collector with default initial capacity.
     */
    public ByteBufferCollector() {
        this(INITIAL_CAPACITY);
    }

    /**
     * Creates a new collector sized for an expected amount of data.
     *
     * @param initialCapacity the initial capacity in bytes
     */
    public ByteBufferCollector(int initialCapacity) {
        this.buffer = ByteBuffer.allocate(Math.max(16, initialCapacity));
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int remaining = src.remaining();
        if (remaining == 0) {
            return 0;
        }
        ensureCapacity(remaining);
        buffer.put(src);
        return remaining;
    }

    private void ensureCapacity(int additional) throws IOException {
        if (buffer.remaining() >= additional) {
            return;
        }
        int required = buffer.position() + additional;
        if (required < 0) {
            throw new IOException("Decoded stream too large");
        }
        // Doubling, clamped where it would overflow
        int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8L,
                                         Math.max(2L * buffer.capacity(), required));
        if (newCapacity < required) {
            throw new IOException("Decoded stream too large");
        }
        buffer.flip();
        ByteBuffer grown = ByteBuffer.allocate(newCapacity);
        grown.put(buffer);
        buffer = grown;
    }

    @Override
    public void close() throws IOException {
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void reset() {
        buffer.clear();
        if (buffer.capacity() > INITIAL_CAPACITY) {
            buffer = ByteBuffer.allocate(INITIAL_CAPACITY);
        }
        open = true;
    }

    /**
     * Returns a read-only view of the collected data.
     * The buffer is flipped (position 0, limit at end).
     *
     * @return a read-only duplicate of the collected data
     */
    public ByteBuffer toByteBuffer() {
        ByteBuffer out = buffer.duplicate();
        out.flip();
        return out.asReadOnlyBuffer();
    }

    /**
     * Returns a copy of the collected data.
     *
     * @return the collected bytes
     */
    public byte[] toByteArray() {
        ByteBuffer out = toByteBuffer();
        byte[] bytes = new byte[out.remaining()];
        out.get(bytes);
        return bytes;
    }

}
