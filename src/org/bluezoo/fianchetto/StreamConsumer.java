/*
 * StreamConsumer.java
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

import java.nio.channels.WritableByteChannel;

/**
 * A consumer at the end of, or inside, a stream decoding pipeline.
 * <p>
 * Extends {@link WritableByteChannel} so that stages compose with standard
 * NIO semantics: {@code write(ByteBuffer)} consumes data, {@code close()}
 * signals the end of the stream. Data may arrive in several chunks.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface StreamConsumer extends WritableByteChannel {

    /**
     * Resets the consumer state for reuse.
     */
    void reset();

}
