/*
 * StreamFilter.java
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
import java.nio.channels.WritableByteChannel;
import java.util.Map;

/**
 * One decoding stage of a {@link FilterPipeline}.
 * <p>
 * A stage receives encoded bytes in whatever chunks the caller writes
 * and passes decoded bytes on as soon as it has them, keeping back any
 * partial unit (for example an incomplete predictor row) until more input
 * or {@link #close()} arrives. A stage that cannot decode its input throws
 * {@link IOException}; the stream's raw bytes are then kept.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class StreamFilter implements StreamConsumer {

    protected WritableByteChannel next;
    protected Map<Name, Object> params;
    protected boolean open = true;

    /**
     * Sets the stage that receives this stage's output.
     *
     * @param next the next stage or the final consumer
     */
    public void setNext(WritableByteChannel next) {
        this.next = next;
    }

    /**
     * Sets the {@code /DecodeParms} entry that belongs to this stage.
     *
     * @param params the parameters, or null when the stream gives none
     */
    public void setParams(Map<Name, Object> params) {
        this.params = params;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void reset() {
        open = true;
    }

    // Empty output is not forwarded
    protected int writeToNext(ByteBuffer data) throws IOException {
        if (next != null && data.hasRemaining()) {
            return next.write(data);
        }
        return 0;
    }

    /**
     * Returns a decoder for a {@code /Filter} name, full or abbreviated.
     * Only Flate is decoded here. Any other name returns null, and the
     * pipeline stops at it so that the caller receives the bytes still
     * encoded with that filter, together with its name.
     *
     * @param filterName the filter name without the slash
     * @return a new decoder, or null if the filter is left to the caller
     */
    public static StreamFilter create(String filterName) {
        switch (filterName) {
            case "FlateDecode":
            case "Fl":
                return new FlateDecodeFilter();
            default:
                return null;
        }
    }

}
