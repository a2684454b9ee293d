/*
 * ObjectStream.java
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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A decoded PDF object stream ({@code /Type /ObjStm}).
 * <p>
 * An object stream contains multiple indirect objects stored sequentially.
 * The stream begins with an index table ({@code /N} pairs of object number
 * and byte offset) followed by the object data. Offsets in the table are
 * relative to the first object (the {@code /First} value in the stream
 * dictionary).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStream.class);

    private final int streamNumber;
    private final ByteBuffer decoded;
    private final int first;
    private final int[] objectNumbers;
    private final int[] relativeOffsets;

    private ObjectStream(int streamNumber, ByteBuffer decoded, int first,
                         int[] objectNumbers, int[] relativeOffsets) {
        this.streamNumber = streamNumber;
        this.decoded = decoded;
        this.first = first;
        this.objectNumbers = objectNumbers;
        this.relativeOffsets = relativeOffsets;
    }

    /**
     * Reads the index table of an object stream.
     *
     * @param stream the raw object holding the stream
     * @return the object stream
     * @throws PDFParseException if the stream is not a usable object stream
     */
    public static ObjectStream load(RawObject stream) {
        if (!stream.hasStream() || stream.getUnappliedFilter() != null) {
            throw new PDFParseException("Object stream " + stream.getObjectNumber() + " is not decoded");
        }
        int n = stream.getInt(Name.N, -1);
        int first = stream.getInt(Name.FIRST, -1);
        ByteBuffer data = stream.getStreamData();
        if (n < 0 || first < 0 || first > data.limit()) {
            throw new PDFParseException("Object stream " + stream.getObjectNumber()
                                        + " has invalid /N or /First");
        }
        // Each header pair takes at least four bytes
        n = Math.min(n, first / 4 + 1);
        Lexer lexer = new Lexer(data);
        int[] numbers = new int[n];
        int[] offsets = new int[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            Token num = lexer.next();
            Token off = lexer.next();
            if (num == null || off == null
                    || !(num.getNumber() instanceof Integer) || !(off.getNumber() instanceof Integer)
                    || lexer.getPosition() > first) {
                break;
            }
            int offset = off.getNumber().intValue();
            if (offset < 0 || offset > data.limit() - first) {
                LOGGER.debug("Object stream {}: offset {} of object {} out of range",
                             stream.getObjectNumber(), offset, num.getNumber());
                continue;
            }
            numbers[count] = num.getNumber().intValue();
            offsets[count] = offset;
            count++;
        }
        if (count < n) {
            // Keep the entries that could be read
            int[] shortNumbers = new int[count];
            int[] shortOffsets = new int[count];
            System.arraycopy(numbers, 0, shortNumbers, 0, count);
            System.arraycopy(offsets, 0, shortOffsets, 0, count);
            numbers = shortNumbers;
            offsets = shortOffsets;
        }
        return new ObjectStream(stream.getObjectNumber(), data, first, numbers, offsets);
    }

    /**
     * Returns the object number of this object stream.
     *
     * @return the stream's object number
     */
    public int getStreamNumber() {
        return streamNumber;
    }

    /**
     * Returns the number of objects in this stream.
     *
     * @return the object count
     */
    public int getObjectCount() {
        return relativeOffsets.length;
    }

    /**
     * Returns the object number stored at the given index.
     *
     * @param index the 0-based index of the object in the stream
     * @return the object number
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public int getObjectNumber(int index) {
        checkIndex(index);
        return objectNumbers[index];
    }

    /**
     * Returns the byte offset in the decoded stream where the object at the
     * given index starts. This is {@code first + relativeOffsets[index]}.
     *
     * @param index the 0-based index of the object in the stream
     * @return the start offset in decoded
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public int getObjectStartOffset(int index) {
        checkIndex(index);
        return first + relativeOffsets[index];
    }

    /**
     * Returns the text of the object at the given index: the bytes from its
     * start offset up to the start of the next object, or the end of the
     * stream for the last one.
     *
     * @param index the 0-based index of the object in the stream
     * @return the object text
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public String getObjectText(int index) {
        int start = Math.min(getObjectStartOffset(index), decoded.limit());
        int end = decoded.limit();
        if (index + 1 < relativeOffsets.length) {
            int nextStart = first + relativeOffsets[index + 1];
            if (nextStart >= start && nextStart <= end) {
                end = nextStart;
            }
        }
        byte[] bytes = new byte[end - start];
        ByteBuffer view = decoded.duplicate();
        view.position(start);
        view.get(bytes);
        return new String(bytes, StandardCharsets.ISO_8859_1).trim();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= relativeOffsets.length) {
            throw new IndexOutOfBoundsException("Object index " + index + " not in [0, "
                                                + relativeOffsets.length + ")");
        }
    }

}
