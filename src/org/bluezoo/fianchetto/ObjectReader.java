/*
 * ObjectReader.java
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
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads single indirect objects ({@code N G obj ... endobj}) from a document
 * buffer.
 * <p>
 * The value following the header is not built: its extent is found by
 * walking the tokens, and its text is captured for lazy parsing. Only when
 * the value is followed by {@code stream} is the dictionary parsed, to read
 * {@code /Length} and {@code /Filter}.
 * <p>
 * A direct {@code /Length} is trusted only if {@code endstream} follows the
 * declared span; an indirect one is resolved through the supplied lookup.
 * When neither yields a usable length the data ends at the next
 * {@code endstream} keyword.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class ObjectReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectReader.class);

    private static final byte[] ENDSTREAM = "endstream".getBytes();

    private final ByteBuffer data;
    private final IntFunction<Object> lengthLookup;
    private int endOffset;

    /**
     * Creates a reader over a document buffer.
     *
     * @param data the whole document
     * @param lengthLookup resolves the object number of an indirect
     *                     {@code /Length} to its value, may return null
     */
    ObjectReader(ByteBuffer data, IntFunction<Object> lengthLookup) {
        this.data = data;
        this.lengthLookup = lengthLookup;
    }

    /**
     * Returns the offset just past the last object read.
     *
     * @return the end offset
     */
    int getEndOffset() {
        return endOffset;
    }

    /**
     * Reads the object whose header starts at the given offset.
     *
     * @param offset the offset of the {@code N G obj} header
     * @return the object
     * @throws PDFParseException if there is no well-formed object at the offset
     */
    RawObject read(int offset) {
        if (offset < 0 || offset >= data.limit()) {
            throw new PDFParseException("Object offset out of range", offset);
        }
        Lexer lexer = new Lexer(data);
        lexer.setPosition(offset);
        Token num = lexer.next();
        Token gen = lexer.next();
        Token obj = lexer.next();
        if (num == null || gen == null || obj == null
                || !isNonNegativeInteger(num) || !isNonNegativeInteger(gen)
                || !obj.isKeyword("obj")) {
            throw new PDFParseException("Expected object header", offset);
        }
        int objectNumber = num.getNumber().intValue();
        int generation = gen.getNumber().intValue();

        // Value span
        Token first = lexer.peekToken();
        int valueStart = (first != null) ? first.getStart() : lexer.getPosition();
        int valueEnd = valueStart;
        if (first != null && !first.isKeyword("endobj") && !first.isKeyword("stream")) {
            skipValue(lexer);
            valueEnd = lexer.getPosition();
        }
        String dictText = latin1(valueStart, valueEnd);

        int afterValue = lexer.getPosition();
        Token next = lexer.next();
        if (next != null && next.isKeyword("stream")) {
            return readStream(lexer, objectNumber, generation, dictText, next, offset);
        }
        if (next != null && next.isKeyword("endobj")) {
            endOffset = next.getEnd();
        } else {
            // Missing endobj
            endOffset = afterValue;
        }
        return new RawObject(objectNumber, generation, dictText, null, null, offset);
    }

    private RawObject readStream(Lexer lexer, int objectNumber, int generation,
                                 String dictText, Token streamKeyword, int offset) {
        Object value;
        try {
            value = ObjectParser.parse(new Lexer(dictText.getBytes(StandardCharsets.ISO_8859_1)));
        } catch (PDFParseException e) {
            throw new PDFParseException("Invalid stream dictionary: " + e.getMessage(), offset);
        }
        if (!(value instanceof Map)) {
            throw new PDFParseException("Stream without dictionary", offset);
        }
        @SuppressWarnings("unchecked")
        Map<Name, Object> dict = (Map<Name, Object>) value;

        // Data begins after the EOL following the keyword
        int dataStart = streamKeyword.getEnd();
        if (dataStart < data.limit() && byteAt(dataStart) == '\r') {
            dataStart++;
        }
        if (dataStart < data.limit() && byteAt(dataStart) == '\n') {
            dataStart++;
        }

        int dataEnd = -1;
        int length = resolveLength(dict.get(Name.LENGTH), objectNumber);
        if (length >= 0 && length <= data.limit() - dataStart
                && endstreamFollows(dataStart + length)) {
            dataEnd = dataStart + length;
        }
        int afterEndstream;
        if (dataEnd < 0) {
            int found = indexOf(data, ENDSTREAM, dataStart, data.limit());
            if (found < 0) {
                LOGGER.debug("Object {}: no endstream, stream data runs to end of input", objectNumber);
                dataEnd = data.limit();
                afterEndstream = data.limit();
            } else {
                if (length >= 0) {
                    LOGGER.debug("Object {}: declared /Length {} does not match, using endstream",
                                 objectNumber, length);
                }
                afterEndstream = found + ENDSTREAM.length;
                dataEnd = trimTrailingEol(dataStart, found);
            }
        } else {
            afterEndstream = indexOf(data, ENDSTREAM, dataEnd, data.limit()) + ENDSTREAM.length;
        }

        lexer.setPosition(afterEndstream);
        Token next = lexer.peekToken();
        if (next != null && next.isKeyword("endobj")) {
            endOffset = next.getEnd();
        } else {
            endOffset = afterEndstream;
        }

        byte[] raw = new byte[dataEnd - dataStart];
        ByteBuffer view = data.duplicate();
        view.position(dataStart);
        view.get(raw);
        Decoded decoded = decode(dict, raw, objectNumber);
        return new RawObject(objectNumber, generation, dictText, dict,
                             decoded.bytes, decoded.unappliedFilter, offset);
    }

    private int resolveLength(Object lengthValue, int objectNumber) {
        if (lengthValue instanceof ObjectId && lengthLookup != null) {
            int ref = ((ObjectId) lengthValue).getObjectNumber();
            if (ref != objectNumber) {
                lengthValue = lengthLookup.apply(ref);
            }
        }
        if (lengthValue instanceof Integer) {
            return (Integer) lengthValue;
        }
        return -1;
    }

    private boolean endstreamFollows(int pos) {
        int limit = data.limit();
        while (pos < limit && Lexer.isWhitespace(byteAt(pos))) {
            pos++;
        }
        return matches(data, pos, ENDSTREAM);
    }

    private int trimTrailingEol(int start, int end) {
        if (end > start && byteAt(end - 1) == '\n') {
            end--;
        }
        if (end > start && byteAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    // ========== Decoding ==========

    static final class Decoded {
        final byte[] bytes;
        final Name unappliedFilter;

        Decoded(byte[] bytes, Name unappliedFilter) {
            this.bytes = bytes;
            this.unappliedFilter = unappliedFilter;
        }
    }

    /**
     * Applies the supported prefix of a stream's filter chain.
     * A stream whose decoding fails keeps its raw bytes, and its first
     * filter is reported as unapplied.
     */
    static Decoded decode(Map<Name, Object> dict, byte[] raw, int objectNumber) {
        ByteBufferCollector collector = new ByteBufferCollector((int) Math.min(raw.length * 2L, 1 << 24));
        FilterPipeline pipeline = FilterPipeline.create(dict, collector);
        if (!pipeline.hasFilters()) {
            return new Decoded(raw, pipeline.getUnappliedFilter());
        }
        try {
            pipeline.write(ByteBuffer.wrap(raw));
            pipeline.close();
            return new Decoded(collector.toByteArray(), pipeline.getUnappliedFilter());
        } catch (IOException e) {
            LOGGER.debug("Object {}: stream could not be decoded, keeping raw bytes: {}",
                         objectNumber, e.getMessage());
            return new Decoded(raw, FilterPipeline.getFilterNames(dict).get(0));
        }
    }

    // ========== Value extent ==========

    /**
     * Advances the lexer past one value without building it.
     */
    static void skipValue(Lexer lexer) {
        Token token = lexer.next();
        if (token == null) {
            return;
        }
        if (token.getType() == TokenType.NUMBER) {
            // Possibly "n g R"
            int saved = lexer.getPosition();
            Token second = lexer.next();
            Token third = lexer.next();
            if (second == null || third == null
                    || second.getType() != TokenType.NUMBER || !third.isKeyword("R")) {
                lexer.setPosition(saved);
            }
            return;
        }
        if (token.getType() != TokenType.ARRAY_START && token.getType() != TokenType.DICT_START) {
            return;
        }
        int depth = 1;
        while (depth > 0) {
            int before = lexer.getPosition();
            token = lexer.next();
            if (token == null) {
                return;
            }
            switch (token.getType()) {
                case ARRAY_START:
                case DICT_START:
                    depth++;
                    break;
                case ARRAY_END:
                case DICT_END:
                    depth--;
                    break;
                case KEYWORD:
                    if (token.isKeyword("endobj") || token.isKeyword("stream")
                            || token.isKeyword("obj")) {
                        // Unbalanced value: stop before the structural keyword
                        lexer.setPosition(before);
                        return;
                    }
                    break;
                default:
                    break;
            }
        }
    }

    // ========== Byte helpers ==========

    private int byteAt(int index) {
        return data.get(index) & 0xFF;
    }

    private String latin1(int from, int to) {
        char[] chars = new char[Math.max(0, to - from)];
        for (int i = from; i < to; i++) {
            chars[i - from] = (char) byteAt(i);
        }
        return new String(chars);
    }

    private static boolean isNonNegativeInteger(Token token) {
        return token.getType() == TokenType.NUMBER
            && token.getNumber() instanceof Integer
            && token.getNumber().intValue() >= 0;
    }

    /**
     * Checks if buffer matches a byte sequence at the given position.
     */
    static boolean matches(ByteBuffer buf, int pos, byte[] sequence) {
        if (pos < 0 || pos + sequence.length > buf.limit()) {
            return false;
        }
        for (int i = 0; i < sequence.length; i++) {
            if (buf.get(pos + i) != sequence[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the first offset in [from, to) at which the sequence occurs.
     */
    static int indexOf(ByteBuffer buf, byte[] sequence, int from, int to) {
        int last = Math.min(to, buf.limit()) - sequence.length;
        byte first = sequence[0];
        for (int i = Math.max(0, from); i <= last; i++) {
            if (buf.get(i) == first && matches(buf, i, sequence)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the last offset in [from, to) at which the sequence occurs.
     */
    static int lastIndexOf(ByteBuffer buf, byte[] sequence, int from, int to) {
        byte first = sequence[0];
        for (int i = Math.min(to, buf.limit()) - sequence.length; i >= Math.max(0, from); i--) {
            if (buf.get(i) == first && matches(buf, i, sequence)) {
                return i;
            }
        }
        return -1;
    }

}
