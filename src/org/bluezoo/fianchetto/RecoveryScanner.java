/*
 * RecoveryScanner.java
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the object table of a document by scanning the whole buffer for
 * object headers, for files whose cross-reference data is missing or wrong.
 * <p>
 * Every occurrence of the keyword {@code obj} is a candidate. It is
 * accepted only when it is preceded by two whitespace-separated
 * non-negative integers, the first of which starts at a token boundary,
 * and when a complete object can then be read from that header. After an
 * object is read the scan resumes at its end, so stream data is never
 * examined for headers. Later definitions of an object number replace
 * earlier ones, as an incremental update would.
 * <p>
 * Trailer dictionaries are collected in the same pass. Objects held in
 * recovered object streams are added afterwards, for object numbers no
 * top-level definition claims.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class RecoveryScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecoveryScanner.class);

    private static final byte[] OBJ = "obj".getBytes();
    private static final byte[] TRAILER = "trailer".getBytes();

    private final ByteBuffer data;
    private final Map<Integer, RawObject> objects = new LinkedHashMap<>();
    private final List<Map<Name, Object>> trailers = new ArrayList<>();

    RecoveryScanner(ByteBuffer data) {
        this.data = data;
    }

    /**
     * Scans the buffer.
     */
    void scan() {
        ObjectReader reader = new ObjectReader(data, this::lookupLength);
        int limit = data.limit();
        int pos = 0;
        int nextTrailer = ObjectReader.indexOf(data, TRAILER, 0, limit);
        while (pos < limit) {
            int obj = ObjectReader.indexOf(data, OBJ, pos, limit);
            // Trailers lying before the next object header
            while (nextTrailer >= 0 && (obj < 0 || nextTrailer < obj)) {
                readTrailer(nextTrailer);
                nextTrailer = ObjectReader.indexOf(data, TRAILER, nextTrailer + TRAILER.length, limit);
            }
            if (obj < 0) {
                break;
            }
            int header = findHeaderStart(obj);
            if (header < 0) {
                pos = obj + OBJ.length;
                continue;
            }
            try {
                RawObject object = reader.read(header);
                objects.put(object.getObjectNumber(), object);
                pos = Math.max(obj + OBJ.length, reader.getEndOffset());
                if (nextTrailer >= 0 && nextTrailer < pos) {
                    nextTrailer = ObjectReader.indexOf(data, TRAILER, pos, limit);
                }
            } catch (RuntimeException e) {
                LOGGER.debug("Skipping unreadable object candidate: {}", e.getMessage());
                pos = obj + OBJ.length;
            }
        }
        unpackObjectStreams();
    }

    /**
     * Returns the recovered objects, keyed by object number.
     *
     * @return the objects
     */
    Map<Integer, RawObject> getObjects() {
        return Collections.unmodifiableMap(objects);
    }

    /**
     * Returns the trailer dictionaries found, in file order.
     *
     * @return the trailers
     */
    List<Map<Name, Object>> getTrailers() {
        return Collections.unmodifiableList(trailers);
    }

    /**
     * Returns the start of the {@code N G} preceding an {@code obj} keyword,
     * or -1 if the keyword is not preceded by a plausible header.
     */
    int findHeaderStart(int objOffset) {
        int limit = data.limit();
        int after = objOffset + OBJ.length;
        if (after < limit) {
            int b = byteAt(after);
            if (!Lexer.isWhitespace(b) && !Lexer.isDelimiter(b)) {
                return -1; // e.g. "object"
            }
        }
        int i = objOffset - 1;
        // whitespace, generation, whitespace, number
        int ws = skipBackWhitespace(i);
        if (ws == i) {
            return -1;
        }
        i = ws;
        int digits = skipBackDigits(i);
        if (digits == i) {
            return -1;
        }
        i = digits;
        ws = skipBackWhitespace(i);
        if (ws == i) {
            return -1;
        }
        i = ws;
        digits = skipBackDigits(i);
        if (digits == i) {
            return -1;
        }
        int start = digits + 1;
        if (digits >= 0) {
            int b = byteAt(digits);
            if (!Lexer.isWhitespace(b) && !Lexer.isDelimiter(b)) {
                return -1;
            }
        }
        return start;
    }

    private int skipBackWhitespace(int i) {
        while (i >= 0 && Lexer.isWhitespace(byteAt(i))) {
            i--;
        }
        return i;
    }

    private int skipBackDigits(int i) {
        int count = 0;
        while (i >= 0 && byteAt(i) >= '0' && byteAt(i) <= '9' && count < 10) {
            i--;
            count++;
        }
        return i;
    }

    private void readTrailer(int offset) {
        Lexer lexer = new Lexer(data);
        lexer.setPosition(offset + TRAILER.length);
        try {
            Object value = ObjectParser.parse(lexer);
            if (value instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<Name, Object> dict = (Map<Name, Object>) value;
                trailers.add(dict);
            }
        } catch (PDFParseException e) {
            LOGGER.debug("Skipping unreadable trailer at {}: {}", offset, e.getMessage());
        }
    }

    private Object lookupLength(int objectNumber) {
        RawObject object = objects.get(objectNumber);
        return (object != null) ? object.getValue() : null;
    }

    private void unpackObjectStreams() {
        Map<Integer, RawObject> compressed = new HashMap<>();
        for (RawObject object : objects.values()) {
            if (!object.hasStream() || !object.isType(Name.OBJ_STM)) {
                continue;
            }
            try {
                ObjectStream stream = ObjectStream.load(object);
                for (int i = 0; i < stream.getObjectCount(); i++) {
                    int number = stream.getObjectNumber(i);
                    if (!objects.containsKey(number)) {
                        compressed.put(number, new RawObject(number, 0, stream.getObjectText(i),
                                                             null, null, -1));
                    }
                }
            } catch (RuntimeException e) {
                LOGGER.debug("Skipping object stream {}: {}", object.getObjectNumber(), e.getMessage());
            }
        }
        objects.putAll(compressed);
    }

    private int byteAt(int index) {
        return data.get(index) & 0xFF;
    }

}
