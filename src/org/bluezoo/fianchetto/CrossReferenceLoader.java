/*
 * CrossReferenceLoader.java
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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the cross-reference structure of a document: the table mapping
 * object numbers to locations, and the trailer dictionary.
 * <p>
 * Loading starts from the offset given after the last {@code startxref}
 * keyword. A section at that offset is either a classic {@code xref} table
 * followed by a {@code trailer} dictionary, or a cross-reference stream.
 * Sections are then followed backwards through {@code /Prev}; entries from
 * newer sections win. In a hybrid file the {@code /XRefStm} named by a
 * classic trailer is loaded along with the table it accompanies.
 * <p>
 * The newest trailer is the document trailer; keys it lacks are taken from
 * older trailers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class CrossReferenceLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrossReferenceLoader.class);

    private static final byte[] STARTXREF = "startxref".getBytes();

    private final ByteBuffer data;
    private final CrossReferenceTable table = new CrossReferenceTable();
    private final Map<Name, Object> trailer = new LinkedHashMap<>();
    private final Set<Integer> visited = new HashSet<>();

    CrossReferenceLoader(ByteBuffer data) {
        this.data = data;
    }

    /**
     * Loads the cross-reference table and trailer.
     *
     * @throws PDFParseException if there is no usable startxref offset or
     *         the newest section cannot be read
     */
    void load() {
        int startxref = ObjectReader.lastIndexOf(data, STARTXREF,
                                                 Math.max(0, data.limit() - 1024), data.limit());
        if (startxref < 0) {
            startxref = ObjectReader.lastIndexOf(data, STARTXREF, 0, data.limit());
        }
        if (startxref < 0) {
            throw new PDFParseException("startxref not found");
        }
        Lexer lexer = new Lexer(data);
        lexer.setPosition(startxref + STARTXREF.length);
        Token offsetToken = lexer.next();
        if (offsetToken == null || !(offsetToken.getNumber() instanceof Integer)) {
            throw new PDFParseException("Invalid startxref value", startxref);
        }
        int offset = offsetToken.getNumber().intValue();

        loadSection(offset);
        Object prev = trailer.get(Name.PREV);
        while (prev instanceof Integer) {
            int prevOffset = (Integer) prev;
            if (visited.contains(prevOffset)) {
                LOGGER.debug("Cycle in /Prev chain at offset {}", prevOffset);
                break;
            }
            Map<Name, Object> older;
            try {
                older = loadSection(prevOffset);
            } catch (RuntimeException e) {
                LOGGER.debug("Ignoring unreadable older xref section: {}", e.getMessage());
                break;
            }
            prev = older.get(Name.PREV);
        }
    }

    CrossReferenceTable getTable() {
        return table;
    }

    Map<Name, Object> getTrailer() {
        return Collections.unmodifiableMap(trailer);
    }

    /**
     * Loads one section and merges it, returning its own trailer.
     */
    private Map<Name, Object> loadSection(int offset) {
        visited.add(offset);
        if (offset < 0 || offset >= data.limit()) {
            throw new PDFParseException("xref offset out of range", offset);
        }
        Lexer lexer = new Lexer(data);
        lexer.setPosition(offset);
        Token first = lexer.peekToken();
        if (first == null) {
            throw new PDFParseException("Invalid xref", offset);
        }
        Map<Name, Object> sectionTrailer;
        if (first.isKeyword("xref")) {
            sectionTrailer = loadClassicSection(lexer);
        } else if (first.getType() == TokenType.NUMBER) {
            sectionTrailer = loadStreamSection(first.getStart());
        } else {
            throw new PDFParseException("Invalid xref", offset);
        }
        for (Map.Entry<Name, Object> e : sectionTrailer.entrySet()) {
            if (!trailer.containsKey(e.getKey())) {
                trailer.put(e.getKey(), e.getValue());
            }
        }
        return sectionTrailer;
    }

    // ========== Classic tables ==========

    private Map<Name, Object> loadClassicSection(Lexer lexer) {
        lexer.next(); // xref
        CrossReferenceTable section = new CrossReferenceTable();
        while (true) {
            Token token = lexer.next();
            if (token == null) {
                throw new PDFParseException("Missing trailer", lexer.getPosition());
            }
            if (token.isKeyword("trailer")) {
                break;
            }
            Token countToken = lexer.next();
            if (!(token.getNumber() instanceof Integer) || countToken == null
                    || !(countToken.getNumber() instanceof Integer)) {
                throw new PDFParseException("Expected subsection or trailer", token.getStart());
            }
            int startObject = token.getNumber().intValue();
            int count = countToken.getNumber().intValue();
            for (int i = 0; i < count; i++) {
                Token offsetToken = lexer.next();
                Token genToken = lexer.next();
                Token typeToken = lexer.next();
                if (offsetToken == null || genToken == null || typeToken == null
                        || offsetToken.getType() != TokenType.NUMBER
                        || genToken.getType() != TokenType.NUMBER) {
                    throw new PDFParseException("Truncated xref subsection", lexer.getPosition());
                }
                int objectNumber = startObject + i;
                if (typeToken.isKeyword("n")) {
                    section.putIfAbsent(objectNumber,
                        CrossReferenceEntry.inUse(offsetToken.getNumber().longValue(),
                                                  genToken.getNumber().intValue()));
                } else if (typeToken.isKeyword("f")) {
                    section.putIfAbsent(objectNumber, CrossReferenceEntry.free());
                } else {
                    throw new PDFParseException("Invalid xref entry type: " + typeToken,
                                                typeToken.getStart());
                }
            }
        }
        Object value = ObjectParser.parse(lexer);
        if (!(value instanceof Map)) {
            throw new PDFParseException("Trailer is not a dictionary", lexer.getPosition());
        }
        @SuppressWarnings("unchecked")
        Map<Name, Object> sectionTrailer = (Map<Name, Object>) value;

        // Hybrid file: the stream holds the entries the table marks free
        Object xrefStm = sectionTrailer.get(Name.XREF_STM);
        if (xrefStm instanceof Integer && !visited.contains(xrefStm)) {
            visited.add((Integer) xrefStm);
            try {
                loadStreamSection((Integer) xrefStm);
            } catch (RuntimeException e) {
                LOGGER.debug("Ignoring unreadable /XRefStm: {}", e.getMessage());
            }
        }
        for (Integer objectNumber : section.getObjectNumbers()) {
            table.putIfAbsent(objectNumber, section.get(objectNumber));
        }
        return sectionTrailer;
    }

    // ========== Cross-reference streams ==========

    private Map<Name, Object> loadStreamSection(int offset) {
        ObjectReader reader = new ObjectReader(data, null);
        RawObject stream = reader.read(offset);
        if (!stream.hasStream() || !stream.isType(Name.XREF)) {
            throw new PDFParseException("Not a cross-reference stream", offset);
        }
        if (stream.getUnappliedFilter() != null) {
            throw new PDFParseException("Cross-reference stream uses unsupported filter "
                                        + stream.getUnappliedFilter(), offset);
        }
        Map<Name, Object> dict = stream.getDictionary();
        parseStreamEntries(stream.getStreamData(), dict);
        return dict;
    }

    /**
     * Parses the binary entries of a decoded cross-reference stream.
     */
    private void parseStreamEntries(ByteBuffer entries, Map<Name, Object> dict) {
        Object wValue = dict.get(Name.W);
        if (!(wValue instanceof List) || ((List<?>) wValue).size() != 3) {
            throw new PDFParseException("XRef stream missing or invalid W array");
        }
        List<?> wArray = (List<?>) wValue;
        int[] w = new int[3];
        for (int i = 0; i < 3; i++) {
            Object wi = wArray.get(i);
            if (!(wi instanceof Integer) || (Integer) wi < 0 || (Integer) wi > 8) {
                throw new PDFParseException("XRef stream has invalid field width");
            }
            w[i] = (Integer) wi;
        }
        int entrySize = w[0] + w[1] + w[2];
        if (entrySize == 0) {
            throw new PDFParseException("XRef stream has zero entry size");
        }

        int[] index;
        Object indexValue = dict.get(Name.INDEX);
        if (indexValue instanceof List) {
            List<?> indexArray = (List<?>) indexValue;
            index = new int[indexArray.size() & ~1];
            for (int i = 0; i < index.length; i++) {
                Object v = indexArray.get(i);
                index[i] = (v instanceof Number) ? ((Number) v).intValue() : 0;
            }
        } else {
            Object sizeNum = dict.get(Name.SIZE);
            int size = (sizeNum instanceof Number)
                ? ((Number) sizeNum).intValue() : entries.remaining() / entrySize;
            index = new int[] { 0, size };
        }

        for (int i = 0; i < index.length; i += 2) {
            int startObj = index[i];
            int count = index[i + 1];
            for (int j = 0; j < count; j++) {
                if (entries.remaining() < entrySize) {
                    LOGGER.debug("XRef stream truncated after {} entries of subsection {}", j, startObj);
                    return;
                }
                int type = (w[0] > 0) ? (int) readField(entries, w[0]) : 1;
                long field2 = readField(entries, w[1]);
                long field3 = readField(entries, w[2]);
                CrossReferenceEntry entry = CrossReferenceEntry.fromStreamRow(type, field2, field3);
                if (entry == null) {
                    continue;
                }
                table.putIfAbsent(startObj + j, entry);
            }
        }
    }

    /**
     * Reads a big-endian unsigned field of the given byte width.
     */
    private static long readField(ByteBuffer buf, int width) {
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (buf.get() & 0xFF);
        }
        return value;
    }

}
