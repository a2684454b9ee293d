/*
 * RawObject.java
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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An indirect object as held by the {@link ObjectStore}.
 * <p>
 * The object's value is kept as unparsed text and parsed on first access;
 * the parsed value is memoised and safe to share between threads. A stream
 * object additionally carries its stream data, decoded as far as the
 * supported filters allow. When a declared filter could not be applied,
 * {@link #getUnappliedFilter()} names it and the stream data is still
 * encoded with that filter and any that follow it.
 * <p>
 * Instances are immutable once loaded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RawObject {

    private static final Logger LOGGER = LoggerFactory.getLogger(RawObject.class);

    private final int objectNumber;
    private final int generation;
    private final String dictText;
    private final byte[] stream;
    private final Name unappliedFilter;
    private final long offset;

    private volatile boolean parsed;
    private volatile Object value;

    /**
     * Creates a raw object.
     *
     * @param objectNumber the object number
     * @param generation the generation number
     * @param dictText the unparsed value text
     * @param stream the decoded stream data, or null if this is not a stream
     * @param unappliedFilter the first filter that could not be applied, or null
     * @param offset the byte offset of the object header, or -1 for an
     *               object read from an object stream
     */
    RawObject(int objectNumber, int generation, String dictText, byte[] stream,
              Name unappliedFilter, long offset) {
        this.objectNumber = objectNumber;
        this.generation = generation;
        this.dictText = dictText;
        this.stream = stream;
        this.unappliedFilter = unappliedFilter;
        this.offset = offset;
    }

    /**
     * Creates a raw object whose value has already been parsed.
     */
    RawObject(int objectNumber, int generation, String dictText, Object value,
              byte[] stream, Name unappliedFilter, long offset) {
        this(objectNumber, generation, dictText, stream, unappliedFilter, offset);
        this.value = value;
        this.parsed = true;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    public int getGeneration() {
        return generation;
    }

    /**
     * Returns the identifier of this object.
     *
     * @return the object id
     */
    public ObjectId getId() {
        return new ObjectId(objectNumber, generation);
    }

    /**
     * Returns the unparsed text of the object's value, for a stream object
     * its dictionary.
     *
     * @return the value text
     */
    public String getDictText() {
        return dictText;
    }

    /**
     * Returns the byte offset of the object header in the file.
     *
     * @return the offset, or -1 if the object was stored in an object stream
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Returns the parsed value of this object. Dictionaries are
     * {@code Map<Name,Object>}, arrays {@code List<Object>}.
     * A value that cannot be parsed is reported as null.
     *
     * @return the value
     */
    public Object getValue() {
        if (!parsed) {
            synchronized (this) {
                if (!parsed) {
                    value = parseValue();
                    parsed = true;
                }
            }
        }
        return value;
    }

    private Object parseValue() {
        if (dictText.isEmpty()) {
            return null;
        }
        try {
            return ObjectParser.parse(new Lexer(dictText.getBytes(StandardCharsets.ISO_8859_1)));
        } catch (PDFParseException e) {
            LOGGER.debug("Object {} has an unparseable value: {}", objectNumber, e.getMessage());
            return null;
        }
    }

    /**
     * Returns the value of this object if it is a dictionary (for a stream
     * object, the stream dictionary).
     *
     * @return the dictionary, or an empty map
     */
    @SuppressWarnings("unchecked")
    public Map<Name, Object> getDictionary() {
        Object v = getValue();
        if (v instanceof Map) {
            return (Map<Name, Object>) v;
        }
        return Collections.emptyMap();
    }

    /**
     * Returns whether the value of this object is a dictionary.
     *
     * @return true for dictionaries and streams
     */
    public boolean isDictionary() {
        return getValue() instanceof Map;
    }

    /**
     * Returns the value of this object if it is an array.
     *
     * @return the array, or null
     */
    @SuppressWarnings("unchecked")
    public List<Object> getArray() {
        Object v = getValue();
        return (v instanceof List) ? (List<Object>) v : null;
    }

    /**
     * Looks up a key in this object's dictionary.
     *
     * @param key the key
     * @return the direct value, which may be an {@link ObjectId}, or null
     */
    public Object get(Name key) {
        return getDictionary().get(key);
    }

    /**
     * Looks up a name-valued key in this object's dictionary.
     *
     * @param key the key
     * @return the name, or null if absent or not a name
     */
    public Name getName(Name key) {
        Object v = get(key);
        return (v instanceof Name) ? (Name) v : null;
    }

    /**
     * Looks up an integer-valued key in this object's dictionary.
     *
     * @param key the key
     * @param defaultValue the value to return if absent or not a number
     * @return the value
     */
    public int getInt(Name key, int defaultValue) {
        Object v = get(key);
        return (v instanceof Number) ? ((Number) v).intValue() : defaultValue;
    }

    /**
     * Tests whether this object's dictionary has the given {@code /Type}.
     *
     * @param type the expected type
     * @return true if the types match
     */
    public boolean isType(Name type) {
        return type.equals(getName(Name.TYPE));
    }

    public boolean hasStream() {
        return stream != null;
    }

    /**
     * Returns a read-only view of the stream data.
     *
     * @return the stream data, or null if this object is not a stream
     */
    public ByteBuffer getStreamData() {
        return (stream == null) ? null : ByteBuffer.wrap(stream).asReadOnlyBuffer();
    }

    /**
     * Returns a copy of the stream data.
     *
     * @return the stream bytes, or null if this object is not a stream
     */
    public byte[] getStreamBytes() {
        return (stream == null) ? null : stream.clone();
    }

    int getStreamLength() {
        return (stream == null) ? 0 : stream.length;
    }

    /**
     * Returns the first declared filter that was not applied to the stream
     * data.
     *
     * @return the filter name, or null if the data is fully decoded
     */
    public Name getUnappliedFilter() {
        return unappliedFilter;
    }

    @Override
    public String toString() {
        return "RawObject[" + objectNumber + " " + generation
            + (stream != null ? ", stream=" + stream.length : "") + "]";
    }

}
