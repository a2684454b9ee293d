/*
 * CrossReferenceEntry.java
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

/**
 * Where the cross-reference data says an object lives.
 * <p>
 * Rows of a classic {@code xref} table become free or in-use entries;
 * rows of a cross-reference stream may also point into an object stream.
 * An entry is only a claim: {@link ObjectStore} reads the object it names
 * and, when the claim turns out to be wrong, looks for the object by
 * scanning the file instead.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CrossReferenceEntry {

    private static final int FREE_ENTRY = 0;
    private static final int IN_USE_ENTRY = 1;
    private static final int COMPRESSED_ENTRY = 2;

    private static final CrossReferenceEntry FREE = new CrossReferenceEntry(FREE_ENTRY, 0, 0);

    private final int kind;
    private final long location;
    private final int detail;

    public static CrossReferenceEntry free() {
        return FREE;
    }

    /**
     * An object at a byte offset in the file.
     *
     * @param offset the offset of the {@code N G obj} header
     * @param generation the generation number
     * @return the entry
     */
    public static CrossReferenceEntry inUse(long offset, int generation) {
        return new CrossReferenceEntry(IN_USE_ENTRY, offset, generation);
    }

    /**
     * An object stored in an object stream.
     *
     * @param objectStreamNumber the object number of the object stream
     * @param indexInStream the position of the object in the stream's header
     * @return the entry
     */
    public static CrossReferenceEntry compressed(int objectStreamNumber, int indexInStream) {
        return new CrossReferenceEntry(COMPRESSED_ENTRY, objectStreamNumber, indexInStream);
    }

    /**
     * Decodes one row of a cross-reference stream.
     *
     * @param type the first field, 1 when the stream omits it
     * @param field2 the second field
     * @param field3 the third field
     * @return the entry, or null for a type this library does not know,
     *         which stands for the null object
     */
    static CrossReferenceEntry fromStreamRow(int type, long field2, long field3) {
        switch (type) {
            case FREE_ENTRY:
                return FREE;
            case IN_USE_ENTRY:
                return inUse(field2, (int) field3);
            case COMPRESSED_ENTRY:
                if (field2 > Integer.MAX_VALUE || field3 > Integer.MAX_VALUE) {
                    return null;
                }
                return compressed((int) field2, (int) field3);
            default:
                return null;
        }
    }

    private CrossReferenceEntry(int kind, long location, int detail) {
        this.kind = kind;
        this.location = location;
        this.detail = detail;
    }

    public boolean isFree() {
        return kind == FREE_ENTRY;
    }

    public boolean isInUse() {
        return kind == IN_USE_ENTRY;
    }

    public boolean isCompressed() {
        return kind == COMPRESSED_ENTRY;
    }

    /**
     * Returns the claimed offset of an in-use object. The offset is not
     * checked against the file.
     *
     * @return the byte offset
     * @throws IllegalStateException if this is not an in-use entry
     */
    public long getOffset() {
        requireKind(IN_USE_ENTRY);
        return location;
    }

    public int getGeneration() {
        requireKind(IN_USE_ENTRY);
        return detail;
    }

    /**
     * Returns the object number of the containing object stream.
     *
     * @return the object stream number
     * @throws IllegalStateException if this is not a compressed entry
     */
    public int getObjectStreamNumber() {
        requireKind(COMPRESSED_ENTRY);
        return (int) location;
    }

    /**
     * Returns the claimed position in the object stream's header. The
     * store searches the header by object number when this is wrong.
     *
     * @return the index in the stream
     * @throws IllegalStateException if this is not a compressed entry
     */
    public int getIndexInStream() {
        requireKind(COMPRESSED_ENTRY);
        return detail;
    }

    private void requireKind(int expected) {
        if (kind != expected) {
            throw new IllegalStateException("Entry is " + this);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case IN_USE_ENTRY:
                return location + " " + detail + " n";
            case COMPRESSED_ENTRY:
                return "object " + detail + " of stream " + location;
            default:
                return "free";
        }
    }

}
