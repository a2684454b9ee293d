/*
 * CrossReferenceTable.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * In-memory representation of a PDF cross-reference table.
 * <p>
 * The table maps object numbers to their locations within the file. It is
 * populated from classic xref sections and from cross-reference streams.
 * <p>
 * Sections are merged newest first, following the {@code /Prev} chain
 * backwards through incremental updates. An entry from a newer section
 * therefore always wins: {@link #putIfAbsent} is used when adding entries
 * from an older section. Object numbers are the key; generations are kept
 * on the entries for diagnostics only.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CrossReferenceTable {

    private final Map<Integer, CrossReferenceEntry> entries;
    private int maxObjectNumber;

    /**
     * Creates an empty cross-reference table.
     */
    public CrossReferenceTable() {
        this.entries = new LinkedHashMap<>();
        this.maxObjectNumber = 0;
    }

    /**
     * Adds or replaces the entry for an object number.
     *
     * @param objectNumber the object number
     * @param entry the cross-reference entry
     */
    public void put(int objectNumber, CrossReferenceEntry entry) {
        entries.put(objectNumber, entry);
        if (objectNumber > maxObjectNumber) {
            maxObjectNumber = objectNumber;
        }
    }

    /**
     * Adds the entry for an object number unless a newer section has
     * already defined it.
     *
     * @param objectNumber the object number
     * @param entry the cross-reference entry
     * @return true if the entry was added
     */
    public boolean putIfAbsent(int objectNumber, CrossReferenceEntry entry) {
        if (entries.containsKey(objectNumber)) {
            return false;
        }
        put(objectNumber, entry);
        return true;
    }

    /**
     * Returns the entry for the specified object number.
     *
     * @param objectNumber the object number
     * @return the entry, or null if not found
     */
    public CrossReferenceEntry get(int objectNumber) {
        return entries.get(objectNumber);
    }

    public boolean contains(int objectNumber) {
        return entries.containsKey(objectNumber);
    }

    /**
     * Returns the number of entries in the table, free entries included.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the highest object number in the table.
     *
     * @return the maximum object number
     */
    public int getMaxObjectNumber() {
        return maxObjectNumber;
    }

    /**
     * Returns all object numbers in the table.
     *
     * @return an unmodifiable view of the object numbers
     */
    public Set<Integer> getObjectNumbers() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Override
    public String toString() {
        return "CrossReferenceTable[entries=" + entries.size() +
               ", maxObject=" + maxObjectNumber + "]";
    }

}
