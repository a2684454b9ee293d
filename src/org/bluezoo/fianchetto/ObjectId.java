/*
 * ObjectId.java
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
 * An indirect object identifier: object number and generation number.
 * <p>
 * Values of this type appear in parsed dictionaries wherever the source
 * contained an indirect reference ({@code 12 0 R}). Resolution through the
 * {@link ObjectStore} is by object number only; the generation is carried
 * for diagnostics, since an incrementally updated file keeps the last
 * definition of a number regardless of its generation.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectId {

    private final int objectNumber;
    private final int generationNumber;

    /**
     * Creates a new object identifier with generation number 0.
     *
     * @param objectNumber the object number
     */
    public ObjectId(int objectNumber) {
        this(objectNumber, 0);
    }

    /**
     * Creates a new object identifier.
     *
     * @param objectNumber the object number (must be non-negative)
     * @param generationNumber the generation number (must be non-negative)
     * @throws IllegalArgumentException if either number is negative
     */
    public ObjectId(int objectNumber, int generationNumber) {
        if (objectNumber < 0) {
            throw new IllegalArgumentException(
                "Object number must be non-negative: " + objectNumber);
        }
        if (generationNumber < 0) {
            throw new IllegalArgumentException(
                "Generation number must be non-negative: " + generationNumber);
        }
        this.objectNumber = objectNumber;
        this.generationNumber = generationNumber;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    public int getGenerationNumber() {
        return generationNumber;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ObjectId) {
            ObjectId other = (ObjectId) obj;
            return objectNumber == other.objectNumber
                && generationNumber == other.generationNumber;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * objectNumber + generationNumber;
    }

    /**
     * Returns the reference in PDF syntax, "n g R".
     *
     * @return the object reference in PDF syntax
     */
    @Override
    public String toString() {
        return objectNumber + " " + generationNumber + " R";
    }

}
