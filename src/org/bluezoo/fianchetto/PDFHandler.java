/*
 * PDFHandler.java
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
 * SAX-like callback handler for receiving PDF object syntax events.
 * <p>
 * The {@link ObjectParser} reports each value it reads as a sequence of
 * calls on this interface. Composite values are bracketed by
 * {@link #startArray()}/{@link #endArray()} and
 * {@link #startDictionary()}/{@link #endDictionary()}; inside a dictionary
 * every value is preceded by a {@link #key(Name)} call.
 * <p>
 * {@link ValueBuilder} is the implementation used to materialise values
 * as Java objects.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface PDFHandler {

    /**
     * Receives a boolean value.
     *
     * @param value the boolean value (true or false)
     */
    void booleanValue(boolean value);

    /**
     * Receives a numeric value.
     * <p>
     * The parser provides an Integer where the value fits, a Long for
     * larger integers and a Double for real numbers.
     *
     * @param value the numeric value
     */
    void numberValue(Number value);

    /**
     * Receives a string value.
     * <p>
     * Literal and hexadecimal strings are both delivered decoded, one
     * char per byte (ISO-8859-1).
     *
     * @param value the string value
     */
    void stringValue(String value);

    /**
     * Receives a name value.
     *
     * @param name the name value
     */
    void nameValue(Name name);

    /**
     * Signals the start of an array.
     */
    void startArray();

    /**
     * Signals the end of an array.
     */
    void endArray();

    /**
     * Signals the start of a dictionary.
     */
    void startDictionary();

    /**
     * Signals the end of a dictionary.
     */
    void endDictionary();

    /**
     * Receives a dictionary key.
     *
     * @param name the key name
     */
    void key(Name name);

    /**
     * Receives a null value.
     */
    void nullValue();

    /**
     * Receives an indirect object reference.
     *
     * @param id the object identifier being referenced
     */
    void objectReference(ObjectId id);

}
