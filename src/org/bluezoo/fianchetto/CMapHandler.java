/*
 * CMapHandler.java
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

import java.util.List;

/**
 * Handler interface for CMap parsing events, as produced by
 * {@link CMapParser} for a font's {@code /ToUnicode} stream.
 * <p>
 * Character codes are delivered as unsigned integers built big-endian from
 * the code bytes. Destinations are delivered as Java strings decoded from
 * UTF-16BE, so a destination may hold more than one char (a ligature or a
 * surrogate pair).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface CMapHandler {

    /**
     * Defines a code space range (begincodespacerange).
     *
     * @param low minimum code
     * @param high maximum code
     * @param codeLength the length of codes in this range, in bytes
     */
    void codeSpaceRange(long low, long high, int codeLength);

    /**
     * Single character code to Unicode mapping (beginbfchar / endbfchar).
     *
     * @param code the source character code
     * @param unicode the destination text
     */
    void bfchar(long code, String unicode);

    /**
     * Range of character codes mapping to consecutive Unicode values
     * (beginbfrange). For each code in [low, high] the destination is
     * {@code start} with its last char incremented by {@code code - low}.
     *
     * @param low start of the source range
     * @param high end of the source range, inclusive
     * @param start destination of the first code
     */
    void bfrange(long low, long high, String start);

    /**
     * Range of character codes mapping to an array of destinations
     * (beginbfrange with array).
     *
     * @param low start of the source range
     * @param high end of the source range, inclusive
     * @param destinations one destination per code, starting at low
     */
    void bfrange(long low, long high, List<String> destinations);

}
