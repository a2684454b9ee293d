/*
 * TokenType.java
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
 * The lexical categories produced by the {@link Lexer}.
 * <p>
 * The same categories serve object syntax and content-stream syntax.
 * {@code true}, {@code false}, {@code null}, {@code R}, {@code obj} and all
 * content-stream operators are {@link #KEYWORD}s.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum TokenType {

    NUMBER,
    LITERAL_STRING,
    HEX_STRING,
    NAME,
    ARRAY_START,
    ARRAY_END,
    DICT_START,
    DICT_END,
    KEYWORD;

    /**
     * Returns whether this type is one of the two string forms.
     *
     * @return true for literal and hex strings
     */
    public boolean isString() {
        return this == LITERAL_STRING || this == HEX_STRING;
    }

}
