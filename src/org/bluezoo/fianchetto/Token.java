/*
 * Token.java
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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A lexical token produced by the {@link Lexer}.
 * <p>
 * Tokens are immutable. Each carries its type, the byte span it was read
 * from and the payload relevant to its type:
 * <ul>
 * <li>{@link TokenType#NUMBER}: an {@link Integer}, {@link Long} or
 * {@link Double} value</li>
 * <li>{@link TokenType#LITERAL_STRING}: the unescaped bytes</li>
 * <li>{@link TokenType#HEX_STRING}: the decoded bytes, plus the number of
 * hex digits that were present in the source</li>
 * <li>{@link TokenType#NAME}: the name without its solidus</li>
 * <li>{@link TokenType#KEYWORD}: the keyword text</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Token {

    private static final byte[] EMPTY = new byte[0];

    private final TokenType type;
    private final int start;
    private final int end;
    private final Number number;
    private final byte[] bytes;
    private final String text;
    private final int hexDigitCount;

    private Token(TokenType type, int start, int end, Number number,
                  byte[] bytes, String text, int hexDigitCount) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.number = number;
        this.bytes = bytes;
        this.text = text;
        this.hexDigitCount = hexDigitCount;
    }

    static Token number(Number value, int start, int end) {
        return new Token(TokenType.NUMBER, start, end, value, EMPTY, null, 0);
    }

    static Token literalString(byte[] bytes, int start, int end) {
        return new Token(TokenType.LITERAL_STRING, start, end, null, bytes, null, 0);
    }

    static Token hexString(byte[] bytes, int hexDigitCount, int start, int end) {
        return new Token(TokenType.HEX_STRING, start, end, null, bytes, null, hexDigitCount);
    }

    static Token name(String value, int start, int end) {
        return new Token(TokenType.NAME, start, end, null, EMPTY, value, 0);
    }

    static Token keyword(String value, int start, int end) {
        return new Token(TokenType.KEYWORD, start, end, null, EMPTY, value, 0);
    }

    static Token delimiter(TokenType type, int start, int end) {
        return new Token(type, start, end, null, EMPTY, null, 0);
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Returns the offset of the first byte of this token in the lexer's input.
     *
     * @return the start offset
     */
    public int getStart() {
        return start;
    }

    /**
     * Returns the offset just past the last byte of this token.
     *
     * @return the end offset
     */
    public int getEnd() {
        return end;
    }

    /**
     * Returns the numeric value of a NUMBER token.
     *
     * @return the number, or null if this is not a number token
     */
    public Number getNumber() {
        return number;
    }

    /**
     * Returns the numeric value of a NUMBER token as a double.
     *
     * @return the value, or 0 if this is not a number token
     */
    public double doubleValue() {
        return (number != null) ? number.doubleValue() : 0.0;
    }

    /**
     * Returns a copy of the string bytes of a string token.
     *
     * @return the bytes, empty for tokens that are not strings
     */
    public byte[] getBytes() {
        return (bytes.length == 0) ? EMPTY : Arrays.copyOf(bytes, bytes.length);
    }

    int length() {
        return bytes.length;
    }

    int byteAt(int index) {
        return bytes[index] & 0xFF;
    }

    /**
     * Returns the string bytes as ISO-8859-1 characters, one char per byte.
     * This is the representation used for string values inside parsed
     * dictionaries.
     *
     * @return the string value, or null if this is not a string token
     */
    public String getString() {
        if (!type.isString()) {
            return null;
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /**
     * Returns the number of hex digits of a HEX_STRING token as they
     * appeared in the source, whitespace excluded.
     *
     * @return the digit count, or 0 for other token types
     */
    public int getHexDigitCount() {
        return hexDigitCount;
    }

    /**
     * Returns the value of a NAME or KEYWORD token.
     *
     * @return the text, or null for other token types
     */
    public String getText() {
        return text;
    }

    /**
     * Tests whether this token is the given keyword.
     *
     * @param keyword the keyword to compare
     * @return true if this is a KEYWORD token with that text
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && keyword.equals(text);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return String.valueOf(number);
            case LITERAL_STRING:
                return "(" + getString() + ")";
            case HEX_STRING:
                return "<" + getString() + ">";
            case NAME:
                return "/" + text;
            case ARRAY_START:
                return "[";
            case ARRAY_END:
                return "]";
            case DICT_START:
                return "<<";
            case DICT_END:
                return ">>";
            default:
                return text;
        }
    }

}
