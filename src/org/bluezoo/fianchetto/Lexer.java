/*
 * Lexer.java
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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Tokenizer for PDF object syntax and content-stream syntax.
 * <p>
 * The lexer reads from a {@link ByteBuffer} using absolute gets, so the
 * buffer's own position is never modified and several lexers may share
 * one buffer. Offsets reported by {@link #getPosition()} and by
 * {@link Token#getStart()} are absolute indices into the buffer.
 * <p>
 * The lexer never fails and never reads past the buffer's limit. Strings
 * and hex strings that are not terminated before the end of input are
 * truncated to the bytes available. Stray closing delimiters are returned
 * as single-character keywords so that callers can skip them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Lexer {

    private final ByteBuffer data;
    private final int limit;
    private int pos;

    /**
     * Creates a lexer over the remaining bytes of a buffer.
     *
     * @param data the input buffer
     */
    public Lexer(ByteBuffer data) {
        this.data = data;
        this.limit = data.limit();
        this.pos = data.position();
    }

    /**
     * Creates a lexer over a byte array.
     *
     * @param data the input bytes
     */
    public Lexer(byte[] data) {
        this(ByteBuffer.wrap(data));
    }

    /**
     * Returns the offset of the next byte to be read.
     *
     * @return the current offset
     */
    public int getPosition() {
        return pos;
    }

    /**
     * Sets the offset of the next byte to be read.
     *
     * @param position the new offset, clamped to the input bounds
     */
    public void setPosition(int position) {
        this.pos = Math.max(0, Math.min(position, limit));
    }

    /**
     * Returns the limit of the input.
     *
     * @return the offset just past the last byte
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Returns the next token, or null at end of input.
     *
     * @return the next token or null
     */
    public Token next() {
        skipWhitespaceAndComments();
        if (pos >= limit) {
            return null;
        }
        int start = pos;
        int b = peek();
        switch (b) {
            case '(':
                return readLiteralString();
            case '<':
                if (peekAt(1) == '<') {
                    pos += 2;
                    return Token.delimiter(TokenType.DICT_START, start, pos);
                }
                return readHexString();
            case '>':
                if (peekAt(1) == '>') {
                    pos += 2;
                    return Token.delimiter(TokenType.DICT_END, start, pos);
                }
                pos++;
                return Token.keyword(">", start, pos);
            case '[':
                pos++;
                return Token.delimiter(TokenType.ARRAY_START, start, pos);
            case ']':
                pos++;
                return Token.delimiter(TokenType.ARRAY_END, start, pos);
            case '/':
                return readName();
            case ')':
            case '{':
            case '}':
                pos++;
                return Token.keyword(String.valueOf((char) b), start, pos);
            default:
                if (isNumberStart(b)) {
                    return readNumber();
                }
                return readKeyword();
        }
    }

    /**
     * Returns the next token without consuming it.
     *
     * @return the next token or null
     */
    public Token peekToken() {
        int saved = pos;
        Token token = next();
        pos = saved;
        return token;
    }

    // ========== Inline images ==========

    /**
     * Skips the binary data of an inline image. The lexer must be positioned
     * just after the {@code ID} keyword. On return it is positioned after the
     * terminating {@code EI}, or at the end of input if none was found.
     */
    public void skipInlineImageData() {
        // One whitespace byte separates ID from the data
        if (pos < limit && isWhitespace(peek())) {
            pos++;
        }
        int i = pos;
        while (i + 2 <= limit) {
            if ((i == pos || isWhitespace(byteAt(i - 1)))
                    && byteAt(i) == 'E' && byteAt(i + 1) == 'I'
                    && (i + 2 == limit || isWhitespace(byteAt(i + 2)) || isDelimiter(byteAt(i + 2)))) {
                pos = i + 2;
                return;
            }
            i++;
        }
        pos = limit;
    }

    // ========== Token readers ==========

    private Token readLiteralString() {
        int start = pos;
        pos++; // '('
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int depth = 1;
        while (pos < limit) {
            int b = byteAt(pos++);
            if (b == '(') {
                depth++;
                out.write(b);
            } else if (b == ')') {
                depth--;
                if (depth == 0) {
                    break;
                }
                out.write(b);
            } else if (b == '\\') {
                if (pos >= limit) {
                    break;
                }
                int escaped = byteAt(pos++);
                switch (escaped) {
                    case 'n': out.write('\n'); break;
                    case 'r': out.write('\r'); break;
                    case 't': out.write('\t'); break;
                    case 'b': out.write('\b'); break;
                    case 'f': out.write('\f'); break;
                    case '(': out.write('('); break;
                    case ')': out.write(')'); break;
                    case '\\': out.write('\\'); break;
                    case '\r':
                        // Line continuation
                        if (pos < limit && byteAt(pos) == '\n') {
                            pos++;
                        }
                        break;
                    case '\n':
                        break;
                    default:
                        if (escaped >= '0' && escaped <= '7') {
                            int octal = escaped - '0';
                            for (int i = 0; i < 2 && pos < limit; i++) {
                                int next = byteAt(pos);
                                if (next < '0' || next > '7') {
                                    break;
                                }
                                octal = (octal << 3) | (next - '0');
                                pos++;
                            }
                            out.write(octal & 0xFF);
                        } else {
                            // Unknown escape: the backslash is ignored
                            out.write(escaped);
                        }
                }
            } else {
                out.write(b);
            }
        }
        return Token.literalString(out.toByteArray(), start, pos);
    }

    private Token readHexString() {
        int start = pos;
        pos++; // '<'
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int digits = 0;
        int high = -1;
        while (pos < limit) {
            int b = byteAt(pos++);
            if (b == '>') {
                break;
            }
            int value = hexValue(b);
            if (value < 0) {
                continue; // whitespace and garbage
            }
            digits++;
            if (high < 0) {
                high = value;
            } else {
                out.write((high << 4) | value);
                high = -1;
            }
        }
        if (high >= 0) {
            out.write(high << 4);
        }
        return Token.hexString(out.toByteArray(), digits, start, pos);
    }

    private Token readName() {
        int start = pos;
        pos++; // '/'
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b) || isDelimiter(b)) {
                break;
            }
            pos++;
        }
        return Token.name(latin1(start + 1, pos), start, pos);
    }

    private Token readNumber() {
        int start = pos;
        if (peek() == '+' || peek() == '-') {
            pos++;
        }
        boolean real = false;
        while (pos < limit) {
            int b = byteAt(pos);
            if (b >= '0' && b <= '9') {
                pos++;
            } else if (b == '.' && !real) {
                real = true;
                pos++;
            } else {
                break;
            }
        }
        String str = latin1(start, pos);
        return Token.number(parseNumber(str, real), start, pos);
    }

    private Token readKeyword() {
        int start = pos;
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b) || isDelimiter(b)) {
                break;
            }
            pos++;
        }
        return Token.keyword(latin1(start, pos), start, pos);
    }

    static Number parseNumber(String str, boolean real) {
        if (str.isEmpty() || str.equals("-") || str.equals("+") || str.equals(".")
                || str.equals("-.") || str.equals("+.")) {
            return 0;
        }
        try {
            if (real) {
                return Double.parseDouble(str);
            }
            long value = Long.parseLong(str);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException e) {
            // Integer too large for a long
            return Double.parseDouble(str);
        }
    }

    // ========== Byte access ==========

    private void skipWhitespaceAndComments() {
        while (pos < limit) {
            int b = byteAt(pos);
            if (isWhitespace(b)) {
                pos++;
            } else if (b == '%') {
                while (pos < limit) {
                    int c = byteAt(pos++);
                    if (c == '\r' || c == '\n') {
                        break;
                    }
                }
            } else {
                break;
            }
        }
    }

    private int peek() {
        return (pos < limit) ? byteAt(pos) : -1;
    }

    private int peekAt(int offset) {
        int p = pos + offset;
        return (p < limit) ? byteAt(p) : -1;
    }

    private int byteAt(int index) {
        return data.get(index) & 0xFF;
    }

    private String latin1(int from, int to) {
        char[] chars = new char[to - from];
        for (int i = from; i < to; i++) {
            chars[i - from] = (char) byteAt(i);
        }
        return new String(chars);
    }

    // ========== Character classes ==========

    /**
     * Checks if a byte is PDF whitespace.
     *
     * @param b the byte value
     * @return true for NUL, TAB, LF, FF, CR and SPACE
     */
    public static boolean isWhitespace(int b) {
        return b == 0 || b == 9 || b == 10 || b == 12 || b == 13 || b == 32;
    }

    /**
     * Checks if a byte is a PDF delimiter.
     *
     * @param b the byte value
     * @return true for the ten delimiter characters
     */
    public static boolean isDelimiter(int b) {
        return b == '(' || b == ')' || b == '<' || b == '>' ||
               b == '[' || b == ']' || b == '{' || b == '}' ||
               b == '/' || b == '%';
    }

    private static boolean isNumberStart(int b) {
        return (b >= '0' && b <= '9') || b == '+' || b == '-' || b == '.';
    }

    static int hexValue(int c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        return -1;
    }

}
