/*
 * TextDecoder.java
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

/**
 * Decodes the string operands of text-showing operators to Unicode.
 * <p>
 * Hex strings are decoded through the font's code to Unicode map when it
 * has one, using two-byte codes for a CID font whose string has a multiple
 * of four hex digits and one-byte codes otherwise; an unmapped code stands
 * for itself. Without a map, a CID font's hex string is UTF-16BE and any
 * other hex string is Latin-1. Literal strings beginning with a UTF-16BE
 * byte order mark are UTF-16BE; otherwise they are mapped byte by byte
 * through the font's map, if any, or read as Latin-1.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextDecoder {

    private TextDecoder() {
    }

    /**
     * Decodes a string token.
     *
     * @param token a LITERAL_STRING or HEX_STRING token
     * @param font the font in effect, or null if unknown
     * @return the decoded text
     */
    public static String decode(Token token, FontInfo font) {
        ToUnicodeMap map = (font != null) ? font.getToUnicode() : null;
        boolean cid = font != null && font.isCID();
        if (token.getType() == TokenType.HEX_STRING) {
            int digits = token.getHexDigitCount();
            if (map != null) {
                return mapCodes(token, map, cid && digits % 4 == 0);
            }
            if (cid && digits % 4 == 0) {
                return new String(token.getBytes(), StandardCharsets.UTF_16BE);
            }
            return token.getString();
        }
        if (token.getType() != TokenType.LITERAL_STRING) {
            return "";
        }
        int length = token.length();
        if (length >= 2 && token.byteAt(0) == 0xFE && token.byteAt(1) == 0xFF) {
            byte[] bytes = token.getBytes();
            return new String(bytes, 2, length - 2, StandardCharsets.UTF_16BE);
        }
        if (map != null) {
            return mapCodes(token, map, false);
        }
        return token.getString();
    }

    private static String mapCodes(Token token, ToUnicodeMap map, boolean twoByte) {
        StringBuilder sb = new StringBuilder(token.length());
        int length = token.length();
        int step = twoByte ? 2 : 1;
        for (int i = 0; i + step <= length; i += step) {
            int code = twoByte ? (token.byteAt(i) << 8) | token.byteAt(i + 1) : token.byteAt(i);
            String text = map.get(code);
            if (text != null) {
                sb.append(text);
            } else if (code != 0 || !twoByte) {
                sb.append((char) code);
            }
        }
        return sb.toString();
    }

}
