/*
 * CMapParser.java
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
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses CMap streams (e.g. ToUnicode) and dispatches events to a
 * {@link CMapHandler}.
 * <p>
 * Supports begincodespacerange/endcodespacerange, beginbfchar/endbfchar,
 * and beginbfrange/endbfrange (both single-destination and array form).
 * Sections may occur any number of times. Everything else in the stream,
 * such as the PostScript resource boilerplate around the mappings, is
 * ignored, as is any entry that is not made of hex strings.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CMapParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(CMapParser.class);

    private static final int NONE = 0;
    private static final int CODESPACERANGE = 1;
    private static final int BFCHAR = 2;
    private static final int BFRANGE = 3;

    private final CMapHandler handler;

    private int section;
    private final List<Token> entry = new ArrayList<>(3);

    public CMapParser(CMapHandler handler) {
        this.handler = handler;
    }

    /**
     * Parses a complete CMap.
     *
     * @param data the decoded CMap stream
     */
    public void parse(byte[] data) {
        section = NONE;
        entry.clear();
        Lexer lexer = new Lexer(data);
        Token token;
        while ((token = lexer.next()) != null) {
            switch (token.getType()) {
                case KEYWORD:
                    keyword(token.getText());
                    break;
                case HEX_STRING:
                    if (section != NONE) {
                        hexString(token);
                    }
                    break;
                case ARRAY_START:
                    if (section == BFRANGE && entry.size() == 2) {
                        bfrangeArray(lexer);
                    }
                    break;
                default:
                    if (section != NONE && !entry.isEmpty()) {
                        LOGGER.debug("Discarding malformed CMap entry at offset {}", token.getStart());
                        entry.clear();
                    }
                    break;
            }
        }
    }

    private void keyword(String keyword) {
        switch (keyword) {
            case "begincodespacerange":
                section = CODESPACERANGE;
                break;
            case "beginbfchar":
                section = BFCHAR;
                break;
            case "beginbfrange":
                section = BFRANGE;
                break;
            case "endcodespacerange":
            case "endbfchar":
            case "endbfrange":
                section = NONE;
                break;
            default:
                break;
        }
        entry.clear();
    }

    private void hexString(Token token) {
        entry.add(token);
        switch (section) {
            case CODESPACERANGE:
                if (entry.size() == 2) {
                    Token low = entry.get(0);
                    handler.codeSpaceRange(code(low), code(entry.get(1)), low.length());
                    entry.clear();
                }
                break;
            case BFCHAR:
                if (entry.size() == 2) {
                    handler.bfchar(code(entry.get(0)), unicode(entry.get(1)));
                    entry.clear();
                }
                break;
            case BFRANGE:
                if (entry.size() == 3) {
                    handler.bfrange(code(entry.get(0)), code(entry.get(1)), unicode(entry.get(2)));
                    entry.clear();
                }
                break;
            default:
                entry.clear();
                break;
        }
    }

    private void bfrangeArray(Lexer lexer) {
        List<String> destinations = new ArrayList<>();
        Token token;
        while ((token = lexer.next()) != null && token.getType() != TokenType.ARRAY_END) {
            if (token.getType() == TokenType.HEX_STRING) {
                destinations.add(unicode(token));
            }
        }
        handler.bfrange(code(entry.get(0)), code(entry.get(1)), destinations);
        entry.clear();
    }

    /**
     * Returns the big-endian value of a hex string's bytes. Codes longer
     * than 4 bytes keep their last 4 bytes.
     */
    static long code(Token token) {
        long value = 0;
        for (int i = 0; i < token.length(); i++) {
            value = ((value << 8) | token.byteAt(i)) & 0xFFFFFFFFL;
        }
        return value;
    }

    static String unicode(Token token) {
        return new String(token.getBytes(), StandardCharsets.UTF_16BE);
    }

}
