/*
 * ObjectParser.java
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
 * Parses PDF object syntax from a {@link Lexer} and reports values to a
 * {@link PDFHandler}.
 * <p>
 * Each call to {@link #parseValue()} reads exactly one value: a scalar,
 * an indirect reference ({@code n g R}), or a complete array or dictionary
 * with all of its nested values. The lexer is left positioned just after
 * the value, so callers can continue with whatever follows it, for example
 * the {@code stream} keyword.
 * <p>
 * Dictionaries are read leniently: a key without a value before
 * {@code >>} is dropped and a non-name token in key position is skipped.
 * Anything that cannot be read as a value raises a
 * {@link PDFParseException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectParser {

    private static final int MAX_NESTING = 256;

    private final Lexer lexer;
    private final PDFHandler handler;
    private int depth;

    /**
     * Creates a new object parser.
     *
     * @param lexer the token source
     * @param handler the handler to receive value events
     */
    public ObjectParser(Lexer lexer, PDFHandler handler) {
        this.lexer = lexer;
        this.handler = handler;
    }

    /**
     * Parses a single value from the given lexer and returns it.
     *
     * @param lexer the token source
     * @return the value, which may be null for the {@code null} keyword
     * @throws PDFParseException if no value can be read
     */
    public static Object parse(Lexer lexer) {
        ValueBuilder builder = new ValueBuilder();
        new ObjectParser(lexer, builder).parseValue();
        return builder.getResult();
    }

    /**
     * Reads the next value and reports it to the handler.
     *
     * @throws PDFParseException if the input does not start with a value
     */
    public void parseValue() {
        Token token = lexer.next();
        if (token == null) {
            throw new PDFParseException("Unexpected end of input", lexer.getPosition());
        }
        parseValue(token);
    }

    private void parseValue(Token token) {
        switch (token.getType()) {
            case NUMBER:
                parseNumberOrReference(token);
                break;
            case LITERAL_STRING:
            case HEX_STRING:
                handler.stringValue(token.getString());
                break;
            case NAME:
                handler.nameValue(new Name(token.getText()));
                break;
            case ARRAY_START:
                parseArray();
                break;
            case DICT_START:
                parseDictionary();
                break;
            case KEYWORD:
                parseKeyword(token);
                break;
            default:
                throw new PDFParseException("Unexpected token " + token, token.getStart());
        }
    }

    private void parseKeyword(Token token) {
        String keyword = token.getText();
        if ("true".equals(keyword)) {
            handler.booleanValue(true);
        } else if ("false".equals(keyword)) {
            handler.booleanValue(false);
        } else if ("null".equals(keyword)) {
            handler.nullValue();
        } else {
            throw new PDFParseException("Unexpected keyword '" + keyword + "'", token.getStart());
        }
    }

    /**
     * Parses a number, or an indirect reference if the number is followed
     * by a second non-negative integer and the keyword {@code R}.
     */
    private void parseNumberOrReference(Token first) {
        Number num1 = first.getNumber();
        if (isNonNegativeInteger(num1)) {
            int saved = lexer.getPosition();
            Token second = lexer.next();
            if (second != null && second.getType() == TokenType.NUMBER
                    && isNonNegativeInteger(second.getNumber())) {
                Token third = lexer.next();
                if (third != null && third.isKeyword("R")) {
                    handler.objectReference(new ObjectId(num1.intValue(),
                                                         second.getNumber().intValue()));
                    return;
                }
            }
            // Not a reference, restore position
            lexer.setPosition(saved);
        }
        handler.numberValue(num1);
    }

    private void parseArray() {
        enter();
        handler.startArray();
        while (true) {
            Token token = lexer.next();
            if (token == null) {
                throw new PDFParseException("Unterminated array", lexer.getPosition());
            }
            if (token.getType() == TokenType.ARRAY_END) {
                break;
            }
            parseValue(token);
        }
        handler.endArray();
        depth--;
    }

    private void parseDictionary() {
        enter();
        handler.startDictionary();
        Name pendingKey = null;
        while (true) {
            Token token = lexer.next();
            if (token == null) {
                throw new PDFParseException("Unterminated dictionary", lexer.getPosition());
            }
            if (token.getType() == TokenType.DICT_END) {
                break;
            }
            if (pendingKey == null) {
                if (token.getType() == TokenType.NAME) {
                    pendingKey = new Name(token.getText());
                }
                continue;
            }
            if (token.getType() == TokenType.KEYWORD && !isValueKeyword(token)) {
                throw new PDFParseException("Unexpected keyword '" + token.getText()
                                            + "' in dictionary", token.getStart());
            }
            handler.key(pendingKey);
            parseValue(token);
            pendingKey = null;
        }
        handler.endDictionary();
        depth--;
    }

    private void enter() {
        if (++depth > MAX_NESTING) {
            throw new PDFParseException("Nesting too deep", lexer.getPosition());
        }
    }

    private static boolean isValueKeyword(Token token) {
        return token.isKeyword("true") || token.isKeyword("false") || token.isKeyword("null");
    }

    private static boolean isNonNegativeInteger(Number n) {
        return (n instanceof Integer) && n.intValue() >= 0;
    }

}
