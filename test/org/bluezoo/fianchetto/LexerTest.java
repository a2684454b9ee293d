/*
 * LexerTest.java
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class LexerTest {

    private static List<Token> tokenize(String s) {
        Lexer lexer = new Lexer(TestPDFBuilder.ascii(s));
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = lexer.next()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    private static Token single(String s) {
        List<Token> tokens = tokenize(s);
        assertEquals("token count for " + s, 1, tokens.size());
        return tokens.get(0);
    }

    @Test
    public void testNumbers() {
        assertEquals(Integer.valueOf(42), single("42").getNumber());
        assertEquals(Integer.valueOf(-17), single("-17").getNumber());
        assertEquals(Integer.valueOf(7), single("+7").getNumber());
        assertEquals(3.25, single("3.25").doubleValue(), 0.0);
        assertEquals(0.5, single(".5").doubleValue(), 0.0);
        assertEquals(-0.002, single("-.002").doubleValue(), 0.0);
        assertEquals(Long.valueOf(4294967296L), single("4294967296").getNumber());
        assertEquals(0, single("-").getNumber().intValue());
    }

    @Test
    public void testLiteralStringEscapes() {
        Token token = single("(a\\nb\\(c\\)\\\\d\\101\\7)");
        assertEquals(TokenType.LITERAL_STRING, token.getType());
        assertEquals("a\nb(c)\\dA\u0007", token.getString());
    }

    @Test
    public void testLiteralStringNestedParentheses() {
        assertEquals("outer (inner) text", single("(outer (inner) text)").getString());
    }

    @Test
    public void testLiteralStringLineContinuation() {
        assertEquals("HelloWorld", single("(Hello\\\nWorld)").getString());
        assertEquals("HelloWorld", single("(Hello\\\r\nWorld)").getString());
    }

    @Test
    public void testUnterminatedLiteralStringIsTruncated() {
        Token token = single("(abc");
        assertEquals(TokenType.LITERAL_STRING, token.getType());
        assertEquals("abc", token.getString());
    }

    @Test
    public void testHexString() {
        Token token = single("<48 65 6C\n6C 6F>");
        assertEquals(TokenType.HEX_STRING, token.getType());
        assertEquals("Hello", token.getString());
        assertEquals(10, token.getHexDigitCount());
    }

    @Test
    public void testHexStringOddNibbleIsPadded() {
        Token token = single("<901FA>");
        assertArrayEquals(new byte[] { (byte) 0x90, 0x1F, (byte) 0xA0 }, token.getBytes());
        assertEquals(5, token.getHexDigitCount());
    }

    @Test
    public void testUnterminatedHexString() {
        Token token = single("<4142");
        assertEquals("AB", token.getString());
    }

    @Test
    public void testNamesPassThroughVerbatim() {
        Token token = single("/A#20B");
        assertEquals(TokenType.NAME, token.getType());
        assertEquals("A#20B", token.getText());
    }

    @Test
    public void testDictionaryDelimiters() {
        List<Token> tokens = tokenize("<</Type/Page/Kids[1 0 R]>>");
        assertEquals(TokenType.DICT_START, tokens.get(0).getType());
        assertEquals("Type", tokens.get(1).getText());
        assertEquals("Page", tokens.get(2).getText());
        assertEquals("Kids", tokens.get(3).getText());
        assertEquals(TokenType.ARRAY_START, tokens.get(4).getType());
        assertTrue(tokens.get(7).isKeyword("R"));
        assertEquals(TokenType.ARRAY_END, tokens.get(8).getType());
        assertEquals(TokenType.DICT_END, tokens.get(9).getType());
        assertEquals(10, tokens.size());
    }

    @Test
    public void testCommentsAreSkipped() {
        List<Token> tokens = tokenize("1 % comment (not a string\n2");
        assertEquals(2, tokens.size());
        assertEquals(Integer.valueOf(2), tokens.get(1).getNumber());
    }

    @Test
    public void testStrayDelimitersAreKeywords() {
        List<Token> tokens = tokenize(") } >");
        assertEquals(3, tokens.size());
        assertTrue(tokens.get(0).isKeyword(")"));
        assertTrue(tokens.get(1).isKeyword("}"));
        assertTrue(tokens.get(2).isKeyword(">"));
    }

    @Test
    public void testTokenOffsets() {
        List<Token> tokens = tokenize("  12 /Name");
        assertEquals(2, tokens.get(0).getStart());
        assertEquals(4, tokens.get(0).getEnd());
        assertEquals(5, tokens.get(1).getStart());
        assertEquals(10, tokens.get(1).getEnd());
    }

    @Test
    public void testPeekDoesNotConsume() {
        Lexer lexer = new Lexer(TestPDFBuilder.ascii("BT ET"));
        assertTrue(lexer.peekToken().isKeyword("BT"));
        assertTrue(lexer.next().isKeyword("BT"));
        assertTrue(lexer.next().isKeyword("ET"));
        assertNull(lexer.next());
    }

    @Test
    public void testSkipInlineImageData() {
        Lexer lexer = new Lexer(TestPDFBuilder.ascii("ID ÿEI(x)EIa EI Q"));
        assertTrue(lexer.next().isKeyword("ID"));
        lexer.skipInlineImageData();
        Token next = lexer.next();
        assertTrue(next.isKeyword("Q"));
    }

}
