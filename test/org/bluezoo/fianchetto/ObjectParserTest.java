/*
 * ObjectParserTest.java
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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

public class ObjectParserTest {

    private static Object parse(String s) {
        return ObjectParser.parse(new Lexer(TestPDFBuilder.ascii(s)));
    }

    @Test
    public void testScalars() {
        assertEquals(Integer.valueOf(12), parse("12"));
        assertEquals(Double.valueOf(-1.5), parse("-1.5"));
        assertEquals(Boolean.TRUE, parse("true"));
        assertEquals(new Name("Type"), parse("/Type"));
        assertEquals("text", parse("(text)"));
    }

    @Test
    public void testReference() {
        assertEquals(new ObjectId(12, 0), parse("12 0 R"));
        assertEquals(Arrays.asList(new ObjectId(7, 2)), parse("[7 2 R]"));
    }

    @Test
    public void testNumbersThatAreNotReferences() {
        assertEquals(Arrays.<Object>asList(1, 2, new ObjectId(3, 0), -1, 0), parse("[1 2 3 0 R -1 0]"));
    }

    @Test
    public void testNestedContainers() {
        Map<?, ?> dict = (Map<?, ?>) parse("<< /Type /Page /MediaBox [0 0 612 792]"
                                           + " /Resources << /Font << /F1 5 0 R >> >> /Rotate 90 >>");
        assertEquals(new Name("Page"), dict.get(Name.TYPE));
        assertEquals(Arrays.asList(0, 0, 612, 792), dict.get(Name.MEDIA_BOX));
        Map<?, ?> resources = (Map<?, ?>) dict.get(Name.RESOURCES);
        Map<?, ?> fonts = (Map<?, ?>) resources.get(Name.FONT);
        assertEquals(new ObjectId(5), fonts.get(new Name("F1")));
        assertEquals(Integer.valueOf(90), dict.get(Name.ROTATE));
    }

    @Test
    public void testDictionaryIsUnmodifiable() {
        Map<?, ?> dict = (Map<?, ?>) parse("<< /A 1 >>");
        try {
            dict.clear();
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testStrayTokensBeforeKeyIgnored() {
        Map<?, ?> dict = (Map<?, ?>) parse("<< 5 /Length 10 (junk) /Filter /FlateDecode >>");
        assertEquals(Integer.valueOf(10), dict.get(Name.LENGTH));
        assertEquals(new Name("FlateDecode"), dict.get(Name.FILTER));
        assertEquals(2, dict.size());
    }

    @Test
    public void testUnterminatedArray() {
        try {
            parse("[1 2");
            fail("Expected PDFParseException");
        } catch (PDFParseException e) {
            assertTrue(e.getMessage().contains("array"));
        }
    }

    @Test(expected = PDFParseException.class)
    public void testOperatorInDictionary() {
        parse("<< /Length endstream >>");
    }

    @Test(expected = PDFParseException.class)
    public void testEmptyInput() {
        parse("");
    }

}
