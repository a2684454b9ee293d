/*
 * CMapParserTest.java
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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class CMapParserTest {

    private static final String PREAMBLE =
        "/CIDInit /ProcSet findresource begin\n"
        + "12 dict begin\n"
        + "begincmap\n"
        + "/CIDSystemInfo << /Registry (Adobe) /Ordering (UCS) /Supplement 0 >> def\n"
        + "/CMapName /Adobe-Identity-UCS def\n"
        + "/CMapType 2 def\n";

    private static final String POSTAMBLE =
        "endcmap\n"
        + "CMapName currentdict /CMap defineresource pop\n"
        + "end\n"
        + "end\n";

    private static ToUnicodeMap parse(String body) {
        return ToUnicodeMap.parse(TestPDFBuilder.ascii(PREAMBLE + body + POSTAMBLE));
    }

    @Test
    public void testBfchar() {
        ToUnicodeMap map = parse("1 begincodespacerange\n<00> <FF>\nendcodespacerange\n"
                                 + "2 beginbfchar\n<01> <0048>\n<02> <0069>\nendbfchar\n");
        assertEquals(2, map.size());
        assertEquals("H", map.get(1));
        assertEquals("i", map.get(2));
        assertNull(map.get(3));
        assertEquals(1, map.getMaxCodeLength());
    }

    @Test
    public void testBfrange() {
        ToUnicodeMap map = parse("1 begincodespacerange\n<0000> <FFFF>\nendcodespacerange\n"
                                 + "1 beginbfrange\n<0003> <0005> <0041>\nendbfrange\n");
        assertEquals(3, map.size());
        assertEquals("A", map.get(3));
        assertEquals("B", map.get(4));
        assertEquals("C", map.get(5));
        assertEquals(2, map.getMaxCodeLength());
    }

    @Test
    public void testBfrangeIncrementsLastCharacter() {
        ToUnicodeMap map = parse("1 beginbfrange\n<10> <11> <00660066>\nendbfrange\n");
        assertEquals("ff", map.get(0x10));
        assertEquals("fg", map.get(0x11));
    }

    @Test
    public void testBfrangeArray() {
        ToUnicodeMap map = parse("1 beginbfrange\n<0010> <0012> [<0066006C> <0066> <00660069>]\nendbfrange\n");
        assertEquals("fl", map.get(0x10));
        assertEquals("f", map.get(0x11));
        assertEquals("fi", map.get(0x12));
    }

    @Test
    public void testLaterMappingOverridesEarlier() {
        ToUnicodeMap map = parse("1 beginbfrange\n<20> <22> <0061>\nendbfrange\n"
                                 + "1 beginbfchar\n<21> <005A>\nendbfchar\n");
        assertEquals("a", map.get(0x20));
        assertEquals("Z", map.get(0x21));
        assertEquals("c", map.get(0x22));
    }

    @Test
    public void testSurrogatePairDestination() {
        ToUnicodeMap map = parse("1 beginbfchar\n<0001> <D83DDE00>\nendbfchar\n");
        assertEquals("😀", map.get(1));
    }

    @Test
    public void testInvalidRangesIgnored() {
        ToUnicodeMap map = parse("2 beginbfrange\n<05> <03> <0041>\n<00010000> <00010002> <0041>\nendbfrange\n"
                                 + "1 beginbfchar\n<01> <0041>\nendbfchar\n");
        assertEquals(1, map.size());
        assertEquals("A", map.get(1));
    }

    @Test
    public void testMalformedEntryDiscarded() {
        ToUnicodeMap map = parse("2 beginbfchar\n<01> 65\n<02> <0042>\nendbfchar\n");
        assertNull(map.get(1));
        assertEquals("B", map.get(2));
    }

    @Test
    public void testEmptyCMap() {
        assertTrue(parse("").isEmpty());
        assertTrue(ToUnicodeMap.parse(new byte[0]).isEmpty());
    }

    @Test
    public void testHandlerEvents() {
        final List<String> events = new ArrayList<>();
        CMapParser parser = new CMapParser(new CMapHandler() {
            @Override
            public void codeSpaceRange(long low, long high, int codeLength) {
                events.add("codespace " + low + " " + high + " " + codeLength);
            }

            @Override
            public void bfchar(long code, String unicode) {
                events.add("char " + code + " " + unicode);
            }

            @Override
            public void bfrange(long low, long high, String start) {
                events.add("range " + low + " " + high + " " + start);
            }

            @Override
            public void bfrange(long low, long high, List<String> destinations) {
                events.add("array " + low + " " + high + " " + destinations);
            }
        });
        parser.parse(TestPDFBuilder.ascii("begincodespacerange <0000> <FFFF> endcodespacerange\n"
                                          + "beginbfchar <0041> <0061> endbfchar\n"
                                          + "beginbfrange <0001> <0002> <0030> <0003> <0004> [<0078> <0079>] endbfrange"));
        assertEquals(Arrays.asList("codespace 0 65535 2",
                                   "char 65 a",
                                   "range 1 2 0",
                                   "array 3 4 [x, y]"),
                     events);
    }

}
