/*
 * TextLayoutTest.java
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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class TextLayoutTest {

    private static final PageDescriptor PAGE = new PageDescriptor(
        0, 4, new double[] { 0, 0, 612, 792 }, null, 0, ResourceMap.EMPTY,
        Collections.<Integer>emptyList());

    private static ExtractedText run(String text, double x, double y) {
        return new ExtractedText(text, x, y, "Helvetica", 12, new Name("F1"), 3);
    }

    @Test
    public void testGroupLines() {
        List<ExtractedText> runs = Arrays.asList(
            run("b", 200, 100.5),
            run("c", 72, 300),
            run("a", 72, 100),
            run("d", 300, 101.9));
        List<List<ExtractedText>> lines = TextLayout.groupLines(runs, 2.0);
        assertEquals(2, lines.size());
        assertEquals(3, lines.get(0).size());
        assertEquals("a", lines.get(0).get(0).getText());
        assertEquals("b", lines.get(0).get(1).getText());
        assertEquals("d", lines.get(0).get(2).getText());
        assertEquals("c", lines.get(1).get(0).getText());
    }

    @Test
    public void testLineToleranceIsInclusive() {
        List<List<ExtractedText>> lines = TextLayout.groupLines(
            Arrays.asList(run("a", 0, 100), run("b", 10, 102), run("c", 20, 104)), 2.0);
        // Compared with the first run of each line
        assertEquals(2, lines.size());
        assertEquals(2, lines.get(0).size());
    }

    @Test
    public void testBlocksLinesAndWords() {
        List<ExtractedText> runs = new ArrayList<>();
        runs.add(run("Hello world", 72, 100));
        runs.add(run("again", 150, 101));
        runs.add(run("Second line", 72, 114));
        runs.add(run("New block", 72, 200));
        TextLayout layout = TextLayout.build(PAGE, runs, 2.0);

        assertEquals(0, layout.getPageIndex());
        assertEquals(612.0, layout.getPageWidth(), 0.0);
        assertEquals(792.0, layout.getPageHeight(), 0.0);
        assertEquals(2, layout.getBlocks().size());
        assertEquals(3, layout.getLines().size());

        TextBlock first = layout.getBlocks().get(0);
        assertEquals("Hello world again\nSecond line", first.getText());
        assertEquals(72.0, first.getX(), 1e-9);
        assertEquals(100.0, first.getY(), 1e-9);
        assertEquals(108.0, first.getWidth(), 1e-9);
        assertEquals(26.0, first.getHeight(), 1e-9);

        TextLine line = first.getLines().get(0);
        assertEquals(3, line.getWords().size());
        TextWord hello = line.getWords().get(0);
        TextWord world = line.getWords().get(1);
        assertEquals("Hello", hello.getText());
        assertEquals(30.0, hello.getWidth(), 1e-9);
        assertEquals(12.0, hello.getHeight(), 1e-9);
        assertEquals("world", world.getText());
        assertEquals(105.0, world.getX(), 1e-9);
        assertEquals("Helvetica", world.getFontName());

        assertEquals("New block", layout.getBlocks().get(1).getText());
    }

    @Test
    public void testWhitespaceOnlyRun() {
        TextLayout layout = TextLayout.build(PAGE, Arrays.asList(run("   ", 72, 100)), 2.0);
        assertTrue(layout.getBlocks().isEmpty());
    }

    @Test
    public void testEmptyPage() {
        TextLayout layout = TextLayout.build(PAGE, Collections.<ExtractedText>emptyList(), 2.0);
        assertTrue(layout.getBlocks().isEmpty());
        assertTrue(layout.getLines().isEmpty());
    }

    @Test
    public void testHTML() {
        List<ExtractedText> runs = new ArrayList<>();
        runs.add(run("x<y & z", 72, 100));
        runs.add(new ExtractedText("quoted", 72, 120, "O'Font", 10, new Name("F2"), 4));
        String html = TextLayout.build(PAGE, runs, 2.0).toHTML();

        assertTrue(html.startsWith("<div class=\"page\" data-page=\"0\">\n"));
        assertTrue(html.endsWith("</div>"));
        assertTrue(html.contains("<p style=\"position:absolute;top:100.0px;left:72.0px;\">"
                                 + "<span style=\"font-size:12.0px;font-family:'Helvetica';\">x&lt;y</span> "
                                 + "<span style=\"font-size:12.0px;font-family:'Helvetica';\">&amp;</span> "));
        assertTrue(html.contains("font-family:'O&#39;Font';\">quoted</span></p>"));
    }

    @Test
    public void testEmptyHTML() {
        assertEquals("<div></div>",
                     TextLayout.build(PAGE, Collections.<ExtractedText>emptyList(), 2.0).toHTML());
    }

    @Test
    public void testJSON() throws Exception {
        List<ExtractedText> runs = new ArrayList<>();
        runs.add(run("Hello world", 72, 100));
        runs.add(new ExtractedText("Anonymous", 72, 300, "", 10, new Name("F2"), 4));
        JsonNode root = new ObjectMapper().readTree(TextLayout.build(PAGE, runs, 2.0).toJSON());

        assertEquals(0, root.get("page_index").asInt());
        assertEquals(612.0, root.get("width").asDouble(), 0.0);
        assertEquals(792.0, root.get("height").asDouble(), 0.0);
        assertEquals(2, root.get("blocks").size());

        JsonNode line = root.get("blocks").get(0).get("lines").get(0);
        assertEquals(100.0, line.get("y").asDouble(), 1e-9);
        assertEquals("Hello world", line.get("text").asText());
        JsonNode world = line.get("words").get(1);
        assertEquals("world", world.get("text").asText());
        assertEquals(105.0, world.get("x").asDouble(), 1e-9);
        assertEquals("Helvetica", world.get("font_name").asText());
        assertEquals(12.0, world.get("font_size").asDouble(), 0.0);

        JsonNode anonymous = root.get("blocks").get(1).get("lines").get(0).get("words").get(0);
        assertFalse(anonymous.has("font_name"));
    }

}
