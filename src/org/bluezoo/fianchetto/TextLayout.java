/*
 * TextLayout.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The text of a page arranged into blocks, lines and words by position.
 * <p>
 * Runs whose baselines are within the line tolerance of a line's first run
 * form that line. Lines are ordered top to bottom and their runs left to
 * right. A block ends where the gap to the next line is more than twice the
 * height of the line above it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextLayout {

    static final double CHARACTER_WIDTH = 0.5;
    static final double WORD_SPACING = 0.25;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final int pageIndex;
    private final double pageWidth;
    private final double pageHeight;
    private final List<TextBlock> blocks;

    TextLayout(int pageIndex, double pageWidth, double pageHeight, List<TextBlock> blocks) {
        this.pageIndex = pageIndex;
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.blocks = Collections.unmodifiableList(blocks);
    }

    /**
     * Lays out the text runs of a page.
     *
     * @param page the page
     * @param runs the page's text in event order
     * @param tolerance the line tolerance
     * @return the layout
     */
    static TextLayout build(PageDescriptor page, List<ExtractedText> runs, double tolerance) {
        List<TextLine> lines = buildLines(runs, tolerance);
        List<TextBlock> blocks = new ArrayList<>();
        List<TextLine> current = new ArrayList<>();
        TextLine previous = null;
        for (TextLine line : lines) {
            if (line.getWords().isEmpty()) {
                continue;
            }
            if (previous != null && Math.abs(line.getY() - previous.getY()) > previous.getHeight() * 2) {
                blocks.add(createBlock(current));
                current = new ArrayList<>();
            }
            current.add(line);
            previous = line;
        }
        if (!current.isEmpty()) {
            blocks.add(createBlock(current));
        }
        return new TextLayout(page.getIndex(), page.getWidth(), page.getHeight(), blocks);
    }

    /**
     * Groups runs into lines, each sorted left to right, the lines sorted
     * top to bottom.
     */
    static List<List<ExtractedText>> groupLines(List<ExtractedText> runs, double tolerance) {
        List<List<ExtractedText>> groups = new ArrayList<>();
        for (ExtractedText run : runs) {
            List<ExtractedText> group = null;
            for (List<ExtractedText> candidate : groups) {
                if (Math.abs(candidate.get(0).getY() - run.getY()) <= tolerance) {
                    group = candidate;
                    break;
                }
            }
            if (group == null) {
                group = new ArrayList<>();
                groups.add(group);
            }
            group.add(run);
        }
        for (List<ExtractedText> group : groups) {
            group.sort(Comparator.comparingDouble(ExtractedText::getX));
        }
        groups.sort(Comparator.comparingDouble(group -> group.get(0).getY()));
        return groups;
    }

    private static List<TextLine> buildLines(List<ExtractedText> runs, double tolerance) {
        List<TextLine> lines = new ArrayList<>();
        for (List<ExtractedText> group : groupLines(runs, tolerance)) {
            List<TextWord> words = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            for (ExtractedText run : group) {
                double size = run.getFontSize();
                double x = run.getX();
                for (String part : run.getText().trim().split("\\s+")) {
                    if (part.isEmpty()) {
                        continue;
                    }
                    double width = size * part.length() * CHARACTER_WIDTH;
                    words.add(new TextWord(part, x, run.getY(), width, size, run.getFontName(), size));
                    x += width + size * WORD_SPACING;
                }
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(run.getText());
            }
            lines.add(new TextLine(group.get(0).getY(), words, text.toString()));
        }
        return lines;
    }

    private static TextBlock createBlock(List<TextLine> lines) {
        double minX = Double.MAX_VALUE;
        double maxX = 0;
        for (TextLine line : lines) {
            for (TextWord word : line.getWords()) {
                minX = Math.min(minX, word.getX());
                maxX = Math.max(maxX, word.getX() + word.getWidth());
            }
        }
        TextLine first = lines.get(0);
        TextLine last = lines.get(lines.size() - 1);
        double height = last.getY() - first.getY() + last.getHeight();
        return new TextBlock(minX, first.getY(), maxX - minX, height, lines);
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public double getPageWidth() {
        return pageWidth;
    }

    public double getPageHeight() {
        return pageHeight;
    }

    public List<TextBlock> getBlocks() {
        return blocks;
    }

    /**
     * Returns all lines of all blocks, in order.
     *
     * @return the lines
     */
    public List<TextLine> getLines() {
        List<TextLine> lines = new ArrayList<>();
        for (TextBlock block : blocks) {
            lines.addAll(block.getLines());
        }
        return lines;
    }

    // ========== Renderings ==========

    /**
     * Renders the lines as absolutely positioned HTML paragraphs, one span
     * per word.
     *
     * @return the HTML fragment
     */
    public String toHTML() {
        List<TextLine> lines = getLines();
        if (lines.isEmpty()) {
            return "<div></div>";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"page\" data-page=\"").append(pageIndex).append("\">\n");
        for (TextLine line : lines) {
            sb.append(String.format(Locale.ROOT, "  <p style=\"position:absolute;top:%.1fpx;left:%.1fpx;\">",
                                    line.getY(), line.getWords().get(0).getX()));
            boolean first = true;
            for (TextWord word : line.getWords()) {
                if (!first) {
                    sb.append(' ');
                }
                first = false;
                sb.append(String.format(Locale.ROOT, "<span style=\"font-size:%.1fpx;", word.getFontSize()));
                if (word.getFontName() != null && !word.getFontName().isEmpty()) {
                    sb.append("font-family:'").append(escapeAttribute(word.getFontName())).append("';");
                }
                sb.append("\">").append(escapeText(word.getText())).append("</span>");
            }
            sb.append("</p>\n");
        }
        sb.append("</div>");
        return sb.toString();
    }

    /**
     * Renders the page size and the block, line and word tree as indented
     * JSON. Words without a font name omit {@code font_name}.
     *
     * @return the JSON document
     */
    public String toJSON() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("page_index", pageIndex);
        root.put("width", pageWidth);
        root.put("height", pageHeight);
        ArrayNode blockArray = root.putArray("blocks");
        for (TextBlock block : blocks) {
            ObjectNode blockNode = blockArray.addObject();
            blockNode.put("x", block.getX());
            blockNode.put("y", block.getY());
            blockNode.put("width", block.getWidth());
            blockNode.put("height", block.getHeight());
            ArrayNode lineArray = blockNode.putArray("lines");
            for (TextLine line : block.getLines()) {
                ObjectNode lineNode = lineArray.addObject();
                lineNode.put("y", line.getY());
                lineNode.put("text", line.getText());
                ArrayNode wordArray = lineNode.putArray("words");
                for (TextWord word : line.getWords()) {
                    ObjectNode wordNode = wordArray.addObject();
                    wordNode.put("x", word.getX());
                    wordNode.put("y", word.getY());
                    wordNode.put("width", word.getWidth());
                    wordNode.put("height", word.getHeight());
                    wordNode.put("text", word.getText());
                    if (word.getFontName() != null && !word.getFontName().isEmpty()) {
                        wordNode.put("font_name", word.getFontName());
                    }
                    wordNode.put("font_size", word.getFontSize());
                }
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // A tree of plain nodes always serializes
            throw new IllegalStateException(e);
        }
    }

    private static String escapeText(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String escapeAttribute(String s) {
        return escapeText(s).replace("'", "&#39;").replace("\"", "&quot;");
    }

    @Override
    public String toString() {
        return "TextLayout[page " + pageIndex + " " + blocks.size() + " blocks]";
    }

}
