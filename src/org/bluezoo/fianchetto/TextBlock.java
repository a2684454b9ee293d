/*
 * TextBlock.java
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

import java.util.Collections;
import java.util.List;

/**
 * A group of consecutive lines with no large vertical gap between them,
 * roughly a paragraph.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextBlock {

    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final List<TextLine> lines;

    TextBlock(double x, double y, double width, double height, List<TextLine> lines) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.lines = Collections.unmodifiableList(lines);
    }

    public double getX() {
        return x;
    }

    /**
     * Returns the baseline of the block's first line.
     *
     * @return the y coordinate
     */
    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public List<TextLine> getLines() {
        return lines;
    }

    /**
     * Returns the text of the block, one line per line.
     *
     * @return the block text
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (TextLine line : lines) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.getText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TextBlock[" + x + "," + y + " " + width + "x" + height + " " + lines.size() + " lines]";
    }

}
