/*
 * ExtractedText.java
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
 * A run of text shown on a page by one text-showing operator.
 * <p>
 * The position is the text origin of the run in page coordinates, with the
 * origin at the top left of the media box and y increasing downwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExtractedText {

    private final String text;
    private final double x;
    private final double y;
    private final String fontName;
    private final double fontSize;
    private final Name fontResourceName;
    private final int fontObjectNumber;

    ExtractedText(String text, double x, double y, String fontName, double fontSize,
                  Name fontResourceName, int fontObjectNumber) {
        this.text = text;
        this.x = x;
        this.y = y;
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.fontResourceName = fontResourceName;
        this.fontObjectNumber = fontObjectNumber;
    }

    public String getText() {
        return text;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * Returns the font's base name, or its resource name if the font has
     * no /BaseFont.
     *
     * @return the font name, empty if no font was selected
     */
    public String getFontName() {
        return fontName;
    }

    public double getFontSize() {
        return fontSize;
    }

    /**
     * Returns the name under which the page's resources define the font.
     *
     * @return the resource name, or null if no font was selected
     */
    public Name getFontResourceName() {
        return fontResourceName;
    }

    /**
     * Returns the object number of the font.
     *
     * @return the object number, or -1 if the font is not in the page's
     *         resources
     */
    public int getFontObjectNumber() {
        return fontObjectNumber;
    }

    @Override
    public String toString() {
        return "ExtractedText[\"" + text + "\" at " + x + "," + y + " " + fontName + " " + fontSize + "]";
    }

}
