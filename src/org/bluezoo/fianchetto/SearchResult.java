/*
 * SearchResult.java
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
 * A text search match.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class SearchResult {

    private final int pageIndex;
    private final String text;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final String context;

    SearchResult(int pageIndex, String text, double x, double y,
                 double width, double height, String context) {
        this.pageIndex = pageIndex;
        this.text = text;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.context = context;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    /**
     * Returns the matched text as it appears on the page, which may differ
     * in case from the query.
     *
     * @return the matched text
     */
    public String getText() {
        return text;
    }

    /**
     * Returns the horizontal position of the run or line containing the
     * match.
     *
     * @return the x coordinate
     */
    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /**
     * Returns the approximate width of the match, from its length and font
     * size.
     *
     * @return the width
     */
    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    /**
     * Returns the text the match was found in.
     *
     * @return the run or line text
     */
    public String getContext() {
        return context;
    }

    @Override
    public String toString() {
        return "SearchResult[page " + pageIndex + " \"" + text + "\" at " + x + "," + y + "]";
    }

}
