/*
 * TextLine.java
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
 * A line of a {@link TextBlock}: the words of the text runs sharing a
 * baseline, left to right.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TextLine {

    private final double y;
    private final List<TextWord> words;
    private final String text;

    TextLine(double y, List<TextWord> words, String text) {
        this.y = y;
        this.words = Collections.unmodifiableList(words);
        this.text = text;
    }

    public double getY() {
        return y;
    }

    public List<TextWord> getWords() {
        return words;
    }

    /**
     * Returns the text of the line's runs joined with spaces.
     *
     * @return the line text
     */
    public String getText() {
        return text;
    }

    /**
     * Returns the height of the line, the largest height of its words.
     *
     * @return the line height
     */
    public double getHeight() {
        double height = 0;
        for (TextWord word : words) {
            height = Math.max(height, word.getHeight());
        }
        return height;
    }

    @Override
    public String toString() {
        return text;
    }

}
