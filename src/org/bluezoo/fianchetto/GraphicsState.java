/*
 * GraphicsState.java
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
 * The part of the graphics and text state that text and image extraction
 * depend on. One instance is live during a content-stream replay; saving
 * the state pushes a copy.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class GraphicsState {

    Matrix ctm = Matrix.IDENTITY;
    Matrix textMatrix = Matrix.IDENTITY;
    Matrix lineMatrix = Matrix.IDENTITY;
    double leading;
    double characterSpacing;
    double wordSpacing;
    Name font;
    double fontSize;

    GraphicsState copy() {
        GraphicsState copy = new GraphicsState();
        copy.ctm = ctm;
        copy.textMatrix = textMatrix;
        copy.lineMatrix = lineMatrix;
        copy.leading = leading;
        copy.characterSpacing = characterSpacing;
        copy.wordSpacing = wordSpacing;
        copy.font = font;
        copy.fontSize = fontSize;
        return copy;
    }

    /**
     * Moves to the start of the next line, offset from the current line
     * start by (tx, ty) in text space.
     */
    void moveTextPosition(double tx, double ty) {
        lineMatrix = lineMatrix.translate(tx, ty);
        textMatrix = lineMatrix;
    }

    void moveToNextLine() {
        moveTextPosition(0, -leading);
    }

    /**
     * Returns the text rendering matrix, excluding font size, rise and
     * horizontal scaling.
     */
    Matrix getTextRenderingMatrix() {
        return textMatrix.concat(ctm);
    }

}
