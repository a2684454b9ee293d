/*
 * ContentHandler.java
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

import java.util.List;

/**
 * Receives the extraction events of a {@link ContentStreamInterpreter}.
 * <p>
 * Coordinates are page coordinates with the origin at the top left of the
 * page's media box and y increasing downwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface ContentHandler {

    /**
     * A text-showing operator was executed.
     * <p>
     * PDF operators: <b>Tj</b>, <b>'</b>, <b>"</b>, <b>TJ</b>. The strings of
     * a TJ array are delivered together, in order, with its numeric
     * adjustments removed.
     *
     * @param font the font resource name, or null if no font was selected
     * @param fontSize the effective font size in page units
     * @param strings the string tokens shown
     * @param x the horizontal position of the text origin
     * @param y the vertical position of the text baseline
     */
    void showText(Name font, double fontSize, List<Token> strings, double x, double y);

    /**
     * An external object was painted.
     * <p>
     * PDF operator: <b>Do</b>
     *
     * @param name the XObject resource name
     * @param ctm the current transformation matrix at invocation, in the
     *        content stream's native bottom-left coordinates
     */
    void paintXObject(Name name, Matrix ctm);

}
