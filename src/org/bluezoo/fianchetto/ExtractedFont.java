/*
 * ExtractedFont.java
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
 * A font used by a page.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExtractedFont {

    private final Name resourceName;
    private final FontInfo info;

    ExtractedFont(Name resourceName, FontInfo info) {
        this.resourceName = resourceName;
        this.info = info;
    }

    public Name getResourceName() {
        return resourceName;
    }

    public String getBaseFont() {
        return info.getBaseFont();
    }

    public String getSubtype() {
        return info.getSubtype();
    }

    public String getEncoding() {
        return info.getEncoding();
    }

    public int getObjectNumber() {
        return info.getObjectNumber();
    }

    public boolean isEmbedded() {
        return info.isEmbedded();
    }

    /**
     * Returns the embedded font program, as stored after any FlateDecode
     * filtering.
     *
     * @return the program bytes, or null if the font is not embedded
     */
    public byte[] getData() {
        return info.getFontProgram();
    }

    @Override
    public String toString() {
        return "ExtractedFont[" + resourceName + " " + info.getBaseFont() + " " + info.getSubtype()
            + " " + info.getObjectNumber() + " R" + (info.isEmbedded() ? " embedded" : "") + "]";
    }

}
