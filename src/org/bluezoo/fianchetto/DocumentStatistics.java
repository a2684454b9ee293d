/*
 * DocumentStatistics.java
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
 * Summary counts for a loaded document.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DocumentStatistics {

    private final int pageCount;
    private final int objectCount;
    private final int streamCount;
    private final int fontCount;
    private final int imageCount;
    private final boolean recovered;
    private final String version;

    DocumentStatistics(int pageCount, int objectCount, int streamCount, int fontCount,
                       int imageCount, boolean recovered, String version) {
        this.pageCount = pageCount;
        this.objectCount = objectCount;
        this.streamCount = streamCount;
        this.fontCount = fontCount;
        this.imageCount = imageCount;
        this.recovered = recovered;
        this.version = version;
    }

    public int getPageCount() {
        return pageCount;
    }

    /**
     * Returns the number of indirect objects loaded.
     *
     * @return the object count
     */
    public int getObjectCount() {
        return objectCount;
    }

    public int getStreamCount() {
        return streamCount;
    }

    /**
     * Returns the number of objects whose /Type is /Font.
     *
     * @return the font object count
     */
    public int getFontCount() {
        return fontCount;
    }

    /**
     * Returns the number of objects whose /Subtype is /Image.
     *
     * @return the image object count
     */
    public int getImageCount() {
        return imageCount;
    }

    /**
     * Returns whether the object table was rebuilt by scanning the file
     * because its cross-reference data was unusable.
     *
     * @return true if the document was recovered
     */
    public boolean isRecovered() {
        return recovered;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "DocumentStatistics[pages=" + pageCount + " objects=" + objectCount
            + " streams=" + streamCount + " fonts=" + fontCount + " images=" + imageCount
            + (recovered ? " recovered" : "") + "]";
    }

}
