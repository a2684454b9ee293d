/*
 * PageDescriptor.java
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
 * A page of a loaded document, with its inherited attributes resolved.
 * <p>
 * Boxes are arrays of four numbers {@code [llx lly urx ury]} in default
 * user space. Descriptors are immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PageDescriptor {

    private final int index;
    private final int objectNumber;
    private final double[] mediaBox;
    private final double[] cropBox;
    private final int rotate;
    private final ResourceMap resources;
    private final List<Integer> contentObjectNumbers;

    PageDescriptor(int index, int objectNumber, double[] mediaBox, double[] cropBox,
                   int rotate, ResourceMap resources, List<Integer> contentObjectNumbers) {
        this.index = index;
        this.objectNumber = objectNumber;
        this.mediaBox = mediaBox.clone();
        this.cropBox = (cropBox != null) ? cropBox.clone() : null;
        this.rotate = rotate;
        this.resources = resources;
        this.contentObjectNumbers = Collections.unmodifiableList(contentObjectNumbers);
    }

    /**
     * Returns the 0-based position of this page in reading order.
     *
     * @return the page index
     */
    public int getIndex() {
        return index;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    /**
     * Returns the effective media box.
     *
     * @return a copy of the media box
     */
    public double[] getMediaBox() {
        return mediaBox.clone();
    }

    /**
     * Returns the crop box if the page or an ancestor defines one.
     *
     * @return a copy of the crop box, or null
     */
    public double[] getCropBox() {
        return (cropBox != null) ? cropBox.clone() : null;
    }

    /**
     * Returns the page rotation, normalised to 0, 90, 180 or 270.
     *
     * @return the rotation in degrees
     */
    public int getRotate() {
        return rotate;
    }

    public ResourceMap getResources() {
        return resources;
    }

    /**
     * Returns the object numbers of the page's content streams, in the
     * order they are concatenated.
     *
     * @return the content stream object numbers
     */
    public List<Integer> getContentObjectNumbers() {
        return contentObjectNumbers;
    }

    public double getWidth() {
        return Math.abs(mediaBox[2] - mediaBox[0]);
    }

    public double getHeight() {
        return Math.abs(mediaBox[3] - mediaBox[1]);
    }

    @Override
    public String toString() {
        return "PageDescriptor[index=" + index + ", object=" + objectNumber
            + ", size=" + getWidth() + "x" + getHeight() + "]";
    }

}
