/*
 * ExtractedImage.java
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

import java.util.Arrays;

/**
 * An image XObject painted on a page.
 * <p>
 * The image data is held as stored, after any FlateDecode filtering: for
 * an image compressed with a filter this library does not decode, such as
 * DCTDecode, the data is the encoded image. The placement is that of the
 * first {@code Do} operator on the page that paints the image.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExtractedImage {

    private final Name resourceName;
    private final int objectNumber;
    private final int width;
    private final int height;
    private final int bitsPerComponent;
    private final String colorSpace;
    private final String compressionFilter;
    private final byte[] data;
    private final double x;
    private final double y;
    private final double displayWidth;
    private final double displayHeight;

    ExtractedImage(Name resourceName, int objectNumber, int width, int height,
                   int bitsPerComponent, String colorSpace, String compressionFilter,
                   byte[] data, double x, double y, double displayWidth, double displayHeight) {
        this.resourceName = resourceName;
        this.objectNumber = objectNumber;
        this.width = width;
        this.height = height;
        this.bitsPerComponent = bitsPerComponent;
        this.colorSpace = colorSpace;
        this.compressionFilter = compressionFilter;
        this.data = data;
        this.x = x;
        this.y = y;
        this.displayWidth = displayWidth;
        this.displayHeight = displayHeight;
    }

    public Name getResourceName() {
        return resourceName;
    }

    public int getObjectNumber() {
        return objectNumber;
    }

    /**
     * Returns the image width in samples.
     *
     * @return the /Width value
     */
    public int getWidth() {
        return width;
    }

    /**
     * Returns the image height in samples.
     *
     * @return the /Height value
     */
    public int getHeight() {
        return height;
    }

    public int getBitsPerComponent() {
        return bitsPerComponent;
    }

    /**
     * Returns the colour space name. For a colour space array such as
     * {@code [/ICCBased 5 0 R]} this is the family name.
     *
     * @return the colour space, empty if none is declared
     */
    public String getColorSpace() {
        return colorSpace;
    }

    /**
     * Returns the first filter declared for the image stream.
     *
     * @return the filter name, empty if the stream is not filtered
     */
    public String getCompressionFilter() {
        return compressionFilter;
    }

    public byte[] getData() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Guesses the file format the image data corresponds to.
     *
     * @return "jpeg", "jp2", "tiff", "png" or "raw"
     */
    public String getImageFormat() {
        switch (compressionFilter) {
            case "DCTDecode":
                return "jpeg";
            case "JPXDecode":
                return "jp2";
            case "CCITTFaxDecode":
                return "tiff";
            case "FlateDecode":
            case "":
                return "png";
            default:
                return "raw";
        }
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getDisplayWidth() {
        return displayWidth;
    }

    public double getDisplayHeight() {
        return displayHeight;
    }

    @Override
    public String toString() {
        return "ExtractedImage[" + resourceName + " " + objectNumber + " R " + width + "x" + height
            + " " + compressionFilter + " at " + x + "," + y + "]";
    }

}
