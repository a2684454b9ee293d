/*
 * ParseOptions.java
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
 * Options controlling how a document is loaded and queried.
 * <p>
 * An options object is copied when a document is opened, so later changes
 * have no effect on documents already open.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ParseOptions {

    private static final double[] LETTER = { 0, 0, 612, 792 };

    private int maxPageTreeDepth = 64;
    private int maxReferenceDepth = 32;
    private boolean recoveryEnabled = true;
    private double[] defaultMediaBox = LETTER.clone();
    private double lineTolerance = 2.0;

    /**
     * Creates options with default values.
     */
    public ParseOptions() {
    }

    /**
     * Creates a copy of the given options.
     *
     * @param other the options to copy
     */
    public ParseOptions(ParseOptions other) {
        this.maxPageTreeDepth = other.maxPageTreeDepth;
        this.maxReferenceDepth = other.maxReferenceDepth;
        this.recoveryEnabled = other.recoveryEnabled;
        this.defaultMediaBox = other.defaultMediaBox.clone();
        this.lineTolerance = other.lineTolerance;
    }

    /**
     * Returns the maximum depth of the page tree. Subtrees below this depth
     * are not expanded.
     *
     * @return the maximum page tree depth (default 64)
     */
    public int getMaxPageTreeDepth() {
        return maxPageTreeDepth;
    }

    public void setMaxPageTreeDepth(int maxPageTreeDepth) {
        if (maxPageTreeDepth < 1) {
            throw new IllegalArgumentException("maxPageTreeDepth must be positive");
        }
        this.maxPageTreeDepth = maxPageTreeDepth;
    }

    /**
     * Returns the maximum number of links followed when resolving a chain of
     * indirect references or walking a page's parent chain.
     *
     * @return the maximum reference depth (default 32)
     */
    public int getMaxReferenceDepth() {
        return maxReferenceDepth;
    }

    public void setMaxReferenceDepth(int maxReferenceDepth) {
        if (maxReferenceDepth < 1) {
            throw new IllegalArgumentException("maxReferenceDepth must be positive");
        }
        this.maxReferenceDepth = maxReferenceDepth;
    }

    /**
     * Returns whether the recovery scan may be used when the cross-reference
     * data is missing or inconsistent.
     *
     * @return true if recovery is enabled (default)
     */
    public boolean isRecoveryEnabled() {
        return recoveryEnabled;
    }

    public void setRecoveryEnabled(boolean recoveryEnabled) {
        this.recoveryEnabled = recoveryEnabled;
    }

    /**
     * Returns the page box used when no page or ancestor defines
     * {@code /MediaBox}.
     *
     * @return a copy of the default media box (default US Letter)
     */
    public double[] getDefaultMediaBox() {
        return defaultMediaBox.clone();
    }

    /**
     * Sets the fallback page box.
     *
     * @param mediaBox four numbers: llx, lly, urx, ury
     */
    public void setDefaultMediaBox(double[] mediaBox) {
        if (mediaBox == null || mediaBox.length != 4) {
            throw new IllegalArgumentException("mediaBox must have four elements");
        }
        this.defaultMediaBox = mediaBox.clone();
    }

    /**
     * Returns the vertical distance below which two text runs are considered
     * to be on the same line.
     *
     * @return the line tolerance in points (default 2)
     */
    public double getLineTolerance() {
        return lineTolerance;
    }

    public void setLineTolerance(double lineTolerance) {
        if (lineTolerance < 0) {
            throw new IllegalArgumentException("lineTolerance must not be negative");
        }
        this.lineTolerance = lineTolerance;
    }

}
