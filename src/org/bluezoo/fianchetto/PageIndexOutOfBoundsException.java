/*
 * PageIndexOutOfBoundsException.java
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
 * Thrown when a caller asks for a page that the document does not have.
 * <p>
 * This is a caller-input error and is distinct from
 * {@link PDFParseException}, which reports a document that could not be
 * loaded. Whole-document queries on a document with no pages report
 * index 0 and page count 0.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PageIndexOutOfBoundsException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    private final int pageIndex;
    private final int pageCount;

    /**
     * Creates a new exception.
     *
     * @param pageIndex the requested 0-based page index
     * @param pageCount the number of pages in the document
     */
    public PageIndexOutOfBoundsException(int pageIndex, int pageCount) {
        super((pageCount == 0)
            ? "Document has no pages"
            : "Page index " + pageIndex + " out of range [0, " + (pageCount - 1) + "]");
        this.pageIndex = pageIndex;
        this.pageCount = pageCount;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getPageCount() {
        return pageCount;
    }

}
