/*
 * Name.java
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
 * Represents a PDF name object.
 * <p>
 * A name is an atomic, case-sensitive symbol. In PDF syntax it is written
 * with a leading solidus ({@code /Type}); the solidus is not part of the
 * value held here. Names read by the {@link Lexer} are kept verbatim,
 * so a {@code #xx} escape in the source appears unchanged in the value.
 * <p>
 * Frequently used dictionary keys are provided as constants so that
 * lookups do not allocate.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Name {

    public static final Name TYPE = new Name("Type");
    public static final Name SUBTYPE = new Name("Subtype");
    public static final Name ROOT = new Name("Root");
    public static final Name PAGES = new Name("Pages");
    public static final Name PAGE = new Name("Page");
    public static final Name KIDS = new Name("Kids");
    public static final Name PARENT = new Name("Parent");
    public static final Name RESOURCES = new Name("Resources");
    public static final Name MEDIA_BOX = new Name("MediaBox");
    public static final Name CROP_BOX = new Name("CropBox");
    public static final Name ROTATE = new Name("Rotate");
    public static final Name CONTENTS = new Name("Contents");
    public static final Name FONT = new Name("Font");
    public static final Name XOBJECT = new Name("XObject");
    public static final Name LENGTH = new Name("Length");
    public static final Name FILTER = new Name("Filter");
    public static final Name DECODE_PARMS = new Name("DecodeParms");
    public static final Name PREV = new Name("Prev");
    public static final Name XREF_STM = new Name("XRefStm");
    public static final Name SIZE = new Name("Size");
    public static final Name INDEX = new Name("Index");
    public static final Name W = new Name("W");
    public static final Name N = new Name("N");
    public static final Name FIRST = new Name("First");
    public static final Name BASE_FONT = new Name("BaseFont");
    public static final Name ENCODING = new Name("Encoding");
    public static final Name TO_UNICODE = new Name("ToUnicode");
    public static final Name FONT_DESCRIPTOR = new Name("FontDescriptor");
    public static final Name DESCENDANT_FONTS = new Name("DescendantFonts");
    public static final Name WIDTH = new Name("Width");
    public static final Name HEIGHT = new Name("Height");
    public static final Name BITS_PER_COMPONENT = new Name("BitsPerComponent");
    public static final Name COLOR_SPACE = new Name("ColorSpace");
    public static final Name IMAGE = new Name("Image");
    public static final Name CATALOG = new Name("Catalog");
    public static final Name OBJ_STM = new Name("ObjStm");
    public static final Name XREF = new Name("XRef");

    private final String value;
    private final int hashCode;

    /**
     * Creates a new name with the specified value.
     *
     * @param value the name value (without the leading solidus)
     * @throws NullPointerException if value is null
     */
    public Name(String value) {
        if (value == null) {
            throw new NullPointerException("Name value cannot be null");
        }
        this.value = value;
        this.hashCode = value.hashCode();
    }

    /**
     * Returns the string value of this name.
     *
     * @return the name value
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Name) {
            Name other = (Name) obj;
            return value.equals(other.value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * Returns the name in PDF syntax, i.e. prefixed with a solidus.
     * This is also the form used for resource names in extraction results
     * (e.g. {@code /F1}).
     *
     * @return the name prefixed with a solidus
     */
    @Override
    public String toString() {
        return "/" + value;
    }

}
