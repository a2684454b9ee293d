/*
 * EncodingMode.java
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
 * How a font's character codes are laid out in a string.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum EncodingMode {

    /** One byte per character code. */
    SIMPLE,

    /** Two-byte codes: a Type0 font or an Identity-H/Identity-V encoding. */
    CID_IDENTITY;

}
