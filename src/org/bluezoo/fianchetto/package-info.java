/*
 * package-info.java
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

/**
 * Fianchetto PDF reading library.
 * <p>
 * Loads a complete PDF file held in memory, rebuilding its object table by
 * scanning the file when the cross-reference data is damaged, and extracts
 * text, images and fonts from its pages. A loaded document is immutable
 * and may be queried from several threads.
 * <p>
 * The main entry points are:
 * <ul>
 *   <li>{@link org.bluezoo.fianchetto.PDFDocument} - opening and querying a document</li>
 *   <li>{@link org.bluezoo.fianchetto.ParseOptions} - load and query options</li>
 *   <li>{@link org.bluezoo.fianchetto.ContentStreamInterpreter} - content stream replay</li>
 * </ul>
 * <p>
 * Core PDF object types represented in this package:
 * <ul>
 *   <li>{@link org.bluezoo.fianchetto.Name} - PDF name objects</li>
 *   <li>{@link org.bluezoo.fianchetto.ObjectId} - Indirect object identifiers</li>
 *   <li>{@link org.bluezoo.fianchetto.RawObject} - An indirect object as loaded</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.fianchetto;
