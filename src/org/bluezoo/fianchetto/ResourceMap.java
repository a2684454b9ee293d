/*
 * ResourceMap.java
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The named resources visible to a page: font names and external object
 * names, each mapped to the object number that defines it.
 * <p>
 * A name is bound by the nearest {@code /Resources} dictionary that
 * defines it, walking from the page up through its ancestors. Whether an
 * external object is an image or a form is not recorded here; it is read
 * from the object's {@code /Subtype} when needed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ResourceMap {

    static final ResourceMap EMPTY = new ResourceMap(
        Collections.<Name, Integer>emptyMap(), Collections.<Name, Integer>emptyMap());

    private final Map<Name, Integer> fonts;
    private final Map<Name, Integer> xObjects;

    ResourceMap(Map<Name, Integer> fonts, Map<Name, Integer> xObjects) {
        this.fonts = Collections.unmodifiableMap(new LinkedHashMap<>(fonts));
        this.xObjects = Collections.unmodifiableMap(new LinkedHashMap<>(xObjects));
    }

    /**
     * Returns the font resources.
     *
     * @return font resource name to object number
     */
    public Map<Name, Integer> getFonts() {
        return fonts;
    }

    /**
     * Returns the external object resources.
     *
     * @return XObject resource name to object number
     */
    public Map<Name, Integer> getXObjects() {
        return xObjects;
    }

    /**
     * Returns the object number of a font resource.
     *
     * @param name the resource name
     * @return the object number, or -1 if the page has no such font
     */
    public int getFont(Name name) {
        Integer number = fonts.get(name);
        return (number != null) ? number : -1;
    }

    /**
     * Returns the object number of an external object resource.
     *
     * @param name the resource name
     * @return the object number, or -1 if the page has no such object
     */
    public int getXObject(Name name) {
        Integer number = xObjects.get(name);
        return (number != null) ? number : -1;
    }

    @Override
    public String toString() {
        return "ResourceMap[fonts=" + fonts + ", xObjects=" + xObjects + "]";
    }

}
