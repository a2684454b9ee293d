/*
 * ReferenceResolver.java
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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves indirect references and inherited page attributes against an
 * {@link ObjectStore}.
 * <p>
 * Every walk is bounded: reference chains and {@code /Parent} chains are
 * followed at most {@link ParseOptions#getMaxReferenceDepth()} steps, and
 * an object number seen twice ends the walk. A walk that ends this way
 * reports "not found" rather than failing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ReferenceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ObjectStore store;
    private final int maxDepth;
    private final double[] defaultMediaBox;

    /**
     * Creates a resolver.
     *
     * @param store the object store
     * @param options the parse options
     */
    public ReferenceResolver(ObjectStore store, ParseOptions options) {
        this.store = store;
        this.maxDepth = options.getMaxReferenceDepth();
        this.defaultMediaBox = options.getDefaultMediaBox();
    }

    public ObjectStore getStore() {
        return store;
    }

    /**
     * Resolves a value. A direct value is returned unchanged; an
     * {@link ObjectId} is replaced by the value of the object it names,
     * repeatedly if that value is itself a reference.
     *
     * @param value a direct value or reference
     * @return the direct value, or null if a reference cannot be resolved
     */
    public Object resolve(Object value) {
        Set<Integer> visited = new HashSet<>();
        int depth = 0;
        while (value instanceof ObjectId) {
            int number = ((ObjectId) value).getObjectNumber();
            if (!visited.add(number) || ++depth > maxDepth) {
                LOGGER.debug("Reference cycle or chain too long at object {}", number);
                return null;
            }
            RawObject object = store.get(number);
            if (object == null) {
                return null;
            }
            value = object.getValue();
        }
        return value;
    }

    /**
     * Resolves a reference to the object it names, following a chain of
     * references if the named object's value is itself a reference.
     *
     * @param value a reference
     * @return the final object, or null if value is not a resolvable reference
     */
    public RawObject resolveObject(Object value) {
        Set<Integer> visited = new HashSet<>();
        RawObject object = null;
        int depth = 0;
        while (value instanceof ObjectId) {
            int number = ((ObjectId) value).getObjectNumber();
            if (!visited.add(number) || ++depth > maxDepth) {
                LOGGER.debug("Reference cycle or chain too long at object {}", number);
                return null;
            }
            object = store.get(number);
            if (object == null) {
                return null;
            }
            value = object.getValue();
        }
        return object;
    }

    /**
     * Resolves a value that should be a dictionary.
     *
     * @param value a direct value or reference
     * @return the dictionary, or null if the value is not one
     */
    @SuppressWarnings("unchecked")
    public Map<Name, Object> resolveDictionary(Object value) {
        Object resolved = resolve(value);
        return (resolved instanceof Map) ? (Map<Name, Object>) resolved : null;
    }

    /**
     * Resolves a value that should be an array.
     *
     * @param value a direct value or reference
     * @return the array, or null if the value is not one
     */
    @SuppressWarnings("unchecked")
    public List<Object> resolveArray(Object value) {
        Object resolved = resolve(value);
        return (resolved instanceof List) ? (List<Object>) resolved : null;
    }

    /**
     * Resolves a value that should be a number.
     *
     * @param value a direct value or reference
     * @return the number, or null if the value is not one
     */
    public Number resolveNumber(Object value) {
        Object resolved = resolve(value);
        return (resolved instanceof Number) ? (Number) resolved : null;
    }

    /**
     * Resolves an array of four numbers, such as a page box.
     *
     * @param value a direct value or reference
     * @return the rectangle, or null if the value is not a four-number array
     */
    public double[] resolveRectangle(Object value) {
        List<Object> array = resolveArray(value);
        if (array == null || array.size() != 4) {
            return null;
        }
        double[] rect = new double[4];
        for (int i = 0; i < 4; i++) {
            Number n = resolveNumber(array.get(i));
            if (n == null) {
                return null;
            }
            rect[i] = n.doubleValue();
        }
        return rect;
    }

    /**
     * Looks up an inheritable page attribute, walking the {@code /Parent}
     * chain from the page until a dictionary defines the key.
     * <p>
     * When no ancestor defines {@code /MediaBox} the configured default page
     * box is returned; other keys default to null.
     *
     * @param pageObjectNumber the page object number
     * @param key the attribute, normally /MediaBox, /CropBox, /Resources or /Rotate
     * @return the resolved value, or the default
     */
    public Object resolveInherited(int pageObjectNumber, Name key) {
        Set<Integer> visited = new HashSet<>();
        Object node = new ObjectId(pageObjectNumber);
        int depth = 0;
        while (node instanceof ObjectId) {
            int number = ((ObjectId) node).getObjectNumber();
            if (!visited.add(number) || ++depth > maxDepth) {
                LOGGER.debug("Parent chain cycle or too deep at object {}", number);
                break;
            }
            RawObject object = store.get(number);
            if (object == null) {
                break;
            }
            Map<Name, Object> dict = object.getDictionary();
            Object value = dict.get(key);
            if (value != null) {
                Object resolved = resolve(value);
                if (resolved != null) {
                    return resolved;
                }
            }
            node = dict.get(Name.PARENT);
        }
        if (Name.MEDIA_BOX.equals(key)) {
            return toList(defaultMediaBox);
        }
        return null;
    }

    private static List<Object> toList(double[] box) {
        return Collections.unmodifiableList(Arrays.asList(new Object[] { box[0], box[1], box[2], box[3] }));
    }

}
