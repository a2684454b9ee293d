/*
 * ValueBuilder.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PDFHandler implementation that builds in-memory values from parsing events.
 * <p>
 * Dictionaries become unmodifiable {@code Map<Name,Object>} instances that
 * preserve key order, arrays become unmodifiable {@code List<Object>}
 * instances. Scalars are delivered as received. Once a top-level value has
 * been completed it is available from {@link #getResult()}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class ValueBuilder implements PDFHandler {

    /**
     * Stack for building nested structures (arrays, dictionaries).
     */
    private final Deque<Object> stack = new ArrayDeque<>();

    /**
     * The key each open container will be stored under in its parent.
     */
    private final Deque<Name> keys = new ArrayDeque<>();

    private static final Name NO_KEY = new Name("");

    private Name currentKey;
    private Object result;
    private boolean complete;

    /**
     * Returns the parsed result.
     *
     * @return the parsed object
     */
    Object getResult() {
        return result;
    }

    /**
     * Returns whether a complete top-level value has been built.
     *
     * @return true if a value is available
     */
    boolean isComplete() {
        return complete;
    }

    /**
     * Resets the builder for reuse.
     */
    void reset() {
        stack.clear();
        keys.clear();
        currentKey = null;
        result = null;
        complete = false;
    }

    @Override
    public void booleanValue(boolean value) {
        addValue(Boolean.valueOf(value));
    }

    @Override
    public void numberValue(Number value) {
        addValue(value);
    }

    @Override
    public void stringValue(String value) {
        addValue(value);
    }

    @Override
    public void nameValue(Name name) {
        addValue(name);
    }

    @Override
    public void startArray() {
        pushKey();
        stack.push(new ArrayList<Object>());
    }

    @Override
    @SuppressWarnings("unchecked")
    public void endArray() {
        List<Object> array = (List<Object>) stack.pop();
        popKey();
        addValue(Collections.unmodifiableList(array));
    }

    @Override
    public void startDictionary() {
        pushKey();
        stack.push(new LinkedHashMap<Name, Object>());
    }

    @Override
    @SuppressWarnings("unchecked")
    public void endDictionary() {
        Map<Name, Object> dict = (Map<Name, Object>) stack.pop();
        popKey();
        addValue(Collections.unmodifiableMap(dict));
    }

    @Override
    public void key(Name name) {
        currentKey = name;
    }

    @Override
    public void nullValue() {
        addValue(null);
    }

    @Override
    public void objectReference(ObjectId id) {
        addValue(id);
    }

    private void pushKey() {
        keys.push((currentKey != null) ? currentKey : NO_KEY);
        currentKey = null;
    }

    private void popKey() {
        Name key = keys.isEmpty() ? NO_KEY : keys.pop();
        currentKey = (key == NO_KEY) ? null : key;
    }

    /**
     * Adds a value to the current context (array or dictionary).
     */
    @SuppressWarnings("unchecked")
    private void addValue(Object value) {
        if (stack.isEmpty()) {
            result = value;
            complete = true;
            return;
        }
        Object container = stack.peek();
        if (container instanceof List) {
            ((List<Object>) container).add(value);
        } else if (currentKey != null) {
            // A null value is equivalent to the key being absent
            if (value != null) {
                ((Map<Name, Object>) container).put(currentKey, value);
            }
            currentKey = null;
        }
    }

}
