/*
 * ToUnicodeMap.java
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A font's character code to Unicode mapping, built from its
 * {@code /ToUnicode} CMap.
 * <p>
 * Only codes of up to two bytes are mapped. Mappings defined later
 * override earlier ones for the same code. Once built the map is
 * immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ToUnicodeMap {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToUnicodeMap.class);

    static final int MAX_CODE = 0xFFFF;

    private final Map<Integer, String> mappings;
    private final int maxCodeLength;

    private ToUnicodeMap(Map<Integer, String> mappings, int maxCodeLength) {
        this.mappings = Collections.unmodifiableMap(mappings);
        this.maxCodeLength = maxCodeLength;
    }

    /**
     * Parses a CMap stream.
     *
     * @param data the decoded CMap
     * @return the mapping, possibly empty
     */
    public static ToUnicodeMap parse(byte[] data) {
        Builder builder = new Builder();
        new CMapParser(builder).parse(data);
        return new ToUnicodeMap(builder.mappings, builder.maxCodeLength);
    }

    /**
     * Returns the text for a character code.
     *
     * @param code the character code
     * @return the mapped text, or null if the code is not mapped
     */
    public String get(int code) {
        return mappings.get(code);
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public int size() {
        return mappings.size();
    }

    /**
     * Returns the longest code length declared by the code space ranges.
     *
     * @return the code length in bytes, or 0 if no code space was declared
     */
    public int getMaxCodeLength() {
        return maxCodeLength;
    }

    /**
     * Collects CMap events into a code map.
     */
    private static final class Builder implements CMapHandler {

        final Map<Integer, String> mappings = new HashMap<>();
        int maxCodeLength;

        @Override
        public void codeSpaceRange(long low, long high, int codeLength) {
            maxCodeLength = Math.max(maxCodeLength, codeLength);
        }

        @Override
        public void bfchar(long code, String unicode) {
            if (code <= MAX_CODE) {
                mappings.put((int) code, unicode);
            }
        }

        @Override
        public void bfrange(long low, long high, String start) {
            if (start.isEmpty() || !checkRange(low, high)) {
                return;
            }
            String prefix = start.substring(0, start.length() - 1);
            char last = start.charAt(start.length() - 1);
            for (long code = low; code <= high; code++) {
                char c = (char) (last + (code - low));
                mappings.put((int) code, prefix + c);
            }
        }

        @Override
        public void bfrange(long low, long high, List<String> destinations) {
            if (!checkRange(low, high)) {
                return;
            }
            for (int i = 0; i < destinations.size() && low + i <= high; i++) {
                mappings.put((int) (low + i), destinations.get(i));
            }
        }

        private boolean checkRange(long low, long high) {
            if (low > high || high > MAX_CODE) {
                LOGGER.debug("Ignoring bfrange {}..{}", low, high);
                return false;
            }
            return true;
        }

    }

}
