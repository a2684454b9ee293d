/*
 * FilterPipeline.java
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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds and manages a filter pipeline for decoding stream content.
 * <p>
 * The pipeline consists of zero or more filters followed by a final consumer.
 * Data is pushed through the pipeline in a feedforward manner:
 * <pre>
 *   Input → Filter1 → Filter2 → ... → Consumer
 * </pre>
 * <p>
 * Filters are applied in the order the stream dictionary lists them. The
 * chain stops at the first filter that is not supported: that filter and
 * any after it are left for the caller, and the first of them is reported
 * by {@link #getUnappliedFilter()}.
 * <p>
 * Usage:
 * <pre>
 *   ByteBufferCollector out = new ByteBufferCollector();
 *   FilterPipeline pipeline = FilterPipeline.create(streamDict, out);
 *   pipeline.write(data);
 *   pipeline.close();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FilterPipeline implements StreamConsumer {

    private static final Name DP = new Name("DP");
    private static final Name F = new Name("F");

    private final WritableByteChannel head;
    private final List<StreamFilter> filters;
    private final Name unappliedFilter;
    private boolean open = true;

    private FilterPipeline(WritableByteChannel head, List<StreamFilter> filters,
                           Name unappliedFilter) {
        this.head = head;
        this.filters = filters;
        this.unappliedFilter = unappliedFilter;
    }

    /**
     * Creates a filter pipeline based on the stream dictionary.
     *
     * @param streamDict the stream dictionary (may contain /Filter and /DecodeParms)
     * @param finalConsumer the consumer to receive decoded data
     * @return a new pipeline
     */
    public static FilterPipeline create(Map<Name, Object> streamDict,
                                        WritableByteChannel finalConsumer) {
        List<StreamFilter> filters = new ArrayList<>();
        List<Name> filterNames = getFilterNames(streamDict);
        if (filterNames.isEmpty()) {
            return new FilterPipeline(finalConsumer, filters, null);
        }

        Object paramsObj = streamDict.get(Name.DECODE_PARMS);
        if (paramsObj == null) {
            paramsObj = streamDict.get(DP); // Abbreviation
        }

        // Supported prefix of the chain
        Name unapplied = null;
        List<Map<Name, Object>> paramsList = new ArrayList<>();
        for (int i = 0; i < filterNames.size(); i++) {
            Name filterName = filterNames.get(i);
            StreamFilter filter = StreamFilter.create(filterName.getValue());
            if (filter == null) {
                unapplied = filterName;
                break;
            }
            filters.add(filter);
            paramsList.add(extractParams(paramsObj, i));
        }

        // Connect in reverse order (last filter connects to consumer first)
        WritableByteChannel current = finalConsumer;
        for (int i = filters.size() - 1; i >= 0; i--) {
            StreamFilter filter = filters.get(i);
            filter.setParams(paramsList.get(i));
            filter.setNext(current);
            current = filter;
        }
        return new FilterPipeline(current, filters, unapplied);
    }

    /**
     * Returns the filter names declared by a stream dictionary, in the
     * order they must be applied.
     *
     * @param streamDict the stream dictionary, may be null
     * @return the filter names, empty if none
     */
    public static List<Name> getFilterNames(Map<Name, Object> streamDict) {
        List<Name> filterNames = new ArrayList<>();
        if (streamDict == null) {
            return filterNames;
        }
        Object filterObj = streamDict.get(Name.FILTER);
        if (filterObj == null) {
            filterObj = streamDict.get(F);
        }
        if (filterObj instanceof Name) {
            filterNames.add((Name) filterObj);
        } else if (filterObj instanceof List) {
            for (Object f : (List<?>) filterObj) {
                if (f instanceof Name) {
                    filterNames.add((Name) f);
                }
            }
        }
        return filterNames;
    }

    /**
     * Extracts decode parameters for a specific filter index.
     */
    @SuppressWarnings("unchecked")
    private static Map<Name, Object> extractParams(Object paramsObj, int index) {
        if (paramsObj instanceof Map) {
            // Single params dict applies to a single filter or the first in a chain
            return index == 0 ? (Map<Name, Object>) paramsObj : null;
        }
        if (paramsObj instanceof List) {
            List<Object> paramsList = (List<Object>) paramsObj;
            if (index < paramsList.size()) {
                Object p = paramsList.get(index);
                if (p instanceof Map) {
                    return (Map<Name, Object>) p;
                }
            }
        }
        return null;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return head.write(src);
    }

    @Override
    public void close() throws IOException {
        head.close();
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void reset() {
        for (StreamFilter filter : filters) {
            filter.reset();
        }
        open = true;
    }

    /**
     * Returns true if this pipeline has any filters.
     *
     * @return true if there are filters in the pipeline
     */
    public boolean hasFilters() {
        return !filters.isEmpty();
    }

    /**
     * Returns the first declared filter that this pipeline does not apply.
     *
     * @return the filter name, or null if every declared filter is applied
     */
    public Name getUnappliedFilter() {
        return unappliedFilter;
    }

}
