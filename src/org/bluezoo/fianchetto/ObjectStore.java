/*
 * ObjectStore.java
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

import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The table of all indirect objects of a document, keyed by object number.
 * <p>
 * Two load strategies are tried in order. The indexed load reads the
 * cross-reference structure and loads every in-use object from its offset
 * or from its object stream. If that fails, or the result has no catalog
 * with a {@code /Pages} entry, the {@link RecoveryScanner} rebuilds the
 * table from the raw bytes. When the indexed load succeeds but some
 * entries could not be read, the recovery scan is used to fill in just
 * those object numbers.
 * <p>
 * A single malformed object never fails the load: it is omitted. The load
 * fails with a {@link PDFParseException} only when neither strategy finds a
 * document catalog.
 * <p>
 * Once loaded, the store is immutable and may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStore.class);

    private static final byte[] HEADER = "%PDF-".getBytes();

    private final Map<Integer, RawObject> objects;
    private final Map<Name, Object> trailer;
    private final int rootObjectNumber;
    private final CrossReferenceTable crossReferenceTable;
    private final boolean recovered;
    private final String version;

    private ObjectStore(Map<Integer, RawObject> objects, Map<Name, Object> trailer,
                        int rootObjectNumber, CrossReferenceTable crossReferenceTable,
                        boolean recovered, String version) {
        this.objects = Collections.unmodifiableMap(objects);
        this.trailer = Collections.unmodifiableMap(trailer);
        this.rootObjectNumber = rootObjectNumber;
        this.crossReferenceTable = crossReferenceTable;
        this.recovered = recovered;
        this.version = version;
    }

    /**
     * Loads the object table of a document.
     *
     * @param data the complete document
     * @param options the parse options
     * @return the loaded store
     * @throws PDFParseException if no document catalog can be found
     */
    public static ObjectStore load(ByteBuffer data, ParseOptions options) {
        String version = readVersion(data);
        IndexedLoad indexed = null;
        try {
            indexed = loadIndexed(data);
        } catch (RuntimeException e) {
            LOGGER.warn("Cross-reference data unusable ({}), scanning for objects", e.getMessage());
        }
        if (indexed != null) {
            int root = findCatalog(indexed.trailer, indexed.objects);
            if (root >= 0) {
                if (!indexed.missing.isEmpty() && options.isRecoveryEnabled()) {
                    fillMissing(data, indexed);
                }
                return new ObjectStore(indexed.objects, indexed.trailer, root,
                                       indexed.table, false, version);
            }
            LOGGER.warn("Cross-reference data does not lead to a document catalog, scanning for objects");
        }
        if (!options.isRecoveryEnabled()) {
            throw new PDFParseException("No document catalog found");
        }
        return loadRecovered(data, version);
    }

    // ========== Indexed load ==========

    private static final class IndexedLoad {
        final CrossReferenceTable table;
        final Map<Name, Object> trailer;
        final Map<Integer, RawObject> objects = new TreeMap<>();
        final Map<Integer, CrossReferenceEntry> missing = new LinkedHashMap<>();

        IndexedLoad(CrossReferenceTable table, Map<Name, Object> trailer) {
            this.table = table;
            this.trailer = trailer;
        }
    }

    private static IndexedLoad loadIndexed(ByteBuffer data) {
        CrossReferenceLoader loader = new CrossReferenceLoader(data);
        loader.load();
        CrossReferenceTable table = loader.getTable();
        IndexedLoad load = new IndexedLoad(table, loader.getTrailer());
        ObjectReader reader = new ObjectReader(data, number -> {
            // Indirect /Length: read the length object on its own
            CrossReferenceEntry entry = table.get(number);
            if (entry == null || !entry.isInUse()) {
                return null;
            }
            RawObject loaded = load.objects.get(number);
            if (loaded != null) {
                return loaded.getValue();
            }
            try {
                RawObject lengthObject = new ObjectReader(data, null).read((int) entry.getOffset());
                return lengthObject.getValue();
            } catch (RuntimeException e) {
                return null;
            }
        });
        Map<Integer, ObjectStream> objectStreams = new HashMap<>();

        // Direct objects first, so object streams are available
        for (Integer number : table.getObjectNumbers()) {
            CrossReferenceEntry entry = table.get(number);
            if (!entry.isInUse()) {
                continue;
            }
            try {
                long offset = entry.getOffset();
                if (offset > Integer.MAX_VALUE) {
                    throw new PDFParseException("Offset out of range", offset);
                }
                RawObject object = reader.read((int) offset);
                if (object.getObjectNumber() != number) {
                    throw new PDFParseException("Found object " + object.getObjectNumber()
                                                + " instead of " + number, offset);
                }
                load.objects.put(number, object);
            } catch (RuntimeException e) {
                LOGGER.debug("Object {} could not be read: {}", number, e.getMessage());
                load.missing.put(number, entry);
            }
        }
        for (Integer number : table.getObjectNumbers()) {
            CrossReferenceEntry entry = table.get(number);
            if (!entry.isCompressed()) {
                continue;
            }
            try {
                RawObject object = readCompressed(load.objects, objectStreams, number, entry);
                load.objects.put(number, object);
            } catch (RuntimeException e) {
                LOGGER.debug("Compressed object {} could not be read: {}", number, e.getMessage());
                load.missing.put(number, entry);
            }
        }
        return load;
    }

    private static RawObject readCompressed(Map<Integer, RawObject> objects,
                                            Map<Integer, ObjectStream> objectStreams,
                                            int number, CrossReferenceEntry entry) {
        int streamNumber = entry.getObjectStreamNumber();
        ObjectStream stream = objectStreams.get(streamNumber);
        if (stream == null) {
            RawObject container = objects.get(streamNumber);
            if (container == null) {
                throw new PDFParseException("Object stream " + streamNumber + " not loaded");
            }
            stream = ObjectStream.load(container);
            objectStreams.put(streamNumber, stream);
        }
        int index = entry.getIndexInStream();
        if (index >= stream.getObjectCount() || stream.getObjectNumber(index) != number) {
            // Index disagrees with the stream's own table: search it
            index = -1;
            for (int i = 0; i < stream.getObjectCount(); i++) {
                if (stream.getObjectNumber(i) == number) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                throw new PDFParseException("Object " + number + " not in object stream " + streamNumber);
            }
        }
        return new RawObject(number, 0, stream.getObjectText(index), null, null, -1);
    }

    private static void fillMissing(ByteBuffer data, IndexedLoad indexed) {
        LOGGER.warn("{} objects could not be read from their cross-reference entries, scanning for them",
                    indexed.missing.size());
        RecoveryScanner scanner = new RecoveryScanner(data);
        scanner.scan();
        Map<Integer, RawObject> found = scanner.getObjects();
        for (Integer number : indexed.missing.keySet()) {
            RawObject object = found.get(number);
            if (object != null) {
                indexed.objects.put(number, object);
            }
        }
    }

    // ========== Recovery ==========

    private static ObjectStore loadRecovered(ByteBuffer data, String version) {
        RecoveryScanner scanner = new RecoveryScanner(data);
        scanner.scan();
        TreeMap<Integer, RawObject> objects = new TreeMap<>(scanner.getObjects());
        List<Map<Name, Object>> trailers = scanner.getTrailers();

        // Last trailer naming a usable catalog
        for (int i = trailers.size() - 1; i >= 0; i--) {
            int root = findCatalog(trailers.get(i), objects);
            if (root >= 0) {
                return new ObjectStore(objects, trailers.get(i), root, null, true, version);
            }
        }
        // Cross-reference stream dictionaries serve as trailers
        RawObject lastXRef = null;
        for (RawObject object : objects.values()) {
            if (object.isType(Name.XREF) && findCatalog(object.getDictionary(), objects) >= 0
                    && (lastXRef == null || object.getOffset() > lastXRef.getOffset())) {
                lastXRef = object;
            }
        }
        if (lastXRef != null) {
            Map<Name, Object> trailer = lastXRef.getDictionary();
            return new ObjectStore(objects, trailer, findCatalog(trailer, objects), null, true, version);
        }
        // Any catalog
        RawObject catalog = null;
        for (RawObject object : objects.values()) {
            if (object.isType(Name.CATALOG) && object.get(Name.PAGES) != null
                    && (catalog == null || object.getOffset() > catalog.getOffset())) {
                catalog = object;
            }
        }
        if (catalog == null) {
            throw new PDFParseException("No document catalog found");
        }
        Map<Name, Object> trailer = new LinkedHashMap<>();
        trailer.put(Name.ROOT, catalog.getId());
        trailer.put(Name.SIZE, objects.lastKey() + 1);
        return new ObjectStore(objects, trailer, catalog.getObjectNumber(), null, true, version);
    }

    /**
     * Returns the object number of the catalog named by a trailer, if that
     * object exists and has a {@code /Pages} entry.
     */
    private static int findCatalog(Map<Name, Object> trailer, Map<Integer, RawObject> objects) {
        Object root = trailer.get(Name.ROOT);
        if (!(root instanceof ObjectId)) {
            return -1;
        }
        int number = ((ObjectId) root).getObjectNumber();
        RawObject catalog = objects.get(number);
        if (catalog == null || catalog.get(Name.PAGES) == null) {
            return -1;
        }
        return number;
    }

    private static String readVersion(ByteBuffer data) {
        int header = ObjectReader.indexOf(data, HEADER, 0, Math.min(1024, data.limit()));
        if (header < 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = header + HEADER.length; i < data.limit(); i++) {
            int b = data.get(i) & 0xFF;
            if ((b >= '0' && b <= '9') || b == '.') {
                sb.append((char) b);
            } else {
                break;
            }
        }
        return (sb.length() > 0) ? sb.toString() : null;
    }

    // ========== Accessors ==========

    /**
     * Returns the object with the given number.
     *
     * @param objectNumber the object number
     * @return the object, or null if the document has no such object
     */
    public RawObject get(int objectNumber) {
        return objects.get(objectNumber);
    }

    public boolean contains(int objectNumber) {
        return objects.containsKey(objectNumber);
    }

    /**
     * Returns the number of objects in the store.
     *
     * @return the object count
     */
    public int size() {
        return objects.size();
    }

    /**
     * Returns the object numbers in ascending order.
     *
     * @return the object numbers
     */
    public Set<Integer> getObjectNumbers() {
        return objects.keySet();
    }

    /**
     * Returns all objects in ascending object number order.
     *
     * @return the objects
     */
    public Collection<RawObject> getObjects() {
        return objects.values();
    }

    /**
     * Returns the trailer dictionary. For a recovered document this is the
     * trailer that named the catalog, or a synthesised one.
     *
     * @return the trailer
     */
    public Map<Name, Object> getTrailer() {
        return trailer;
    }

    /**
     * Returns the object number of the document catalog.
     *
     * @return the catalog's object number
     */
    public int getRootObjectNumber() {
        return rootObjectNumber;
    }

    /**
     * Returns the document catalog.
     *
     * @return the catalog
     */
    public RawObject getCatalog() {
        return objects.get(rootObjectNumber);
    }

    /**
     * Returns the cross-reference table the store was loaded from.
     *
     * @return the table, or null if the document was recovered by scanning
     */
    public CrossReferenceTable getCrossReferenceTable() {
        return crossReferenceTable;
    }

    /**
     * Returns whether the object table was rebuilt by the recovery scan.
     *
     * @return true if the recovery scan was used
     */
    public boolean isRecovered() {
        return recovered;
    }

    /**
     * Returns the version from the {@code %PDF-} header.
     *
     * @return the version, e.g. "1.7", or null if there is no header
     */
    public String getVersion() {
        return version;
    }

}
