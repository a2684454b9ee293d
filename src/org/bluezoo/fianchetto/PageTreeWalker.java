/*
 * PageTreeWalker.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens the page tree of a document into an ordered list of
 * {@link PageDescriptor}s.
 * <p>
 * The tree is expanded depth-first from the catalog's {@code /Pages} node,
 * following each {@code /Kids} array left to right. {@code /Resources},
 * {@code /MediaBox}, {@code /CropBox} and {@code /Rotate} are carried down
 * from ancestors. A node is a page if its {@code /Type} is {@code /Page},
 * or if it has no {@code /Type} and no {@code /Kids}.
 * <p>
 * Recursion stops at {@link ParseOptions#getMaxPageTreeDepth()}; deeper
 * subtrees are dropped. A node reached a second time, through a cycle or a
 * shared subtree, is not expanded again.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PageTreeWalker {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageTreeWalker.class);

    private final ReferenceResolver resolver;
    private final int maxDepth;
    private final double[] defaultMediaBox;

    /**
     * Creates a walker.
     *
     * @param resolver the resolver for the document
     * @param options the parse options
     */
    public PageTreeWalker(ReferenceResolver resolver, ParseOptions options) {
        this.resolver = resolver;
        this.maxDepth = options.getMaxPageTreeDepth();
        this.defaultMediaBox = options.getDefaultMediaBox();
    }

    /**
     * Inherited state passed down the tree.
     */
    private static final class Inherited {
        final List<Map<Name, Object>> resources; // nearest first
        final double[] mediaBox;
        final double[] cropBox;
        final Integer rotate;

        Inherited(List<Map<Name, Object>> resources, double[] mediaBox,
                  double[] cropBox, Integer rotate) {
            this.resources = resources;
            this.mediaBox = mediaBox;
            this.cropBox = cropBox;
            this.rotate = rotate;
        }
    }

    /**
     * Builds the page list for the document's catalog.
     *
     * @param catalog the document catalog
     * @return the pages in reading order
     */
    public List<PageDescriptor> buildPageList(RawObject catalog) {
        List<PageDescriptor> pages = new ArrayList<>();
        Object root = catalog.get(Name.PAGES);
        if (!(root instanceof ObjectId)) {
            LOGGER.debug("Catalog /Pages is not an indirect reference");
            return pages;
        }
        Inherited top = new Inherited(Collections.<Map<Name, Object>>emptyList(), null, null, null);
        walk(((ObjectId) root).getObjectNumber(), top, 0, new HashSet<Integer>(), pages);
        return Collections.unmodifiableList(pages);
    }

    private void walk(int objectNumber, Inherited inherited, int depth,
                      Set<Integer> visited, List<PageDescriptor> pages) {
        if (depth >= maxDepth) {
            LOGGER.debug("Page tree deeper than {} at object {}, subtree dropped", maxDepth, objectNumber);
            return;
        }
        if (!visited.add(objectNumber)) {
            LOGGER.debug("Page tree node {} reached twice", objectNumber);
            return;
        }
        RawObject node = resolver.getStore().get(objectNumber);
        if (node == null || !node.isDictionary()) {
            LOGGER.debug("Page tree node {} missing or not a dictionary", objectNumber);
            return;
        }
        Map<Name, Object> dict = node.getDictionary();
        Inherited state = inherit(dict, inherited);

        Name type = node.getName(Name.TYPE);
        Object kids = dict.get(Name.KIDS);
        boolean leaf = Name.PAGE.equals(type) || (type == null && kids == null);
        if (leaf) {
            pages.add(createPage(pages.size(), objectNumber, dict, state));
            return;
        }
        List<Object> kidList = resolver.resolveArray(kids);
        if (kidList == null) {
            return;
        }
        for (Object kid : kidList) {
            if (kid instanceof ObjectId) {
                walk(((ObjectId) kid).getObjectNumber(), state, depth + 1, visited, pages);
            }
        }
    }

    private Inherited inherit(Map<Name, Object> dict, Inherited parent) {
        List<Map<Name, Object>> resources = parent.resources;
        Map<Name, Object> own = resolver.resolveDictionary(dict.get(Name.RESOURCES));
        if (own != null) {
            resources = new ArrayList<>(parent.resources.size() + 1);
            resources.add(own);
            resources.addAll(parent.resources);
        }
        double[] mediaBox = resolver.resolveRectangle(dict.get(Name.MEDIA_BOX));
        double[] cropBox = resolver.resolveRectangle(dict.get(Name.CROP_BOX));
        Number rotate = resolver.resolveNumber(dict.get(Name.ROTATE));
        return new Inherited(resources,
                             (mediaBox != null) ? mediaBox : parent.mediaBox,
                             (cropBox != null) ? cropBox : parent.cropBox,
                             (rotate != null) ? Integer.valueOf(rotate.intValue()) : parent.rotate);
    }

    private PageDescriptor createPage(int index, int objectNumber, Map<Name, Object> dict,
                                      Inherited state) {
        double[] mediaBox = (state.mediaBox != null) ? state.mediaBox : defaultMediaBox;
        int rotate = normaliseRotation((state.rotate != null) ? state.rotate : 0);
        return new PageDescriptor(index, objectNumber, mediaBox, state.cropBox, rotate,
                                  buildResourceMap(state.resources),
                                  contentObjectNumbers(dict.get(Name.CONTENTS)));
    }

    /**
     * Merges the resource dictionaries of a page and its ancestors, nearest
     * definition of each name first.
     */
    private ResourceMap buildResourceMap(List<Map<Name, Object>> resources) {
        if (resources.isEmpty()) {
            return ResourceMap.EMPTY;
        }
        Map<Name, Integer> fonts = new LinkedHashMap<>();
        Map<Name, Integer> xObjects = new LinkedHashMap<>();
        for (Map<Name, Object> dict : resources) {
            addEntries(resolver.resolveDictionary(dict.get(Name.FONT)), fonts);
            addEntries(resolver.resolveDictionary(dict.get(Name.XOBJECT)), xObjects);
        }
        return new ResourceMap(fonts, xObjects);
    }

    private static void addEntries(Map<Name, Object> category, Map<Name, Integer> target) {
        if (category == null) {
            return;
        }
        for (Map.Entry<Name, Object> entry : category.entrySet()) {
            if (entry.getValue() instanceof ObjectId && !target.containsKey(entry.getKey())) {
                target.put(entry.getKey(), ((ObjectId) entry.getValue()).getObjectNumber());
            }
        }
    }

    /**
     * Returns the content stream object numbers named by a /Contents value:
     * a single reference, an array of references, or a reference to such an
     * array.
     */
    private List<Integer> contentObjectNumbers(Object contents) {
        List<Integer> numbers = new ArrayList<>();
        if (contents instanceof ObjectId) {
            RawObject target = resolver.getStore().get(((ObjectId) contents).getObjectNumber());
            if (target != null && !target.hasStream() && target.getArray() != null) {
                contents = target.getArray();
            } else {
                numbers.add(((ObjectId) contents).getObjectNumber());
                return numbers;
            }
        }
        if (contents instanceof List) {
            for (Object element : (List<?>) contents) {
                if (element instanceof ObjectId) {
                    numbers.add(((ObjectId) element).getObjectNumber());
                }
            }
        }
        return numbers;
    }

    static int normaliseRotation(int rotate) {
        int r = ((rotate % 360) + 360) % 360;
        return (r / 90) * 90;
    }

}
