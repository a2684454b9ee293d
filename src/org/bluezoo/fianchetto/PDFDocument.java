/*
 * PDFDocument.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A loaded PDF document, and the entry point for querying it.
 * <p>
 * Opening a document reads the whole file into memory, loads its object
 * table and flattens its page tree. After that the document is immutable:
 * every query replays the relevant content streams afresh, so queries may
 * be run repeatedly and from several threads at once.
 * <p>
 * Queries never fail on malformed content. A content stream that cannot
 * be decoded, an operator with missing operands or an unmapped character
 * code reduces what is extracted. The only errors are a
 * {@link PDFParseException} from {@code open} when the document has no
 * usable catalog, and a {@link PageIndexOutOfBoundsException} for a page
 * the document does not have.
 * <p>
 * Coordinates in results have their origin at the top left corner of the
 * page's media box, with y increasing downwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class PDFDocument {

    private static final Logger LOGGER = LoggerFactory.getLogger(PDFDocument.class);

    private final ObjectStore store;
    private final ReferenceResolver resolver;
    private final List<PageDescriptor> pages;
    private final double lineTolerance;
    private final ConcurrentMap<Integer, FontInfo> fonts = new ConcurrentHashMap<>();

    private PDFDocument(ObjectStore store, ParseOptions options) {
        this.store = store;
        this.resolver = new ReferenceResolver(store, options);
        this.pages = new PageTreeWalker(resolver, options).buildPageList(store.getCatalog());
        this.lineTolerance = options.getLineTolerance();
    }

    // ========== Opening ==========

    /**
     * Opens a document with default options.
     *
     * @param data the complete file
     * @return the document
     * @throws PDFParseException if no document catalog can be found
     */
    public static PDFDocument open(byte[] data) {
        return open(data, new ParseOptions());
    }

    /**
     * Opens a document.
     *
     * @param data the complete file
     * @param options the parse options, copied
     * @return the document
     * @throws PDFParseException if no document catalog can be found
     */
    public static PDFDocument open(byte[] data, ParseOptions options) {
        return open(ByteBuffer.wrap(data), options);
    }

    /**
     * Opens a document held in a buffer. The buffer's remaining content is
     * the file; the buffer must not be modified while the document is in
     * use.
     *
     * @param data the complete file
     * @param options the parse options, copied
     * @return the document
     * @throws PDFParseException if no document catalog can be found
     */
    public static PDFDocument open(ByteBuffer data, ParseOptions options) {
        ParseOptions copy = new ParseOptions(options);
        ByteBuffer buffer = data.slice();
        ObjectStore store = ObjectStore.load(buffer, copy);
        PDFDocument document = new PDFDocument(store, copy);
        LOGGER.debug("Opened document: {} objects, {} pages{}", store.size(),
                     document.pages.size(), store.isRecovered() ? ", recovered" : "");
        return document;
    }

    /**
     * Reads a document from a stream, to its end. The stream is not closed.
     *
     * @param in the stream
     * @return the document
     * @throws IOException if the stream cannot be read
     * @throws PDFParseException if no document catalog can be found
     */
    public static PDFDocument open(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int len;
        while ((len = in.read(buf)) != -1) {
            out.write(buf, 0, len);
        }
        return open(out.toByteArray());
    }

    /**
     * Reads a document from a channel, from its start. The channel is not
     * closed.
     *
     * @param channel the channel
     * @return the document
     * @throws IOException if the channel cannot be read, or is larger than
     *         a buffer can hold
     * @throws PDFParseException if no document catalog can be found
     */
    public static PDFDocument open(SeekableByteChannel channel) throws IOException {
        long size = channel.size();
        if (size > Integer.MAX_VALUE) {
            throw new IOException("File too large: " + size + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        channel.position(0);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        buffer.flip();
        return open(buffer, new ParseOptions());
    }

    // ========== Structure ==========

    public int getPageCount() {
        return pages.size();
    }

    /**
     * Returns a page.
     *
     * @param pageIndex the 0-based page index
     * @return the page
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public PageDescriptor getPage(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= pages.size()) {
            throw new PageIndexOutOfBoundsException(pageIndex, pages.size());
        }
        return pages.get(pageIndex);
    }

    public List<PageDescriptor> getPages() {
        return pages;
    }

    /**
     * Returns the version from the file header.
     *
     * @return the version, e.g. "1.7", or null if the file has no header
     */
    public String getVersion() {
        return store.getVersion();
    }

    public Map<Name, Object> getTrailer() {
        return store.getTrailer();
    }

    public ObjectStore getObjectStore() {
        return store;
    }

    public ReferenceResolver getResolver() {
        return resolver;
    }

    // ========== Text ==========

    /**
     * Extracts the text runs of a page, in the order the page shows them.
     * Runs that decode to an empty string are omitted.
     *
     * @param pageIndex the 0-based page index
     * @return the text runs
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public List<ExtractedText> extractText(int pageIndex) {
        PageDescriptor page = getPage(pageIndex);
        TextCollector collector = new TextCollector(page.getResources());
        replay(page, collector);
        return Collections.unmodifiableList(collector.runs);
    }

    /**
     * Extracts the text runs of every page.
     *
     * @return the runs keyed by page index; pages without text are omitted
     * @throws PageIndexOutOfBoundsException if the document has no pages
     */
    public Map<Integer, List<ExtractedText>> extractTextFromAllPages() {
        checkNotEmpty();
        Map<Integer, List<ExtractedText>> result = new TreeMap<>();
        for (int i = 0; i < pages.size(); i++) {
            List<ExtractedText> runs = extractText(i);
            if (!runs.isEmpty()) {
                result.put(i, runs);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns the plain text of a page. Runs on the same line are separated
     * by a space and each change of line by a newline.
     *
     * @param pageIndex the 0-based page index
     * @return the page text, empty if the page has none
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public String getPageText(int pageIndex) {
        StringBuilder sb = new StringBuilder();
        ExtractedText previous = null;
        for (ExtractedText run : extractText(pageIndex)) {
            if (previous != null) {
                sb.append(Math.abs(run.getY() - previous.getY()) > lineTolerance ? '\n' : ' ');
            }
            sb.append(run.getText());
            previous = run;
        }
        return sb.toString();
    }

    /**
     * Returns the plain text of all pages that have text, separated by
     * newlines.
     *
     * @return the document text
     * @throws PageIndexOutOfBoundsException if the document has no pages
     */
    public String getAllPagesText() {
        checkNotEmpty();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pages.size(); i++) {
            String text = getPageText(i);
            if (text.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    /**
     * Arranges the text of a page into blocks, lines and words.
     *
     * @param pageIndex the 0-based page index
     * @return the layout
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public TextLayout getTextLayout(int pageIndex) {
        return TextLayout.build(getPage(pageIndex), extractText(pageIndex), lineTolerance);
    }

    // ========== Images ==========

    /**
     * Returns the image XObjects in a page's resources. An image painted by
     * the page carries the placement of its first {@code Do}; one that is
     * never painted has a zero placement.
     *
     * @param pageIndex the 0-based page index
     * @return the images, in resource order
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public List<ExtractedImage> extractImages(int pageIndex) {
        PageDescriptor page = getPage(pageIndex);
        PlacementCollector collector = new PlacementCollector();
        replay(page, collector);
        double[] box = page.getMediaBox();
        double originX = Math.min(box[0], box[2]);
        double originY = Math.max(box[1], box[3]);

        List<ExtractedImage> images = new ArrayList<>();
        for (Map.Entry<Name, Integer> entry : page.getResources().getXObjects().entrySet()) {
            RawObject xObject = store.get(entry.getValue());
            if (xObject == null || !Name.IMAGE.equals(xObject.getName(Name.SUBTYPE))) {
                continue;
            }
            Matrix ctm = collector.placements.get(entry.getKey());
            double x = 0, y = 0, displayWidth = 0, displayHeight = 0;
            if (ctm != null) {
                x = ctm.getE() - originX;
                y = originY - ctm.getF() - ctm.getD();
                displayWidth = ctm.getA();
                displayHeight = ctm.getD();
            }
            images.add(createImage(entry.getKey(), xObject, x, y, displayWidth, displayHeight));
        }
        return Collections.unmodifiableList(images);
    }

    private ExtractedImage createImage(Name name, RawObject xObject, double x, double y,
                                       double displayWidth, double displayHeight) {
        Map<Name, Object> dict = xObject.getDictionary();
        List<Name> filters = FilterPipeline.getFilterNames(dict);
        String filter = filters.isEmpty() ? "" : filters.get(0).getValue();
        byte[] data = xObject.hasStream() ? xObject.getStreamBytes() : new byte[0];
        return new ExtractedImage(name, xObject.getObjectNumber(),
                                  intValue(dict.get(Name.WIDTH)),
                                  intValue(dict.get(Name.HEIGHT)),
                                  intValue(dict.get(Name.BITS_PER_COMPONENT)),
                                  colorSpaceName(dict.get(Name.COLOR_SPACE)),
                                  filter, data, x, y, displayWidth, displayHeight);
    }

    private int intValue(Object value) {
        Number n = resolver.resolveNumber(value);
        return (n != null) ? n.intValue() : 0;
    }

    private String colorSpaceName(Object value) {
        Object resolved = resolver.resolve(value);
        if (resolved instanceof List && !((List<?>) resolved).isEmpty()) {
            resolved = ((List<?>) resolved).get(0);
        }
        return (resolved instanceof Name) ? ((Name) resolved).getValue() : "";
    }

    /**
     * Returns the images of every page.
     *
     * @return the images keyed by page index; pages without images are
     *         omitted
     * @throws PageIndexOutOfBoundsException if the document has no pages
     */
    public Map<Integer, List<ExtractedImage>> extractImagesFromAllPages() {
        checkNotEmpty();
        Map<Integer, List<ExtractedImage>> result = new TreeMap<>();
        for (int i = 0; i < pages.size(); i++) {
            List<ExtractedImage> images = extractImages(i);
            if (!images.isEmpty()) {
                result.put(i, images);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    // ========== Fonts ==========

    /**
     * Returns the fonts in a page's resources.
     *
     * @param pageIndex the 0-based page index
     * @return the fonts, in resource order
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public List<ExtractedFont> extractFonts(int pageIndex) {
        PageDescriptor page = getPage(pageIndex);
        List<ExtractedFont> result = new ArrayList<>();
        for (Map.Entry<Name, Integer> entry : page.getResources().getFonts().entrySet()) {
            if (!store.contains(entry.getValue())) {
                LOGGER.debug("Font {} of page {} refers to missing object {}",
                             entry.getKey(), pageIndex, entry.getValue());
                continue;
            }
            result.add(new ExtractedFont(entry.getKey(), getFont(entry.getValue())));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the fonts of every page.
     *
     * @return the fonts keyed by page index; pages without fonts are omitted
     * @throws PageIndexOutOfBoundsException if the document has no pages
     */
    public Map<Integer, List<ExtractedFont>> extractFontsFromAllPages() {
        checkNotEmpty();
        Map<Integer, List<ExtractedFont>> result = new TreeMap<>();
        for (int i = 0; i < pages.size(); i++) {
            List<ExtractedFont> pageFonts = extractFonts(i);
            if (!pageFonts.isEmpty()) {
                result.put(i, pageFonts);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns the font information for a font object, loading it on first
     * use.
     *
     * @param objectNumber the font object number
     * @return the font information
     */
    public FontInfo getFont(int objectNumber) {
        return fonts.computeIfAbsent(objectNumber, n -> FontInfo.load(n, resolver));
    }

    // ========== Search ==========

    /**
     * Searches every page for a string.
     *
     * @param query the text to find
     * @param caseInsensitive whether to ignore case
     * @return the matches, by page and then in page order
     * @throws PageIndexOutOfBoundsException if the document has no pages
     */
    public List<SearchResult> search(String query, boolean caseInsensitive) {
        checkNotEmpty();
        List<SearchResult> results = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            results.addAll(searchPage(i, query, caseInsensitive));
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * Searches a page for a string.
     * <p>
     * Each text run is searched on its own. If no run contains the query,
     * the runs of each line are searched together, first joined with
     * spaces and then, for text split across adjacent runs, joined without
     * a separator.
     *
     * @param pageIndex the 0-based page index
     * @param query the text to find
     * @param caseInsensitive whether to ignore case
     * @return the matches, in page order; empty for an empty query
     * @throws PageIndexOutOfBoundsException if there is no such page
     */
    public List<SearchResult> searchPage(int pageIndex, String query, boolean caseInsensitive) {
        List<ExtractedText> runs = extractText(pageIndex);
        List<SearchResult> results = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return results;
        }
        for (ExtractedText run : runs) {
            String text = run.getText();
            for (int start : find(text, query, caseInsensitive)) {
                results.add(createResult(pageIndex, text, start, query.length(), run, text));
            }
        }
        if (!results.isEmpty()) {
            return results;
        }
        for (List<ExtractedText> line : TextLayout.groupLines(runs, lineTolerance)) {
            StringBuilder spaced = new StringBuilder();
            StringBuilder joined = new StringBuilder();
            for (ExtractedText run : line) {
                if (spaced.length() > 0) {
                    spaced.append(' ');
                }
                spaced.append(run.getText());
                joined.append(run.getText());
            }
            String lineText = spaced.toString();
            List<Integer> matches = find(lineText, query, caseInsensitive);
            if (matches.isEmpty()) {
                lineText = joined.toString();
                matches = find(lineText, query, caseInsensitive);
            }
            for (int start : matches) {
                results.add(createResult(pageIndex, lineText, start, query.length(), line.get(0), lineText));
            }
        }
        return results;
    }

    private static List<Integer> find(String text, String query, boolean caseInsensitive) {
        List<Integer> matches = new ArrayList<>();
        int i = 0;
        while (i + query.length() <= text.length()) {
            if (text.regionMatches(caseInsensitive, i, query, 0, query.length())) {
                matches.add(i);
                i += query.length();
            } else {
                i++;
            }
        }
        return matches;
    }

    private static SearchResult createResult(int pageIndex, String text, int start, int length,
                                             ExtractedText run, String context) {
        String match = text.substring(start, start + length);
        double size = run.getFontSize();
        return new SearchResult(pageIndex, match, run.getX(), run.getY(),
                                size * length * TextLayout.CHARACTER_WIDTH, size, context);
    }

    // ========== Statistics ==========

    /**
     * Returns summary counts for the document.
     *
     * @return the statistics
     */
    public DocumentStatistics getStatistics() {
        int streams = 0;
        int fontObjects = 0;
        int images = 0;
        for (RawObject object : store.getObjects()) {
            if (object.hasStream()) {
                streams++;
            }
            if (object.isType(Name.FONT)) {
                fontObjects++;
            }
            if (Name.IMAGE.equals(object.getName(Name.SUBTYPE))) {
                images++;
            }
        }
        return new DocumentStatistics(pages.size(), store.size(), streams, fontObjects, images,
                                      store.isRecovered(), store.getVersion());
    }

    // ========== Content replay ==========

    private void replay(PageDescriptor page, ContentHandler handler) {
        List<byte[]> streams = new ArrayList<>();
        for (Integer number : page.getContentObjectNumbers()) {
            RawObject content = store.get(number);
            if (content == null || !content.hasStream()) {
                LOGGER.debug("Content stream {} of page {} missing", number, page.getIndex());
            } else if (content.getUnappliedFilter() != null) {
                LOGGER.debug("Content stream {} of page {} uses unsupported filter {}",
                             number, page.getIndex(), content.getUnappliedFilter());
            } else {
                streams.add(content.getStreamBytes());
            }
        }
        if (streams.isEmpty()) {
            return;
        }
        ContentStreamInterpreter interpreter = new ContentStreamInterpreter(handler, page.getMediaBox());
        interpreter.interpret(ContentStreamInterpreter.concatenate(streams));
    }

    private void checkNotEmpty() {
        if (pages.isEmpty()) {
            throw new PageIndexOutOfBoundsException(0, 0);
        }
    }

    /**
     * Decodes shown strings into text runs.
     */
    private final class TextCollector implements ContentHandler {

        final ResourceMap resources;
        final List<ExtractedText> runs = new ArrayList<>();

        TextCollector(ResourceMap resources) {
            this.resources = resources;
        }

        @Override
        public void showText(Name font, double fontSize, List<Token> strings, double x, double y) {
            int fontObjectNumber = (font != null) ? resources.getFont(font) : -1;
            FontInfo info = (fontObjectNumber >= 0) ? getFont(fontObjectNumber) : null;
            StringBuilder sb = new StringBuilder();
            for (Token string : strings) {
                sb.append(TextDecoder.decode(string, info));
            }
            if (sb.length() == 0) {
                return;
            }
            String fontName;
            if (info != null) {
                fontName = info.getDisplayName(font);
            } else {
                fontName = (font != null) ? font.getValue() : "";
            }
            runs.add(new ExtractedText(sb.toString(), x, y, fontName, fontSize, font, fontObjectNumber));
        }

        @Override
        public void paintXObject(Name name, Matrix ctm) {
        }

    }

    /**
     * Records the first placement of each XObject.
     */
    private static final class PlacementCollector implements ContentHandler {

        final Map<Name, Matrix> placements = new LinkedHashMap<>();

        @Override
        public void showText(Name font, double fontSize, List<Token> strings, double x, double y) {
        }

        @Override
        public void paintXObject(Name name, Matrix ctm) {
            if (!placements.containsKey(name)) {
                placements.put(name, ctm);
            }
        }

    }

}
