/*
 * TestPDFBuilder.java
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
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.Deflater;

/**
 * Assembles small PDF files for tests, with correct cross-reference data.
 * <p>
 * Objects are written in object number order. {@link #build()} writes a
 * classic xref table; {@link #buildWithXRefStream()} writes a compressed
 * cross-reference stream and puts the objects added with
 * {@link #addCompressed(int, String)} into an object stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class TestPDFBuilder {

    private static final String HEADER = "%PDF-1.7\n%âãÏÓ\n";

    private final TreeMap<Integer, byte[]> objects = new TreeMap<>();
    private final TreeMap<Integer, String> compressed = new TreeMap<>();
    private int root = 1;

    TestPDFBuilder setRoot(int root) {
        this.root = root;
        return this;
    }

    /**
     * Adds an object whose value is the given PDF text.
     */
    TestPDFBuilder addObject(int number, String value) {
        objects.put(number, ascii(number + " 0 obj\n" + value + "\nendobj\n"));
        return this;
    }

    /**
     * Adds a stream object. extraEntries is inserted into the stream
     * dictionary after /Length.
     */
    TestPDFBuilder addStream(int number, String extraEntries, byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, number + " 0 obj\n<< /Length " + data.length + " " + extraEntries + " >>\nstream\n");
        out.write(data, 0, data.length);
        write(out, "\nendstream\nendobj\n");
        objects.put(number, out.toByteArray());
        return this;
    }

    TestPDFBuilder addStream(int number, String content) {
        return addStream(number, "", ascii(content));
    }

    /**
     * Adds a FlateDecode-compressed stream object.
     */
    TestPDFBuilder addFlateStream(int number, String extraEntries, byte[] data) {
        return addStream(number, "/Filter /FlateDecode " + extraEntries, deflate(data));
    }

    /**
     * Adds an object to be stored in an object stream by
     * {@link #buildWithXRefStream()}.
     */
    TestPDFBuilder addCompressed(int number, String value) {
        compressed.put(number, value);
        return this;
    }

    /**
     * Writes the document with a classic cross-reference table.
     */
    byte[] build() {
        if (!compressed.isEmpty()) {
            throw new IllegalStateException("Object streams need a cross-reference stream");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, HEADER);
        int size = maxObjectNumber() + 1;
        long[] offsets = writeObjects(out, size);
        int xref = out.size();
        StringBuilder sb = new StringBuilder();
        sb.append("xref\n0 ").append(size).append('\n');
        for (int i = 0; i < size; i++) {
            if (offsets[i] < 0) {
                sb.append("0000000000 65535 f \n");
            } else {
                sb.append(String.format("%010d %05d n \n", offsets[i], 0));
            }
        }
        sb.append("trailer\n<< /Size ").append(size).append(" /Root ").append(root).append(" 0 R >>\n");
        sb.append("startxref\n").append(xref).append("\n%%EOF\n");
        write(out, sb.toString());
        return out.toByteArray();
    }

    /**
     * Writes the document with a FlateDecode cross-reference stream.
     */
    byte[] buildWithXRefStream() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, HEADER);
        int max = Math.max(maxObjectNumber(), compressed.isEmpty() ? 0 : compressed.lastKey());
        int objectStreamNumber = compressed.isEmpty() ? -1 : max + 1;
        int xrefNumber = max + (compressed.isEmpty() ? 1 : 2);
        int size = xrefNumber + 1;
        long[] offsets = writeObjects(out, size);

        if (objectStreamNumber > 0) {
            StringBuilder header = new StringBuilder();
            StringBuilder body = new StringBuilder();
            for (Map.Entry<Integer, String> entry : compressed.entrySet()) {
                header.append(entry.getKey()).append(' ').append(body.length()).append(' ');
                body.append(entry.getValue()).append('\n');
            }
            String content = header.toString() + body.toString();
            byte[] data = deflate(ascii(content));
            offsets[objectStreamNumber] = out.size();
            write(out, objectStreamNumber + " 0 obj\n<< /Type /ObjStm /N " + compressed.size()
                  + " /First " + header.length() + " /Filter /FlateDecode /Length " + data.length
                  + " >>\nstream\n");
            out.write(data, 0, data.length);
            write(out, "\nendstream\nendobj\n");
        }

        int xref = out.size();
        offsets[xrefNumber] = xref;
        ByteArrayOutputStream entries = new ByteArrayOutputStream();
        int index = 0;
        for (int i = 0; i < size; i++) {
            if (compressed.containsKey(i)) {
                entries.write(2);
                writeField(entries, objectStreamNumber, 4);
                writeField(entries, index++, 2);
            } else if (offsets[i] >= 0) {
                entries.write(1);
                writeField(entries, offsets[i], 4);
                writeField(entries, 0, 2);
            } else {
                entries.write(0);
                writeField(entries, 0, 4);
                writeField(entries, i == 0 ? 65535 : 0, 2);
            }
        }
        byte[] data = deflate(entries.toByteArray());
        write(out, xrefNumber + " 0 obj\n<< /Type /XRef /Size " + size + " /W [1 4 2] /Root " + root
              + " 0 R /Filter /FlateDecode /Length " + data.length + " >>\nstream\n");
        out.write(data, 0, data.length);
        write(out, "\nendstream\nendobj\nstartxref\n" + xref + "\n%%EOF\n");
        return out.toByteArray();
    }

    private long[] writeObjects(ByteArrayOutputStream out, int size) {
        long[] offsets = new long[size];
        for (int i = 0; i < size; i++) {
            offsets[i] = -1;
        }
        for (Map.Entry<Integer, byte[]> entry : objects.entrySet()) {
            offsets[entry.getKey()] = out.size();
            byte[] bytes = entry.getValue();
            out.write(bytes, 0, bytes.length);
        }
        return offsets;
    }

    private int maxObjectNumber() {
        return objects.isEmpty() ? 0 : objects.lastKey();
    }

    private static void writeField(ByteArrayOutputStream out, long value, int width) {
        for (int i = width - 1; i >= 0; i--) {
            out.write((int) (value >>> (i * 8)) & 0xFF);
        }
    }

    static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater();
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[1024];
        while (!deflater.finished()) {
            int len = deflater.deflate(buf);
            out.write(buf, 0, len);
        }
        deflater.end();
        return out.toByteArray();
    }

    static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static void write(ByteArrayOutputStream out, String s) {
        byte[] bytes = ascii(s);
        out.write(bytes, 0, bytes.length);
    }

    // ========== Fixtures ==========

    /**
     * Returns a builder for a document with one page per content string.
     * Object 1 is the catalog, 2 the page tree, 3 a Helvetica font named
     * /F1; page i is object 4 + 2i and its content stream 5 + 2i.
     */
    static TestPDFBuilder simpleDocument(String... pageContents) {
        TestPDFBuilder builder = new TestPDFBuilder();
        builder.addObject(1, "<< /Type /Catalog /Pages 2 0 R >>");
        StringBuilder kids = new StringBuilder();
        for (int i = 0; i < pageContents.length; i++) {
            kids.append(4 + 2 * i).append(" 0 R ");
        }
        builder.addObject(2, "<< /Type /Pages /Kids [" + kids + "] /Count " + pageContents.length
                          + " /MediaBox [0 0 612 792] >>");
        builder.addObject(3, "<< /Type /Font /Subtype /Type1 /BaseFont /Helvetica"
                          + " /Encoding /WinAnsiEncoding >>");
        for (int i = 0; i < pageContents.length; i++) {
            int page = 4 + 2 * i;
            builder.addObject(page, "<< /Type /Page /Parent 2 0 R /Resources << /Font << /F1 3 0 R >> >>"
                              + " /Contents " + (page + 1) + " 0 R >>");
            builder.addStream(page + 1, pageContents[i]);
        }
        return builder;
    }

    /**
     * Content showing one line of text at (x, 792 - y) in /F1 12.
     */
    static String textContent(String text, int x, int y) {
        return "BT /F1 12 Tf " + x + " " + y + " Td (" + text + ") Tj ET";
    }

}
