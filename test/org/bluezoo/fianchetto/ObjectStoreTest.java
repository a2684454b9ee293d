/*
 * ObjectStoreTest.java
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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.Test;

public class ObjectStoreTest {

    private static ObjectStore load(byte[] data) {
        return ObjectStore.load(ByteBuffer.wrap(data), new ParseOptions());
    }

    private static String latin1(byte[] data) {
        return new String(data, StandardCharsets.ISO_8859_1);
    }

    /**
     * Points every in-use xref entry at the file header.
     */
    private static byte[] corruptOffsets(byte[] data) {
        return TestPDFBuilder.ascii(latin1(data).replaceAll("\\d{10} 00000 n", "0000000001 00000 n"));
    }

    private static byte[] corruptStartXRef(byte[] data) {
        return TestPDFBuilder.ascii(latin1(data).replaceAll("startxref\n\\d+", "startxref\n99999999"));
    }

    @Test
    public void testIndexedLoad() {
        ObjectStore store = load(TestPDFBuilder.simpleDocument("BT ET", "BT ET").build());
        assertFalse(store.isRecovered());
        assertEquals("1.7", store.getVersion());
        assertEquals(1, store.getRootObjectNumber());
        assertEquals(7, store.size());
        assertTrue(store.getCatalog().isType(Name.CATALOG));
        assertNotNull(store.getCrossReferenceTable());
        assertEquals(new ObjectId(1), store.getTrailer().get(Name.ROOT));
        assertTrue(store.get(5).hasStream());
        assertEquals("BT ET", latin1(store.get(5).getStreamBytes()));
        assertNull(store.get(42));
    }

    @Test
    public void testCrossReferenceStreamWithObjectStream() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addCompressed(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addCompressed(2, "<< /Type /Pages /Kids [3 0 R] /Count 1 >>")
                .addCompressed(3, "<< /Type /Page /Parent 2 0 R /Contents 4 0 R >>")
                .addStream(4, "BT ET");
        ObjectStore store = load(builder.buildWithXRefStream());
        assertFalse(store.isRecovered());
        assertTrue(store.getCatalog().isType(Name.CATALOG));
        assertTrue(store.get(3).isType(Name.PAGE));
        assertEquals(new ObjectId(2), store.get(3).get(Name.PARENT));
        assertEquals("BT ET", latin1(store.get(4).getStreamBytes()));
    }

    @Test
    public void testCorruptedOffsetsAreRecovered() {
        byte[] data = TestPDFBuilder.simpleDocument("BT ET", "BT ET", "BT ET").build();
        ObjectStore store = load(corruptOffsets(data));
        assertTrue(store.isRecovered());
        assertNull(store.getCrossReferenceTable());
        assertEquals(1, store.getRootObjectNumber());
        assertEquals(9, store.size());
        assertEquals("BT ET", latin1(store.get(9).getStreamBytes()));
    }

    @Test
    public void testMissingStartXRefIsRecovered() {
        byte[] data = TestPDFBuilder.simpleDocument("BT ET").build();
        ObjectStore store = load(corruptStartXRef(data));
        assertTrue(store.isRecovered());
        assertTrue(store.getCatalog().isType(Name.CATALOG));
    }

    @Test
    public void testLaterDefinitionWinsDuringRecovery() {
        byte[] data = TestPDFBuilder.simpleDocument("BT ET").build();
        String updated = latin1(corruptStartXRef(data))
                + "3 0 obj\n<< /Type /Font /Subtype /Type1 /BaseFont /Courier >>\nendobj\n";
        ObjectStore store = load(TestPDFBuilder.ascii(updated));
        assertTrue(store.isRecovered());
        assertEquals(new Name("Courier"), store.get(3).getName(Name.BASE_FONT));
    }

    @Test
    public void testRecoveryDisabled() {
        byte[] data = corruptStartXRef(TestPDFBuilder.simpleDocument("BT ET").build());
        ParseOptions options = new ParseOptions();
        options.setRecoveryEnabled(false);
        try {
            ObjectStore.load(ByteBuffer.wrap(data), options);
            fail("Expected PDFParseException");
        } catch (PDFParseException e) {
            // expected
        }
    }

    @Test
    public void testNoCatalog() {
        byte[] data = TestPDFBuilder.ascii("%PDF-1.4\n1 0 obj\n<< /Foo 1 >>\nendobj\n%%EOF\n");
        try {
            load(data);
            fail("Expected PDFParseException");
        } catch (PDFParseException e) {
            // expected
        }
    }

    @Test
    public void testNotAPDF() {
        try {
            load(TestPDFBuilder.ascii("Hello, world"));
            fail("Expected PDFParseException");
        } catch (PDFParseException e) {
            // expected
        }
    }

    @Test
    public void testIndirectLength() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        builder.addObject(7, "<< /Length 8 0 R >>\nstream\nq 1 0 0 1 0 0 cm Q\nendstream");
        builder.addObject(8, "18");
        ObjectStore store = load(builder.build());
        assertEquals("q 1 0 0 1 0 0 cm Q", latin1(store.get(7).getStreamBytes()));
    }

    @Test
    public void testWrongLengthFallsBackToEndstream() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        builder.addObject(7, "<< /Length 3 >>\nstream\nBT /F1 12 Tf ET\nendstream");
        builder.addObject(8, "<< /Length 5000 >>\nstream\nq Q\r\nendstream");
        ObjectStore store = load(builder.build());
        assertEquals("BT /F1 12 Tf ET", latin1(store.get(7).getStreamBytes()));
        assertEquals("q Q", latin1(store.get(8).getStreamBytes()));
    }

    @Test
    public void testHugeLengthFallsBackToEndstream() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        builder.addObject(7, "<< /Length 2147483647 >>\nstream\nabc\nendstream");
        ObjectStore store = load(builder.build());
        assertFalse(store.isRecovered());
        assertEquals("abc", latin1(store.get(7).getStreamBytes()));
    }

    @Test
    public void testOversizedPredictorRowIsNotFatal() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        byte[] content = TestPDFBuilder.ascii("abcdef");
        builder.addFlateStream(7, "/DecodeParms << /Predictor 12 /Columns 1000000000 >>", content);
        builder.addFlateStream(8, "/DecodeParms << /Predictor 12 /Columns 1000000000"
                               + " /Colors 1000000000 /BitsPerComponent 16 >>", content);
        ObjectStore store = load(builder.build());
        assertFalse(store.isRecovered());
        assertNotNull(store.get(7));
        RawObject object = store.get(8);
        assertEquals(new Name("FlateDecode"), object.getUnappliedFilter());
        assertArrayEquals(TestPDFBuilder.deflate(content), object.getStreamBytes());
    }

    @Test
    public void testMalformedObjectStreamHeaderDuringRecovery() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        builder.addStream(7, "/Type /ObjStm /N 1 /First 8", TestPDFBuilder.ascii("20 -100 << /Foo 1 >>"));
        builder.addStream(8, "/Type /ObjStm /N 2000000000 /First 5",
                          TestPDFBuilder.ascii("21 0 << /Bar 2 >>"));
        ObjectStore store = load(corruptStartXRef(builder.build()));
        assertTrue(store.isRecovered());
        assertTrue(store.getCatalog().isType(Name.CATALOG));
        assertNull(store.get(20));
        assertEquals(2, store.get(21).getInt(new Name("Bar"), -1));
    }

    @Test
    public void testFlateStreamIsDecoded() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        byte[] content = TestPDFBuilder.ascii("BT /F1 12 Tf 72 720 Td (Compressed) Tj ET");
        builder.addFlateStream(7, "", content);
        ObjectStore store = load(builder.build());
        RawObject object = store.get(7);
        assertArrayEquals(content, object.getStreamBytes());
        assertNull(object.getUnappliedFilter());
    }

    @Test
    public void testUnsupportedFilterIsKeptRaw() {
        TestPDFBuilder builder = TestPDFBuilder.simpleDocument("BT ET");
        byte[] jpeg = new byte[] { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0, 0 };
        builder.addStream(7, "/Filter /DCTDecode", jpeg);
        ObjectStore store = load(builder.build());
        RawObject object = store.get(7);
        assertArrayEquals(jpeg, object.getStreamBytes());
        assertEquals(new Name("DCTDecode"), object.getUnappliedFilter());
    }

    @Test
    public void testTrailerIsUnmodifiable() {
        ObjectStore store = load(TestPDFBuilder.simpleDocument("BT ET").build());
        Map<Name, Object> trailer = store.getTrailer();
        try {
            trailer.put(Name.SIZE, 0);
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

}
