/*
 * PageTreeWalkerTest.java
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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class PageTreeWalkerTest {

    private static final Name F1 = new Name("F1");

    private static List<PageDescriptor> pages(TestPDFBuilder builder, ParseOptions options) {
        ObjectStore store = ObjectStore.load(ByteBuffer.wrap(builder.build()), options);
        ReferenceResolver resolver = new ReferenceResolver(store, options);
        return new PageTreeWalker(resolver, options).buildPageList(store.getCatalog());
    }

    private static List<PageDescriptor> pages(TestPDFBuilder builder) {
        return pages(builder, new ParseOptions());
    }

    @Test
    public void testReadingOrder() {
        List<PageDescriptor> pages = pages(TestPDFBuilder.simpleDocument("BT ET", "BT ET", "BT ET"));
        assertEquals(3, pages.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, pages.get(i).getIndex());
            assertEquals(4 + 2 * i, pages.get(i).getObjectNumber());
            assertEquals(Arrays.asList(5 + 2 * i), pages.get(i).getContentObjectNumbers());
        }
    }

    @Test
    public void testInheritedAttributes() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R] /MediaBox [0 0 595 842] /Rotate 450"
                           + " /Resources << /Font << /F1 5 0 R /F2 6 0 R >> >> >>")
                .addObject(3, "<< /Type /Pages /Parent 2 0 R /Kids [4 0 R] /CropBox [10 10 585 832] >>")
                .addObject(4, "<< /Type /Page /Parent 3 0 R"
                           + " /Resources << /Font << /F2 7 0 R >> /XObject << /Im1 8 0 R >> >> >>")
                .addObject(5, "<< /Type /Font /Subtype /Type1 /BaseFont /Helvetica >>")
                .addObject(6, "<< /Type /Font /Subtype /Type1 /BaseFont /Courier >>")
                .addObject(7, "<< /Type /Font /Subtype /Type1 /BaseFont /Times-Roman >>");
        List<PageDescriptor> pages = pages(builder);
        assertEquals(1, pages.size());
        PageDescriptor page = pages.get(0);
        assertArrayEquals(new double[] { 0, 0, 595, 842 }, page.getMediaBox(), 0.0);
        assertArrayEquals(new double[] { 10, 10, 585, 832 }, page.getCropBox(), 0.0);
        assertEquals(90, page.getRotate());
        assertEquals(595.0, page.getWidth(), 0.0);
        assertEquals(842.0, page.getHeight(), 0.0);
        // Nearest definition wins
        assertEquals(5, page.getResources().getFont(F1));
        assertEquals(7, page.getResources().getFont(new Name("F2")));
        assertEquals(8, page.getResources().getXObject(new Name("Im1")));
        assertEquals(-1, page.getResources().getFont(new Name("F3")));
        assertTrue(page.getContentObjectNumbers().isEmpty());
    }

    @Test
    public void testIndirectResources() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R 4 0 R] >>")
                .addObject(3, "<< /Type /Page /Parent 2 0 R /Resources 6 0 R >>")
                .addObject(4, "<< /Type /Page /Parent 2 0 R /Resources << /Font << /F1 5 0 R >> >> >>")
                .addObject(5, "<< /Type /Font /Subtype /Type1 /BaseFont /Helvetica >>")
                .addObject(6, "<< /Font << /F1 5 0 R >> >>");
        List<PageDescriptor> pages = pages(builder);
        assertEquals(2, pages.size());
        assertEquals(5, pages.get(0).getResources().getFont(F1));
        assertEquals(5, pages.get(1).getResources().getFont(F1));
        assertEquals(pages.get(0).getResources().getFonts(), pages.get(1).getResources().getFonts());
    }

    @Test
    public void testDefaultMediaBox() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R] >>")
                .addObject(3, "<< /Type /Page /Parent 2 0 R /MediaBox [0 0 100] >>");
        PageDescriptor page = pages(builder).get(0);
        assertArrayEquals(new double[] { 0, 0, 612, 792 }, page.getMediaBox(), 0.0);
        assertNull(page.getCropBox());
        assertEquals(0, page.getRotate());
    }

    @Test
    public void testDepthLimit() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R 4 0 R] >>")
                .addObject(3, "<< /Type /Page /Parent 2 0 R >>")
                .addObject(4, "<< /Type /Pages /Parent 2 0 R /Kids [5 0 R] >>")
                .addObject(5, "<< /Type /Page /Parent 4 0 R >>");
        assertEquals(2, pages(builder).size());
        ParseOptions options = new ParseOptions();
        options.setMaxPageTreeDepth(2);
        List<PageDescriptor> pages = pages(builder, options);
        assertEquals(1, pages.size());
        assertEquals(3, pages.get(0).getObjectNumber());
    }

    @Test
    public void testCycleInKids() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R 2 0 R 3 0 R] >>")
                .addObject(3, "<< /Type /Page /Parent 2 0 R >>");
        List<PageDescriptor> pages = pages(builder);
        assertEquals(1, pages.size());
    }

    @Test
    public void testUntypedLeafIsPage() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R] >>")
                .addObject(3, "<< /Parent 2 0 R /Contents [4 0 R 5 0 R] >>");
        List<PageDescriptor> pages = pages(builder);
        assertEquals(1, pages.size());
        assertEquals(Arrays.asList(4, 5), pages.get(0).getContentObjectNumbers());
    }

    @Test
    public void testContentsArrayByReference() {
        TestPDFBuilder builder = new TestPDFBuilder()
                .addObject(1, "<< /Type /Catalog /Pages 2 0 R >>")
                .addObject(2, "<< /Type /Pages /Kids [3 0 R] >>")
                .addObject(3, "<< /Type /Page /Parent 2 0 R /Contents 4 0 R >>")
                .addObject(4, "[5 0 R 6 0 R]")
                .addStream(5, "BT")
                .addStream(6, "ET");
        assertEquals(Arrays.asList(5, 6), pages(builder).get(0).getContentObjectNumbers());
    }

    @Test
    public void testRotationNormalised() {
        assertEquals(0, PageTreeWalker.normaliseRotation(360));
        assertEquals(270, PageTreeWalker.normaliseRotation(-90));
        assertEquals(180, PageTreeWalker.normaliseRotation(180));
        assertEquals(90, PageTreeWalker.normaliseRotation(135));
    }

}
