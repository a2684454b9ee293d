/*
 * ContentStreamInterpreterTest.java
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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ContentStreamInterpreterTest {

    private static final double[] LETTER = { 0, 0, 612, 792 };
    private static final Name F1 = new Name("F1");

    private Recorder recorder;
    private ContentStreamInterpreter interpreter;

    @Before
    public void setUp() {
        recorder = new Recorder();
        interpreter = new ContentStreamInterpreter(recorder, LETTER);
    }

    private void interpret(String content) {
        interpreter.interpret(TestPDFBuilder.ascii(content));
    }

    static final class ShowText {
        final Name font;
        final double fontSize;
        final List<String> strings = new ArrayList<>();
        final double x;
        final double y;

        ShowText(Name font, double fontSize, List<Token> strings, double x, double y) {
            this.font = font;
            this.fontSize = fontSize;
            for (Token token : strings) {
                this.strings.add(token.getString());
            }
            this.x = x;
            this.y = y;
        }
    }

    static final class Paint {
        final Name name;
        final Matrix ctm;

        Paint(Name name, Matrix ctm) {
            this.name = name;
            this.ctm = ctm;
        }
    }

    static final class Recorder implements ContentHandler {
        final List<ShowText> text = new ArrayList<>();
        final List<Paint> paints = new ArrayList<>();

        @Override
        public void showText(Name font, double fontSize, List<Token> strings, double x, double y) {
            text.add(new ShowText(font, fontSize, strings, x, y));
        }

        @Override
        public void paintXObject(Name name, Matrix ctm) {
            paints.add(new Paint(name, ctm));
        }
    }

    // ========== Text ==========

    @Test
    public void testSimpleText() {
        interpret("BT /F1 12 Tf 72 720 Td (Hello) Tj ET");
        assertEquals(1, recorder.text.size());
        ShowText show = recorder.text.get(0);
        assertEquals(F1, show.font);
        assertEquals(12.0, show.fontSize, 1e-9);
        assertEquals(Arrays.asList("Hello"), show.strings);
        assertEquals(72.0, show.x, 1e-9);
        assertEquals(72.0, show.y, 1e-9);
    }

    @Test
    public void testTextArray() {
        interpret("BT /F1 10 Tf 0 0 Td [(Hello) -250 (World)] TJ ET");
        assertEquals(1, recorder.text.size());
        assertEquals(Arrays.asList("Hello", "World"), recorder.text.get(0).strings);
    }

    @Test
    public void testTextMatrixScalesFontSize() {
        interpret("BT /F1 1 Tf 12 0 0 12 100 700 Tm (A) Tj ET");
        ShowText show = recorder.text.get(0);
        assertEquals(12.0, show.fontSize, 1e-9);
        assertEquals(100.0, show.x, 1e-9);
        assertEquals(92.0, show.y, 1e-9);
    }

    @Test
    public void testTransformedText() {
        interpret("q 1 0 0 1 50 100 cm BT /F1 10 Tf 10 20 Td (A) Tj ET Q");
        ShowText show = recorder.text.get(0);
        assertEquals(60.0, show.x, 1e-9);
        assertEquals(792.0 - 120.0, show.y, 1e-9);
    }

    @Test
    public void testLeadingAndNextLine() {
        interpret("BT /F1 10 Tf 100 700 Td 0 -14 TD (a) Tj T* (b) Tj ET");
        assertEquals(2, recorder.text.size());
        assertEquals(106.0, recorder.text.get(0).y, 1e-9);
        assertEquals(120.0, recorder.text.get(1).y, 1e-9);
        assertEquals(100.0, recorder.text.get(1).x, 1e-9);
    }

    @Test
    public void testQuoteOperators() {
        interpret("BT /F1 10 Tf 14 TL 100 700 Td (a) ' 1 2 (b) \" ET");
        assertEquals(2, recorder.text.size());
        assertEquals(106.0, recorder.text.get(0).y, 1e-9);
        assertEquals(120.0, recorder.text.get(1).y, 1e-9);
        assertEquals(Arrays.asList("b"), recorder.text.get(1).strings);
    }

    @Test
    public void testTextOutsideTextObjectIgnored() {
        interpret("/F1 12 Tf (Hello) Tj BT ET (World) Tj [(x)] TJ");
        assertTrue(recorder.text.isEmpty());
    }

    @Test
    public void testTextMatrixResetAtBeginText() {
        interpret("BT /F1 10 Tf 100 100 Td ET BT (a) Tj ET");
        assertEquals(0.0, recorder.text.get(0).x, 1e-9);
        assertEquals(792.0, recorder.text.get(0).y, 1e-9);
    }

    @Test
    public void testMarkedContentDictionaryIgnored() {
        interpret("/P << /MCID 0 /Alt (alt) >> BDC BT /F1 10 Tf 10 10 Td (x) Tj ET EMC");
        assertEquals(1, recorder.text.size());
        assertEquals(Arrays.asList("x"), recorder.text.get(0).strings);
        assertEquals(10.0, recorder.text.get(0).x, 1e-9);
    }

    @Test
    public void testUnterminatedArrayClosedByOperator() {
        interpret("BT /F1 10 Tf [(a) (b) TJ ET");
        assertEquals(1, recorder.text.size());
        assertEquals(Arrays.asList("a", "b"), recorder.text.get(0).strings);
    }

    // ========== Malformed input ==========

    @Test
    public void testMissingOperandsSkipped() {
        interpret("BT Td /F1 Tf 10 Tj /F1 10 Tf (ok) Tj ET");
        assertEquals(3, interpreter.getSkippedOperatorCount());
        assertEquals(1, recorder.text.size());
        assertEquals(Arrays.asList("ok"), recorder.text.get(0).strings);
        assertEquals(1, interpreter.getFontChangeCount());
    }

    @Test
    public void testTextWithoutFont() {
        interpret("BT (x) Tj ET");
        assertEquals(1, recorder.text.size());
        assertNull(recorder.text.get(0).font);
    }

    @Test
    public void testInlineImageSkipped() {
        interpret("BT /F1 10 Tf 50 50 Td ET BI /W 1 /H 1 /BPC 8 ID \u0000) (EI EI BT /F1 10 Tf (after) Tj ET");
        assertEquals(1, recorder.text.size());
        assertEquals(Arrays.asList("after"), recorder.text.get(0).strings);
        assertEquals(0, interpreter.getSkippedOperatorCount());
    }

    @Test
    public void testFontChangeCount() {
        interpret("BT /F1 10 Tf /F2 12 Tf ET BT /F1 8 Tf ET");
        assertEquals(3, interpreter.getFontChangeCount());
        interpret("BT ET");
        assertEquals(0, interpreter.getFontChangeCount());
    }

    // ========== Graphics state ==========

    @Test
    public void testPaintUsesCurrentTransform() {
        interpret("q 100 0 0 50 10 20 cm /Im1 Do Q /Im2 Do");
        assertEquals(2, recorder.paints.size());
        assertEquals(new Name("Im1"), recorder.paints.get(0).name);
        assertEquals(new Matrix(100, 0, 0, 50, 10, 20), recorder.paints.get(0).ctm);
        assertEquals(new Name("Im2"), recorder.paints.get(1).name);
        assertEquals(Matrix.IDENTITY, recorder.paints.get(1).ctm);
    }

    @Test
    public void testNestedTransforms() {
        interpret("q 2 0 0 2 0 0 cm q 1 0 0 1 10 10 cm /A Do Q /B Do Q /C Do");
        assertEquals(new Matrix(2, 0, 0, 2, 20, 20), recorder.paints.get(0).ctm);
        assertEquals(new Matrix(2, 0, 0, 2, 0, 0), recorder.paints.get(1).ctm);
        assertEquals(Matrix.IDENTITY, recorder.paints.get(2).ctm);
    }

    @Test
    public void testUnbalancedRestoreResetsState() {
        interpret("2 0 0 2 0 0 cm Q /Im1 Do");
        assertEquals(Matrix.IDENTITY, recorder.paints.get(0).ctm);
    }

    @Test
    public void testDoWithoutName() {
        interpret("Do /Im1 Do");
        assertEquals(1, recorder.paints.size());
        assertEquals(1, interpreter.getSkippedOperatorCount());
    }

    @Test
    public void testMediaBoxOrigin() {
        ContentStreamInterpreter offset = new ContentStreamInterpreter(recorder, new double[] { 100, 0, 700, 500 });
        offset.interpret(TestPDFBuilder.ascii("BT /F1 10 Tf 150 400 Td (a) Tj ET"));
        assertEquals(50.0, recorder.text.get(0).x, 1e-9);
        assertEquals(100.0, recorder.text.get(0).y, 1e-9);
    }

    @Test
    public void testConcatenatedStreams() {
        byte[] content = ContentStreamInterpreter.concatenate(Arrays.asList(
                TestPDFBuilder.ascii("BT /F1 10 Tf"),
                TestPDFBuilder.ascii("(x) Tj ET")));
        interpreter.interpret(content);
        assertEquals(1, recorder.text.size());
        assertEquals(F1, recorder.text.get(0).font);
    }

}
