/*
 * ContentStreamInterpreter.java
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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a page's content stream, tracking the graphics and text state
 * needed to place text and images, and reports text-showing and XObject
 * operators to a {@link ContentHandler}.
 * <p>
 * The stream is read in a single forward pass. Numeric operands accumulate
 * on an operand stack; the most recent name, string and array of strings
 * are held in registers, so an operator such as {@code Tf} or {@code Tj}
 * finds its non-numeric operand without scanning back. All operands are
 * discarded after each operator.
 * <p>
 * {@code q} and {@code Q} save and restore the full graphics state. A
 * {@code Q} without a matching {@code q} resets the state to that at the
 * start of the page. An operator with too few operands is skipped; the
 * rest of the stream is still interpreted. Inline image data is skipped
 * without being tokenized.
 * <p>
 * An interpreter holds the state of one replay and is not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ContentStreamInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentStreamInterpreter.class);

    private final ContentHandler handler;
    private final double originX;
    private final double originY;

    private final List<Double> operands = new ArrayList<>();
    private final Deque<GraphicsState> stack = new ArrayDeque<>();
    private GraphicsState state;
    private boolean inText;

    // Registers for the non-numeric operands
    private Name lastName;
    private Token lastString;
    private List<Token> lastArray;
    private List<Token> arrayStrings;
    private int arrayDepth;
    private int dictDepth;

    private int fontChangeCount;
    private int skippedOperatorCount;

    /**
     * Creates an interpreter for a page.
     *
     * @param handler the handler to receive events
     * @param mediaBox the page's media box {@code [llx lly urx ury]}; event
     *        coordinates are relative to its top left corner
     */
    public ContentStreamInterpreter(ContentHandler handler, double[] mediaBox) {
        this.handler = handler;
        this.originX = Math.min(mediaBox[0], mediaBox[2]);
        this.originY = Math.max(mediaBox[1], mediaBox[3]);
    }

    /**
     * Concatenates the content streams of a page, separated by a newline
     * so that a token cannot span two streams.
     *
     * @param streams the decoded stream contents, in order
     * @return the combined content
     */
    public static byte[] concatenate(List<byte[]> streams) {
        if (streams.size() == 1) {
            return streams.get(0);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] stream : streams) {
            out.write(stream, 0, stream.length);
            out.write('\n');
        }
        return out.toByteArray();
    }

    /**
     * Interprets a content stream from the page's initial state.
     *
     * @param content the decoded content
     */
    public void interpret(byte[] content) {
        reset();
        Lexer lexer = new Lexer(content);
        Token token;
        while ((token = lexer.next()) != null) {
            switch (token.getType()) {
                case DICT_START:
                    dictDepth++;
                    break;
                case DICT_END:
                    if (dictDepth > 0) {
                        dictDepth--;
                    }
                    break;
                case NUMBER:
                    if (dictDepth == 0 && arrayDepth == 0) {
                        operands.add(token.doubleValue());
                    }
                    break;
                case LITERAL_STRING:
                case HEX_STRING:
                    if (dictDepth > 0) {
                        break;
                    }
                    if (arrayDepth > 0) {
                        arrayStrings.add(token);
                    } else {
                        lastString = token;
                        lastName = null;
                    }
                    break;
                case NAME:
                    if (dictDepth == 0 && arrayDepth == 0) {
                        lastName = new Name(token.getText());
                        lastString = null;
                    }
                    break;
                case ARRAY_START:
                    if (dictDepth > 0) {
                        break;
                    }
                    if (arrayDepth++ == 0) {
                        arrayStrings = new ArrayList<>();
                    }
                    break;
                case ARRAY_END:
                    if (dictDepth == 0 && arrayDepth > 0 && --arrayDepth == 0) {
                        lastArray = arrayStrings;
                        arrayStrings = null;
                    }
                    break;
                case KEYWORD:
                    keyword(token.getText(), lexer);
                    break;
                default:
                    break;
            }
        }
    }

    private void keyword(String keyword, Lexer lexer) {
        switch (keyword) {
            case "true":
            case "false":
            case "null":
                return;
            default:
                break;
        }
        if (dictDepth > 0) {
            return;
        }
        if (arrayDepth > 0) {
            // Unterminated array: the operator ends it
            LOGGER.debug("Operator {} inside array, array closed", keyword);
            arrayDepth = 0;
            lastArray = arrayStrings;
            arrayStrings = null;
        }
        if ("ID".equals(keyword)) {
            lexer.skipInlineImageData();
        } else {
            execute(keyword);
        }
        clearOperands();
    }

    // ========== Operator Dispatch ==========

    private void execute(String op) {
        switch (op) {
            // Graphics state
            case "q":
                stack.push(state.copy());
                break;
            case "Q":
                restoreGraphicsState();
                break;
            case "cm":
                if (require(op, 6)) {
                    Matrix m = new Matrix(operand(0, 6), operand(1, 6), operand(2, 6),
                                          operand(3, 6), operand(4, 6), operand(5, 6));
                    state.ctm = m.concat(state.ctm);
                }
                break;

            // Text objects
            case "BT":
                inText = true;
                state.textMatrix = Matrix.IDENTITY;
                state.lineMatrix = Matrix.IDENTITY;
                break;
            case "ET":
                inText = false;
                break;

            // Text state
            case "Tf":
                if (lastName == null) {
                    skip(op);
                } else if (require(op, 1)) {
                    state.font = lastName;
                    state.fontSize = operand(0, 1);
                    fontChangeCount++;
                }
                break;
            case "TL":
                if (require(op, 1)) {
                    state.leading = operand(0, 1);
                }
                break;
            case "Tc":
                if (require(op, 1)) {
                    state.characterSpacing = operand(0, 1);
                }
                break;
            case "Tw":
                if (require(op, 1)) {
                    state.wordSpacing = operand(0, 1);
                }
                break;

            // Text positioning
            case "Td":
                if (require(op, 2)) {
                    state.moveTextPosition(operand(0, 2), operand(1, 2));
                }
                break;
            case "TD":
                if (require(op, 2)) {
                    state.leading = -operand(1, 2);
                    state.moveTextPosition(operand(0, 2), operand(1, 2));
                }
                break;
            case "Tm":
                if (require(op, 6)) {
                    Matrix m = new Matrix(operand(0, 6), operand(1, 6), operand(2, 6),
                                          operand(3, 6), operand(4, 6), operand(5, 6));
                    state.textMatrix = m;
                    state.lineMatrix = m;
                }
                break;
            case "T*":
                state.moveToNextLine();
                break;

            // Text showing
            case "Tj":
                if (inText && requireString(op)) {
                    show(Collections.singletonList(lastString));
                }
                break;
            case "'":
                if (inText && requireString(op)) {
                    state.moveToNextLine();
                    show(Collections.singletonList(lastString));
                }
                break;
            case "\"":
                if (inText && require(op, 2) && requireString(op)) {
                    state.wordSpacing = operand(0, 2);
                    state.characterSpacing = operand(1, 2);
                    state.moveToNextLine();
                    show(Collections.singletonList(lastString));
                }
                break;
            case "TJ":
                if (inText) {
                    if (lastArray == null) {
                        skip(op);
                    } else if (!lastArray.isEmpty()) {
                        show(lastArray);
                    }
                }
                break;

            // XObjects
            case "Do":
                if (lastName == null) {
                    skip(op);
                } else {
                    handler.paintXObject(lastName, state.ctm);
                }
                break;

            default:
                // Operators that do not affect extraction
                break;
        }
    }

    private void restoreGraphicsState() {
        GraphicsState restored;
        if (stack.isEmpty()) {
            LOGGER.debug("Unbalanced Q, graphics state reset");
            restored = new GraphicsState();
        } else {
            restored = stack.pop();
        }
        // The text matrices are not part of the graphics state
        restored.textMatrix = state.textMatrix;
        restored.lineMatrix = state.lineMatrix;
        state = restored;
    }

    private void show(List<Token> strings) {
        Matrix trm = state.getTextRenderingMatrix();
        double x = trm.getE() - originX;
        double y = originY - trm.getF();
        double fontSize = state.fontSize * trm.getVerticalScale();
        handler.showText(state.font, fontSize, strings, x, y);
    }

    // ========== Operands ==========

    private boolean require(String op, int count) {
        if (operands.size() < count) {
            skip(op);
            return false;
        }
        return true;
    }

    private boolean requireString(String op) {
        if (lastString == null) {
            skip(op);
            return false;
        }
        return true;
    }

    private void skip(String op) {
        skippedOperatorCount++;
        LOGGER.debug("Skipping {} with missing operands", op);
    }

    /**
     * Returns operand i of the last count operands on the stack.
     */
    private double operand(int i, int count) {
        return operands.get(operands.size() - count + i);
    }

    private void clearOperands() {
        operands.clear();
        lastName = null;
        lastString = null;
        lastArray = null;
    }

    private void reset() {
        clearOperands();
        stack.clear();
        state = new GraphicsState();
        inText = false;
        arrayStrings = null;
        arrayDepth = 0;
        dictDepth = 0;
        fontChangeCount = 0;
        skippedOperatorCount = 0;
    }

    // ========== Statistics ==========

    /**
     * Returns the number of font selections made by the last replay.
     *
     * @return the number of {@code Tf} operators applied
     */
    public int getFontChangeCount() {
        return fontChangeCount;
    }

    /**
     * Returns the number of operators the last replay skipped for missing
     * operands.
     *
     * @return the skipped operator count
     */
    public int getSkippedOperatorCount() {
        return skippedOperatorCount;
    }

}
