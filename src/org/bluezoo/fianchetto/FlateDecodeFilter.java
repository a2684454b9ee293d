/*
 * FlateDecodeFilter.java
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
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Stream filter implementing FlateDecode (zlib/deflate decompression).
 * <p>
 * Supports incremental decompression and the PNG (10 to 15) and TIFF (2)
 * predictors given by {@code /DecodeParms}, which compressed
 * cross-reference streams depend on. Rows are reassembled across chunk
 * boundaries before a predictor is applied.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FlateDecodeFilter extends StreamFilter {

    private static final int OUTPUT_BUFFER_SIZE = 8192;

    private static final Name PREDICTOR = new Name("Predictor");
    private static final Name COLUMNS = new Name("Columns");
    private static final Name COLORS = new Name("Colors");

    private final Inflater inflater;
    private final byte[] outputBuffer;
    private byte[] inputBuffer;
    private int predictor = 1;  // Default: no predictor
    private int columns = 1;
    private int colors = 1;
    private int bitsPerComponent = 8;

    // Predictor state
    private final ByteArrayOutputStream pendingRows = new ByteArrayOutputStream();
    private byte[] prevRow;

    public FlateDecodeFilter() {
        this.inflater = new Inflater();
        this.outputBuffer = new byte[OUTPUT_BUFFER_SIZE];
    }

    @Override
    public void setParams(Map<Name, Object> params) {
        super.setParams(params);
        if (params != null) {
            predictor = intParam(params, PREDICTOR, predictor);
            columns = Math.max(1, intParam(params, COLUMNS, columns));
            colors = Math.max(1, intParam(params, COLORS, colors));
            bitsPerComponent = Math.max(1, intParam(params, Name.BITS_PER_COMPONENT, bitsPerComponent));
        }
    }

    private static int intParam(Map<Name, Object> params, Name key, int defaultValue) {
        Object value = params.get(key);
        return (value instanceof Number) ? ((Number) value).intValue() : defaultValue;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        int len = src.remaining();
        if (inputBuffer == null || inputBuffer.length < len) {
            inputBuffer = new byte[len];
        }
        src.get(inputBuffer, 0, len);
        inflater.setInput(inputBuffer, 0, len);
        inflate();
        return len;
    }

    @Override
    public void close() throws IOException {
        try {
            inflate();
            flushPredictor();
        } finally {
            inflater.end();
            open = false;
        }
        if (next != null) {
            next.close();
        }
    }

    private void inflate() throws IOException {
        try {
            while (!inflater.finished()) {
                int count = inflater.inflate(outputBuffer);
                if (count > 0) {
                    emit(ByteBuffer.wrap(outputBuffer, 0, count));
                } else if (inflater.needsInput()) {
                    break;
                } else if (inflater.needsDictionary()) {
                    throw new IOException("FlateDecode error: preset dictionary required");
                }
            }
        } catch (DataFormatException e) {
            throw new IOException("FlateDecode error: " + e.getMessage(), e);
        }
    }

    @Override
    public void reset() {
        super.reset();
        inflater.reset();
        predictor = 1;
        columns = 1;
        colors = 1;
        bitsPerComponent = 8;
        prevRow = null;
        pendingRows.reset();
    }

    // ========== Predictors ==========

    private void emit(ByteBuffer data) throws IOException {
        if (predictor == 2 || (predictor >= 10 && predictor <= 15)) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            pendingRows.write(chunk, 0, chunk.length);
            decodeRows(false);
        } else {
            writeToNext(data);
        }
    }

    private void flushPredictor() throws IOException {
        if (pendingRows.size() > 0) {
            decodeRows(true);
        }
    }

    /**
     * Decodes all complete rows held in the pending buffer.
     *
     * @param last whether a final partial row should be emitted as is
     */
    private void decodeRows(boolean last) throws IOException {
        long maxRowBits = (Integer.MAX_VALUE - 8L) * 8;
        long pixelBits = (long) colors * bitsPerComponent;
        if (pixelBits > maxRowBits || columns > maxRowBits / pixelBits) {
            throw new IOException("FlateDecode error: predictor row of " + columns + " columns is too large");
        }
        long rowBits = pixelBits * columns;
        int bytesPerPixel = (int) Math.max(1, (pixelBits + 7) / 8);
        int rowBytes = (int) ((rowBits + 7) / 8);
        boolean png = predictor >= 10;
        int fullRowBytes = png ? rowBytes + 1 : rowBytes;

        byte[] input = pendingRows.toByteArray();
        pendingRows.reset();
        ByteArrayOutputStream result = new ByteArrayOutputStream(input.length);
        int pos = 0;
        while (input.length - pos >= fullRowBytes) {
            if (prevRow == null) {
                prevRow = new byte[rowBytes];
            }
            byte[] row;
            if (png) {
                int filterByte = input[pos] & 0xFF;
                row = new byte[rowBytes];
                System.arraycopy(input, pos + 1, row, 0, rowBytes);
                applyPNGFilter(filterByte, row, bytesPerPixel);
            } else {
                row = new byte[rowBytes];
                System.arraycopy(input, pos, row, 0, rowBytes);
                // TIFF Predictor 2: horizontal differencing
                for (int i = bytesPerPixel; i < rowBytes; i++) {
                    row[i] = (byte) (row[i] + row[i - bytesPerPixel]);
                }
            }
            result.write(row, 0, rowBytes);
            prevRow = row;
            pos += fullRowBytes;
        }
        if (pos < input.length) {
            if (last) {
                // Truncated final row
                int start = png ? pos + 1 : pos;
                if (start < input.length) {
                    result.write(input, start, input.length - start);
                }
            } else {
                pendingRows.write(input, pos, input.length - pos);
            }
        }
        writeToNext(ByteBuffer.wrap(result.toByteArray()));
    }

    private void applyPNGFilter(int filterByte, byte[] row, int bytesPerPixel) {
        int rowBytes = row.length;
        switch (filterByte) {
            case 0: // None
                break;
            case 1: // Sub
                for (int i = bytesPerPixel; i < rowBytes; i++) {
                    row[i] = (byte) (row[i] + row[i - bytesPerPixel]);
                }
                break;
            case 2: // Up
                for (int i = 0; i < rowBytes; i++) {
                    row[i] = (byte) (row[i] + prevRow[i]);
                }
                break;
            case 3: // Average
                for (int i = 0; i < rowBytes; i++) {
                    int left = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                    int up = prevRow[i] & 0xFF;
                    row[i] = (byte) (row[i] + (left + up) / 2);
                }
                break;
            case 4: // Paeth
                for (int i = 0; i < rowBytes; i++) {
                    int a = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                    int b = prevRow[i] & 0xFF;
                    int c = (i >= bytesPerPixel) ? (prevRow[i - bytesPerPixel] & 0xFF) : 0;
                    row[i] = (byte) (row[i] + paethPredictor(a, b, c));
                }
                break;
            default:
                break;
        }
    }

    private static int paethPredictor(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        if (pb <= pc) {
            return b;
        }
        return c;
    }

}
