/*
 * Matrix.java
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

/**
 * An immutable affine transformation matrix {@code [a b c d e f]}, as used
 * for the current transformation matrix and the text matrices.
 * <p>
 * Points are row vectors: {@code [x' y' 1] = [x y 1] × M}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Matrix {

    public static final Matrix IDENTITY = new Matrix(1, 0, 0, 1, 0, 0);

    private final double a, b, c, d, e, f;

    public Matrix(double a, double b, double c, double d, double e, double f) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
        this.e = e;
        this.f = f;
    }

    public static Matrix translation(double tx, double ty) {
        return new Matrix(1, 0, 0, 1, tx, ty);
    }

    public double getA() {
        return a;
    }

    public double getB() {
        return b;
    }

    public double getC() {
        return c;
    }

    public double getD() {
        return d;
    }

    public double getE() {
        return e;
    }

    public double getF() {
        return f;
    }

    /**
     * Returns the product {@code this × m}: the transformation that applies
     * this matrix first and then {@code m}.
     *
     * @param m the matrix to apply after this one
     * @return the product
     */
    public Matrix concat(Matrix m) {
        return new Matrix(a * m.a + b * m.c,
                          a * m.b + b * m.d,
                          c * m.a + d * m.c,
                          c * m.b + d * m.d,
                          e * m.a + f * m.c + m.e,
                          e * m.b + f * m.d + m.f);
    }

    /**
     * Returns this matrix preceded by a translation of (tx, ty).
     *
     * @param tx horizontal offset
     * @param ty vertical offset
     * @return {@code T(tx, ty) × this}
     */
    public Matrix translate(double tx, double ty) {
        return new Matrix(a, b, c, d, tx * a + ty * c + e, tx * b + ty * d + f);
    }

    /**
     * Returns the length of the transformed unit vertical vector, the factor
     * by which this matrix scales heights.
     *
     * @return the vertical scale
     */
    public double getVerticalScale() {
        return Math.sqrt(c * c + d * d);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Matrix)) {
            return false;
        }
        Matrix m = (Matrix) obj;
        return a == m.a && b == m.b && c == m.c && d == m.d && e == m.e && f == m.f;
    }

    @Override
    public int hashCode() {
        // Signed zeros hash alike, as they compare equal
        long h = Double.doubleToLongBits(a + 0.0);
        h = h * 31 + Double.doubleToLongBits(b + 0.0);
        h = h * 31 + Double.doubleToLongBits(c + 0.0);
        h = h * 31 + Double.doubleToLongBits(d + 0.0);
        h = h * 31 + Double.doubleToLongBits(e + 0.0);
        h = h * 31 + Double.doubleToLongBits(f + 0.0);
        return (int) (h ^ (h >>> 32));
    }

    @Override
    public String toString() {
        return "[" + a + " " + b + " " + c + " " + d + " " + e + " " + f + "]";
    }

}
