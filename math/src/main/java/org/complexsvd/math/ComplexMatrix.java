/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.complexsvd.math;

import org.apache.commons.math.complex.Complex;
import org.apache.commons.math.complex.ComplexField;
import org.apache.commons.math.linear.Array2DRowFieldMatrix;
import org.apache.commons.math.linear.FieldMatrix;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;

/**
 * Dense complex matrix. <P>
 *
 * Elements are kept row-major in a single <code>double[]</code> with real and
 * imaginary parts interleaved, so element <code>(i,j)</code> lives at
 * <code>2*(i*columns+j)</code> (real) and the slot after it (imaginary). No
 * per-element objects are created unless {@link #get(int, int)} is called.
 * <P>
 *
 * Decomposition code works directly on {@link #getData()}.
 *
 */
public class ComplexMatrix {

    private final double[] m_values;
    private final int m_rows;
    private final int m_columns;

    /**
     * zero matrix of the given shape.
     */
    public ComplexMatrix(int rows, int columns) {
        super();
        if (rows < 0 || columns < 0)
            throw new IllegalArgumentException(String.format(
                    "invalid matrix shape %dx%d", rows, columns));
        m_rows = rows;
        m_columns = columns;
        m_values = new double[(rows * columns) << 1];
    }

    /**
     * wrap (or copy) interleaved row-major data.
     *
     * @param shallow
     *            if true, <code>data</code> becomes the backing array.
     */
    public ComplexMatrix(int rows, int columns, double[] data, boolean shallow) {
        super();
        if (data == null)
            throw new IllegalArgumentException("data");
        if (data.length != (rows * columns) << 1)
            throw new IllegalArgumentException(String.format(
                    "%dx%d complex matrix needs %d doubles, got %d", rows,
                    columns, (rows * columns) << 1, data.length));
        m_rows = rows;
        m_columns = columns;
        m_values = shallow ? data : data.clone();
    }

    public ComplexMatrix(Complex[][] data) {
        this(data.length, data.length == 0 ? 0 : data[0].length);
        for (int i = 0; i < m_rows; i++) {
            if (data[i].length != m_columns)
                throw new IllegalArgumentException("ragged rows");
            for (int j = 0; j < m_columns; j++)
                set(i, j, data[i][j]);
        }
    }

    public ComplexMatrix(FieldMatrix<Complex> mx) {
        this(mx.getRowDimension(), mx.getColumnDimension());
        for (int i = 0; i < m_rows; i++)
            for (int j = 0; j < m_columns; j++)
                set(i, j, mx.getEntry(i, j));
    }

    // copy-constructor
    public ComplexMatrix(ComplexMatrix mx) {
        this(mx.m_rows, mx.m_columns, mx.m_values, false);
    }

    /**
     * complex matrix with the imaginary part zero.
     */
    public static ComplexMatrix fromReal(Matrix real) {
        ComplexMatrix result = new ComplexMatrix(real.rowSize(),
                real.columnSize());
        for (int i = 0; i < result.m_rows; i++)
            for (int j = 0; j < result.m_columns; j++)
                result.setQuick(i, j, real.getQuick(i, j), 0);
        return result;
    }

    /**
     * leading <code>columns</code> columns of the <code>rows x rows</code>
     * identity.
     */
    public static ComplexMatrix identity(int rows, int columns) {
        ComplexMatrix result = new ComplexMatrix(rows, columns);
        int d = Math.min(rows, columns);
        for (int i = 0; i < d; i++)
            result.m_values[result.index(i, i)] = 1;
        return result;
    }

    public int rowSize() {
        return m_rows;
    }

    public int columnSize() {
        return m_columns;
    }

    public double getRe(int row, int column) {
        return m_values[index(row, column)];
    }

    public double getIm(int row, int column) {
        return m_values[index(row, column) + 1];
    }

    public Complex get(int row, int column) {
        int l = index(row, column);
        return new Complex(m_values[l], m_values[l + 1]);
    }

    public void setQuick(int row, int column, double re, double im) {
        int l = index(row, column);
        m_values[l] = re;
        m_values[l + 1] = im;
    }

    public void set(int row, int column, Complex value) {
        setQuick(row, column, value.getReal(), value.getImaginary());
    }

    /**
     * modulus of element <code>(row, column)</code>.
     */
    public double abs(int row, int column) {
        int l = index(row, column);
        return Math.sqrt(m_values[l] * m_values[l] + m_values[l + 1]
                * m_values[l + 1]);
    }

    /**
     * @return true if no element is NaN or infinite.
     */
    public boolean isFinite() {
        return isFinite(m_rows, m_columns);
    }

    /**
     * @return true if no element of the leading <code>rows x columns</code>
     *         block is NaN or infinite.
     */
    public boolean isFinite(int rows, int columns) {
        for (int i = 0; i < rows; i++) {
            for (int l = index(i, 0), to = index(i, columns); l < to; l++)
                if (Double.isNaN(m_values[l]) || Double.isInfinite(m_values[l]))
                    return false;
        }
        return true;
    }

    /**
     * matrix product <code>this * other</code>.
     *
     * @throws CardinalityException
     *             if <code>columnSize() != other.rowSize()</code>
     */
    public ComplexMatrix times(ComplexMatrix other) {
        if (m_columns != other.m_rows)
            throw new CardinalityException(m_columns, other.m_rows);
        ComplexMatrix result = new ComplexMatrix(m_rows, other.m_columns);
        double[] a = m_values, b = other.m_values, c = result.m_values;
        int n = other.m_columns;
        for (int i = 0; i < m_rows; i++) {
            for (int k = 0; k < m_columns; k++) {
                int la = (i * m_columns + k) << 1;
                double ar = a[la], ai = a[la + 1];
                if (ar == 0 && ai == 0)
                    continue;
                for (int j = 0; j < n; j++) {
                    int lb = (k * n + j) << 1, lc = (i * n + j) << 1;
                    c[lc] += ar * b[lb] - ai * b[lb + 1];
                    c[lc + 1] += ar * b[lb + 1] + ai * b[lb];
                }
            }
        }
        return result;
    }

    public ComplexMatrix conjugateTranspose() {
        ComplexMatrix result = new ComplexMatrix(m_columns, m_rows);
        for (int i = 0; i < m_rows; i++)
            for (int j = 0; j < m_columns; j++)
                result.setQuick(j, i, getRe(i, j), -getIm(i, j));
        return result;
    }

    /**
     * element-wise comparison: false as soon as the squared distance between
     * two corresponding elements exceeds <code>eps</code>.
     */
    public boolean equalsWithin(ComplexMatrix other, double eps) {
        if (m_rows != other.m_rows || m_columns != other.m_columns)
            return false;
        for (int l = 0; l < m_values.length; l += 2) {
            double dr = m_values[l] - other.m_values[l];
            double di = m_values[l + 1] - other.m_values[l + 1];
            if (!(dr * dr + di * di <= eps))
                return false;
        }
        return true;
    }

    public FieldMatrix<Complex> toFieldMatrix() {
        FieldMatrix<Complex> result = new Array2DRowFieldMatrix<Complex>(
                ComplexField.getInstance(), m_rows, m_columns);
        for (int i = 0; i < m_rows; i++)
            for (int j = 0; j < m_columns; j++)
                result.setEntry(i, j, get(i, j));
        return result;
    }

    public DenseMatrix getRealPart() {
        return _part(0);
    }

    public DenseMatrix getImaginaryPart() {
        return _part(1);
    }

    private DenseMatrix _part(int offset) {
        DenseMatrix result = new DenseMatrix(m_rows, m_columns);
        for (int i = 0; i < m_rows; i++)
            for (int j = 0; j < m_columns; j++)
                result.setQuick(i, j, m_values[index(i, j) + offset]);
        return result;
    }

    /**
     * backing array, interleaved row-major. Changes write through.
     */
    public double[] getData() {
        return m_values;
    }

    /**
     * offset of the real part of <code>(row, column)</code> in
     * {@link #getData()}.
     */
    public int index(int row, int column) {
        return (row * m_columns + column) << 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        for (int i = 0; i < m_rows; i++) {
            if (i > 0)
                sb.append(",\n ");
            sb.append('[');
            for (int j = 0; j < m_columns; j++) {
                if (j > 0)
                    sb.append(", ");
                sb.append(String.format("%.4e%+.4ei", getRe(i, j), getIm(i, j)));
            }
            sb.append(']');
        }
        return sb.append('}').toString();
    }

}
