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

package org.complexsvd.math.csvd;

import java.util.Arrays;

import org.apache.commons.math.util.MathUtils;
import org.complexsvd.math.ComplexMatrix;
import org.complexsvd.math.csvd.InvalidDimensionException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Singular value decomposition of a complex <code>m x n</code> matrix,
 * <code>n <= m</code>, after Businger and Golub, Algorithm 358 (CACM 12(10),
 * 1969). <P>
 *
 * <code>A = U S V*</code> where U is <code>m x m</code> unitary, V is
 * <code>n x n</code> unitary and S is <code>m x n</code> diagonal with the
 * singular values in non-increasing order. <P>
 *
 * Three phases:
 * <UL>
 * <LI>Householder reduction of A to a real bidiagonal matrix;
 * <LI>implicit-shift QR diagonalization of the bidiagonal, accumulating
 * rotations into U and V;
 * <LI>sorting, then back transformation of U and V by the Householder
 * reflectors.
 * </UL>
 *
 * A is overwritten. The caller owns every buffer; the engine only allocates
 * three scratch vectors of length <code>n</code> per call and keeps no state
 * between calls, so one instance can serve any number of threads as long as
 * they work on distinct buffers. <P>
 *
 * Negligible elements are judged against a single threshold,
 * <code>eps = ETA * max(s[k] + t[k])</code> taken from the bidiagonal, so the
 * algorithm is scale invariant.
 *
 */
public class ComplexSVD {

    private static final Logger s_log = LoggerFactory.getLogger(ComplexSVD.class);

    /**
     * largest <code>n</code> accepted unless another capacity is given.
     */
    public static final int DEFAULT_CAPACITY = 150;

    /** relative machine precision */
    static final double ETA = MathUtils.EPSILON;

    /** smallest normalized positive number divided by ETA */
    static final double TOL = MathUtils.SAFE_MIN / ETA;

    private final int m_capacity;

    public ComplexSVD() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param capacity
     *            largest column count this engine will decompose
     */
    public ComplexSVD(int capacity) {
        super();
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be positive");
        m_capacity = capacity;
    }

    public int getCapacity() {
        return m_capacity;
    }

    /**
     * decompose using the shape of <code>a</code>: <code>m</code> is its row
     * count, <code>n</code> its column count less the <code>p</code>
     * auxiliary columns.
     *
     * @see #decompose(ComplexMatrix, int, int, int, int, int, double[],
     *      ComplexMatrix, ComplexMatrix)
     */
    public void decompose(ComplexMatrix a, int p, int nu, int nv, double[] s,
            ComplexMatrix u, ComplexMatrix v) {
        decompose(a, a.rowSize(), a.columnSize() - p, p, nu, nv, s, u, v);
    }

    /**
     * compute the singular values and, on request, singular vectors of the
     * leading <code>m x n</code> block of <code>a</code>.
     *
     * @param a
     *            input, at least <code>m x (n+p)</code>. Destroyed; on return
     *            columns <code>n..n+p-1</code> hold U* times their original
     *            contents.
     * @param m
     *            row count, <code>n <= m</code>
     * @param n
     *            column count, <code>1 <= n <= capacity</code>
     * @param p
     *            number of auxiliary columns following column <code>n-1</code>
     * @param nu
     *            number of columns of U to compute, <code>0..m</code>
     * @param nv
     *            number of columns of V to compute, <code>0..n</code>
     * @param s
     *            receives the <code>n</code> singular values, largest first
     * @param u
     *            receives the first <code>nu</code> columns of U. When
     *            <code>nu > 0</code> it must be at least
     *            <code>m x max(nu, n)</code>: columns past <code>nu</code> are
     *            used as scratch. Ignored if <code>nu</code> is 0.
     * @param v
     *            receives the first <code>nv</code> columns of V. When
     *            <code>nv > 0</code> it must be at least <code>n x n</code>.
     *            Ignored if <code>nv</code> is 0.
     * @throws InvalidDimensionException
     *             if <code>n < 1</code>, <code>n > capacity</code>,
     *             <code>m < 1</code> or <code>m < n</code>
     * @throws IllegalArgumentException
     *             if a buffer is too small or <code>a</code> holds non-finite
     *             values
     */
    public void decompose(ComplexMatrix a, int m, int n, int p, int nu,
            int nv, double[] s, ComplexMatrix u, ComplexMatrix v) {

        checkDimensions(m, n);
        int uCols = nu > 0 ? Math.max(nu, n) : 0;
        checkBuffers(a, m, n, p, nu, nv, s, u, uCols, v);

        double[] b = new double[n], c = new double[n], t = new double[n];

        Bidiagonalization.reduce(a, m, n, p, b, c);

        // tolerance for negligible elements
        double eps = 0;
        for (int k = 0; k < n; k++) {
            s[k] = b[k];
            t[k] = c[k];
            eps = Math.max(eps, s[k] + t[k]);
        }
        eps *= ETA;

        if (nu > 0)
            _initIdentity(u, m, uCols);
        if (nv > 0)
            _initIdentity(v, n, n);

        BidiagonalQR qr = new BidiagonalQR(s, t, n, eps, nu > 0 ? u : null,
                m, nv > 0 ? v : null, a, p);
        int sweeps = qr.diagonalize();
        qr.sort();

        if (nu > 0)
            Bidiagonalization.backTransformU(a, m, n, b, u, nu);
        if (nv > 0)
            Bidiagonalization.backTransformV(a, n, c, v, nv);

        s_log.debug("csvd {}x{} (p={}, nu={}, nv={}): eps={}, {} QR sweeps, s[0]={}",
                new Object[] { m, n, p, nu, nv, eps, sweeps, s[0] });
    }

    private void checkDimensions(int m, int n) {
        if (n < 1)
            throw new InvalidDimensionException(Kind.N_LESS_THAN_ONE,
                    "Input N < 1");
        if (n > m_capacity)
            throw new InvalidDimensionException(Kind.N_OVER_CAPACITY,
                    String.format("N = %d exceeds capacity %d", n, m_capacity));
        if (m < 1)
            throw new InvalidDimensionException(Kind.M_LESS_THAN_ONE,
                    "Input M < 1");
        if (m < n)
            throw new InvalidDimensionException(Kind.M_LESS_THAN_N,
                    String.format("M < N (%d < %d)", m, n));
    }

    private static void checkBuffers(ComplexMatrix a, int m, int n, int p,
            int nu, int nv, double[] s, ComplexMatrix u, int uCols,
            ComplexMatrix v) {
        if (p < 0)
            throw new IllegalArgumentException("P < 0");
        if (a.rowSize() < m || a.columnSize() < n + p)
            throw new IllegalArgumentException(String.format(
                    "A is %dx%d, need at least %dx%d", a.rowSize(),
                    a.columnSize(), m, n + p));
        if (nu < 0 || nu > m)
            throw new IllegalArgumentException(String.format(
                    "NU = %d outside 0..%d", nu, m));
        if (nv < 0 || nv > n)
            throw new IllegalArgumentException(String.format(
                    "NV = %d outside 0..%d", nv, n));
        if (s == null || s.length < n)
            throw new IllegalArgumentException("S must hold at least N values");
        if (nu > 0
                && (u == null || u.rowSize() < m || u.columnSize() < uCols))
            throw new IllegalArgumentException(String.format(
                    "U must be at least %dx%d", m, uCols));
        if (nv > 0 && (v == null || v.rowSize() < n || v.columnSize() < n))
            throw new IllegalArgumentException(String.format(
                    "V must be at least %dx%d", n, n));
        if (!a.isFinite(m, n + p))
            throw new IllegalArgumentException(String.format(
                    "A(0..%d, 0..%d) holds NaN or infinite values", m - 1,
                    n + p - 1));
    }

    // first columns of the identity, rows 0..rows-1
    private static void _initIdentity(ComplexMatrix mx, int rows, int columns) {
        double[] data = mx.getData();
        for (int i = 0; i < rows; i++)
            Arrays.fill(data, mx.index(i, 0), mx.index(i, columns), 0);
        for (int j = 0; j < columns && j < rows; j++)
            data[mx.index(j, j)] = 1;
    }

    // test helpers

    /**
     * <code>U diag(S) V*</code> over the first <code>n</code> singular
     * triplets, <code>m x n</code>.
     */
    public static ComplexMatrix reconstruct(double[] s, ComplexMatrix u,
            ComplexMatrix v, int m, int n) {
        ComplexMatrix result = new ComplexMatrix(m, n);
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                double re = 0, im = 0;
                for (int k = 0; k < n; k++) {
                    // u(i,k) * s(k) * conj(v(j,k))
                    double ur = u.getRe(i, k) * s[k], ui = u.getIm(i, k) * s[k];
                    double vr = v.getRe(j, k), vi = -v.getIm(j, k);
                    re += ur * vr - ui * vi;
                    im += ur * vi + ui * vr;
                }
                result.setQuick(i, j, re, im);
            }
        }
        return result;
    }

    /**
     * true if the first <code>columns</code> columns of <code>mx</code> are
     * orthonormal within <code>epsilon</code>.
     */
    public static boolean isUnitary(ComplexMatrix mx, int columns,
            double epsilon) {
        int rows = mx.rowSize();
        for (int i = 0; i < columns; i++) {
            for (int j = 0; j <= i; j++) {
                double re = 0, im = 0;
                for (int r = 0; r < rows; r++) {
                    double ar = mx.getRe(r, i), ai = -mx.getIm(r, i);
                    double br = mx.getRe(r, j), bi = mx.getIm(r, j);
                    re += ar * br - ai * bi;
                    im += ar * bi + ai * br;
                }
                if (!(Math.abs((i == j ? 1 : 0) - re) < epsilon && Math
                        .abs(im) < epsilon))
                    return false;
            }
        }
        return true;
    }

}
