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

package org.complexsvd.math.pinv;

import org.complexsvd.math.ComplexMatrix;
import org.complexsvd.math.csvd.ComplexSVD;

/**
 * Moore-Penrose pseudo-inverse from a singular value decomposition: <P>
 *
 * <code>INV = V S+ U*</code> <P>
 *
 * where <code>S+</code> holds the reciprocals of the singular values above a
 * fixed cutoff, zero for the rest, padded with zeros from length
 * <code>n</code> to <code>m</code>. The cutoff is absolute, unlike the scale
 * relative threshold of the decomposition itself.
 *
 */
public final class PseudoInverse {

    /**
     * singular values at or below this are treated as zero.
     */
    public static final double DEFAULT_CUTOFF = 1e-4;

    private PseudoInverse() {
    }

    /**
     * decompose <code>a</code> and return its <code>n x m</code>
     * pseudo-inverse. <code>a</code> is destroyed.
     */
    public static ComplexMatrix compute(ComplexMatrix a) {
        return compute(new ComplexSVD(), a, DEFAULT_CUTOFF);
    }

    public static ComplexMatrix compute(ComplexSVD svd, ComplexMatrix a,
            double cutoff) {
        int m = a.rowSize(), n = a.columnSize();
        double[] s = new double[m];
        ComplexMatrix u = new ComplexMatrix(m, m);
        ComplexMatrix v = new ComplexMatrix(n, n);
        svd.decompose(a, m, n, 0, m, n, s, u, v);

        ComplexMatrix inv = new ComplexMatrix(n, m);
        build(s, u, v, m, n, inv, cutoff);
        return inv;
    }

    public static void build(double[] s, ComplexMatrix u, ComplexMatrix v,
            int m, int n, ComplexMatrix inv) {
        build(s, u, v, m, n, inv, DEFAULT_CUTOFF);
    }

    /**
     * fill <code>inv</code> with <code>V S+ U*</code>. <P>
     *
     * <code>s</code> is consumed: on return <code>s[0..n-1]</code> holds
     * <code>S+</code> and whatever of <code>s[n..m-1]</code> exists is zero.
     *
     * @param s
     *            singular values, at least <code>n</code>
     * @param u
     *            left singular vectors, at least <code>m x n</code>
     * @param v
     *            right singular vectors, at least <code>n x n</code>
     * @param inv
     *            receives the result, <code>n x m</code>
     * @param cutoff
     *            absolute threshold for zero singular values
     */
    public static void build(double[] s, ComplexMatrix u, ComplexMatrix v,
            int m, int n, ComplexMatrix inv, double cutoff) {
        if (s.length < n)
            throw new IllegalArgumentException("S must hold at least N values");
        if (u.rowSize() < m || u.columnSize() < n)
            throw new IllegalArgumentException(String.format(
                    "U must be at least %dx%d", m, n));
        if (v.rowSize() < n || v.columnSize() < n)
            throw new IllegalArgumentException(String.format(
                    "V must be at least %dx%d", n, n));
        if (inv.rowSize() != n || inv.columnSize() != m)
            throw new IllegalArgumentException(String.format(
                    "INV must be %dx%d", n, m));

        for (int i = 0; i < n; i++)
            s[i] = s[i] > cutoff ? 1 / s[i] : 0;
        for (int i = n; i < m && i < s.length; i++)
            s[i] = 0;

        // padding terms k >= n vanish
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                double re = 0, im = 0;
                for (int k = 0; k < n; k++) {
                    if (s[k] == 0)
                        continue;
                    // v(i,k) * s(k) * conj(u(j,k))
                    double vr = v.getRe(i, k) * s[k], vi = v.getIm(i, k) * s[k];
                    double ur = u.getRe(j, k), ui = -u.getIm(j, k);
                    re += vr * ur - vi * ui;
                    im += vr * ui + vi * ur;
                }
                inv.setQuick(i, j, re, im);
            }
        }
    }

    /**
     * true if <code>A INV A</code> equals <code>A</code> element-wise within
     * <code>eps</code> (squared distance).
     */
    public static boolean isPseudoInverse(ComplexMatrix a, ComplexMatrix inv,
            double eps) {
        return a.times(inv).times(a).equalsWithin(a, eps);
    }

}
