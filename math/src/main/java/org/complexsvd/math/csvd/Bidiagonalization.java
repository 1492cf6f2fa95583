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

import org.complexsvd.math.ComplexMatrix;

/**
 * Householder reduction of a complex matrix to real bidiagonal form, and the
 * back transformation that turns the rotated identities of the QR phase into
 * singular vectors. <P>
 *
 * The reflector vectors stay in A: column reflector <code>k</code> in
 * <code>A(k..m-1, k)</code>, row reflector <code>k+1</code> in
 * <code>A(k, k+1..n-1)</code>. <code>b[k]</code> and <code>c[k+1]</code> are
 * the diagonal and super-diagonal magnitudes; a zero means the reflector was
 * skipped. <P>
 *
 * Elements are addressed in the interleaved backing array of
 * {@link ComplexMatrix}; <code>(re, im)</code> pairs are spelled out by hand.
 *
 */
final class Bidiagonalization {

    private Bidiagonalization() {
    }

    /**
     * reduce the leading <code>m x n</code> block of A in place.
     * Column reflectors also hit the <code>p</code> auxiliary columns
     * <code>n..n+p-1</code>; row reflectors do not.
     */
    static void reduce(ComplexMatrix mx, int m, int n, int p, double[] b,
            double[] c) {
        double[] a = mx.getData();
        int cols = mx.columnSize();
        int np = n + p;

        c[0] = 0;
        for (int k = 0; k < n; k++) {
            int k1 = k + 1;

            // elimination of A(i,k), i = k+1..m-1
            double z = 0;
            for (int i = k; i < m; i++) {
                int l = (i * cols + k) << 1;
                z += a[l] * a[l] + a[l + 1] * a[l + 1];
            }
            b[k] = 0;

            if (z > ComplexSVD.TOL) {
                z = Math.sqrt(z);
                b[k] = z;
                int lkk = (k * cols + k) << 1;
                double w = cabs(a, lkk);
                double qr = 1, qi = 0;
                if (w != 0) {
                    qr = a[lkk] / w;
                    qi = a[lkk + 1] / w;
                }
                a[lkk] = qr * (z + w);
                a[lkk + 1] = qi * (z + w);

                double d = z * (z + w);
                for (int j = k1; j < np; j++) {
                    qr = 0;
                    qi = 0;
                    for (int i = k; i < m; i++) {
                        int lk = (i * cols + k) << 1, lj = (i * cols + j) << 1;
                        qr += a[lk] * a[lj] + a[lk + 1] * a[lj + 1];
                        qi += a[lk] * a[lj + 1] - a[lk + 1] * a[lj];
                    }
                    qr /= d;
                    qi /= d;
                    for (int i = k; i < m; i++) {
                        int lk = (i * cols + k) << 1, lj = (i * cols + j) << 1;
                        a[lj] -= qr * a[lk] - qi * a[lk + 1];
                        a[lj + 1] -= qr * a[lk + 1] + qi * a[lk];
                    }
                }

                // phase transformation, makes the pivot real
                if (k1 < np) {
                    w = cabs(a, lkk);
                    qr = -a[lkk] / w;
                    qi = a[lkk + 1] / w;
                    for (int j = k1; j < np; j++)
                        scale(a, (k * cols + j) << 1, qr, qi);
                }
            }

            if (k == n - 1)
                break;

            // elimination of A(k,j), j = k+2..n-1
            z = 0;
            for (int j = k1; j < n; j++) {
                int l = (k * cols + j) << 1;
                z += a[l] * a[l] + a[l + 1] * a[l + 1];
            }
            c[k1] = 0;

            if (z > ComplexSVD.TOL) {
                z = Math.sqrt(z);
                c[k1] = z;
                int lk1 = (k * cols + k1) << 1;
                double w = cabs(a, lk1);
                double qr = 1, qi = 0;
                if (w != 0) {
                    qr = a[lk1] / w;
                    qi = a[lk1 + 1] / w;
                }
                a[lk1] = qr * (z + w);
                a[lk1 + 1] = qi * (z + w);

                double d = z * (z + w);
                for (int i = k1; i < m; i++) {
                    qr = 0;
                    qi = 0;
                    for (int j = k1; j < n; j++) {
                        int lk = (k * cols + j) << 1, li = (i * cols + j) << 1;
                        qr += a[lk] * a[li] + a[lk + 1] * a[li + 1];
                        qi += a[lk] * a[li + 1] - a[lk + 1] * a[li];
                    }
                    qr /= d;
                    qi /= d;
                    for (int j = k1; j < n; j++) {
                        int lk = (k * cols + j) << 1, li = (i * cols + j) << 1;
                        a[li] -= qr * a[lk] - qi * a[lk + 1];
                        a[li + 1] -= qr * a[lk + 1] + qi * a[lk];
                    }
                }

                // phase transformation
                w = cabs(a, lk1);
                qr = -a[lk1] / w;
                qi = a[lk1 + 1] / w;
                for (int i = k1; i < m; i++)
                    scale(a, (i * cols + k1) << 1, qr, qi);
            }
        }
    }

    /**
     * apply the column reflectors (and their phases) to the first
     * <code>nu</code> columns of U, last reflector first.
     */
    static void backTransformU(ComplexMatrix mx, int m, int n, double[] b,
            ComplexMatrix umx, int nu) {
        double[] a = mx.getData(), u = umx.getData();
        int cols = mx.columnSize(), ucols = umx.columnSize();

        for (int k = n - 1; k >= 0; k--) {
            if (b[k] == 0)
                continue;
            int lkk = (k * cols + k) << 1;
            double akk = cabs(a, lkk);
            double qr = -a[lkk] / akk, qi = -a[lkk + 1] / akk;
            for (int j = 0; j < nu; j++)
                scale(u, (k * ucols + j) << 1, qr, qi);

            double d = akk * b[k];
            for (int j = 0; j < nu; j++) {
                qr = 0;
                qi = 0;
                for (int i = k; i < m; i++) {
                    int la = (i * cols + k) << 1, lu = (i * ucols + j) << 1;
                    qr += a[la] * u[lu] + a[la + 1] * u[lu + 1];
                    qi += a[la] * u[lu + 1] - a[la + 1] * u[lu];
                }
                qr /= d;
                qi /= d;
                for (int i = k; i < m; i++) {
                    int la = (i * cols + k) << 1, lu = (i * ucols + j) << 1;
                    u[lu] -= qr * a[la] - qi * a[la + 1];
                    u[lu + 1] -= qr * a[la + 1] + qi * a[la];
                }
            }
        }
    }

    /**
     * apply the row reflectors (and their phases) to the first
     * <code>nv</code> columns of V.
     */
    static void backTransformV(ComplexMatrix mx, int n, double[] c,
            ComplexMatrix vmx, int nv) {
        double[] a = mx.getData(), v = vmx.getData();
        int cols = mx.columnSize(), vcols = vmx.columnSize();

        for (int k = n - 2; k >= 0; k--) {
            int k1 = k + 1;
            if (c[k1] == 0)
                continue;
            int lk1 = (k * cols + k1) << 1;
            double ak = cabs(a, lk1);
            double qr = -a[lk1] / ak, qi = a[lk1 + 1] / ak;
            for (int j = 0; j < nv; j++)
                scale(v, (k1 * vcols + j) << 1, qr, qi);

            double d = ak * c[k1];
            for (int j = 0; j < nv; j++) {
                qr = 0;
                qi = 0;
                for (int i = k1; i < n; i++) {
                    int la = (k * cols + i) << 1, lv = (i * vcols + j) << 1;
                    qr += a[la] * v[lv] - a[la + 1] * v[lv + 1];
                    qi += a[la] * v[lv + 1] + a[la + 1] * v[lv];
                }
                qr /= d;
                qi /= d;
                for (int i = k1; i < n; i++) {
                    int la = (k * cols + i) << 1, lv = (i * vcols + j) << 1;
                    // q * conj(A(k,i))
                    v[lv] -= qr * a[la] + qi * a[la + 1];
                    v[lv + 1] -= qi * a[la] - qr * a[la + 1];
                }
            }
        }
    }

    static double cabs(double[] data, int l) {
        return Math.sqrt(data[l] * data[l] + data[l + 1] * data[l + 1]);
    }

    // data[l] *= (qr, qi)
    private static void scale(double[] data, int l, double qr, double qi) {
        double xr = data[l], xi = data[l + 1];
        data[l] = qr * xr - qi * xi;
        data[l + 1] = qr * xi + qi * xr;
    }

}
