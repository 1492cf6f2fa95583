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
 * Implicit-shift QR diagonalization of a real bidiagonal matrix with diagonal
 * <code>s</code> and super-diagonal <code>t</code> (<code>t[0]</code> is 0).
 * <P>
 *
 * Every rotation is accumulated into the columns of U (left) and V (right),
 * and left rotations are also applied to the rows of the auxiliary columns
 * of A. Any of the three may be absent. <P>
 *
 * Each singular value index <code>k</code>, bottom up, runs through
 * {@link State}: find a split, cancel <code>t[l]</code> when the diagonal
 * above it vanished, then either converge or take a shifted QR step and
 * split again. The steps are package-visible so they can be driven one at a
 * time. <P>
 *
 * Not thread-safe; one instance per decomposition.
 *
 */
class BidiagonalQR {

    enum State {
        SPLITTING, CANCELLING, SHIFT_STEP, CONVERGED
    }

    private final double[] m_s, m_t;
    private final int m_n;
    private final double m_eps;

    private final ComplexMatrix m_u;
    private final int m_m;
    private final ComplexMatrix m_v;
    private final ComplexMatrix m_a;
    private final int m_p;

    private int m_sweeps;

    /**
     * @param u
     *            rows <code>0..m-1</code> of columns <code>0..n-1</code> get
     *            the left rotations; null to skip
     * @param v
     *            rows <code>0..n-1</code> of columns <code>0..n-1</code> get
     *            the right rotations; null to skip
     * @param a
     *            matrix whose columns <code>n..n+p-1</code> get the left
     *            rotations; may be null if <code>p</code> is 0
     */
    BidiagonalQR(double[] s, double[] t, int n, double eps, ComplexMatrix u,
            int m, ComplexMatrix v, ComplexMatrix a, int p) {
        super();
        m_s = s;
        m_t = t;
        m_n = n;
        m_eps = eps;
        m_u = u;
        m_m = m;
        m_v = v;
        m_a = a;
        m_p = p;
    }

    /**
     * diagonalize, leaving non-negative (unsorted) singular values in
     * <code>s</code>.
     *
     * @return number of QR sweeps taken
     */
    int diagonalize() {
        for (int k = m_n - 1; k >= 0; k--) {
            int l = k;
            State state = State.SPLITTING;
            while (state != State.CONVERGED) {
                switch (state) {
                case SPLITTING:
                    l = findSplit(k);
                    if (!isSplit(l))
                        state = State.CANCELLING;
                    else
                        state = l == k ? State.CONVERGED : State.SHIFT_STEP;
                    break;
                case CANCELLING:
                    cancel(l, k);
                    state = l == k ? State.CONVERGED : State.SHIFT_STEP;
                    break;
                case SHIFT_STEP:
                    shiftStep(l, k);
                    state = State.SPLITTING;
                    break;
                default:
                    throw new IllegalStateException(state.name());
                }
            }
            converge(k);
        }
        return m_sweeps;
    }

    /**
     * scan up from <code>k</code> for the first <code>l</code> with either a
     * negligible <code>t[l]</code> or a negligible <code>s[l-1]</code>.
     */
    int findSplit(int k) {
        for (int l = k; l > 0; l--) {
            if (Math.abs(m_t[l]) <= m_eps)
                return l;
            if (Math.abs(m_s[l - 1]) <= m_eps)
                return l;
        }
        return 0;
    }

    /**
     * true if the block splits above <code>l</code>; false means
     * <code>s[l-1]</code> vanished and <code>t[l]</code> has to be cancelled.
     */
    boolean isSplit(int l) {
        return l == 0 || Math.abs(m_t[l]) <= m_eps;
    }

    /**
     * chase <code>t[l]</code> out along row <code>l-1</code> with left
     * rotations.
     */
    void cancel(int l, int k) {
        double cs = 0, sn = 1;
        int l1 = l - 1;
        for (int i = l; i <= k; i++) {
            double f = sn * m_t[i];
            m_t[i] = cs * m_t[i];
            if (Math.abs(f) <= m_eps)
                break;
            double h = m_s[i];
            double w = Math.sqrt(f * f + h * h);
            m_s[i] = w;
            cs = h / w;
            sn = -f / w;
            rotateLeft(l1, i, cs, sn);
        }
    }

    /**
     * one QR sweep over rows <code>l..k</code>, shifted by the eigenvalue of
     * the trailing 2x2 block closer to <code>s[k]</code>.
     */
    void shiftStep(int l, int k) {
        // origin shift
        double x = m_s[l];
        double y = m_s[k - 1];
        double g = m_t[k - 1];
        double h = m_t[k];
        double w = m_s[k];
        double f = ((y - w) * (y + w) + (g - h) * (g + h)) / (2 * h * y);
        g = Math.sqrt(f * f + 1);
        if (f < 0)
            g = -g;
        f = ((x - w) * (x + w) + (y / (f + g) - h) * h) / x;

        // QR step
        double cs = 1, sn = 1;
        for (int i = l + 1; i <= k; i++) {
            g = m_t[i];
            y = m_s[i];
            h = sn * g;
            g = cs * g;
            w = Math.sqrt(h * h + f * f);
            m_t[i - 1] = w;
            cs = f / w;
            sn = h / w;
            f = x * cs + g * sn;
            g = g * cs - x * sn;
            h = y * sn;
            y = y * cs;
            if (m_v != null)
                rotateColumns(m_v, m_n, i - 1, i, cs, sn);

            w = Math.sqrt(h * h + f * f);
            m_s[i - 1] = w;
            cs = f / w;
            sn = h / w;
            f = cs * g + sn * y;
            x = cs * y - sn * g;
            rotateLeft(i - 1, i, cs, sn);
        }
        m_t[l] = 0;
        m_t[k] = f;
        m_s[k] = x;
        m_sweeps++;
    }

    /**
     * make <code>s[k]</code> non-negative, flipping column <code>k</code> of V
     * along with it.
     */
    void converge(int k) {
        if (m_s[k] >= 0)
            return;
        m_s[k] = -m_s[k];
        if (m_v != null) {
            double[] v = m_v.getData();
            for (int j = 0; j < m_n; j++) {
                int l = m_v.index(j, k);
                v[l] = -v[l];
                v[l + 1] = -v[l + 1];
            }
        }
    }

    /**
     * selection sort of <code>s</code>, descending, interchanging columns of
     * U and V and auxiliary rows of A in lockstep.
     */
    void sort() {
        for (int k = 0; k < m_n; k++) {
            double g = -1;
            int j = k;
            for (int i = k; i < m_n; i++) {
                if (g < m_s[i]) {
                    g = m_s[i];
                    j = i;
                }
            }
            if (j == k)
                continue;

            m_s[j] = m_s[k];
            m_s[k] = g;
            if (m_v != null)
                swapColumns(m_v, m_n, j, k);
            if (m_u != null)
                swapColumns(m_u, m_m, j, k);
            if (m_p > 0) {
                double[] a = m_a.getData();
                for (int c = m_n; c < m_n + m_p; c++)
                    swap(a, m_a.index(j, c), m_a.index(k, c));
            }
        }
    }

    int getSweeps() {
        return m_sweeps;
    }

    private void rotateLeft(int r1, int r2, double cs, double sn) {
        if (m_u != null)
            rotateColumns(m_u, m_m, r1, r2, cs, sn);
        if (m_p > 0) {
            double[] a = m_a.getData();
            for (int c = m_n; c < m_n + m_p; c++)
                rotate(a, m_a.index(r1, c), m_a.index(r2, c), cs, sn);
        }
    }

    private static void rotateColumns(ComplexMatrix mx, int rows, int c1,
            int c2, double cs, double sn) {
        double[] data = mx.getData();
        for (int j = 0; j < rows; j++)
            rotate(data, mx.index(j, c1), mx.index(j, c2), cs, sn);
    }

    // (x, y) <- (x*cs + y*sn, y*cs - x*sn), both parts
    private static void rotate(double[] data, int l1, int l2, double cs,
            double sn) {
        for (int d = 0; d < 2; d++) {
            double x = data[l1 + d];
            double y = data[l2 + d];
            data[l1 + d] = x * cs + y * sn;
            data[l2 + d] = y * cs - x * sn;
        }
    }

    private static void swapColumns(ComplexMatrix mx, int rows, int c1, int c2) {
        double[] data = mx.getData();
        for (int i = 0; i < rows; i++)
            swap(data, mx.index(i, c1), mx.index(i, c2));
    }

    private static void swap(double[] data, int l1, int l2) {
        double re = data[l1], im = data[l1 + 1];
        data[l1] = data[l2];
        data[l1 + 1] = data[l2 + 1];
        data[l2] = re;
        data[l2 + 1] = im;
    }

}
