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

import org.apache.mahout.math.DenseVector;
import org.apache.mahout.math.Vector;
import org.complexsvd.math.ComplexMatrix;
import org.complexsvd.math.csvd.ComplexSVD;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Complex SVD solver. <P>
 *
 * Allocates the buffers {@link ComplexSVD} needs and keeps the results. The
 * use pattern is as follows:
 *
 * <UL>
 * <LI>create the solver with the input matrix (<code>m x n</code>,
 * <code>m >= n</code>).
 * <LI>set optional parameters thru setter methods.
 * <LI>call {@link #run()}.
 * <LI>{@link #getSingularValues()}, {@link #getU()} (m x m, if computed),
 * {@link #getV()} (n x n, if computed), {@link #getPseudoInverse()}.
 * </UL>
 *
 * Not thread-safe.
 *
 */
public class ComplexSVDSolver {

    private static final Logger s_log = LoggerFactory.getLogger(ComplexSVDSolver.class);

    private final ComplexMatrix m_a;

    private boolean m_computeU = true, m_computeV = true;
    private boolean m_overwrite;
    private int m_capacity = ComplexSVD.DEFAULT_CAPACITY;
    private double m_cutoff = PseudoInverse.DEFAULT_CUTOFF;

    private double[] m_svalues;
    private ComplexMatrix m_u, m_v;
    private ComplexMatrix m_pinv;

    public ComplexSVDSolver(ComplexMatrix a) {
        super();
        if (a == null)
            throw new IllegalArgumentException("a");
        m_a = a;
    }

    /**
     * whether to compute the full <code>m x m</code> U. Default is true.
     */
    public void setComputeU(boolean val) {
        m_computeU = val;
    }

    /**
     * whether to compute the full <code>n x n</code> V. Default is true.
     */
    public void setComputeV(boolean val) {
        m_computeV = val;
    }

    /**
     * if true, the input matrix is decomposed in place and destroyed.
     * Default is false: a working copy is taken.
     */
    public void setOverwrite(boolean val) {
        m_overwrite = val;
    }

    /**
     * largest column count accepted, see {@link ComplexSVD#ComplexSVD(int)}.
     */
    public void setCapacity(int capacity) {
        m_capacity = capacity;
    }

    /**
     * absolute threshold under which singular values count as zero for
     * {@link #getRank()} and {@link #getPseudoInverse()}.
     */
    public void setPseudoInverseCutoff(double cutoff) {
        m_cutoff = cutoff;
    }

    /**
     * run the decomposition.
     *
     * @throws org.complexsvd.math.csvd.InvalidDimensionException
     *             if the input is wider than it is tall, empty, or wider than
     *             the capacity
     */
    public void run() {
        int m = m_a.rowSize(), n = m_a.columnSize();
        ComplexMatrix work = m_overwrite ? m_a : new ComplexMatrix(m_a);

        int nu = m_computeU ? m : 0, nv = m_computeV ? n : 0;
        double[] s = new double[n];
        ComplexMatrix u = m_computeU ? new ComplexMatrix(m, m) : null;
        ComplexMatrix v = m_computeV ? new ComplexMatrix(n, n) : null;

        new ComplexSVD(m_capacity).decompose(work, m, n, 0, nu, nv, s, u, v);

        m_svalues = s;
        m_u = u;
        m_v = v;
        m_pinv = null;
        s_log.debug("solved {}x{}, rank {} (cutoff {})", new Object[] { m, n,
                getRank(), m_cutoff });
    }

    /**
     * @return singular values, largest to smallest
     */
    public double[] getSingularValues() {
        _checkRun();
        return m_svalues;
    }

    public Vector getSingularValueVector() {
        _checkRun();
        return new DenseVector(m_svalues, true);
    }

    /**
     * @return m x m U, or null if not computed
     */
    public ComplexMatrix getU() {
        _checkRun();
        return m_u;
    }

    /**
     * @return n x n V, or null if not computed
     */
    public ComplexMatrix getV() {
        _checkRun();
        return m_v;
    }

    /**
     * number of singular values above the pseudo-inverse cutoff.
     */
    public int getRank() {
        _checkRun();
        int rank = 0;
        for (double sv : m_svalues)
            if (sv > m_cutoff)
                rank++;
        return rank;
    }

    /**
     * <code>n x m</code> pseudo-inverse, built on first call from a copy of
     * the singular values.
     */
    public ComplexMatrix getPseudoInverse() {
        _checkRun();
        if (m_u == null || m_v == null)
            throw new IllegalStateException(
                    "pseudo-inverse requires both U and V to be computed");
        if (m_pinv == null) {
            int m = m_u.rowSize(), n = m_v.rowSize();
            ComplexMatrix pinv = new ComplexMatrix(n, m);
            PseudoInverse.build(m_svalues.clone(), m_u, m_v, m, n, pinv,
                    m_cutoff);
            m_pinv = pinv;
        }
        return m_pinv;
    }

    private void _checkRun() {
        if (m_svalues == null)
            throw new IllegalStateException("solver has not been run");
    }

}
