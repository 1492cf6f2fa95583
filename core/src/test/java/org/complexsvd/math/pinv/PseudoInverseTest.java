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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.commons.math.complex.Complex;
import org.apache.commons.math.linear.Array2DRowRealMatrix;
import org.apache.commons.math.linear.FieldLUDecompositionImpl;
import org.apache.commons.math.linear.FieldMatrix;
import org.apache.commons.math.linear.LUDecompositionImpl;
import org.apache.commons.math.linear.RealMatrix;
import org.apache.mahout.math.DenseMatrix;
import org.complexsvd.math.ComplexMatrix;
import org.complexsvd.math.csvd.ComplexSVD;
import org.junit.Test;

public class PseudoInverseTest {

    private static final double EPSILON = 1e-4;

    @Test
    public void testMoorePenroseConditions() {
        ComplexMatrix a = PinvFixtures.random(6, 4, 31L);
        ComplexMatrix x = PseudoInverse.compute(new ComplexMatrix(a));

        assertEquals(4, x.rowSize());
        assertEquals(6, x.columnSize());
        assertTrue(PseudoInverse.isPseudoInverse(a, x, 1e-20));
        assertTrue(x.times(a).times(x).equalsWithin(x, 1e-20));
        assertTrue(PinvFixtures.isHermitian(a.times(x), 1e-20));
        assertTrue(PinvFixtures.isHermitian(x.times(a), 1e-20));
    }

    @Test
    public void testSquareNonSingularIsInverse() {
        ComplexMatrix a = PinvFixtures.random(4, 4, 32L);
        double[] s = new double[4];
        new ComplexSVD().decompose(new ComplexMatrix(a), 0, 0, 0, s, null,
                null);
        assertTrue(s[3] > 10 * PseudoInverse.DEFAULT_CUTOFF);

        ComplexMatrix inv = PseudoInverse.compute(new ComplexMatrix(a));
        ComplexMatrix id = ComplexMatrix.identity(4, 4);

        assertTrue(a.times(inv).equalsWithin(id, 1e-20));
        assertTrue(inv.times(a).equalsWithin(id, 1e-20));

        FieldMatrix<Complex> control = new FieldLUDecompositionImpl<Complex>(
                a.toFieldMatrix()).getSolver().getInverse();
        assertTrue(inv.equalsWithin(new ComplexMatrix(control), 1e-12));
    }

    @Test
    public void testNearlySingularScenarioIsTruncated() {
        ComplexMatrix a = PinvFixtures.scenario();
        ComplexMatrix work = new ComplexMatrix(a);
        double[] s = new double[3];
        ComplexMatrix u = new ComplexMatrix(3, 3), v = new ComplexMatrix(3, 3);
        new ComplexSVD().decompose(work, 0, 3, 3, s, u, v);
        assertEquals(5.70e-5, s[2], 1e-6);

        // default cutoff drops the smallest singular value: rank 2
        double[] sInv = s.clone();
        ComplexMatrix inv = new ComplexMatrix(3, 3);
        PseudoInverse.build(sInv, u, v, 3, 3, inv);
        assertEquals(0, sInv[2], 0);
        assertTrue(PseudoInverse.isPseudoInverse(a, inv, 1e-8));
        assertFalse(a.times(inv).equalsWithin(ComplexMatrix.identity(3, 3),
                EPSILON));

        // a cutoff under s[2] gives the true inverse
        ComplexMatrix full = new ComplexMatrix(3, 3);
        PseudoInverse.build(s.clone(), u, v, 3, 3, full, 1e-6);
        assertTrue(a.times(full).equalsWithin(ComplexMatrix.identity(3, 3),
                1e-16));
        FieldMatrix<Complex> control = new FieldLUDecompositionImpl<Complex>(
                a.toFieldMatrix()).getSolver().getInverse();
        assertTrue(full.equalsWithin(new ComplexMatrix(control), 1e-8));
    }

    @Test
    public void testRealMatrixAgreesWithLuInverse() {
        double[][] data = { { 4, -2, 1, 0 }, { 3, 6, -4, 2 }, { 2, 1, 8, -1 },
                { 0, 1, 1, 5 } };
        RealMatrix control = new LUDecompositionImpl(new Array2DRowRealMatrix(
                data)).getSolver().getInverse();

        ComplexMatrix inv = PseudoInverse.compute(ComplexMatrix
                .fromReal(new DenseMatrix(data)));

        for (int i = 0; i < 4; i++)
            for (int j = 0; j < 4; j++) {
                assertEquals(control.getEntry(i, j), inv.getRe(i, j), 1e-12);
                assertEquals(0, inv.getIm(i, j), 1e-12);
            }
    }

    @Test
    public void testZeroSingularValueMapsToZero() {
        ComplexMatrix a = PinvFixtures.withZeroRow(PinvFixtures.scenario(), 2);
        ComplexMatrix work = new ComplexMatrix(a);
        double[] s = new double[3];
        ComplexMatrix u = new ComplexMatrix(3, 3), v = new ComplexMatrix(3, 3);
        new ComplexSVD().decompose(work, 0, 3, 3, s, u, v);
        assertEquals(0, s[2], 1e-12);

        ComplexMatrix inv = new ComplexMatrix(3, 3);
        PseudoInverse.build(s, u, v, 3, 3, inv);

        assertEquals(0, s[2], 0);
        assertTrue(inv.isFinite());
        assertTrue(PseudoInverse.isPseudoInverse(a, inv, 1e-20));
        // the zero row of A becomes a zero column of INV
        for (int i = 0; i < 3; i++)
            assertEquals(0, inv.get(i, 2).abs(), 1e-12);
    }

    @Test
    public void testReciprocalsAndPadding() {
        double[] s = { 2, 1e-5, 9, 9 };
        ComplexMatrix u = ComplexMatrix.identity(4, 4);
        ComplexMatrix v = ComplexMatrix.identity(2, 2);
        ComplexMatrix inv = new ComplexMatrix(2, 4);

        PseudoInverse.build(s, u, v, 4, 2, inv);

        assertArrayEquals(new double[] { 0.5, 0, 0, 0 }, s, 0);
        assertEquals(0.5, inv.getRe(0, 0), 0);
        for (int i = 0; i < 2; i++)
            for (int j = 0; j < 4; j++)
                if (i != 0 || j != 0)
                    assertEquals(0, inv.get(i, j).abs(), 0);
    }

    @Test
    public void testCutoffIsAbsolute() {
        double[] s = { 2, 1e-5 };
        ComplexMatrix inv = new ComplexMatrix(2, 2);
        PseudoInverse.build(s, ComplexMatrix.identity(2, 2),
                ComplexMatrix.identity(2, 2), 2, 2, inv, 1e-6);
        assertEquals(1e5, inv.getRe(1, 1), 1e-6);
    }

    @Test
    public void testResultShapeIsChecked() {
        try {
            PseudoInverse.build(new double[2], ComplexMatrix.identity(3, 3),
                    ComplexMatrix.identity(2, 2), 3, 2, new ComplexMatrix(3, 2));
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // INV must be 2x3
        }
    }

    @Test
    public void testIsPseudoInverseRejectsWrongMatrix() {
        ComplexMatrix a = PinvFixtures.scenario();
        assertFalse(PseudoInverse.isPseudoInverse(a, ComplexMatrix.identity(3,
                3), EPSILON));
    }

}
