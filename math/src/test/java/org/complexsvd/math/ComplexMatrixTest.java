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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.commons.math.complex.Complex;
import org.apache.commons.math.linear.FieldMatrix;
import org.apache.mahout.math.CardinalityException;
import org.apache.mahout.math.DenseMatrix;
import org.apache.mahout.math.Matrix;
import org.junit.Test;

public class ComplexMatrixTest {

    private static final double EPSILON = 1e-12;

    @Test
    public void testTimes() {
        // [1+i, 2] * [[3], [-i]] = 3+3i - 2i = 3+i
        ComplexMatrix a = new ComplexMatrix(new Complex[][] { {
                new Complex(1, 1), new Complex(2, 0) } });
        ComplexMatrix b = new ComplexMatrix(new Complex[][] {
                { new Complex(3, 0) }, { new Complex(0, -1) } });
        ComplexMatrix c = a.times(b);
        assertEquals(1, c.rowSize());
        assertEquals(1, c.columnSize());
        assertEquals(3, c.getRe(0, 0), EPSILON);
        assertEquals(1, c.getIm(0, 0), EPSILON);
    }

    @Test
    public void testTimesAgreesWithFieldMatrix() {
        ComplexMatrix a = new ComplexMatrix(3, 2);
        ComplexMatrix b = new ComplexMatrix(2, 4);
        for (int i = 0; i < 3; i++)
            for (int j = 0; j < 2; j++)
                a.setQuick(i, j, i + 0.5 * j, j - i);
        for (int i = 0; i < 2; i++)
            for (int j = 0; j < 4; j++)
                b.setQuick(i, j, 1 - j, 0.25 * i * j);

        FieldMatrix<Complex> control = a.toFieldMatrix().multiply(
                b.toFieldMatrix());
        assertTrue(a.times(b).equalsWithin(new ComplexMatrix(control), 1e-24));
    }

    @Test
    public void testTimesRejectsMismatchedShapes() {
        try {
            new ComplexMatrix(2, 3).times(new ComplexMatrix(2, 3));
            fail("expected CardinalityException");
        } catch (CardinalityException expected) {
            // ok
        }
    }

    @Test
    public void testConjugateTranspose() {
        ComplexMatrix a = new ComplexMatrix(2, 3);
        a.setQuick(0, 2, 1, 2);
        a.setQuick(1, 0, -3, 4);
        ComplexMatrix h = a.conjugateTranspose();
        assertEquals(3, h.rowSize());
        assertEquals(2, h.columnSize());
        assertEquals(1, h.getRe(2, 0), 0);
        assertEquals(-2, h.getIm(2, 0), 0);
        assertEquals(-3, h.getRe(0, 1), 0);
        assertEquals(-4, h.getIm(0, 1), 0);
    }

    @Test
    public void testRealAndImaginaryParts() {
        Matrix real = new DenseMatrix(new double[][] { { 1, 2 }, { 3, 4 } });
        ComplexMatrix a = ComplexMatrix.fromReal(real);
        a.setQuick(1, 0, 3, -7);
        assertEquals(4, a.getRealPart().getQuick(1, 1), 0);
        assertEquals(3, a.getRealPart().getQuick(1, 0), 0);
        assertEquals(-7, a.getImaginaryPart().getQuick(1, 0), 0);
        assertEquals(0, a.getImaginaryPart().getQuick(0, 1), 0);
    }

    @Test
    public void testIdentityTruncation() {
        ComplexMatrix id = ComplexMatrix.identity(4, 2);
        assertEquals(4, id.rowSize());
        assertEquals(2, id.columnSize());
        for (int i = 0; i < 4; i++)
            for (int j = 0; j < 2; j++) {
                assertEquals(i == j ? 1 : 0, id.getRe(i, j), 0);
                assertEquals(0, id.getIm(i, j), 0);
            }
    }

    @Test
    public void testEqualsWithinUsesSquaredDistance() {
        ComplexMatrix a = new ComplexMatrix(1, 2);
        ComplexMatrix b = new ComplexMatrix(1, 2);
        b.setQuick(0, 1, 0.006, 0.008); // |d|^2 = 1e-4
        assertTrue(a.equalsWithin(b, 1.01e-4));
        assertFalse(a.equalsWithin(b, 0.99e-4));
        assertFalse(a.equalsWithin(new ComplexMatrix(2, 1), 1));
    }

    @Test
    public void testCopyIsDeep() {
        ComplexMatrix a = new ComplexMatrix(2, 2);
        ComplexMatrix copy = new ComplexMatrix(a);
        a.setQuick(0, 0, 5, 5);
        assertEquals(0, copy.getRe(0, 0), 0);
        assertEquals(new Complex(5, 5), a.get(0, 0));
    }

    @Test
    public void testWrappedDataLengthIsChecked() {
        try {
            new ComplexMatrix(2, 2, new double[4], true);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // 2x2 needs 8 doubles
        }
        double[] data = new double[8];
        ComplexMatrix a = new ComplexMatrix(2, 2, data, true);
        a.setQuick(1, 1, 2, 3);
        assertEquals(2, data[6], 0);
        assertEquals(3, data[7], 0);
    }

    @Test
    public void testIsFinite() {
        ComplexMatrix a = new ComplexMatrix(2, 2);
        assertTrue(a.isFinite());
        a.setQuick(1, 0, 0, Double.NaN);
        assertFalse(a.isFinite());
    }

    @Test
    public void testIsFiniteOverLeadingBlock() {
        ComplexMatrix a = new ComplexMatrix(3, 4);
        a.setQuick(1, 3, Double.POSITIVE_INFINITY, 0);
        a.setQuick(2, 0, 0, Double.NaN);
        assertTrue(a.isFinite(2, 3));
        assertFalse(a.isFinite(2, 4));
        assertFalse(a.isFinite(3, 1));
        assertTrue(a.isFinite(0, 4));
    }

}
