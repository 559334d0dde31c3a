/*
 * Copyright (C) 2026 The Homofilter Authors.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.homofilter.algorithms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SamplesTest {

    @Test
    void byteRangeIsDetectedFromAnySampleAboveOne() {
        assertFalse(Samples.isByteRange(new double[][] {{0, 0.5, 1.0}}));
        assertTrue(Samples.isByteRange(new double[][] {{0, 0.5, 2.0}}));
        assertTrue(Samples.isByteRange(
            new double[][] {{0.1}}, new double[][] {{255}}));
    }

    @Test
    void toUnitRangeScalesByteSamplesAndClampsNegatives() {
        double[][] result =
            Samples.toUnitRange(new double[][] {{255, 51, -3}});
        assertEquals(1.0, result[0][0], 1e-15);
        assertEquals(0.2, result[0][1], 1e-15);
        assertEquals(0.0, result[0][2], 0.0);

        double[][] unit = Samples.toUnitRange(new double[][] {{0.25, 1.0}});
        assertEquals(0.25, unit[0][0], 0.0);
    }

    @Test
    void logOfZeroIsFinite() {
        double[][] log = Samples.log(new double[][] {{0.0}});
        assertEquals(Math.log(Samples.EPSILON), log[0][0], 1e-12);
    }

    @Test
    void colorShapeRequiresThreeMatchingPlanes() {
        assertThrows(ShapeException.class,
            () -> Samples.checkColorShape(new double[2][4][4]));
        assertThrows(ShapeException.class,
            () -> Samples.checkColorShape(new double[4][4][4]));
        assertThrows(ShapeException.class,
            () -> Samples.checkColorShape(new double[][][] {
                new double[4][4], new double[4][4], new double[4][3]}));
        assertThrows(ShapeException.class,
            () -> Samples.checkColorShape(new double[3][0][0]));
        Samples.checkColorShape(new double[3][2][5]);
    }
}
