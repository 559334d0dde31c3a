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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FilterDesignerTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void highpassAndLowpassAreComplementary() {
        int[][] shapes = {{16, 16}, {9, 12}, {1, 5}, {33, 7}};
        double[] cutoffs = {0.5, 3, 30};
        int[] orders = {1, 2, 5};
        for (int[] shape : shapes) {
            for (double cutoff : cutoffs) {
                for (int order : orders) {
                    double[][] high = FilterDesigner.butterworthHighpass(
                        shape[0], shape[1], cutoff, order);
                    double[][] low = FilterDesigner.butterworthLowpass(
                        shape[0], shape[1], cutoff, order);
                    for (int u = 0; u < shape[0]; u++) {
                        for (int v = 0; v < shape[1]; v++) {
                            assertEquals(1.0, high[u][v] + low[u][v],
                                         TOLERANCE);
                        }
                    }
                }
            }
        }
    }

    @Test
    void centerValues() {
        double[][] high = FilterDesigner.butterworthHighpass(8, 9, 2, 1);
        double[][] low = FilterDesigner.butterworthLowpass(8, 9, 2, 1);
        assertEquals(0.0, high[4][4], TOLERANCE);
        assertEquals(1.0, low[4][4], 0.0);
    }

    @Test
    void gainIsHalfAtCutoff() {
        double[][] high = FilterDesigner.butterworthHighpass(21, 21, 5, 3);
        double[][] low = FilterDesigner.butterworthLowpass(21, 21, 5, 3);
        assertEquals(0.5, high[15][10], TOLERANCE);
        assertEquals(0.5, low[10][5], TOLERANCE);
    }

    @Test
    void radialDistanceUsesIntegerCenter() {
        assertEquals(0.0, FilterDesigner.radialDistance(2, 3, 5, 7), 0.0);
        assertEquals(5.0, FilterDesigner.radialDistance(5, 6, 4, 4), 0.0);
    }

    @Test
    void masksAreSymmetricAboutCenter() {
        double[][] low = FilterDesigner.butterworthLowpass(9, 9, 2, 2);
        assertEquals(low[4 - 3][4 + 2], low[4 + 3][4 - 2], 0.0);
        assertEquals(low[4 + 1][4], low[4][4 - 1], 0.0);
    }

    @Test
    void shapedFilterSpansGammaRange() {
        FilterParams params = new FilterParams(4, 2, 0.3, 2.0);
        double[][] mask =
            FilterDesigner.homomorphicShapedFilter(32, 32, params);
        double[][] high = FilterDesigner.butterworthHighpass(32, 32, params);
        for (int u = 0; u < 32; u++) {
            for (int v = 0; v < 32; v++) {
                assertTrue(mask[u][v] >= 0.3 && mask[u][v] <= 2.0);
                assertEquals(1.7 * high[u][v] + 0.3, mask[u][v], TOLERANCE);
            }
        }
        assertEquals(0.3, mask[16][16], TOLERANCE);
        assertEquals(2.0, mask[0][0], 1e-2);
    }

    @Test
    void equalGammasGiveFlatMask() {
        double[][] mask =
            FilterDesigner.homomorphicShapedFilter(6, 6, 3, 2, 1.0, 1.0);
        for (double[] row : mask) {
            for (double value : row) {
                assertEquals(1.0, value, 0.0);
            }
        }
    }

    @Test
    void invalidParametersFail() {
        assertThrows(ParameterException.class,
            () -> FilterDesigner.butterworthHighpass(4, 4, 0, 2));
        assertThrows(ParameterException.class,
            () -> FilterDesigner.butterworthLowpass(4, 4, -1, 2));
        assertThrows(ParameterException.class,
            () -> FilterDesigner.butterworthLowpass(4, 4, Double.NaN, 2));
        assertThrows(ParameterException.class,
            () -> FilterDesigner.butterworthHighpass(4, 4, 10, 0));
        assertThrows(ParameterException.class,
            () -> FilterDesigner.homomorphicShapedFilter(
                4, 4, 10, 2, 2.0, 0.3));
        assertThrows(ShapeException.class,
            () -> FilterDesigner.butterworthLowpass(0, 4, 10, 2));
    }

    @Test
    void defaultParameters() {
        FilterParams params = FilterParams.defaults();
        assertEquals(30, params.cutoff, 0.0);
        assertEquals(2, params.order);
        assertEquals(0.3, params.gammaLow, 0.0);
        assertEquals(2.0, params.gammaHigh, 0.0);
    }
}
