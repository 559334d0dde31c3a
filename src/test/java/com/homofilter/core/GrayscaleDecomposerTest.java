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

package com.homofilter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.homofilter.algorithms.FilterParams;
import com.homofilter.algorithms.ParameterException;
import com.homofilter.algorithms.Samples;
import com.homofilter.algorithms.ShapeException;
import com.homofilter.algorithms.TransformMethod;

class GrayscaleDecomposerTest {

    private static double[][] unevenlyLitTexture(int rows, int cols) {
        Random random = new Random(42);
        double[][] image = new double[rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                double light = 0.2 + 0.7 * col / (cols - 1.0);
                double texture = 0.5 + 0.5 * random.nextDouble();
                image[row][col] = light * texture;
            }
        }
        return image;
    }

    @Test
    void flatImageHasFlatComponents() {
        double[][] image = new double[4][4];
        for (double[] row : image) {
            java.util.Arrays.fill(row, 0.5);
        }
        Decomposition result = GrayscaleDecomposer.decompose(
            image, new FilterParams(1, 1), TransformMethod.DIRECT);

        double[][] illumination = result.illumination();
        double[][] reflectance = result.reflectance();
        double[][] rawIllumination = result.rawIllumination();
        double[][] reconstruction = result.reconstruction();
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                assertEquals(illumination[0][0], illumination[row][col],
                             1e-6);
                assertEquals(reflectance[0][0], reflectance[row][col], 1e-6);
                assertEquals(0.5, rawIllumination[row][col], 1e-5);
                assertEquals(0.5, reconstruction[row][col], 1e-5);
            }
        }
    }

    @Test
    void rawComponentsAddUpToLogImage() {
        double[][] image = unevenlyLitTexture(24, 20);
        for (TransformMethod method : TransformMethod.values()) {
            Decomposition result = GrayscaleDecomposer.decompose(
                image, new FilterParams(5, 2), method);
            double[][] logImage = Samples.log(image);
            double[][] rawReflectance = result.rawReflectance();
            double[][] rawIllumination = result.rawIllumination();
            for (int row = 0; row < image.length; row++) {
                for (int col = 0; col < image[row].length; col++) {
                    double sum = Math.log(rawReflectance[row][col])
                               + Math.log(rawIllumination[row][col]);
                    assertEquals(logImage[row][col], sum, 1e-9,
                                 method.name());
                }
            }
        }
    }

    @Test
    void directAndFastDecompositionsAgree() {
        double[][] image = unevenlyLitTexture(12, 10);
        FilterParams params = new FilterParams(3, 2);
        Decomposition direct = GrayscaleDecomposer.decompose(
            image, params, TransformMethod.DIRECT);
        Decomposition fast = GrayscaleDecomposer.decompose(
            image, params, TransformMethod.FAST);
        assertEquals(direct.illumination()[5][7],
                     fast.illumination()[5][7], 1e-9);
        assertEquals(direct.reflectance()[11][0],
                     fast.reflectance()[11][0], 1e-9);
    }

    @Test
    void outputsAreNormalizedToUnitRange() {
        Decomposition result = GrayscaleDecomposer.decompose(
            unevenlyLitTexture(32, 32), FilterParams.defaults());
        for (double[][] output : new double[][][] {
                result.reflectance(), result.illumination()}) {
            double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
            for (double[] row : output) {
                for (double value : row) {
                    min = Math.min(min, value);
                    max = Math.max(max, value);
                }
            }
            assertEquals(0.0, min, 1e-12);
            assertTrue(max <= 1.0 && max > 0.99);
        }
    }

    @Test
    void illuminationFollowsTheLightGradient() {
        Decomposition result = GrayscaleDecomposer.decompose(
            unevenlyLitTexture(32, 32), new FilterParams(2, 2));
        double[][] illumination = result.illumination();
        double left = 0, right = 0;
        for (double[] row : illumination) {
            left += row[8];
            right += row[20];
        }
        assertTrue(right > left,
                   "Brighter side should carry more illumination");
    }

    @Test
    void byteSamplesGiveSameResultAsUnitSamples() {
        double[][] unit = unevenlyLitTexture(8, 8);
        double[][] bytes = new double[8][8];
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                bytes[row][col] = unit[row][col] * 255.0;
            }
        }
        FilterParams params = new FilterParams(2, 1);
        Decomposition fromUnit = GrayscaleDecomposer.decompose(unit, params);
        Decomposition fromBytes = GrayscaleDecomposer.decompose(bytes, params);
        assertEquals(fromUnit.reflectance()[3][4],
                     fromBytes.reflectance()[3][4], 1e-9);
    }

    @Test
    void malformedInputFails() {
        assertThrows(ShapeException.class,
            () -> GrayscaleDecomposer.decompose(
                new double[0][0], FilterParams.defaults()));
        assertThrows(ParameterException.class,
            () -> GrayscaleDecomposer.decompose(
                new double[4][4], new FilterParams(0, 2)));
    }

    @Test
    void accessorsReturnCopies() {
        Decomposition result = GrayscaleDecomposer.decompose(
            unevenlyLitTexture(4, 4), FilterParams.defaults());
        result.reflectance()[0][0] = 42;
        assertTrue(result.reflectance()[0][0] <= 1.0);
    }

    @Test
    void explicitByteRangeOverridesTheGuess() {
        double[][] dark = {{0, 1, 0, 1}, {1, 0, 1, 0}};
        Decomposition result = GrayscaleDecomposer.decompose(
            dark, new FilterParams(1, 1), TransformMethod.FAST, true);
        double[][] reconstruction = result.reconstruction();
        assertEquals(1.0 / 255.0 + Samples.EPSILON, reconstruction[0][1],
                     1e-12);
        assertEquals(Samples.EPSILON, reconstruction[0][0], 1e-12);

        Decomposition guessed = GrayscaleDecomposer.decompose(
            dark, new FilterParams(1, 1), TransformMethod.FAST);
        assertEquals(1.0 + Samples.EPSILON, guessed.reconstruction()[0][1],
                     1e-9);
    }
}
