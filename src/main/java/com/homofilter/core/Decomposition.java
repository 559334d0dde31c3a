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

/**
 * Result of {@link GrayscaleDecomposer#decompose}.
 *
 * The raw pair multiplies back to the conditioned input. The normalized
 * pair is min-max stretched independently for display, so their product
 * no longer reconstructs anything.
 */
public final class Decomposition {

    private final double[][] reflectance;

    private final double[][] illumination;

    private final double[][] rawReflectance;

    private final double[][] rawIllumination;

    Decomposition(
            double[][] reflectance, double[][] illumination,
            double[][] rawReflectance, double[][] rawIllumination)
    {
        this.reflectance = reflectance;
        this.illumination = illumination;
        this.rawReflectance = rawReflectance;
        this.rawIllumination = rawIllumination;
    }

    /** High-frequency component, min-max normalized to [0,1]. */
    public double[][] reflectance() {
        return copy(reflectance);
    }

    /** Low-frequency component, min-max normalized to [0,1]. */
    public double[][] illumination() {
        return copy(illumination);
    }

    /** exp(log R) before display normalization. */
    public double[][] rawReflectance() {
        return copy(rawReflectance);
    }

    /** exp(log L) before display normalization. */
    public double[][] rawIllumination() {
        return copy(rawIllumination);
    }

    /**
     * Pointwise {@code R * L} of the raw pair: the normalized input plus
     * EPSILON, up to transform rounding.
     */
    public double[][] reconstruction() {
        int rows = rawReflectance.length, cols = rawReflectance[0].length;
        double[][] result = new double[rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                result[row][col] =
                    rawReflectance[row][col] * rawIllumination[row][col];
            }
        }
        return result;
    }

    private static double[][] copy(double[][] array) {
        double[][] result = new double[array.length][];
        for (int row = 0; row < array.length; row++) {
            result[row] = array[row].clone();
        }
        return result;
    }
}
