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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Output scaling. The two policies give different display ranges and are
 * not interchangeable: min-max stretches each array on its own, the
 * percentile policy applies one shared factor to every channel.
 */
public final class RangeNormalizer {

    /** Percentile mapped to 1.0 by {@link #percentileNormalize}. */
    public static final double CLIP_PERCENTILE = 99.0;

    private RangeNormalizer() {
    }

    /**
     * {@code (x - min) / (max - min + EPSILON)}; a constant array maps to
     * all zeros.
     */
    public static double[][] minMaxNormalize(double[][] array) {
        Samples.checkShape(array);
        double[] values = flatten(array);
        double min = StatUtils.min(values);
        double range = StatUtils.max(values) - min + Samples.EPSILON;
        double[][] result = new double[array.length][array[0].length];
        for (int row = 0; row < array.length; row++) {
            for (int col = 0; col < array[row].length; col++) {
                result[row][col] = (array[row][col] - min) / range;
            }
        }
        return result;
    }

    /**
     * Clips negatives to 0, divides every plane by the 99th percentile of
     * all samples (+ EPSILON) and clips the result to [0,1].
     */
    public static double[][][] percentileNormalize(double[][][] planes) {
        if (planes == null || planes.length == 0) {
            throw new ShapeException("No planes to normalize");
        }
        for (double[][] plane : planes) {
            Samples.checkShape(plane);
            Samples.checkSameShape(planes[0], plane);
        }
        int rows = planes[0].length, cols = planes[0][0].length;
        double[] values = new double[planes.length * rows * cols];
        int index = 0;
        for (double[][] plane : planes) {
            for (double[] row : plane) {
                for (double value : row) {
                    values[index++] = Math.max(0.0, value);
                }
            }
        }
        double scale = percentile(values, CLIP_PERCENTILE) + Samples.EPSILON;
        double[][][] result = new double[planes.length][rows][cols];
        for (int plane = 0; plane < planes.length; plane++) {
            for (int row = 0; row < rows; row++) {
                for (int col = 0; col < cols; col++) {
                    double value =
                        Math.max(0.0, planes[plane][row][col]) / scale;
                    result[plane][row][col] = Math.min(1.0, value);
                }
            }
        }
        return result;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    public static double percentile(double[] values, double p) {
        return new Percentile()
            .withEstimationType(EstimationType.R_7)
            .evaluate(values, p);
    }

    private static double[] flatten(double[][] array) {
        int cols = array[0].length;
        double[] values = new double[array.length * cols];
        for (int row = 0; row < array.length; row++) {
            System.arraycopy(array[row], 0, values, row * cols, cols);
        }
        return values;
    }
}
