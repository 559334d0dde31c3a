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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Radial Butterworth gain masks for centered spectra.
 *
 * Every mask is a pure function of its shape and parameters and is
 * symmetric about [rows / 2][cols / 2], the DC position after
 * {@link FrequencyTransform#centerShift}.
 */
public final class FilterDesigner {

    private static final Logger log =
        LoggerFactory.getLogger(FilterDesigner.class);

    /** Stands in for a zero radial distance in the highpass gain. */
    public static final double MIN_DISTANCE = 1e-10;

    private FilterDesigner() {
    }

    public static double radialDistance(int u, int v, int rows, int cols) {
        int du = u - rows / 2;
        int dv = v - cols / 2;
        return Math.sqrt((double) du * du + (double) dv * dv);
    }

    /**
     * {@code H = 1 / (1 + (D0 / D)^(2n))}, about 0 at the center.
     */
    public static double[][] butterworthHighpass(
            int rows, int cols, double cutoff, int order)
    {
        checkShape(rows, cols);
        FilterParams.validate(cutoff, order);
        log.debug("Butterworth highpass {}x{}, D0={}, n={}",
                  rows, cols, cutoff, order);
        double[][] mask = new double[rows][cols];
        for (int u = 0; u < rows; u++) {
            for (int v = 0; v < cols; v++) {
                mask[u][v] = highpassGain(
                    radialDistance(u, v, rows, cols), cutoff, order);
            }
        }
        return mask;
    }

    public static double[][] butterworthHighpass(
            int rows, int cols, FilterParams params)
    {
        return butterworthHighpass(rows, cols, params.cutoff, params.order);
    }

    /**
     * {@code H = 1 / (1 + (D / D0)^(2n))}, exactly 1 at the center.
     */
    public static double[][] butterworthLowpass(
            int rows, int cols, double cutoff, int order)
    {
        checkShape(rows, cols);
        FilterParams.validate(cutoff, order);
        log.debug("Butterworth lowpass {}x{}, D0={}, n={}",
                  rows, cols, cutoff, order);
        double[][] mask = new double[rows][cols];
        for (int u = 0; u < rows; u++) {
            for (int v = 0; v < cols; v++) {
                double distance = radialDistance(u, v, rows, cols);
                mask[u][v] =
                    1.0 / (1.0 + Math.pow(distance / cutoff, 2.0 * order));
            }
        }
        return mask;
    }

    public static double[][] butterworthLowpass(
            int rows, int cols, FilterParams params)
    {
        return butterworthLowpass(rows, cols, params.cutoff, params.order);
    }

    /**
     * Highpass response rescaled from [0,1] to [gammaLow, gammaHigh]:
     * {@code H = (gammaHigh - gammaLow) * highpass + gammaLow}.
     */
    public static double[][] homomorphicShapedFilter(
            int rows, int cols, double cutoff, int order,
            double gammaLow, double gammaHigh)
    {
        return homomorphicShapedFilter(
            rows, cols, new FilterParams(cutoff, order, gammaLow, gammaHigh));
    }

    public static double[][] homomorphicShapedFilter(
            int rows, int cols, FilterParams params)
    {
        checkShape(rows, cols);
        log.debug("Homomorphic filter {}x{}, {}", rows, cols, params);
        double span = params.gammaHigh - params.gammaLow;
        double[][] mask = new double[rows][cols];
        for (int u = 0; u < rows; u++) {
            for (int v = 0; v < cols; v++) {
                double gain = highpassGain(
                    radialDistance(u, v, rows, cols),
                    params.cutoff, params.order);
                mask[u][v] = span * gain + params.gammaLow;
            }
        }
        return mask;
    }

    private static double highpassGain(
            double distance, double cutoff, int order)
    {
        if (distance == 0) {
            distance = MIN_DISTANCE;
        }
        return 1.0 / (1.0 + Math.pow(cutoff / distance, 2.0 * order));
    }

    private static void checkShape(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new ShapeException(
                "Filter shape must be positive, got " + rows + "x" + cols);
        }
    }
}
