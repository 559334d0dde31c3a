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

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.homofilter.algorithms.FilterDesigner;
import com.homofilter.algorithms.FilterParams;
import com.homofilter.algorithms.FrequencyTransform;
import com.homofilter.algorithms.RangeNormalizer;
import com.homofilter.algorithms.Samples;
import com.homofilter.algorithms.TransformMethod;

/**
 * Illumination correction of RGB images, given as three planes
 * {@code double[3][rows][cols]}. Both strategies attenuate the low
 * frequencies of the log image with one homomorphic mask and scale the
 * result with {@link RangeNormalizer#percentileNormalize}.
 *
 * Overloads without a {@code byteRange} argument treat the planes as
 * 8-bit if any sample in any plane exceeds 1.0.
 */
public class ColorCorrector {

    private static final Logger log =
        LoggerFactory.getLogger(ColorCorrector.class);

    public static final int CHANNELS = 3;

    public static double[][][] correct(
        double[][][] rgb, FilterParams params,
        Options.ColorStrategy strategy, TransformMethod method)
    {
        Samples.checkColorShape(rgb);
        return correct(
            rgb, params, strategy, method, Samples.isByteRange(rgb));
    }

    /**
     * @param byteRange true if samples are in [0,255], false for [0,1]
     */
    public static double[][][] correct(
        double[][][] rgb, FilterParams params,
        Options.ColorStrategy strategy, TransformMethod method,
        boolean byteRange)
    {
        switch (strategy) {
            case INDEPENDENT_CHANNELS:
                return correctIndependentChannels(
                    rgb, params, method, byteRange);
            case CHROMATICITY_PRESERVING:
                return correctPreservingChromaticity(
                    rgb, params, method, byteRange);
            default:
                throw new IllegalArgumentException(
                    "Unrecognized color strategy: " + strategy);
        }
    }

    /**
     * Filters R, G and B as unrelated signals. Channel ratios, and with
     * them the hue, may change.
     */
    public static double[][][] correctIndependentChannels(
        double[][][] rgb, FilterParams params, TransformMethod method)
    {
        Samples.checkColorShape(rgb);
        return correctIndependentChannels(
            rgb, params, method, Samples.isByteRange(rgb));
    }

    public static double[][][] correctIndependentChannels(
        double[][][] rgb, FilterParams params, TransformMethod method,
        boolean byteRange)
    {
        Samples.checkColorShape(rgb);
        int rows = rgb[0].length, cols = rgb[0][0].length;
        log.debug("Independent channel correction of {}x{} image, {}",
                  rows, cols, params);
        double[][] mask =
            FilterDesigner.homomorphicShapedFilter(rows, cols, params);
        double[][][] result = new double[CHANNELS][][];
        for (int channel = 0; channel < CHANNELS; channel++) {
            double[][] unit = Samples.toUnitRange(rgb[channel], byteRange);
            result[channel] = homomorphicFilter(unit, mask, method);
        }
        return RangeNormalizer.percentileNormalize(result);
    }

    /**
     * Corrects the mean intensity only and rebuilds every channel from its
     * fixed chromaticity, so output channel ratios equal input ratios.
     */
    public static double[][][] correctPreservingChromaticity(
        double[][][] rgb, FilterParams params, TransformMethod method)
    {
        Samples.checkColorShape(rgb);
        return correctPreservingChromaticity(
            rgb, params, method, Samples.isByteRange(rgb));
    }

    public static double[][][] correctPreservingChromaticity(
        double[][][] rgb, FilterParams params, TransformMethod method,
        boolean byteRange)
    {
        Samples.checkColorShape(rgb);
        int rows = rgb[0].length, cols = rgb[0][0].length;
        log.debug("Chromaticity preserving correction of {}x{} image, {}",
                  rows, cols, params);
        double[][][] unit = new double[CHANNELS][][];
        for (int channel = 0; channel < CHANNELS; channel++) {
            unit[channel] = Samples.toUnitRange(rgb[channel], byteRange);
        }

        double[][] intensity = new double[rows][cols];
        double[][][] chromaticity = new double[CHANNELS][rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                double sum = 0;
                for (int channel = 0; channel < CHANNELS; channel++) {
                    sum += unit[channel][row][col];
                }
                intensity[row][col] = sum / CHANNELS;
                for (int channel = 0; channel < CHANNELS; channel++) {
                    chromaticity[channel][row][col] =
                        unit[channel][row][col] / (sum + Samples.EPSILON);
                }
            }
        }

        double[][] mask =
            FilterDesigner.homomorphicShapedFilter(rows, cols, params);
        double[][] corrected = homomorphicFilter(intensity, mask, method);

        double[][][] result = new double[CHANNELS][rows][cols];
        for (int channel = 0; channel < CHANNELS; channel++) {
            for (int row = 0; row < rows; row++) {
                for (int col = 0; col < cols; col++) {
                    // chromaticities sum to 1, so 3x restores the magnitude
                    result[channel][row][col] =
                        chromaticity[channel][row][col]
                        * corrected[row][col] * CHANNELS;
                }
            }
        }
        return RangeNormalizer.percentileNormalize(result);
    }

    /**
     * exp(IDFT(unshift(H * shift(DFT(log(x + EPSILON)))))) for a plane
     * already in [0,1].
     */
    static double[][] homomorphicFilter(
        double[][] unitPlane, double[][] mask, TransformMethod method)
    {
        Complex[][] spectrum = FrequencyTransform.centerShift(
            FrequencyTransform.forward(Samples.log(unitPlane), method));
        return Samples.exp(
            GrayscaleDecomposer.filter(spectrum, mask, method));
    }
}
