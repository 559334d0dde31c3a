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
 * Splits a grayscale image I = R * L into reflectance R (high frequencies
 * of log I) and illumination L (low frequencies of log I) with a
 * complementary Butterworth highpass/lowpass pair.
 */
public class GrayscaleDecomposer {

    private static final Logger log =
        LoggerFactory.getLogger(GrayscaleDecomposer.class);

    public static Decomposition decompose(
        double[][] image, FilterParams params)
    {
        return decompose(image, params, TransformMethod.FAST);
    }

    /**
     * Guesses the sample range: any sample above 1.0 marks the image as
     * 8-bit.
     */
    public static Decomposition decompose(
        double[][] image, FilterParams params, TransformMethod method)
    {
        Samples.checkShape(image);
        return decompose(image, params, method, Samples.isByteRange(image));
    }

    /**
     * @param byteRange true if samples are in [0,255], false for [0,1]
     */
    public static Decomposition decompose(
        double[][] image, FilterParams params, TransformMethod method,
        boolean byteRange)
    {
        Samples.checkShape(image);
        int rows = image.length, cols = image[0].length;
        log.debug("Decomposing {}x{} image, {}, {}",
                  rows, cols, params, method);

        double[][] logImage = Samples.log(
            Samples.toUnitRange(image, byteRange));
        Complex[][] spectrum = FrequencyTransform.centerShift(
            FrequencyTransform.forward(logImage, method));

        double[][] highpass =
            FilterDesigner.butterworthHighpass(rows, cols, params);
        double[][] lowpass =
            FilterDesigner.butterworthLowpass(rows, cols, params);

        double[][] logReflectance = filter(spectrum, highpass, method);
        double[][] logIllumination = filter(spectrum, lowpass, method);

        double[][] reflectance = Samples.exp(logReflectance);
        double[][] illumination = Samples.exp(logIllumination);
        return new Decomposition(
            RangeNormalizer.minMaxNormalize(reflectance),
            RangeNormalizer.minMaxNormalize(illumination),
            reflectance, illumination);
    }

    /**
     * Applies a mask to a shifted spectrum and returns the real part of
     * its inverse transform.
     */
    static double[][] filter(
        Complex[][] shiftedSpectrum, double[][] mask, TransformMethod method)
    {
        Complex[][] filtered = FrequencyTransform.centerUnshift(
            FrequencyTransform.multiply(shiftedSpectrum, mask));
        return FrequencyTransform.realPart(
            FrequencyTransform.inverse(filtered, method));
    }
}
