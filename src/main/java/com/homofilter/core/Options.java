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

import com.homofilter.algorithms.FilterParams;
import com.homofilter.algorithms.TransformMethod;

public class Options {

    public enum ProcessingMode {
        GRAYSCALE, COLOR
    }

    public enum ColorStrategy {
        INDEPENDENT_CHANNELS, CHROMATICITY_PRESERVING
    }

    /**
     *  Butterworth cutoff D0
     */
    public double cutoff = FilterParams.DEFAULT_CUTOFF;

    /**
     *  Butterworth order n
     */
    public int order = FilterParams.DEFAULT_ORDER;

    /**
     *  low-frequency gain of the homomorphic filter (color mode only)
     */
    public double gammaLow = FilterParams.DEFAULT_GAMMA_LOW;

    /**
     *  high-frequency gain of the homomorphic filter (color mode only)
     */
    public double gammaHigh = FilterParams.DEFAULT_GAMMA_HIGH;

    public TransformMethod transformMethod = TransformMethod.FAST;

    public ProcessingMode mode = ProcessingMode.GRAYSCALE;

    public ColorStrategy colorStrategy = ColorStrategy.CHROMATICITY_PRESERVING;

    /**
     *  also write the log-magnitude spectrum of every input
     */
    public boolean writeSpectrum = false;

    public boolean overwrite = false;

    /**
     * @throws com.homofilter.algorithms.ParameterException if the filter
     * fields are out of range
     */
    public FilterParams toFilterParams() {
        return new FilterParams(cutoff, order, gammaLow, gammaHigh);
    }
}
