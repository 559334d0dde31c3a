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

public final class FilterParams {

    public static final double DEFAULT_CUTOFF = 30;

    public static final int DEFAULT_ORDER = 2;

    public static final double DEFAULT_GAMMA_LOW = 0.3;

    public static final double DEFAULT_GAMMA_HIGH = 2.0;

    /**
     *  cutoff D0, radial distance at which a Butterworth gain is 0.5
     */
    public final double cutoff;

    /**
     *  order n, sharpness of the roll-off around the cutoff
     */
    public final int order;

    /**
     *  gain applied to the lowest frequencies by shaped masks
     */
    public final double gammaLow;

    /**
     *  gain applied to the highest frequencies by shaped masks
     */
    public final double gammaHigh;

    public FilterParams(double cutoff, int order) {
        this(cutoff, order, DEFAULT_GAMMA_LOW, DEFAULT_GAMMA_HIGH);
    }

    public FilterParams(
            double cutoff, int order, double gammaLow, double gammaHigh)
    {
        validate(cutoff, order);
        if (!Double.isFinite(gammaLow) || !Double.isFinite(gammaHigh)) {
            throw new ParameterException(
                "gammaLow and gammaHigh must be finite, got "
                + gammaLow + ", " + gammaHigh);
        }
        if (gammaLow > gammaHigh) {
            throw new ParameterException(
                "gammaLow (" + gammaLow + ") must not exceed gammaHigh ("
                + gammaHigh + ")");
        }
        this.cutoff = cutoff;
        this.order = order;
        this.gammaLow = gammaLow;
        this.gammaHigh = gammaHigh;
    }

    public static FilterParams defaults() {
        return new FilterParams(
            DEFAULT_CUTOFF, DEFAULT_ORDER,
            DEFAULT_GAMMA_LOW, DEFAULT_GAMMA_HIGH);
    }

    static void validate(double cutoff, int order) {
        if (!(cutoff > 0) || Double.isInfinite(cutoff)) {
            throw new ParameterException(
                "Cutoff must be a positive finite number, got " + cutoff);
        }
        if (order < 1) {
            throw new ParameterException(
                "Order must be at least 1, got " + order);
        }
    }

    @Override
    public String toString() {
        return "FilterParams[cutoff=" + cutoff + ", order=" + order
            + ", gammaLow=" + gammaLow + ", gammaHigh=" + gammaHigh + "]";
    }
}
