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

/**
 * Shape checks and the sample conditioning shared by every pipeline.
 */
public final class Samples {

    /** Offset added before every logarithm and used by both normalizers. */
    public static final double EPSILON = 1e-6;

    /** Samples above this value mark an array as 8-bit. */
    private static final double UNIT_RANGE_MAX = 1.0;

    private static final double BYTE_RANGE_MAX = 255.0;

    private Samples() {
    }

    public static void checkShape(double[][] image) {
        if (image == null || image.length == 0) {
            throw new ShapeException("Image has no rows");
        }
        int cols = image[0] == null ? 0 : image[0].length;
        if (cols == 0) {
            throw new ShapeException("Image has no columns");
        }
        for (int row = 1; row < image.length; row++) {
            if (image[row] == null || image[row].length != cols) {
                throw new ShapeException(
                    "Row " + row + " has a different length than row 0 ("
                    + cols + ")");
            }
        }
    }

    public static void checkColorShape(double[][][] rgb) {
        if (rgb == null || rgb.length != 3) {
            throw new ShapeException(
                "Color image must have exactly 3 channels, got "
                + (rgb == null ? 0 : rgb.length));
        }
        for (int channel = 0; channel < 3; channel++) {
            checkShape(rgb[channel]);
        }
        for (int channel = 1; channel < 3; channel++) {
            checkSameShape(rgb[0], rgb[channel]);
        }
    }

    public static void checkSameShape(double[][] a, double[][] b) {
        if (a.length != b.length || a[0].length != b[0].length) {
            throw new ShapeException(
                "Shape mismatch: " + a.length + "x" + a[0].length
                + " vs " + b.length + "x" + b[0].length);
        }
    }

    /**
     * Returns true if any sample exceeds 1.0, in which case the image is
     * taken to hold 8-bit values.
     */
    public static boolean isByteRange(double[][]... planes) {
        for (double[][] plane : planes) {
            for (double[] row : plane) {
                for (double value : row) {
                    if (value > UNIT_RANGE_MAX) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Copies the image into [0,1]. Negative samples are clamped to 0.
     */
    public static double[][] toUnitRange(double[][] image, boolean byteRange) {
        double scale = byteRange ? 1.0 / BYTE_RANGE_MAX : 1.0;
        double[][] result = new double[image.length][image[0].length];
        for (int row = 0; row < image.length; row++) {
            for (int col = 0; col < image[row].length; col++) {
                result[row][col] = Math.max(0.0, image[row][col]) * scale;
            }
        }
        return result;
    }

    public static double[][] toUnitRange(double[][] image) {
        return toUnitRange(image, isByteRange(image));
    }

    /** log(x + EPSILON) for every sample. */
    public static double[][] log(double[][] image) {
        double[][] result = new double[image.length][image[0].length];
        for (int row = 0; row < image.length; row++) {
            for (int col = 0; col < image[row].length; col++) {
                result[row][col] = Math.log(image[row][col] + EPSILON);
            }
        }
        return result;
    }

    public static double[][] exp(double[][] image) {
        double[][] result = new double[image.length][image[0].length];
        for (int row = 0; row < image.length; row++) {
            for (int col = 0; col < image[row].length; col++) {
                result[row][col] = Math.exp(image[row][col]);
            }
        }
        return result;
    }
}
