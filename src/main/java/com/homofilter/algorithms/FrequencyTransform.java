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

import org.apache.commons.math3.complex.Complex;
import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-dimensional discrete Fourier transform and the spectrum centering
 * primitives.
 *
 * Spectra are {@code Complex[rows][cols]}. A spectrum returned by
 * {@link #forward} holds the zero-frequency term at [0][0];
 * {@link #centerShift} moves it to [rows / 2][cols / 2], which is the
 * layout every filter mask from {@link FilterDesigner} expects.
 */
public final class FrequencyTransform {

    private static final Logger log =
        LoggerFactory.getLogger(FrequencyTransform.class);

    /**
     * Largest row or column count the direct summation is run on. Larger
     * inputs are transformed with {@link TransformMethod#FAST} instead.
     */
    public static final int DIRECT_TRANSFORM_MAX_SIZE = 64;

    private FrequencyTransform() {
    }

    /**
     * Resolves the algorithm actually used for an array of the given size.
     */
    public static TransformMethod effectiveMethod(
            int rows, int cols, TransformMethod requested)
    {
        if (requested == TransformMethod.DIRECT
            && (rows > DIRECT_TRANSFORM_MAX_SIZE
                || cols > DIRECT_TRANSFORM_MAX_SIZE))
        {
            log.warn(
                "Direct transform requested for {}x{} samples, limit is "
                + "{}x{}; using the fast transform",
                rows, cols,
                DIRECT_TRANSFORM_MAX_SIZE, DIRECT_TRANSFORM_MAX_SIZE);
            return TransformMethod.FAST;
        }
        return requested;
    }

    public static Complex[][] forward(double[][] image, TransformMethod method)
    {
        Samples.checkShape(image);
        int rows = image.length, cols = image[0].length;
        double[][] interleaved = new double[rows][2 * cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                interleaved[row][2 * col] = image[row][col];
            }
        }
        return transform(interleaved, method, false);
    }

    public static Complex[][] forward(double[][] image) {
        return forward(image, TransformMethod.FAST);
    }

    /**
     * Inverse transform, scaled by 1 / (rows * cols). The result is complex;
     * when the source was real the imaginary part only holds rounding
     * residue and {@link #realPart} recovers the samples.
     */
    public static Complex[][] inverse(
            Complex[][] spectrum, TransformMethod method)
    {
        checkShape(spectrum);
        return transform(toInterleaved(spectrum), method, true);
    }

    public static Complex[][] inverse(Complex[][] spectrum) {
        return inverse(spectrum, TransformMethod.FAST);
    }

    private static Complex[][] transform(
            double[][] interleaved, TransformMethod method, boolean inverse)
    {
        int rows = interleaved.length, cols = interleaved[0].length / 2;
        TransformMethod effective = effectiveMethod(rows, cols, method);
        log.debug("{} {} transform of {}x{} samples",
                  effective, inverse ? "inverse" : "forward", rows, cols);
        if (effective == TransformMethod.DIRECT) {
            return toComplex(directTransform(interleaved, inverse));
        }
        fastTransform(interleaved, inverse);
        return toComplex(interleaved);
    }

    /**
     * Direct summation of
     * {@code F[u][v] = sum x(m, n) * exp(-+2 pi i (u m / M + v n / N))}.
     * Twiddle factors are tabulated once per axis.
     */
    private static double[][] directTransform(
            double[][] interleaved, boolean inverse)
    {
        int rows = interleaved.length, cols = interleaved[0].length / 2;
        double sign = inverse ? 1.0 : -1.0;
        double[] rowCos = new double[rows], rowSin = new double[rows];
        for (int k = 0; k < rows; k++) {
            double angle = sign * 2.0 * Math.PI * k / rows;
            rowCos[k] = Math.cos(angle);
            rowSin[k] = Math.sin(angle);
        }
        double[] colCos = new double[cols], colSin = new double[cols];
        for (int k = 0; k < cols; k++) {
            double angle = sign * 2.0 * Math.PI * k / cols;
            colCos[k] = Math.cos(angle);
            colSin[k] = Math.sin(angle);
        }
        double scale = inverse ? 1.0 / ((double) rows * cols) : 1.0;
        double[][] result = new double[rows][2 * cols];
        for (int u = 0; u < rows; u++) {
            for (int v = 0; v < cols; v++) {
                double sumRe = 0.0, sumIm = 0.0;
                for (int x = 0; x < rows; x++) {
                    int rowIndex = (int) (((long) u * x) % rows);
                    for (int y = 0; y < cols; y++) {
                        int colIndex = (int) (((long) v * y) % cols);
                        // exp(i a) * exp(i b)
                        double twRe = rowCos[rowIndex] * colCos[colIndex]
                                    - rowSin[rowIndex] * colSin[colIndex];
                        double twIm = rowCos[rowIndex] * colSin[colIndex]
                                    + rowSin[rowIndex] * colCos[colIndex];
                        double re = interleaved[x][2 * y];
                        double im = interleaved[x][2 * y + 1];
                        sumRe += re * twRe - im * twIm;
                        sumIm += re * twIm + im * twRe;
                    }
                }
                result[u][2 * v] = sumRe * scale;
                result[u][2 * v + 1] = sumIm * scale;
            }
        }
        return result;
    }

    /**
     * In-place transform of an interleaved (re, im) buffer. A single row or
     * column is a one-dimensional transform.
     */
    private static void fastTransform(double[][] interleaved, boolean inverse)
    {
        int rows = interleaved.length, cols = interleaved[0].length / 2;
        if (rows > 1 && cols > 1) {
            DoubleFFT_2D fft = new DoubleFFT_2D(rows, cols);
            if (inverse) {
                fft.complexInverse(interleaved, true);
            } else {
                fft.complexForward(interleaved);
            }
            return;
        }
        int n = rows * cols;
        if (n == 1) {
            return;
        }
        double[] line = new double[2 * n];
        for (int row = 0; row < rows; row++) {
            System.arraycopy(
                interleaved[row], 0, line, 2 * row * cols, 2 * cols);
        }
        DoubleFFT_1D fft = new DoubleFFT_1D(n);
        if (inverse) {
            fft.complexInverse(line, true);
        } else {
            fft.complexForward(line);
        }
        for (int row = 0; row < rows; row++) {
            System.arraycopy(
                line, 2 * row * cols, interleaved[row], 0, 2 * cols);
        }
    }

    /**
     * Swaps quadrants so the element at [0][0] moves to
     * [rows / 2][cols / 2].
     */
    public static <T> T[][] centerShift(T[][] array) {
        checkShape(array);
        return roll(array, array.length / 2, array[0].length / 2);
    }

    /**
     * Exact inverse of {@link #centerShift(Object[][])}, for even and odd
     * sizes.
     */
    public static <T> T[][] centerUnshift(T[][] array) {
        checkShape(array);
        int rows = array.length, cols = array[0].length;
        return roll(array, rows - rows / 2, cols - cols / 2);
    }

    public static double[][] centerShift(double[][] array) {
        Samples.checkShape(array);
        return roll(array, array.length / 2, array[0].length / 2);
    }

    public static double[][] centerUnshift(double[][] array) {
        Samples.checkShape(array);
        int rows = array.length, cols = array[0].length;
        return roll(array, rows - rows / 2, cols - cols / 2);
    }

    private static <T> T[][] roll(T[][] array, int rowOffset, int colOffset) {
        int rows = array.length, cols = array[0].length;
        T[][] result = array.clone();
        for (int row = 0; row < rows; row++) {
            result[row] = array[row].clone();
        }
        for (int row = 0; row < rows; row++) {
            int target = (row + rowOffset) % rows;
            for (int col = 0; col < cols; col++) {
                result[target][(col + colOffset) % cols] = array[row][col];
            }
        }
        return result;
    }

    private static double[][] roll(
            double[][] array, int rowOffset, int colOffset)
    {
        int rows = array.length, cols = array[0].length;
        double[][] result = new double[rows][cols];
        for (int row = 0; row < rows; row++) {
            int target = (row + rowOffset) % rows;
            for (int col = 0; col < cols; col++) {
                result[target][(col + colOffset) % cols] = array[row][col];
            }
        }
        return result;
    }

    /**
     * Element-wise product of a shifted spectrum and a filter mask of the
     * same shape.
     */
    public static Complex[][] multiply(Complex[][] spectrum, double[][] mask)
    {
        checkShape(spectrum);
        Samples.checkShape(mask);
        if (spectrum.length != mask.length
            || spectrum[0].length != mask[0].length)
        {
            throw new ShapeException(
                "Spectrum is " + spectrum.length + "x" + spectrum[0].length
                + " but mask is " + mask.length + "x" + mask[0].length);
        }
        Complex[][] result = new Complex[spectrum.length][spectrum[0].length];
        for (int u = 0; u < spectrum.length; u++) {
            for (int v = 0; v < spectrum[u].length; v++) {
                result[u][v] = spectrum[u][v].multiply(mask[u][v]);
            }
        }
        return result;
    }

    public static double[][] realPart(Complex[][] values) {
        checkShape(values);
        double[][] result = new double[values.length][values[0].length];
        for (int row = 0; row < values.length; row++) {
            for (int col = 0; col < values[row].length; col++) {
                result[row][col] = values[row][col].getReal();
            }
        }
        return result;
    }

    /**
     * log(|F| + 1), the usual way to look at a spectrum.
     */
    public static double[][] logMagnitude(Complex[][] spectrum) {
        checkShape(spectrum);
        double[][] result = new double[spectrum.length][spectrum[0].length];
        for (int u = 0; u < spectrum.length; u++) {
            for (int v = 0; v < spectrum[u].length; v++) {
                result[u][v] = Math.log(spectrum[u][v].abs() + 1.0);
            }
        }
        return result;
    }

    private static <T> void checkShape(T[][] array) {
        if (array == null || array.length == 0) {
            throw new ShapeException("Array has no rows");
        }
        int cols = array[0] == null ? 0 : array[0].length;
        if (cols == 0) {
            throw new ShapeException("Array has no columns");
        }
        for (int row = 1; row < array.length; row++) {
            if (array[row] == null || array[row].length != cols) {
                throw new ShapeException(
                    "Row " + row + " has a different length than row 0 ("
                    + cols + ")");
            }
        }
    }

    private static double[][] toInterleaved(Complex[][] spectrum) {
        int rows = spectrum.length, cols = spectrum[0].length;
        double[][] result = new double[rows][2 * cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                result[row][2 * col] = spectrum[row][col].getReal();
                result[row][2 * col + 1] = spectrum[row][col].getImaginary();
            }
        }
        return result;
    }

    private static Complex[][] toComplex(double[][] interleaved) {
        int rows = interleaved.length, cols = interleaved[0].length / 2;
        Complex[][] result = new Complex[rows][cols];
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                result[row][col] = new Complex(
                    interleaved[row][2 * col], interleaved[row][2 * col + 1]);
            }
        }
        return result;
    }
}
