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

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.homofilter.algorithms.FilterParams;
import com.homofilter.algorithms.FrequencyTransform;
import com.homofilter.algorithms.RangeNormalizer;
import com.homofilter.algorithms.Samples;
import com.homofilter.io.ImageFileReader;
import com.homofilter.io.ImageFileWriter;

/**
 * Runs one input file through the pipeline selected by {@link Options}
 * and writes the results next to each other in the output directory.
 * File samples are always 8-bit, so the pipelines are told so instead of
 * guessing the range from the data.
 */
public class Homofilter {

    private static final Logger log =
        LoggerFactory.getLogger(Homofilter.class);

    private final String fileName;

    private final String outputDirectory;

    private final Options options;

    public Homofilter(String fileName, String outputDirectory, Options options)
    {
        this.fileName = fileName;
        this.outputDirectory = outputDirectory;
        this.options = options;
    }

    public void execute() throws IOException
    {
        FilterParams params = this.options.toFilterParams();
        log.info("Processing {} ({}, {}, {})", this.fileName,
                 this.options.mode, params, this.options.transformMethod);
        switch (this.options.mode) {
            case GRAYSCALE:
                processGrayscale(params);
                break;
            case COLOR:
                processColor(params);
                break;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized processing mode: " + this.options.mode);
        }
    }

    private void processGrayscale(FilterParams params) throws IOException
    {
        double[][] image = ImageFileReader.readGrayscale(this.fileName);
        Decomposition decomposition = GrayscaleDecomposer.decompose(
            image, params, this.options.transformMethod, true);
        writer("reflectance").write(decomposition.reflectance());
        writer("illumination").write(decomposition.illumination());
        // R * L lies in (0, 1 + EPSILON]; clipped on write
        writer("reconstruction").write(decomposition.reconstruction());
        if (this.options.writeSpectrum) {
            writeSpectrum(Samples.toUnitRange(image, true));
        }
    }

    private void processColor(FilterParams params) throws IOException
    {
        double[][][] rgb = ImageFileReader.readColor(this.fileName);
        double[][][] corrected = ColorCorrector.correct(
            rgb, params, this.options.colorStrategy,
            this.options.transformMethod, true);
        writer(this.options.colorStrategy.name().toLowerCase())
            .write(corrected);
        if (this.options.writeSpectrum) {
            int rows = rgb[0].length, cols = rgb[0][0].length;
            double[][] intensity = new double[rows][cols];
            for (double[][] plane : rgb) {
                double[][] unit = Samples.toUnitRange(plane, true);
                for (int row = 0; row < rows; row++) {
                    for (int col = 0; col < cols; col++) {
                        intensity[row][col] += unit[row][col] / 3.0;
                    }
                }
            }
            writeSpectrum(intensity);
        }
    }

    /**
     * @param unitImage samples already scaled to [0,1]
     */
    private void writeSpectrum(double[][] unitImage) throws IOException
    {
        double[][] logImage = Samples.log(unitImage);
        double[][] magnitude = FrequencyTransform.logMagnitude(
            FrequencyTransform.centerShift(FrequencyTransform.forward(
                logImage, this.options.transformMethod)));
        writer("spectrum").write(RangeNormalizer.minMaxNormalize(magnitude));
    }

    private ImageFileWriter writer(String suffix)
    {
        String name = new File(this.fileName).getName();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        File output = new File(
            this.outputDirectory, name + "_" + suffix + ".png");
        return new ImageFileWriter(output.getPath(), this.options.overwrite);
    }
}
