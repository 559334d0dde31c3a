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

package com.homofilter;

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.homofilter.algorithms.FilterParams;
import com.homofilter.algorithms.TransformMethod;
import com.homofilter.core.Homofilter;
import com.homofilter.core.Options;
import com.homofilter.core.Options.ColorStrategy;
import com.homofilter.core.Options.ProcessingMode;

import ch.qos.logback.classic.Level;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.annotation.Arg;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;

public class Main {

    @Arg
    private ArrayList<String> input;

    @Arg
    private String output;

    @Arg
    private ProcessingMode mode;

    @Arg
    private ColorStrategy colorStrategy;

    @Arg
    private Double cutoff;

    @Arg
    private Integer order;

    @Arg
    private Double gammaLow;

    @Arg
    private Double gammaHigh;

    @Arg
    private Boolean directTransform;

    @Arg
    private Boolean spectrum;

    @Arg
    private Boolean debug;

    @Arg
    private Boolean overwrite;

    private static final Logger log =
        LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ArgumentParser parser = buildParser();
        Main main = new Main();
        try {
            parser.parseArgs(args, main);
        } catch (ArgumentParserException e) {
            parser.handleError(e);
            System.exit(1);
        }
        try {
            main.processImages();
        } catch (Exception e) {
            log.error("Processing failed", e);
            System.exit(1);
        }
    }

    static ArgumentParser buildParser() {
        ArgumentParser parser =
            ArgumentParsers.newFor("homofilter").build();
        parser.description(
            "Separates illumination and reflectance of grayscale images, or "
            + "corrects uneven illumination of color images, by homomorphic "
            + "filtering.");
        parser.addArgument("--input")
              .nargs("+")
              .required(true)
              .help("One or more image files.");
        parser.addArgument("--output")
              .required(true)
              .help("Output directory for the processed images.");
        parser.addArgument("--mode")
              .type(ProcessingMode.class)
              .setDefault(ProcessingMode.GRAYSCALE)
              .help("GRAYSCALE writes reflectance, illumination and their "
                    + "product; COLOR writes the illumination corrected "
                    + "image. (default: GRAYSCALE)");
        parser.addArgument("--colorStrategy")
              .type(ColorStrategy.class)
              .setDefault(ColorStrategy.CHROMATICITY_PRESERVING)
              .help("Color correction strategy.  'Chromaticity preserving' "
                    + "corrects the mean intensity and keeps channel ratios "
                    + "(hue); 'Independent channels' filters R, G and B "
                    + "separately. (default: CHROMATICITY_PRESERVING)");
        parser.addArgument("--cutoff")
              .type(Double.class)
              .setDefault(FilterParams.DEFAULT_CUTOFF)
              .help("Butterworth cutoff D0. (default: 30)");
        parser.addArgument("--order")
              .type(Integer.class)
              .setDefault(FilterParams.DEFAULT_ORDER)
              .help("Butterworth order n. (default: 2)");
        parser.addArgument("--gammaLow")
              .type(Double.class)
              .setDefault(FilterParams.DEFAULT_GAMMA_LOW)
              .help("Low-frequency gain, color mode. (default: 0.3)");
        parser.addArgument("--gammaHigh")
              .type(Double.class)
              .setDefault(FilterParams.DEFAULT_GAMMA_HIGH)
              .help("High-frequency gain, color mode. (default: 2.0)");
        parser.addArgument("--directTransform")
              .action(Arguments.storeTrue())
              .help("Use the direct summation transform for images up to "
                    + "64x64; larger images use the FFT.");
        parser.addArgument("--spectrum")
              .action(Arguments.storeTrue())
              .help("Also write the log-magnitude spectrum of each input.");
        parser.addArgument("--debug")
              .action(Arguments.storeTrue())
              .help("Set logging level to DEBUG");
        parser.addArgument("--overwrite")
              .action(Arguments.storeTrue())
              .help("Overwrite output file(s) if exist");
        return parser;
    }

    Options toOptions() {
        Options options = new Options();
        options.mode = this.mode;
        options.colorStrategy = this.colorStrategy;
        options.cutoff = this.cutoff;
        options.order = this.order;
        options.gammaLow = this.gammaLow;
        options.gammaHigh = this.gammaHigh;
        options.transformMethod = this.directTransform
            ? TransformMethod.DIRECT : TransformMethod.FAST;
        options.writeSpectrum = this.spectrum;
        options.overwrite = this.overwrite;
        return options;
    }

    public void processImages() throws Exception {
        // Setup logger
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger)LoggerFactory.getLogger(
                Logger.ROOT_LOGGER_NAME);
        if (this.debug) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }

        Options options = toOptions();
        // fail on bad parameters before touching any file
        options.toFilterParams();
        for (String fileName : this.input) {
            new Homofilter(fileName, this.output, options).execute();
        }
        log.info("Done");
    }
}
