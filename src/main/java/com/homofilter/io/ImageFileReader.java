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

package com.homofilter.io;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads image files as [0,255] sample arrays indexed [row][col].
 */
public class ImageFileReader {

    private static final Logger log =
        LoggerFactory.getLogger(ImageFileReader.class);

    public static double[][] readGrayscale(String fileName) throws IOException
    {
        BufferedImage image = read(fileName);
        int width = image.getWidth(), height = image.getHeight();
        double[][] samples = new double[height][width];
        if (isSingleBand(image)) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    samples[y][x] = graySample(image, x, y);
                }
            }
            return samples;
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                // ITU-R 601-2 luma
                samples[y][x] = (((rgb >> 16) & 0xff) * 299
                                 + ((rgb >> 8) & 0xff) * 587
                                 + (rgb & 0xff) * 114) / 1000.0;
            }
        }
        return samples;
    }

    /**
     * @return planes {@code [channel][row][col]} in R, G, B order
     */
    public static double[][][] readColor(String fileName) throws IOException
    {
        BufferedImage image = read(fileName);
        int width = image.getWidth(), height = image.getHeight();
        double[][][] samples = new double[3][height][width];
        if (isSingleBand(image)) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    double gray = graySample(image, x, y);
                    samples[0][y][x] = gray;
                    samples[1][y][x] = gray;
                    samples[2][y][x] = gray;
                }
            }
            return samples;
        }
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                samples[0][y][x] = (rgb >> 16) & 0xff;
                samples[1][y][x] = (rgb >> 8) & 0xff;
                samples[2][y][x] = rgb & 0xff;
            }
        }
        return samples;
    }

    /**
     * Gray rasters are read directly; going through getRGB would apply
     * the linear-gray to sRGB conversion.
     */
    private static boolean isSingleBand(BufferedImage image)
    {
        return image.getRaster().getNumBands() == 1
            && !(image.getColorModel() instanceof IndexColorModel);
    }

    private static double graySample(BufferedImage image, int x, int y)
    {
        int bits = image.getColorModel().getComponentSize(0);
        double sample = image.getRaster().getSample(x, y, 0);
        if (bits == 8) {
            return sample;
        }
        return sample * 255.0 / ((1L << bits) - 1);
    }

    private static BufferedImage read(String fileName) throws IOException
    {
        BufferedImage image = ImageIO.read(new File(fileName));
        if (image == null) {
            throw new IOException("Unsupported image format: " + fileName);
        }
        log.debug("Read {}x{} image from {}",
                  image.getWidth(), image.getHeight(), fileName);
        return image;
    }
}
