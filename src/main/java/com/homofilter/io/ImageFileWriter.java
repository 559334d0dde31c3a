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
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.homofilter.algorithms.Samples;

/**
 * Writes [0,1] sample planes as 8-bit images. The format follows the file
 * extension.
 */
public class ImageFileWriter {

    private static final Logger log =
        LoggerFactory.getLogger(ImageFileWriter.class);

    private static final String DEFAULT_FORMAT = "png";

    private File file;

    private String formatName;

    private boolean overwrite = false;

    public ImageFileWriter(String fileName)
    {
        this(fileName, false);
    }

    public ImageFileWriter(String fileName, boolean overwrite)
    {
        this.file = new File(fileName);
        this.overwrite = overwrite;
        this.formatName = formatOf(fileName);
    }

    public void write(double[][] plane) throws IOException
    {
        Samples.checkShape(plane);
        int height = plane.length, width = plane[0].length;
        BufferedImage image =
            new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.getRaster().setSample(x, y, 0, toByte(plane[y][x]));
            }
        }
        save(image);
    }

    public void write(double[][][] rgb) throws IOException
    {
        Samples.checkColorShape(rgb);
        int height = rgb[0].length, width = rgb[0][0].length;
        BufferedImage image =
            new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = toByte(rgb[0][y][x]);
                int g = toByte(rgb[1][y][x]);
                int b = toByte(rgb[2][y][x]);
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        save(image);
    }

    private void save(BufferedImage image) throws IOException
    {
        if (this.file.exists() && !this.overwrite) {
            throw new IOException(
                "Output file " + this.file + " exists, use overwrite");
        }
        File parent = this.file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Cannot create directory " + parent);
        }
        if (!ImageIO.write(image, this.formatName, this.file)) {
            throw new IOException(
                "No image writer for format " + this.formatName);
        }
        log.info("Wrote {}x{} image to {}",
                 image.getWidth(), image.getHeight(), this.file);
    }

    /**
     * Scales [0,1] to [0,255], truncating toward zero; out-of-range samples
     * are clipped.
     */
    static int toByte(double value)
    {
        if (!(value > 0)) {
            return 0;
        }
        return (int) Math.min(255.0, value * 255.0);
    }

    private static String formatOf(String fileName)
    {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return DEFAULT_FORMAT;
        }
        return fileName.substring(dot + 1).toLowerCase();
    }
}
