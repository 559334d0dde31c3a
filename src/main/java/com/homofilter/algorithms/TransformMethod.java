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
 * Algorithm used by {@link FrequencyTransform}.
 */
public enum TransformMethod {

    /**
     * Direct summation over every sample, O(M^2 N^2). Only honored up to
     * {@link FrequencyTransform#DIRECT_TRANSFORM_MAX_SIZE} in each dimension.
     */
    DIRECT,

    /**
     * Fast Fourier transform, O(MN log MN), any size.
     */
    FAST
}
