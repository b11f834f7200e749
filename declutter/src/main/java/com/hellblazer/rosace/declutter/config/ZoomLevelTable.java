/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Rosace.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.rosace.declutter.config;

import java.util.Arrays;

/**
 * Maps continuous map zooms onto discrete zoom levels and gives the glyph radius in meters used at each level.
 *
 * <p>The radius at a level is the ground size of {@code pixelWidth} screen pixels at that level's reference map zoom,
 * using the Web Mercator resolution {@code 156543.03392 * cos(latitude) / 2^zoom} meters per pixel.
 *
 * @author hal.hildebrand
 */
public final class ZoomLevelTable {

    public static final double METERS_PER_PIXEL_AT_ZOOM_0 = 156543.03392;
    public static final double DEFAULT_PIXEL_WIDTH        = 40.0;

    private static final ZoomLevelTable DEFAULTS = new ZoomLevelTable(new double[] { 15, 15, 16, 17, 18 },
                                                                      new double[] { 14, 15, 16, 17 }, 0.0,
                                                                      DEFAULT_PIXEL_WIDTH);

    private final double[] referenceZooms;
    private final double[] thresholds;
    private final double   latitude;
    private final double   pixelWidth;

    /**
     * @param referenceZooms map zoom whose resolution sizes the glyphs of each level, indexed by level
     * @param thresholds     ascending map zooms separating consecutive levels; one fewer than there are levels
     * @param latitude       latitude in degrees at which the resolution is evaluated
     * @param pixelWidth     on-screen glyph size in pixels
     */
    public ZoomLevelTable(double[] referenceZooms, double[] thresholds, double latitude, double pixelWidth) {
        if (referenceZooms.length == 0) {
            throw new IllegalArgumentException("At least one zoom level is required");
        }
        if (thresholds.length != referenceZooms.length - 1) {
            throw new IllegalArgumentException(
            "Expected " + (referenceZooms.length - 1) + " zoom thresholds, got " + thresholds.length);
        }
        for (int i = 1; i < thresholds.length; i++) {
            if (thresholds[i] < thresholds[i - 1]) {
                throw new IllegalArgumentException("Zoom thresholds must be ascending: " + Arrays.toString(thresholds));
            }
        }
        if (!(pixelWidth > 0) || !Double.isFinite(pixelWidth)) {
            throw new IllegalArgumentException("Pixel width must be positive: " + pixelWidth);
        }
        if (!(Math.abs(latitude) < 90)) {
            throw new IllegalArgumentException("Latitude must be within (-90, 90): " + latitude);
        }
        this.referenceZooms = referenceZooms.clone();
        this.thresholds = thresholds.clone();
        this.latitude = latitude;
        this.pixelWidth = pixelWidth;
    }

    /**
     * Five levels sized at map zooms 15, 15, 16, 17 and 18 at the equator, 40 pixels wide, with level boundaries at
     * zooms 14, 15, 16 and 17.
     */
    public static ZoomLevelTable defaults() {
        return DEFAULTS;
    }

    /**
     * Ground size in meters of {@code pixelWidth} pixels at the given map zoom and latitude.
     */
    public static double glyphRadiusMeters(double zoom, double latitude, double pixelWidth) {
        double metersPerPixel = METERS_PER_PIXEL_AT_ZOOM_0 * Math.cos(Math.toRadians(latitude)) / Math.pow(2, zoom);
        return metersPerPixel * pixelWidth;
    }

    public double radiusMeters(int level) {
        if (level < 0 || level >= referenceZooms.length) {
            throw new IllegalArgumentException("No zoom level " + level + ", levels are 0.." + (levels() - 1));
        }
        return glyphRadiusMeters(referenceZooms[level], latitude, pixelWidth);
    }

    /**
     * Discrete level for a continuous map zoom: the index of the first threshold the zoom is below, or the last
     * level when it is at or above every threshold.
     */
    public int levelForZoom(double zoom) {
        for (int i = 0; i < thresholds.length; i++) {
            if (zoom < thresholds[i]) {
                return i;
            }
        }
        return thresholds.length;
    }

    public int levels() {
        return referenceZooms.length;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getPixelWidth() {
        return pixelWidth;
    }

    @Override
    public String toString() {
        return "ZoomLevelTable[zooms=" + Arrays.toString(referenceZooms) + ", thresholds=" + Arrays.toString(
        thresholds) + ", latitude=" + latitude + ", pixelWidth=" + pixelWidth + "]";
    }
}
