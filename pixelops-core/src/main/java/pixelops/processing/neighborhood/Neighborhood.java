/* 
 * Copyright (C) 2026 PIXELOPS contributors
 *
 * This File is part of PIXELOPS
 *
 * PIXELOPS is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PIXELOPS is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PIXELOPS.  If not, see <http://www.gnu.org/licenses/>.
 */
package pixelops.processing.neighborhood;

import pixelops.image.PixelBuffer;

/**
 * Spatial window of samples around an output pixel, within a single channel.
 */
public interface Neighborhood {
    /**
     * Copy in-bounds samples of the window centered on (x, y)
     * @param x X-axis coordinate of the center of the neighborhood
     * @param y Y-axis coordinate of the center of the neighborhood
     * @param c channel to read from; the window never spans channels
     * @param image buffer to copy sample values from
     */
    void setPixels(int x, int y, int c, PixelBuffer image);
    /**
     *
     * @return nominal number of cells, whether in bounds or not
     */
    long getSize();
    int getRadius();
    double[] getPixelValues();
    /**
     *
     * @return for each copied value, the X coordinate of the window cell it was read from
     */
    int[] getCellX();
    /**
     *
     * @return for each copied value, the Y coordinate of the window cell it was read from
     */
    int[] getCellY();
    int getValueCount();
    Neighborhood duplicate();
}
