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

import pixelops.image.Kernel;
import pixelops.image.PixelBuffer;

/**
 * Square window of side 2 * radius + 1, clamped to the image bounds: near edges and corners only the in-bounds part is read,
 * there is no padding nor mirroring.
 * Each copied value carries the coordinates (i, j) of its window cell, with i = x_i - x + radius and j = y_i - y + radius,
 * which is the [i][j] indexing of a {@link Kernel}.
 * Buffers are sized from the clamped extent of the window on the current image, not from the nominal window.
 */
public class SquareNeighborhood implements Neighborhood {
    final int radius, side;
    double[] values;
    int[] cellX, cellY;
    int valueCount = 0;

    /**
     *
     * @param windowSize side of the window
     * @throws pixelops.image.InvalidKernelSizeException unless windowSize is positive and odd
     */
    public SquareNeighborhood(int windowSize) {
        Kernel.checkWindowSize(windowSize);
        this.side = windowSize;
        this.radius = windowSize / 2;
    }

    protected void ensureCapacity(PixelBuffer image) {
        int capacity = Math.min(side, image.width()) * Math.min(side, image.height());
        if (values==null || values.length<capacity) {
            values = new double[capacity];
            cellX = new int[capacity];
            cellY = new int[capacity];
        }
    }

    @Override
    public void setPixels(int x, int y, int c, PixelBuffer image) {
        ensureCapacity(image);
        valueCount = 0;
        int xMin = Math.max(0, x - radius);
        int xMax = (int)Math.min(image.width() - 1, (long)x + radius);
        int yMin = Math.max(0, y - radius);
        int yMax = (int)Math.min(image.height() - 1, (long)y + radius);
        int width = image.width();
        double[] plane = image.getPixelArray()[c];
        for (int xx = xMin; xx<=xMax; ++xx) {
            int i = xx - x + radius;
            for (int yy = yMin; yy<=yMax; ++yy) {
                values[valueCount] = plane[xx + yy * width];
                cellX[valueCount] = i;
                cellY[valueCount++] = yy - y + radius;
            }
        }
    }

    @Override
    public long getSize() {
        return (long)side * side;
    }

    @Override
    public int getRadius() {
        return radius;
    }

    @Override
    public double[] getPixelValues() {
        return values;
    }

    @Override
    public int[] getCellX() {
        return cellX;
    }

    @Override
    public int[] getCellY() {
        return cellY;
    }

    @Override
    public int getValueCount() {
        return valueCount;
    }

    @Override
    public SquareNeighborhood duplicate() {
        return new SquareNeighborhood(side);
    }

    @Override
    public String toString() {
        return "SquareNeighborhood: side="+side;
    }
}
