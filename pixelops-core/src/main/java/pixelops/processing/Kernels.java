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
package pixelops.processing;

import pixelops.image.Kernel;

/**
 * Common kernels. Weights are indexed [i][j] with i along X, j along Y.
 */
public class Kernels {
    /**
     * Responds to intensity changes along X (vertical edges)
     */
    public final static Kernel SOBEL_X = new Kernel(new double[][]{
            {1, 2, 1},
            {0, 0, 0},
            {-1, -2, -1}
    });
    /**
     * Responds to intensity changes along Y (horizontal edges)
     */
    public final static Kernel SOBEL_Y = new Kernel(new double[][]{
            {1, 0, -1},
            {2, 0, -2},
            {1, 0, -1}
    });

    public static Kernel identity() {
        return new Kernel(new double[][]{{1}});
    }

    /**
     * Uniform kernel of weight 1/size². Same result as {@link Filters#blur(pixelops.image.PixelBuffer, int)}, up to rounding
     */
    public static Kernel box(int size) {
        Kernel.checkWindowSize(size);
        return Kernel.uniform(size, 1d / ((double)size * size));
    }
}
