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

import pixelops.image.BufferShape;
import pixelops.image.Kernel;
import pixelops.image.PixelBuffer;
import pixelops.processing.neighborhood.Neighborhood;
import pixelops.processing.neighborhood.SquareNeighborhood;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Neighborhood filters. For each output sample (x, y, c), a square window of the input channel c is aggregated.
 * The window is clamped to the image bounds (see {@link SquareNeighborhood}), so that edge and corner pixels are computed from fewer samples than interior pixels.
 * Inputs are never modified; each call returns a new fully populated buffer.
 */
public class Filters {
    public final static Logger logger = LoggerFactory.getLogger(Filters.class);

    public enum Normalization {
        /**
         * sum is divided by windowSize², whatever the number of in-bounds samples: edges and corners are attenuated
         */
        NOMINAL_AREA,
        /**
         * sum is divided by the number of in-bounds samples
         */
        SAMPLE_COUNT
    }

    /**
     * Uniform average over a windowSize x windowSize window, divided by the nominal window area
     * @param windowSize positive odd integer
     * @throws pixelops.image.InvalidKernelSizeException unless windowSize is positive and odd
     */
    public static PixelBuffer blur(PixelBuffer image, int windowSize) {
        return blur(image, windowSize, Normalization.NOMINAL_AREA, false);
    }

    public static PixelBuffer blur(PixelBuffer image, int windowSize, boolean parallel) {
        return blur(image, windowSize, Normalization.NOMINAL_AREA, parallel);
    }

    public static PixelBuffer blur(PixelBuffer image, int windowSize, Normalization normalization) {
        return blur(image, windowSize, normalization, false);
    }

    public static PixelBuffer blur(PixelBuffer image, int windowSize, Normalization normalization, boolean parallel) {
        return applyFilter(image, new Mean(normalization), new SquareNeighborhood(windowSize), parallel);
    }

    /**
     * Unnormalized convolution: Σ image[x_i, y_i, c] * kernel[x_i - x + r][y_i - y + r] over the clamped window.
     * Kernel cells falling outside the image are skipped. The output scale depends on the sum of the kernel weights.
     */
    public static PixelBuffer applyKernel(PixelBuffer image, Kernel kernel) {
        return applyKernel(image, kernel, false);
    }

    /**
     * @param kernel square, odd-sided weights matrix
     * @throws pixelops.image.InvalidKernelSizeException if kernel is not square or not odd-sided
     */
    public static PixelBuffer applyKernel(PixelBuffer image, double[][] kernel) {
        return applyKernel(image, new Kernel(kernel), false);
    }

    public static PixelBuffer applyKernel(PixelBuffer image, Kernel kernel, boolean parallel) {
        return applyFilter(image, new Convolution(kernel), new SquareNeighborhood(kernel.getSize()), parallel);
    }

    /**
     * Edge magnitude: combination of the responses to {@link Kernels#SOBEL_X} and {@link Kernels#SOBEL_Y}
     */
    public static PixelBuffer sobel(PixelBuffer image, boolean parallel) {
        PixelBuffer edgeX = applyKernel(image, Kernels.SOBEL_X, parallel);
        PixelBuffer edgeY = applyKernel(image, Kernels.SOBEL_Y, parallel);
        return ImageOperations.combine(edgeX, edgeY).setName("Sobel of: "+image.getName());
    }

    public static <F extends Filter> PixelBuffer applyFilter(PixelBuffer image, F filter, Neighborhood neighborhood) {
        return applyFilter(image, filter, neighborhood, false);
    }

    /**
     *
     * @param image input buffer, only read
     * @param filter aggregation function; duplicated for each thread in parallel mode
     * @param neighborhood window; duplicated for each thread in parallel mode
     * @param parallel rows are distributed over several threads. Result is identical to the sequential one
     * @return new buffer with the shape of {@param image}
     */
    public static <F extends Filter> PixelBuffer applyFilter(PixelBuffer image, F filter, Neighborhood neighborhood, boolean parallel) {
        if (filter==null) throw new IllegalArgumentException("Apply Filter Error: Filter cannot be null");
        if (neighborhood==null) throw new IllegalArgumentException("Apply Filter ("+filter.getClass().getSimpleName()+") Error: Neighborhood cannot be null");
        filter.check(neighborhood);
        PixelBuffer res = image.newBuffer(filter.getClass().getSimpleName()+" of: "+image.getName());
        int width = image.width();
        long t0 = System.currentTimeMillis();
        if (parallel && Runtime.getRuntime().availableProcessors()>1) {
            BufferShape.loop(res.shape(), () -> {
                Filter f = filter.duplicate();
                f.setUp(image, neighborhood.duplicate());
                return (x, y, c) -> res.setPixel(x + y * width, c, f.applyFilter(x, y, c));
            }, true);
        } else {
            filter.setUp(image, neighborhood);
            BufferShape.loop(res.shape(), (x, y, c) -> res.setPixel(x + y * width, c, filter.applyFilter(x, y, c)));
        }
        long t1 = System.currentTimeMillis();
        logger.debug("{} on {} with {}: {}ms (parallel: {})", filter.getClass().getSimpleName(), image, neighborhood, t1-t0, parallel);
        return res;
    }

    public static abstract class Filter {
        protected PixelBuffer image;
        protected Neighborhood neighborhood;
        public void setUp(PixelBuffer image, Neighborhood neighborhood) {this.image=image; this.neighborhood=neighborhood;}
        /**
         * Validates the neighborhood before any sample is computed
         */
        protected void check(Neighborhood neighborhood) {}
        public abstract double applyFilter(int x, int y, int c);
        public abstract Filter duplicate();
    }

    public static class Mean extends Filter {
        final Normalization normalization;
        public Mean() {
            this(Normalization.NOMINAL_AREA);
        }
        public Mean(Normalization normalization) {
            this.normalization = normalization;
        }
        @Override public Mean duplicate() {
            return new Mean(normalization);
        }
        @Override public double applyFilter(int x, int y, int c) {
            neighborhood.setPixels(x, y, c, image);
            double sum = 0;
            double[] values = neighborhood.getPixelValues();
            for (int i = 0; i<neighborhood.getValueCount(); ++i) sum+=values[i];
            switch (normalization) {
                case SAMPLE_COUNT:
                    return sum / neighborhood.getValueCount();
                case NOMINAL_AREA:
                default:
                    return sum / (double)neighborhood.getSize();
            }
        }
    }

    /**
     * Weighted sum over the neighborhood. Weights are read through the window cell coordinates, so the neighborhood must be as large as the kernel.
     */
    public static class Convolution extends Filter {
        final Kernel kernel;
        final double[][] weights;
        public Convolution(Kernel kernel) {
            this.kernel = kernel;
            this.weights = kernel.getWeights();
        }
        @Override protected void check(Neighborhood neighborhood) {
            if (neighborhood.getSize()!=(long)kernel.getSize() * kernel.getSize()) throw new IllegalArgumentException("neighborhood "+neighborhood+" does not match kernel of size "+kernel.getSize());
        }
        @Override public Convolution duplicate() {
            return new Convolution(kernel);
        }
        @Override public double applyFilter(int x, int y, int c) {
            neighborhood.setPixels(x, y, c, image);
            double sum = 0;
            double[] values = neighborhood.getPixelValues();
            int[] cellX = neighborhood.getCellX();
            int[] cellY = neighborhood.getCellY();
            for (int i = 0; i<neighborhood.getValueCount(); ++i) sum+=values[i] * weights[cellX[i]][cellY[i]];
            return sum;
        }
    }
}
