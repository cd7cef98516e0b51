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
package pixelops.image;

import java.util.Arrays;

/**
 * Square matrix of weights with an odd side length, so that its center cell can be anchored on an output pixel.
 * Weights are indexed [i][j]: i along X and j along Y, as samples of a {@link PixelBuffer}.
 * Instances are immutable.
 */
public class Kernel {
    final private double[][] weights;
    final private int size, radius;

    /**
     * @param weights square matrix, copied
     * @throws InvalidKernelSizeException if weights is empty, not square or even-sided
     */
    public Kernel(double[][] weights) {
        checkSize(weights);
        this.size = weights.length;
        this.radius = size / 2;
        this.weights = new double[size][];
        for (int i = 0; i<size; ++i) this.weights[i] = Arrays.copyOf(weights[i], size);
    }

    public static Kernel uniform(int size, double value) {
        checkWindowSize(size);
        double[][] w = new double[size][size];
        for (double[] row : w) Arrays.fill(row, value);
        return new Kernel(w);
    }

    public static void checkSize(double[][] weights) {
        if (weights==null || weights.length==0) throw new InvalidKernelSizeException("kernel cannot be empty");
        for (int i = 0; i<weights.length; ++i) {
            if (weights[i]==null || weights[i].length!=weights.length) throw new InvalidKernelSizeException("kernel must be square: row "+i+" has "+(weights[i]==null ? 0 : weights[i].length)+" cells, expected "+weights.length);
        }
        if (weights.length%2==0) throw new InvalidKernelSizeException("kernel side must be odd, got: "+weights.length);
    }

    /**
     * @throws InvalidKernelSizeException unless windowSize is positive and odd
     */
    public static void checkWindowSize(int windowSize) {
        if (windowSize<=0 || windowSize%2==0) throw new InvalidKernelSizeException("window size must be a positive odd integer, got: "+windowSize);
    }

    public int getSize() {
        return size;
    }

    public int getRadius() {
        return radius;
    }

    public double getWeight(int i, int j) {
        return weights[i][j];
    }

    public double[][] getWeights() {
        double[][] res = new double[size][];
        for (int i = 0; i<size; ++i) res[i] = Arrays.copyOf(weights[i], size);
        return res;
    }

    public double sum() {
        double sum = 0;
        for (double[] row : weights) for (double w : row) sum+=w;
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kernel)) return false;
        return Arrays.deepEquals(weights, ((Kernel)o).weights);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(weights);
    }

    @Override
    public String toString() {
        return "Kernel"+size+"x"+size+Arrays.deepToString(weights);
    }
}
