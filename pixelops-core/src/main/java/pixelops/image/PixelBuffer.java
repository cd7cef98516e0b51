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

/**
 * Dense raster of double samples indexed [x, y, c].
 * Samples are stored one plane per channel, each plane in row-major order (index x + y * width).
 * Sample values are never validated nor clamped: quantization to a displayable range is the encoder's concern.
 */
public class PixelBuffer {
    protected String name;
    protected final BufferShape shape;
    protected final int width, height, channels, sizeXY;
    final private double[][] pixels;

    /**
     * Builds a new zero-filled buffer
     * @param name name of the buffer
     * @throws InvalidDimensionException if any dimension is not strictly positive
     */
    public PixelBuffer(String name, int width, int height, int channels) {
        this(name, new BufferShape(width, height, channels));
    }

    /**
     * Builds a new zero-filled buffer with the given shape
     */
    public PixelBuffer(String name, BufferShape shape) {
        this.name = name;
        this.shape = shape;
        this.width = shape.width;
        this.height = shape.height;
        this.channels = shape.channels;
        this.sizeXY = width * height;
        this.pixels = new double[channels][sizeXY];
    }

    /**
     * Wraps samples produced by an external decoder.
     * @param samples interleaved samples: index (x + y * width) * channels + c
     * @throws InvalidDimensionException if a dimension is not strictly positive or if samples length does not match
     */
    public PixelBuffer(String name, int width, int height, int channels, double[] samples) {
        this(name, width, height, channels);
        if (samples.length != (long)sizeXY * channels) throw new InvalidDimensionException("sample count "+samples.length+" does not match shape "+shape);
        for (int xy = 0; xy<sizeXY; ++xy) {
            int off = xy * channels;
            for (int c = 0; c<channels; ++c) pixels[c][xy] = samples[off + c];
        }
    }

    public String getName() {
        return name;
    }

    public PixelBuffer setName(String name) {
        this.name = name;
        return this;
    }

    public BufferShape shape() {
        return shape;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public int sizeXY() {
        return sizeXY;
    }

    public boolean sameShape(PixelBuffer other) {
        return shape.equals(other.shape);
    }

    /**
     * @throws OutOfRangeException if any index is outside its extent
     */
    public double getPixel(int x, int y, int c) {
        checkRange(x, y, c);
        return pixels[c][x+y*width];
    }

    /**
     * @throws OutOfRangeException if any index is outside its extent
     */
    public void setPixel(int x, int y, int c, double value) {
        checkRange(x, y, c);
        pixels[c][x+y*width] = value;
    }

    /**
     * No bounds check, for engines that already computed a valid window
     */
    public double getPixel(int xy, int c) {
        return pixels[c][xy];
    }

    /**
     * No bounds check, for engines that already computed a valid window
     */
    public void setPixel(int xy, int c, double value) {
        pixels[c][xy] = value;
    }

    protected void checkRange(int x, int y, int c) {
        if (!shape.contains(x, y, c)) throw new OutOfRangeException("index ("+x+", "+y+", "+c+") out of buffer "+name+" of shape "+shape);
    }

    /**
     * @return backing planes, one per channel, each of length width * height
     */
    public double[][] getPixelArray() {
        return pixels;
    }

    /**
     * @return a copy of all samples, interleaved: index (x + y * width) * channels + c
     */
    public double[] toInterleavedArray() {
        double[] res = new double[sizeXY * channels];
        for (int c = 0; c<channels; ++c) {
            for (int xy = 0; xy<sizeXY; ++xy) res[xy * channels + c] = pixels[c][xy];
        }
        return res;
    }

    public double[] getMinAndMax() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c<channels; ++c) {
            for (int xy = 0; xy<sizeXY; ++xy) {
                if (pixels[c][xy]<min) min = pixels[c][xy];
                if (pixels[c][xy]>max) max = pixels[c][xy];
            }
        }
        return new double[]{min, max};
    }

    /**
     * @return a new zero-filled buffer with the same shape
     */
    public PixelBuffer newBuffer(String name) {
        return new PixelBuffer(name, shape);
    }

    public PixelBuffer duplicate(String name) {
        PixelBuffer res = new PixelBuffer(name, shape);
        for (int c = 0; c<channels; ++c) System.arraycopy(pixels[c], 0, res.pixels[c], 0, sizeXY);
        return res;
    }

    public PixelBuffer duplicate() {
        return duplicate(name);
    }

    @Override
    public String toString() {
        return name + shape;
    }
}
