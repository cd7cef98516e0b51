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

import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Immutable (width, height, channels) triple of a {@link PixelBuffer}
 */
public class BufferShape {
    public final static int MAX_SIZE = Integer.MAX_VALUE - 8;
    final int width, height, channels;

    public BufferShape(int width, int height, int channels) {
        if (width<=0 || height<=0 || channels<=0) throw new InvalidDimensionException("dimensions must be strictly positive: width="+width+" height="+height+" channels="+channels);
        if ((long)width * height * channels > MAX_SIZE) throw new InvalidDimensionException("too many samples: width="+width+" height="+height+" channels="+channels);
        this.width = width;
        this.height = height;
        this.channels = channels;
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
        return width * height;
    }

    /**
     * @return total number of samples
     */
    public int size() {
        return width * height * channels;
    }

    public boolean contains(int x, int y, int c) {
        return x>=0 && x<width && y>=0 && y<height && c>=0 && c<channels;
    }

    /**
     *
     * @param shape area to loop over
     * @param function Each thread will call the function supplier only once and use only the supplied function.
     * @param parallel rows are distributed over several threads
     */
    public static void loop(BufferShape shape, Supplier<LoopFunction> function, boolean parallel) {
        if (!parallel || shape.height==1) {
            loop(shape, function.get());
            return;
        }
        ThreadLocal<LoopFunction> functions = ThreadLocal.withInitial(function);
        IntStream.range(0, shape.height).parallel().forEach(y -> {
            LoopFunction fun = functions.get();
            for (int c = 0; c<shape.channels; ++c) {
                for (int x = 0; x<shape.width; ++x) {
                    fun.loop(x, y, c);
                }
            }
        });
    }

    public static void loop(BufferShape shape, LoopFunction function) {
        for (int c = 0; c<shape.channels; ++c) {
            for (int y = 0; y<shape.height; ++y) {
                for (int x = 0; x<shape.width; ++x) {
                    function.loop(x, y, c);
                }
            }
        }
    }

    @FunctionalInterface
    public interface LoopFunction {
        void loop(int x, int y, int c);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BufferShape)) return false;
        BufferShape other = (BufferShape) o;
        return width == other.width && height == other.height && channels == other.channels;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + width;
        hash = 53 * hash + height;
        hash = 53 * hash + channels;
        return hash;
    }

    @Override
    public String toString() {
        return "[" + width + "x" + height + "x" + channels + "]";
    }
}
