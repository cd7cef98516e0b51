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

import pixelops.image.PixelBuffer;
import pixelops.image.ShapeMismatchException;

/**
 * Per-sample operations. Each returns a new buffer and leaves its inputs untouched. Output values are never clamped.
 */
public class ImageOperations {
    /**
     * output = input x factor
     * @param factor values lower than 1 darken, greater than 1 brighten
     */
    public static PixelBuffer brighten(PixelBuffer image, double factor) {
        return affineOperation(image, factor, 0).setName(image.getName()+" x "+factor);
    }

    /**
     * output = (input - mid) x factor + mid
     * @param factor amplifies (greater than 1) or compresses (lower than 1) the distance to mid; negative values invert
     * @param mid typically the center of the sample range
     */
    public static PixelBuffer adjustContrast(PixelBuffer image, double factor, double mid) {
        PixelBuffer output = image.newBuffer("("+image.getName()+" - "+mid+") x "+factor+" + "+mid);
        for (int c = 0; c<image.channels(); ++c) {
            for (int xy = 0; xy<image.sizeXY(); ++xy) {
                output.setPixel(xy, c, (image.getPixel(xy, c) - mid) * factor + mid);
            }
        }
        return output;
    }

    /**
     * Euclidean magnitude of two images, channel-wise: output = sqrt(image1² + image2²)
     * @throws ShapeMismatchException if shapes differ
     */
    public static PixelBuffer combine(PixelBuffer image1, PixelBuffer image2) {
        if (!image1.sameShape(image2)) throw new ShapeMismatchException(image1.shape(), image2.shape());
        PixelBuffer output = image1.newBuffer("|"+image1.getName()+", "+image2.getName()+"|");
        for (int c = 0; c<output.channels(); ++c) {
            for (int xy = 0; xy<output.sizeXY(); ++xy) {
                double a = image1.getPixel(xy, c);
                double b = image2.getPixel(xy, c);
                output.setPixel(xy, c, Math.sqrt(a * a + b * b));
            }
        }
        return output;
    }

    /**
     *
     * @param image input
     * @param multiplicativeCoefficient
     * @param additiveCoefficient
     * @return new buffer: multiplicative then additive
     */
    public static PixelBuffer affineOperation(PixelBuffer image, double multiplicativeCoefficient, double additiveCoefficient) {
        PixelBuffer output = image.newBuffer(image.getName()+" x "+multiplicativeCoefficient + " + "+additiveCoefficient);
        if (additiveCoefficient==0) {
            for (int c = 0; c<output.channels(); ++c) {
                for (int xy = 0; xy<output.sizeXY(); ++xy) {
                    output.setPixel(xy, c, image.getPixel(xy, c) * multiplicativeCoefficient);
                }
            }
        } else {
            for (int c = 0; c<output.channels(); ++c) {
                for (int xy = 0; xy<output.sizeXY(); ++xy) {
                    output.setPixel(xy, c, image.getPixel(xy, c) * multiplicativeCoefficient + additiveCoefficient);
                }
            }
        }
        return output;
    }
}
