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

import pixelops.configuration.TransformationChain;
import pixelops.image.PixelBuffer;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static pixelops.test_utils.TestUtils.assertImage;
import static pixelops.test_utils.TestUtils.generateRandomImage;

public class TestEdgeDetection {
    public static final Logger logger = LoggerFactory.getLogger(TestEdgeDetection.class);

    /**
     * vertical step: 0 for x < stepX, value otherwise
     */
    static PixelBuffer step(int width, int height, int stepX, double value) {
        PixelBuffer res = new PixelBuffer("step", width, height, 1);
        for (int y = 0; y < height; ++y) {
            for (int x = stepX; x < width; ++x) res.setPixel(x, y, 0, value);
        }
        return res;
    }

    @Test
    public void testSobelOnStep() {
        PixelBuffer image = step(20, 10, 10, 1);
        PixelBuffer edgeX = Filters.applyKernel(image, Kernels.SOBEL_X);
        PixelBuffer edgeY = Filters.applyKernel(image, Kernels.SOBEL_Y);
        PixelBuffer edges = Filters.sobel(image, false);
        for (int y = 1; y < 9; ++y) {
            assertEquals("gradient along X before the step", -4, edgeX.getPixel(9, y, 0), 1e-12);
            assertEquals("gradient along X after the step", -4, edgeX.getPixel(10, y, 0), 1e-12);
            assertEquals("no gradient along Y", 0, edgeY.getPixel(10, y, 0), 1e-12);
            assertEquals("edge magnitude", 4, edges.getPixel(9, y, 0), 1e-12);
            assertEquals("edge magnitude", 4, edges.getPixel(10, y, 0), 1e-12);
            for (int x : new int[]{3, 5, 7, 12, 15, 17}) assertEquals("flat region at x=" + x, 0, edges.getPixel(x, y, 0), 1e-12);
        }
    }

    @Test
    public void testHorizontalStep() {
        PixelBuffer image = new PixelBuffer("step", 10, 20, 1);
        for (int y = 10; y < 20; ++y) {
            for (int x = 0; x < 10; ++x) image.setPixel(x, y, 0, 2);
        }
        PixelBuffer edgeX = Filters.applyKernel(image, Kernels.SOBEL_X);
        PixelBuffer edgeY = Filters.applyKernel(image, Kernels.SOBEL_Y);
        for (int x = 1; x < 9; ++x) {
            assertEquals("no gradient along X", 0, edgeX.getPixel(x, 10, 0), 1e-12);
            assertEquals("gradient along Y", -8, edgeY.getPixel(x, 10, 0), 1e-12);
        }
    }

    /**
     * all operations on a 3-channel image
     */
    @Test
    public void testPhotoEditingScenario() {
        PixelBuffer image = generateRandomImage(40, 30, 3, 1);
        PixelBuffer copy = image.duplicate();
        PixelBuffer brightened = ImageOperations.brighten(image, 1.9);
        PixelBuffer darkened = ImageOperations.brighten(image, 0.4);
        PixelBuffer increasedContrast = ImageOperations.adjustContrast(image, 2, 0.5);
        PixelBuffer decreasedContrast = ImageOperations.adjustContrast(image, 0.7, 0.5);
        PixelBuffer blur3 = Filters.blur(image, 3);
        PixelBuffer blur9 = Filters.blur(image, 9);
        PixelBuffer edgeX = Filters.applyKernel(image, Kernels.SOBEL_X);
        PixelBuffer edgeY = Filters.applyKernel(image, Kernels.SOBEL_Y);
        PixelBuffer edgeXY = ImageOperations.combine(edgeX, edgeY);
        for (PixelBuffer res : new PixelBuffer[]{brightened, darkened, increasedContrast, decreasedContrast, blur3, blur9, edgeX, edgeY, edgeXY}) {
            assertEquals(res.getName(), image.shape(), res.shape());
        }
        assertImage("input never modified", copy, image, 0);
        assertTrue("brightened samples may exceed 1", brightened.getMinAndMax()[1] > 1);
        assertTrue("edge magnitude is positive", edgeXY.getMinAndMax()[0] >= 0);
        assertTrue("larger window is smoother", variance(blur9, 20, 15) < variance(blur3, 20, 15));
        assertImage("sobel", edgeXY, Filters.sobel(image, false), 0);

        TransformationChain chain = TransformationChain.fromJSON("{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 3}, {\"name\": \"SobelEdges\"}]}");
        assertImage("configured chain", Filters.sobel(blur3, false), chain.apply(image), 0);
    }

    static double variance(PixelBuffer image, int x, int y) {
        double mean = 0, mean2 = 0;
        int count = 0;
        for (int c = 0; c < image.channels(); ++c) {
            for (int dy = -5; dy <= 5; ++dy) {
                for (int dx = -5; dx <= 5; ++dx) {
                    double v = image.getPixel(x + dx, y + dy, c);
                    mean += v;
                    mean2 += v * v;
                    ++count;
                }
            }
        }
        mean /= count;
        return mean2 / count - mean * mean;
    }

    @Test
    public void testParallelEquivalence() {
        PixelBuffer image = generateRandomImage(200, 150, 3, 2);
        long t0 = System.currentTimeMillis();
        PixelBuffer seq = Filters.sobel(Filters.blur(image, 5, false), false);
        long t1 = System.currentTimeMillis();
        PixelBuffer par = Filters.sobel(Filters.blur(image, 5, true), true);
        long t2 = System.currentTimeMillis();
        logger.info("blur + sobel processing time sequential: {}ms parallel: {}ms", t1 - t0, t2 - t1);
        assertImage("parallel", seq, par, 0);

        TransformationChain chain = TransformationChain.fromJSON("{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 5}, {\"name\": \"SobelEdges\"}]}");
        assertImage("sequential chain", seq, chain.apply(image), 0);
        assertImage("parallel chain", seq, chain.setParallel(true).apply(image), 0);
    }
}
