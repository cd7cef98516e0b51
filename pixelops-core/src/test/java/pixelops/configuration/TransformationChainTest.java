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
package pixelops.configuration;

import pixelops.image.InvalidKernelSizeException;
import pixelops.image.PixelBuffer;
import pixelops.plugins.PluginFactory;
import pixelops.plugins.Transformation;
import pixelops.plugins.plugins.transformations.AdjustContrast;
import pixelops.plugins.plugins.transformations.ApplyKernel;
import pixelops.plugins.plugins.transformations.Blur;
import pixelops.plugins.plugins.transformations.Brighten;
import pixelops.plugins.plugins.transformations.SobelEdges;
import pixelops.processing.Filters;
import pixelops.processing.Filters.Normalization;
import pixelops.processing.ImageOperations;
import pixelops.processing.Kernels;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static pixelops.test_utils.TestUtils.assertImage;
import static pixelops.test_utils.TestUtils.generateRandomImage;

public class TransformationChainTest {

    @Test
    public void testApply() {
        PixelBuffer image = generateRandomImage(10, 8, 3, 20);
        PixelBuffer copy = image.duplicate();
        TransformationChain chain = new TransformationChain(new Brighten(1.9), new AdjustContrast(2, 0.5), new Blur(3));
        PixelBuffer expected = Filters.blur(ImageOperations.adjustContrast(ImageOperations.brighten(image, 1.9), 2, 0.5), 3);
        assertImage("chain", expected, chain.apply(image), 0);
        assertImage("input not modified", copy, image, 0);
    }

    @Test
    public void testEmptyChain() {
        PixelBuffer image = generateRandomImage(4, 4, 1, 21);
        PixelBuffer res = new TransformationChain().apply(image);
        assertNotSame(image, res);
        assertImage(image, res, 0);
    }

    @Test
    public void testFromJSON() {
        String json = "{\"parallel\": true, \"steps\": [" +
                "{\"name\": \"Blur\", \"windowSize\": 5, \"normalization\": \"SAMPLE_COUNT\"}," +
                "{\"name\": \"ApplyKernel\", \"kernel\": [[0, 0, 0], [0, 2, 0], [0, 0, 0]]}," +
                "{\"name\": \"AdjustContrast\", \"factor\": 0.7}," +
                "{\"name\": \"SobelEdges\"}]}";
        TransformationChain chain = TransformationChain.fromJSON(json);
        assertTrue(chain.isParallel());
        List<Transformation> steps = chain.getSteps();
        assertEquals(4, steps.size());
        Blur blur = (Blur) steps.get(0);
        assertEquals(5, blur.getWindowSize());
        assertEquals(Normalization.SAMPLE_COUNT, blur.getNormalization());
        assertEquals(2, ((ApplyKernel) steps.get(1)).getKernel().getWeight(1, 1), 0);
        assertEquals("default mid", AdjustContrast.DEFAULT_MID, ((AdjustContrast) steps.get(2)).getMid(), 0);
        assertTrue(steps.get(3) instanceof SobelEdges);

        PixelBuffer image = generateRandomImage(12, 9, 2, 22);
        PixelBuffer expected = Filters.sobel(ImageOperations.adjustContrast(ImageOperations.brighten(Filters.blur(image, 5, Normalization.SAMPLE_COUNT), 2), 0.7, 0.5), false);
        assertImage("configured chain", expected, chain.apply(image), 1e-12);
    }

    @Test
    public void testJSONRoundTrip() {
        TransformationChain chain = new TransformationChain(new Brighten(0.4), new Blur(9), new ApplyKernel(Kernels.SOBEL_X), new AdjustContrast(-1, 0.25), new SobelEdges()).setParallel(true);
        TransformationChain read = TransformationChain.fromJSON(chain.toJSONString());
        assertEquals(chain.toJSONEntry(), read.toJSONEntry());
        assertEquals(Kernels.SOBEL_X, ((ApplyKernel) read.getSteps().get(2)).getKernel());
        PixelBuffer image = generateRandomImage(6, 6, 1, 23);
        assertImage("same result after round trip", chain.apply(image), read.apply(image), 0);
    }

    @Test
    public void testInvalidConfiguration() {
        String[] invalid = new String[]{
                "{\"steps\": [{\"name\": \"Unknown\"}]}",
                "{\"steps\": [{\"windowSize\": 3}]}",
                "{\"steps\": [{\"name\": \"Brighten\"}]}",
                "{\"steps\": [{\"name\": \"Brighten\", \"factor\": \"high\"}]}",
                "{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 3.5}]}",
                "{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 1e10}]}",
                "{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 10000000001}]}",
                "{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 3, \"normalization\": \"NONE\"}]}",
                "{\"steps\": [{\"name\": \"ApplyKernel\"}]}",
                "{\"steps\": {\"name\": \"Blur\"}}",
                "{\"parallel\": \"yes\"}",
                "[1, 2]",
                "{\"steps\": ["
        };
        for (String json : invalid) {
            try {
                TransformationChain.fromJSON(json);
                fail("configuration should be rejected: " + json);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test(expected = InvalidKernelSizeException.class)
    public void testInvalidWindowSizeConfiguration() {
        TransformationChain.fromJSON("{\"steps\": [{\"name\": \"Blur\", \"windowSize\": 4}]}");
    }

    @Test(expected = InvalidKernelSizeException.class)
    public void testInvalidKernelConfiguration() {
        TransformationChain.fromJSON("{\"steps\": [{\"name\": \"ApplyKernel\", \"kernel\": [[1, 2], [3, 4]]}]}");
    }

    @Test
    public void testPluginFactory() {
        List<String> names = PluginFactory.getPluginNames();
        assertTrue(names.containsAll(Arrays.asList("Brighten", "AdjustContrast", "Blur", "ApplyKernel", "SobelEdges")));
        for (String name : names) {
            Transformation t = PluginFactory.getPlugin(name);
            assertEquals(name, PluginFactory.getPluginName(t.getClass()));
            assertTrue("hint for " + name, t.getHintText() != null && !t.getHintText().isEmpty());
        }
    }
}
