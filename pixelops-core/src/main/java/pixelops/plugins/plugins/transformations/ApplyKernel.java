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
package pixelops.plugins.plugins.transformations;

import pixelops.image.Kernel;
import pixelops.image.PixelBuffer;
import pixelops.plugins.Transformation;
import pixelops.processing.Filters;
import pixelops.utils.JSONUtils;
import org.json.simple.JSONObject;

import java.util.List;
import java.util.Map;

public class ApplyKernel implements Transformation {
    Kernel kernel;

    public ApplyKernel() {}

    public ApplyKernel(Kernel kernel) {
        this.kernel = kernel;
    }

    public Kernel getKernel() {
        return kernel;
    }

    @Override
    public String getHintText() {
        return "Unnormalized convolution with a square odd-sided kernel. Kernel cells outside the image are ignored";
    }

    @Override
    public PixelBuffer applyTransformation(PixelBuffer image, boolean parallel) {
        if (kernel==null) throw new IllegalStateException("ApplyKernel: kernel not set");
        return Filters.applyKernel(image, kernel, parallel);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = initJSONEntry();
        if (kernel!=null) res.put("kernel", JSONUtils.toJSONArray(kernel.getWeights()));
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        Map json = (Map)jsonEntry;
        Object weights = json.get("kernel");
        if (!(weights instanceof List)) throw new IllegalArgumentException("missing kernel weights in: "+json);
        kernel = new Kernel(JSONUtils.fromDoubleArray2D((List)weights));
    }
}
