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

import pixelops.image.PixelBuffer;
import pixelops.plugins.Transformation;
import pixelops.processing.ImageOperations;
import pixelops.utils.JSONUtils;
import org.json.simple.JSONObject;

import java.util.Map;

public class Brighten implements Transformation {
    double factor = 1;

    public Brighten() {}

    public Brighten(double factor) {
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public String getHintText() {
        return "Multiplies each sample by a factor: values lower than 1 darken, greater than 1 brighten. Output is not clamped";
    }

    @Override
    public PixelBuffer applyTransformation(PixelBuffer image, boolean parallel) {
        return ImageOperations.brighten(image, factor);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = initJSONEntry();
        res.put("factor", factor);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        factor = JSONUtils.getDouble((Map)jsonEntry, "factor");
    }
}
