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

public class AdjustContrast implements Transformation {
    public final static double DEFAULT_MID = 0.5;
    double factor = 1;
    double mid = DEFAULT_MID;

    public AdjustContrast() {}

    public AdjustContrast(double factor, double mid) {
        this.factor = factor;
        this.mid = mid;
    }

    public double getFactor() {
        return factor;
    }

    public double getMid() {
        return mid;
    }

    @Override
    public String getHintText() {
        return "Scales the distance of each sample to a midpoint (default: "+DEFAULT_MID+"). A negative factor inverts the image around the midpoint";
    }

    @Override
    public PixelBuffer applyTransformation(PixelBuffer image, boolean parallel) {
        return ImageOperations.adjustContrast(image, factor, mid);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = initJSONEntry();
        res.put("factor", factor);
        res.put("mid", mid);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        Map json = (Map)jsonEntry;
        factor = JSONUtils.getDouble(json, "factor");
        mid = JSONUtils.getDouble(json, "mid", DEFAULT_MID);
    }
}
