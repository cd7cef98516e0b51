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
import pixelops.processing.Filters.Normalization;
import pixelops.utils.JSONUtils;
import org.json.simple.JSONObject;

import java.util.Map;

public class Blur implements Transformation {
    int windowSize = 3;
    Normalization normalization = Normalization.NOMINAL_AREA;

    public Blur() {}

    public Blur(int windowSize) {
        this(windowSize, Normalization.NOMINAL_AREA);
    }

    public Blur(int windowSize, Normalization normalization) {
        Kernel.checkWindowSize(windowSize);
        this.windowSize = windowSize;
        this.normalization = normalization;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    @Override
    public String getHintText() {
        return "Average over a square window (odd size) clamped to the image bounds. With "+Normalization.NOMINAL_AREA+" normalization, the sum is always divided by the window area so that edges are darkened";
    }

    @Override
    public PixelBuffer applyTransformation(PixelBuffer image, boolean parallel) {
        return Filters.blur(image, windowSize, normalization, parallel);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = initJSONEntry();
        res.put("windowSize", windowSize);
        res.put("normalization", normalization.name());
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        Map json = (Map)jsonEntry;
        int size = JSONUtils.getInt(json, "windowSize");
        Kernel.checkWindowSize(size);
        windowSize = size;
        Object norm = json.get("normalization");
        if (norm==null) normalization = Normalization.NOMINAL_AREA;
        else {
            try {
                normalization = Normalization.valueOf(norm.toString());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown normalization: "+norm+" in: "+json, e);
            }
        }
    }
}
