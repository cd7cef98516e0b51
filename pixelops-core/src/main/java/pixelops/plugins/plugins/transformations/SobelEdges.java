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
import pixelops.processing.Filters;
import org.json.simple.JSONObject;

public class SobelEdges implements Transformation {
    @Override
    public String getHintText() {
        return "Edge magnitude: sqrt(Gx² + Gy²) where Gx and Gy are the responses to the Sobel kernels";
    }

    @Override
    public PixelBuffer applyTransformation(PixelBuffer image, boolean parallel) {
        return Filters.sobel(image, parallel);
    }

    @Override
    public JSONObject toJSONEntry() {
        return initJSONEntry();
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {}
}
