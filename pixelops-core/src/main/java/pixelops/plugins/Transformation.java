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
package pixelops.plugins;

import pixelops.image.PixelBuffer;
import pixelops.utils.JSONSerializable;
import org.json.simple.JSONObject;

/**
 * Operation turning one buffer into a new buffer. Implementations never modify their input.
 * Parameters are persisted as a JSON object holding the simple class name under {@link #NAME_KEY}.
 */
public interface Transformation extends JSONSerializable, Hint {
    String NAME_KEY = "name";

    /**
     *
     * @param image input buffer, only read
     * @param parallel whether the operation may distribute its work over several threads
     * @return new buffer
     */
    PixelBuffer applyTransformation(PixelBuffer image, boolean parallel);

    @Override
    JSONObject toJSONEntry();

    default JSONObject initJSONEntry() {
        JSONObject res = new JSONObject();
        res.put(NAME_KEY, PluginFactory.getPluginName(getClass()));
        return res;
    }
}
