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

import pixelops.image.PixelBuffer;
import pixelops.plugins.PluginFactory;
import pixelops.plugins.Transformation;
import pixelops.utils.JSONSerializable;
import pixelops.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of transformations applied one after the other.
 * JSON form: <code>{"parallel": false, "steps": [{"name": "Blur", "windowSize": 3}, {"name": "SobelEdges"}]}</code>
 */
public class TransformationChain implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(TransformationChain.class);
    final List<Transformation> steps = new ArrayList<>();
    boolean parallel = false;

    public TransformationChain() {}

    public TransformationChain(Transformation... steps) {
        for (Transformation t : steps) add(t);
    }

    public static TransformationChain fromJSON(String json) {
        TransformationChain res = new TransformationChain();
        res.initFromJSONEntry(JSONUtils.parse(json));
        return res;
    }

    public TransformationChain add(Transformation transformation) {
        if (transformation==null) throw new IllegalArgumentException("transformation cannot be null");
        steps.add(transformation);
        return this;
    }

    public List<Transformation> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public boolean isParallel() {
        return parallel;
    }

    public TransformationChain setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    /**
     *
     * @param input buffer, never modified
     * @return result of the last step, or a copy of input if the chain is empty
     */
    public PixelBuffer apply(PixelBuffer input) {
        if (steps.isEmpty()) return input.duplicate();
        PixelBuffer current = input;
        for (int i = 0; i<steps.size(); ++i) {
            Transformation t = steps.get(i);
            long t0 = System.currentTimeMillis();
            current = t.applyTransformation(current, parallel);
            long t1 = System.currentTimeMillis();
            logger.debug("step {}/{}: {} -> {} in {}ms", i+1, steps.size(), PluginFactory.getPluginName(t.getClass()), current, t1-t0);
        }
        return current;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("parallel", parallel);
        JSONArray list = new JSONArray();
        for (Transformation t : steps) list.add(t.toJSONEntry());
        res.put("steps", list);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Transformation chain should be a JSON object: "+jsonEntry);
        Map json = (Map)jsonEntry;
        Object stepList = json.get("steps");
        if (stepList!=null && !(stepList instanceof List)) throw new IllegalArgumentException("\"steps\" should be a JSON array: "+json);
        List<Transformation> newSteps = new ArrayList<>();
        if (stepList!=null) {
            for (Object o : (List)stepList) newSteps.add(PluginFactory.getPlugin(o));
        }
        parallel = JSONUtils.getBoolean(json, "parallel", false);
        steps.clear();
        steps.addAll(newSteps);
    }

    public String toJSONString() {
        return JSONUtils.toJSONString(toJSONEntry());
    }
}
