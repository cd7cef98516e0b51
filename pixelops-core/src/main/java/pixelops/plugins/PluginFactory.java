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

import pixelops.plugins.plugins.transformations.AdjustContrast;
import pixelops.plugins.plugins.transformations.ApplyKernel;
import pixelops.plugins.plugins.transformations.Blur;
import pixelops.plugins.plugins.transformations.Brighten;
import pixelops.plugins.plugins.transformations.SobelEdges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves transformations by their simple class name
 */
public class PluginFactory {
    private final static Logger logger = LoggerFactory.getLogger(PluginFactory.class);
    private final static TreeMap<String, Class<? extends Transformation>> PLUGIN_NAMES_MAP_CLASS = new TreeMap<>();
    static {
        addPlugin(Brighten.class);
        addPlugin(AdjustContrast.class);
        addPlugin(Blur.class);
        addPlugin(ApplyKernel.class);
        addPlugin(SobelEdges.class);
    }

    public static synchronized void addPlugin(Class<? extends Transformation> clazz) {
        Class<? extends Transformation> old = PLUGIN_NAMES_MAP_CLASS.put(getPluginName(clazz), clazz);
        if (old!=null && !old.equals(clazz)) logger.warn("Duplicate plugin name: {} ({} replaced by {})", getPluginName(clazz), old.getName(), clazz.getName());
    }

    public static String getPluginName(Class<?> clazz) {
        return clazz.getSimpleName();
    }

    public static synchronized List<String> getPluginNames() {
        return new ArrayList<>(PLUGIN_NAMES_MAP_CLASS.keySet());
    }

    public static synchronized Transformation getPlugin(String pluginName) {
        Class<? extends Transformation> clazz = PLUGIN_NAMES_MAP_CLASS.get(pluginName);
        if (clazz==null) throw new IllegalArgumentException("Unknown transformation: "+pluginName+" available: "+PLUGIN_NAMES_MAP_CLASS.keySet());
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException ex) {
            logger.error("Could not instantiate plugin: "+pluginName, ex);
            throw new IllegalStateException("Could not instantiate plugin: "+pluginName, ex);
        }
    }

    /**
     * @param jsonEntry object holding the plugin name under {@link Transformation#NAME_KEY} and its parameters
     */
    public static Transformation getPlugin(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Transformation entry should be a JSON object: "+jsonEntry);
        Object name = ((Map)jsonEntry).get(Transformation.NAME_KEY);
        if (!(name instanceof String)) throw new IllegalArgumentException("Transformation entry without name: "+jsonEntry);
        Transformation res = getPlugin((String)name);
        res.initFromJSONEntry(jsonEntry);
        return res;
    }
}
