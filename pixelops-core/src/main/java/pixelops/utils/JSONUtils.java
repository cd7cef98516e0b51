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
package pixelops.utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static String toJSONString(Object jsonObjectOrArray) {
        if (jsonObjectOrArray instanceof JSONObject) return ((JSONObject)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof JSONArray) return ((JSONArray)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof String) return (String)jsonObjectOrArray;
        else throw new IllegalArgumentException("Object is not JSONObject or JSONArray");
    }

    public static JSONObject parse(String s) {
        try {
            JSONParser p = new JSONParser();
            Object res = p.parse(s);
            if (res instanceof JSONObject) return (JSONObject)res;
            throw new IllegalArgumentException("JSON content is not an object: "+s);
        } catch (ParseException ex) {
            logger.debug("Error parsing JSON: {}", s);
            throw new IllegalArgumentException("Invalid JSON at position "+ex.getPosition()+": "+s, ex);
        }
    }

    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }

    public static JSONArray toJSONArray(double[][] array) {
        JSONArray res = new JSONArray();
        for (double[] row : array) res.add(toJSONArray(row));
        return res;
    }

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            Object o = array.get(i);
            if (!(o instanceof Number)) throw new IllegalArgumentException("not a number at index "+i+": "+array);
            res[i]=((Number)o).doubleValue();
        }
        return res;
    }

    public static double[][] fromDoubleArray2D(List array) {
        double[][] res = new double[array.size()][];
        for (int i = 0; i<res.length; ++i) {
            Object row = array.get(i);
            if (!(row instanceof List)) throw new IllegalArgumentException("row "+i+" is not an array: "+array);
            res[i] = fromDoubleArray((List)row);
        }
        return res;
    }

    public static double getDouble(Map json, String key) {
        Object v = json.get(key);
        if (!(v instanceof Number)) throw new IllegalArgumentException("missing or non numeric parameter \""+key+"\" in: "+json);
        return ((Number)v).doubleValue();
    }

    public static double getDouble(Map json, String key, double defaultValue) {
        if (!json.containsKey(key)) return defaultValue;
        return getDouble(json, key);
    }

    public static int getInt(Map json, String key) {
        double v = getDouble(json, key);
        if (v != Math.rint(v)) throw new IllegalArgumentException("parameter \""+key+"\" must be an integer in: "+json);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) throw new IllegalArgumentException("parameter \""+key+"\" is out of integer range in: "+json);
        return (int)v;
    }

    public static boolean getBoolean(Map json, String key, boolean defaultValue) {
        Object v = json.get(key);
        if (v==null) return defaultValue;
        if (!(v instanceof Boolean)) throw new IllegalArgumentException("parameter \""+key+"\" must be a boolean in: "+json);
        return (Boolean)v;
    }
}
