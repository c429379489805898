/*
 * Copyright (C) celltrace contributors
 *
 * This File is part of celltrace
 *
 * celltrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * celltrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with celltrace.  If not, see <http://www.gnu.org/licenses/>.
 */
package celltrace.utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class JSONUtils {
    public final static Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (array.get(i)==null) {
                logger.debug("fromDoubleArrayError: {}", array);
                res[i] = Double.NaN;
            } else res[i]=((Number)array.get(i)).doubleValue();
        }
        return res;
    }
    public static int[] fromIntArray(List array) {
        int[] res = new int[array.size()];
        for (int i = 0; i<res.length; ++i) res[i]=((Number)array.get(i)).intValue();
        return res;
    }
    public static List<Integer> fromIntArrayList(List array) {
        List<Integer> res = new ArrayList<>(array.size());
        for (Object o : array) res.add(((Number)o).intValue());
        return res;
    }
    public static List<String> fromStringArrayList(List array) {
        List<String> res = new ArrayList<>(array.size());
        for (Object o : array) res.add((String)o);
        return res;
    }
    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArray(int[] array) {
        JSONArray res = new JSONArray();
        for (int d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArrayString(Collection<String> collection) {
        JSONArray res = new JSONArray();
        res.addAll(collection);
        return res;
    }
    public static JSONArray toJSONArray(Collection<? extends Number> collection) {
        JSONArray res = new JSONArray();
        res.addAll(collection);
        return res;
    }
    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        return (JSONObject)res;
    }
    public static int getInt(JSONObject json, String key, int defaultValue) {
        Object o = json.get(key);
        return o==null ? defaultValue : ((Number)o).intValue();
    }
    public static double getDouble(JSONObject json, String key, double defaultValue) {
        Object o = json.get(key);
        return o==null ? defaultValue : ((Number)o).doubleValue();
    }
    public static Integer getInteger(JSONObject json, String key) {
        Object o = json.get(key);
        return o==null ? null : ((Number)o).intValue();
    }
    public static String getString(JSONObject json, String key, String defaultValue) {
        Object o = json.get(key);
        return o==null ? defaultValue : o.toString();
    }
}
