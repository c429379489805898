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
package celltrace.plugins;

import celltrace.plugins.plugins.features.AspectRatio;
import celltrace.plugins.plugins.features.Area;
import celltrace.plugins.plugins.features.MeanIntensity;
import celltrace.plugins.plugins.features.ParticleCount;
import celltrace.plugins.plugins.features.TotalIntensity;
import celltrace.plugins.plugins.segmenters.LogStdSegmenter;
import celltrace.plugins.plugins.trackers.KalmanTracker;
import celltrace.plugins.plugins.trackers.OverlapTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Registry of named algorithm implementations
 */
public class PluginFactory {
    private final static Logger logger = LoggerFactory.getLogger(PluginFactory.class);
    private final static Map<String, Class<? extends Plugin>> PLUGIN_NAMES_MAP_CLASS = new TreeMap<>();
    private final static Map<String, String> ALIASES = new HashMap<>();
    static {
        addPlugin("logstd", LogStdSegmenter.class);
        addPlugin("iou", OverlapTracker.class);
        addPlugin("kalman", KalmanTracker.class);
        ALIASES.put("btrack", "kalman");
        addPlugin("area", Area.class);
        addPlugin("aspect_ratio", AspectRatio.class);
        addPlugin("intensity_total", TotalIntensity.class);
        addPlugin("intensity_mean", MeanIntensity.class);
        addPlugin("particle_num", ParticleCount.class);
    }

    public static synchronized void addPlugin(String name, Class<? extends Plugin> c) {
        if (name==null || name.trim().isEmpty()) throw new IllegalArgumentException("Plugin name cannot be empty");
        Class<? extends Plugin> other = PLUGIN_NAMES_MAP_CLASS.get(name);
        if (other!=null && !other.equals(c)) logger.warn("Plugin name: {} was registered for {}, replaced by {}", name, other.getName(), c.getName());
        PLUGIN_NAMES_MAP_CLASS.put(name, c);
    }

    /**
     * Instantiates the plugin registered as {@code pluginName}
     * @throws IllegalArgumentException if no plugin of type {@code clazz} is registered under this name, or if it cannot be instantiated
     */
    public static synchronized <T extends Plugin> T getPlugin(Class<T> clazz, String pluginName) {
        Class<? extends Plugin> plugClass = PLUGIN_NAMES_MAP_CLASS.get(pluginName);
        if (plugClass==null && ALIASES.containsKey(pluginName)) plugClass = PLUGIN_NAMES_MAP_CLASS.get(ALIASES.get(pluginName));
        if (plugClass==null || !clazz.isAssignableFrom(plugClass)) {
            throw new IllegalArgumentException("Unknown "+clazz.getSimpleName()+": "+pluginName+". Available: "+getPluginNames(clazz));
        }
        try {
            return clazz.cast(plugClass.getDeclaredConstructor().newInstance());
        } catch (InstantiationException|InvocationTargetException|NoSuchMethodException|IllegalAccessException ex) {
            logger.error("plugin: {} of class: {} could not be instantiated, missing no-argument constructor?", pluginName, clazz, ex);
            throw new IllegalArgumentException("Plugin "+pluginName+" could not be instantiated", ex);
        }
    }

    public static synchronized <T extends Plugin> List<String> getPluginNames(Class<T> clazz) {
        return PLUGIN_NAMES_MAP_CLASS.entrySet().stream().filter(e -> clazz.isAssignableFrom(e.getValue())).map(Map.Entry::getKey).sorted().collect(Collectors.toList());
    }
}
