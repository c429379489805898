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

import celltrace.configuration.ProcessingParams;

/**
 * Named algorithm implementation, instantiated by {@link PluginFactory} through its no-argument constructor
 */
public interface Plugin {
    /**
     * Called once after instantiation, before any processing
     * @throws IllegalArgumentException if parameters are not valid for this plugin
     */
    default void configure(ProcessingParams params) {}
}
