/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Meshtags.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.meshtags.registry;

import java.util.Objects;

/**
 * Configuration options for a {@link TagRegistry}.
 *
 * <p>Immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class TagRegistryConfiguration {

    /** System property overriding the default start tag */
    public static final String DEFAULT_START_TAG_PROPERTY = "meshtags.registry.defaultStartTag";

    /** Default start tag of a fresh or reset registry */
    public static final int DEFAULT_START_TAG = 1;

    private final int     defaultStartTag;
    private final boolean uniqueNames;

    /**
     * Create a new registry configuration.
     *
     * @param defaultStartTag the start tag of a fresh or reset registry
     * @param uniqueNames     whether live entities must carry distinct names
     * @throws TagRegistryException.InvalidStartTagException if the default start tag is not positive
     */
    public TagRegistryConfiguration(int defaultStartTag, boolean uniqueNames) {
        if (defaultStartTag <= 0) {
            throw new TagRegistryException.InvalidStartTagException("configuration", defaultStartTag);
        }
        this.defaultStartTag = defaultStartTag;
        this.uniqueNames = uniqueNames;
    }

    /**
     * Create a configuration with default values.
     *
     * @return a default configuration
     */
    public static TagRegistryConfiguration defaultConfig() {
        return new TagRegistryConfiguration(DEFAULT_START_TAG, false);
    }

    /**
     * Create a configuration whose default start tag is taken from the {@value #DEFAULT_START_TAG_PROPERTY} system
     * property, falling back to {@link #DEFAULT_START_TAG} when the property is not set.
     *
     * @return the configuration
     * @throws TagRegistryException.InvalidStartTagException if the property is not a positive integer
     */
    public static TagRegistryConfiguration fromSystemProperties() {
        var property = System.getProperty(DEFAULT_START_TAG_PROPERTY);
        if (property == null || property.isBlank()) {
            return defaultConfig();
        }
        try {
            return new TagRegistryConfiguration(Integer.parseInt(property.trim()), false);
        } catch (NumberFormatException e) {
            throw new TagRegistryException.InvalidStartTagException("configuration",
                                                                    DEFAULT_START_TAG_PROPERTY + " is not an integer: "
                                                                    + property);
        }
    }

    /**
     * Get the start tag of a fresh or reset registry.
     *
     * @return the default start tag
     */
    public int defaultStartTag() {
        return defaultStartTag;
    }

    /**
     * Whether live entities must carry distinct names.
     *
     * @return true if names are unique
     */
    public boolean uniqueNames() {
        return uniqueNames;
    }

    /**
     * Create a copy with a different default start tag.
     *
     * @param defaultStartTag the new default start tag
     * @return a new configuration
     */
    public TagRegistryConfiguration withDefaultStartTag(int defaultStartTag) {
        return new TagRegistryConfiguration(defaultStartTag, uniqueNames);
    }

    /**
     * Create a copy with name uniqueness switched on or off.
     *
     * @param uniqueNames whether names must be unique
     * @return a new configuration
     */
    public TagRegistryConfiguration withUniqueNames(boolean uniqueNames) {
        return new TagRegistryConfiguration(defaultStartTag, uniqueNames);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TagRegistryConfiguration that)) {
            return false;
        }
        return defaultStartTag == that.defaultStartTag && uniqueNames == that.uniqueNames;
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultStartTag, uniqueNames);
    }

    @Override
    public String toString() {
        return "TagRegistryConfiguration{defaultStartTag=" + defaultStartTag + ", uniqueNames=" + uniqueNames + "}";
    }
}
