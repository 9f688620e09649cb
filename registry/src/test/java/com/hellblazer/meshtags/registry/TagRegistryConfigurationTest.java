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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TagRegistryConfiguration and CreationCounter
 *
 * @author hal.hildebrand
 */
public class TagRegistryConfigurationTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(TagRegistryConfiguration.DEFAULT_START_TAG_PROPERTY);
    }

    @Test
    void testDefaults() {
        var config = TagRegistryConfiguration.defaultConfig();
        assertEquals(1, config.defaultStartTag());
        assertFalse(config.uniqueNames());
    }

    @Test
    void testCopyModifiers() {
        var config = TagRegistryConfiguration.defaultConfig().withDefaultStartTag(10).withUniqueNames(true);
        assertEquals(new TagRegistryConfiguration(10, true), config);
        assertEquals(new TagRegistryConfiguration(10, true).hashCode(), config.hashCode());
        assertNotEquals(TagRegistryConfiguration.defaultConfig(), config);
    }

    @Test
    void testInvalidDefaultStartTag() {
        assertThrows(TagRegistryException.InvalidStartTagException.class, () -> new TagRegistryConfiguration(0, false));
        assertThrows(TagRegistryException.InvalidStartTagException.class,
                     () -> TagRegistryConfiguration.defaultConfig().withDefaultStartTag(-3));
    }

    @Test
    void testFromSystemProperties() {
        assertEquals(TagRegistryConfiguration.defaultConfig(), TagRegistryConfiguration.fromSystemProperties());

        System.setProperty(TagRegistryConfiguration.DEFAULT_START_TAG_PROPERTY, " 500 ");
        assertEquals(500, TagRegistryConfiguration.fromSystemProperties().defaultStartTag());

        System.setProperty(TagRegistryConfiguration.DEFAULT_START_TAG_PROPERTY, "many");
        assertThrows(TagRegistryException.InvalidStartTagException.class,
                     TagRegistryConfiguration::fromSystemProperties);

        System.setProperty(TagRegistryConfiguration.DEFAULT_START_TAG_PROPERTY, "-1");
        assertThrows(TagRegistryException.InvalidStartTagException.class,
                     TagRegistryConfiguration::fromSystemProperties);
    }

    @Test
    void testCreationCounter() {
        var counter = new CreationCounter();
        assertEquals(0L, counter.peek());
        assertEquals(0L, counter.next());
        assertEquals(1L, counter.next());
        assertEquals(2L, counter.peek());
        counter.reset();
        assertEquals(0L, counter.next());

        var offset = new CreationCounter(Long.MAX_VALUE - 1);
        assertEquals(Long.MAX_VALUE - 1, offset.next());
        assertThrows(IllegalStateException.class, offset::next);
        assertThrows(IllegalArgumentException.class, () -> new CreationCounter(-1));
    }
}
