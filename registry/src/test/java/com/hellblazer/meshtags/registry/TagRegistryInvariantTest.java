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

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives a registry through long random interleavings of register, remove, setStart and reset, checking the numbering
 * invariants after every operation against a plain list kept in creation order.
 *
 * @author hal.hildebrand
 */
public class TagRegistryInvariantTest {

    private static final int OPERATIONS = 5_000;

    static class Node extends TaggedEntity {
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 42L, 0x5EEDL, 20251017L })
    void testRandomInterleavings(long seed) {
        var random = new Random(seed);
        var registry = new TagRegistry<Node>("node");
        var expected = new ArrayList<Node>();
        var orders = new IdentityHashMap<Node, Long>();
        var start = 1;
        var nextOrder = 0L;

        for (int op = 0; op < OPERATIONS; op++) {
            var choice = random.nextInt(100);
            if (choice < 50 || expected.isEmpty()) {
                var node = new Node();
                var tag = registry.register(node);
                assertEquals(start + expected.size(), tag);
                assertEquals(nextOrder++, node.getCreationOrder());
                expected.add(node);
                orders.put(node, node.getCreationOrder());
            } else if (choice < 80) {
                var position = random.nextInt(expected.size());
                var before = snapshotTags(expected);
                var victim = expected.get(position);
                var removed = registry.remove(victim.getTag());
                assertSame(victim, removed);
                assertFalse(victim.isLive());
                expected.remove(position);
                orders.remove(victim);
                // earlier entities keep their tags, later ones shift down by exactly one
                for (int i = 0; i < expected.size(); i++) {
                    var previous = before.get(i < position ? i : i + 1);
                    var shift = i < position ? 0 : 1;
                    assertEquals(previous - shift, expected.get(i).getTag());
                }
            } else if (choice < 95) {
                start = 1 + random.nextInt(10_000);
                registry.setStart(start);
            } else if (choice < 97) {
                var bad = -random.nextInt(5);
                var before = snapshotTags(expected);
                assertThrows(TagRegistryException.InvalidStartTagException.class, () -> registry.setStart(bad));
                assertEquals(before, snapshotTags(expected));
            } else {
                registry.reset();
                expected.forEach(node -> assertFalse(node.isLive()));
                expected.clear();
                orders.clear();
                start = 1;
                nextOrder = 0L;
            }
            assertInvariants(registry, expected, orders, start);
        }
    }

    private static void assertInvariants(TagRegistry<Node> registry, List<Node> expected,
                                         IdentityHashMap<Node, Long> orders, int start) {
        assertEquals(expected, registry.entities());
        assertEquals(start, registry.getStartTag());
        var seen = new HashSet<Integer>();
        for (int i = 0; i < expected.size(); i++) {
            var node = expected.get(i);
            assertEquals(start + i, node.getTag());
            assertTrue(seen.add(node.getTag()), "duplicate tag " + node.getTag());
            assertEquals(orders.get(node), node.getCreationOrder());
            if (i > 0) {
                assertTrue(expected.get(i - 1).getCreationOrder() < node.getCreationOrder());
            }
        }
        registry.validate();
    }

    private static List<Integer> snapshotTags(List<Node> nodes) {
        var tags = new ArrayList<Integer>(nodes.size());
        nodes.forEach(node -> tags.add(node.getTag()));
        return tags;
    }
}
