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

/**
 * Sealed interface for registry lifecycle events.
 * <p>
 * Events are immutable records describing a change that has already been applied, so listeners always observe a
 * registry whose numbering invariant holds.
 *
 * @author hal.hildebrand
 */
public sealed interface TagEvent permits TagEvent.Registered, TagEvent.Retagged, TagEvent.Removed, TagEvent.Reset {

    /**
     * Entity kind of the registry that emitted this event.
     *
     * @return kind name
     */
    String kind();

    /**
     * Event emitted when an entity is registered.
     *
     * @param kind   entity kind
     * @param entity the new entity
     * @param tag    tag assigned to it
     */
    record Registered(String kind, TaggedEntity entity, int tag) implements TagEvent {
    }

    /**
     * Event emitted when a live entity's tag is rewritten by a removal or a start tag change.
     *
     * @param kind   entity kind
     * @param entity the renumbered entity
     * @param oldTag previous tag
     * @param newTag current tag
     */
    record Retagged(String kind, TaggedEntity entity, int oldTag, int newTag) implements TagEvent {
    }

    /**
     * Event emitted when an entity is removed. The entity is already detached.
     *
     * @param kind   entity kind
     * @param entity the removed entity
     * @param tag    tag it held when removed
     */
    record Removed(String kind, TaggedEntity entity, int tag) implements TagEvent {
    }

    /**
     * Event emitted when the registry is reset.
     *
     * @param kind     entity kind
     * @param detached number of entities detached by the reset
     */
    record Reset(String kind, int detached) implements TagEvent {
    }
}
