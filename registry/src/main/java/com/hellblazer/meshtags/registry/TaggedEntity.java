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
 * Base class for anything numbered by a {@link TagRegistry}. The entity holds a cached copy of its current tag; the
 * owning registry is the only writer and rewrites it in place whenever it renumbers.
 * <p>
 * Identity is the object reference. Equality is never based on the tag, so an entity can safely be used as a map key
 * across renumbering.
 *
 * @author hal.hildebrand
 */
public abstract class TaggedEntity {

    /**
     * Tag value of an entity that is not live in any registry
     */
    public static final int NO_TAG = -1;

    /**
     * Creation order of an entity that is not live in any registry
     */
    public static final long NO_CREATION_ORDER = -1L;

    private final String         name;
    private       int            tag           = NO_TAG;
    private       long           creationOrder = NO_CREATION_ORDER;
    private       TagRegistry<?> owner;

    /**
     * Create an unnamed entity
     */
    protected TaggedEntity() {
        this(null);
    }

    /**
     * Create an entity with a user visible name (may be null)
     */
    protected TaggedEntity(String name) {
        this.name = name;
    }

    /**
     * Remove this entity from its owning registry. Entities created after this one are renumbered.
     *
     * @throws IllegalStateException if the entity is not live
     */
    public void delete() {
        var registry = owner;
        if (registry == null) {
            throw new IllegalStateException("Entity is not registered: " + this);
        }
        registry.removeEntity(this);
    }

    /**
     * Get the immutable creation order assigned at registration, or {@link #NO_CREATION_ORDER}
     */
    public long getCreationOrder() {
        return creationOrder;
    }

    /**
     * Get the user visible name (may be null)
     */
    public String getName() {
        return name;
    }

    /**
     * Get the registry this entity is live in, or null
     */
    public TagRegistry<?> getRegistry() {
        return owner;
    }

    /**
     * Get the current tag, or {@link #NO_TAG} when the entity is not live
     */
    public int getTag() {
        return tag;
    }

    /**
     * Check if the entity is currently live in a registry
     */
    public boolean isLive() {
        return owner != null;
    }

    @Override
    public String toString() {
        var simpleName = getClass().getSimpleName();
        return (simpleName.isEmpty() ? "TaggedEntity" : simpleName) + "[tag=" + tag + ", order=" + creationOrder + (
        name != null ? ", name=" + name : "") + "]";
    }

    void attach(TagRegistry<?> registry, long order, int newTag) {
        this.owner = registry;
        this.creationOrder = order;
        this.tag = newTag;
    }

    void detach() {
        this.owner = null;
        this.creationOrder = NO_CREATION_ORDER;
        this.tag = NO_TAG;
    }

    void retag(int newTag) {
        this.tag = newTag;
    }
}
