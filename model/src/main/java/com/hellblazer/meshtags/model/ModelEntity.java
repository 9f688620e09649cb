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
package com.hellblazer.meshtags.model;

import com.hellblazer.meshtags.registry.TaggedEntity;

import java.util.Objects;

/**
 * Common base of the model entity kinds. Each kind base receives the registry of its kind in its constructor, and the
 * concrete class registers once its own construction has succeeded, so a constructed entity is live with a valid tag.
 *
 * @author hal.hildebrand
 */
public abstract class ModelEntity extends TaggedEntity {
    private final String type;

    protected ModelEntity(String type, String name) {
        super(name);
        this.type = Objects.requireNonNull(type, "Type cannot be null");
    }

    /**
     * Get the kind of this entity
     */
    public abstract EntityKind kind();

    /**
     * Get the solver type keyword, e.g. "uniaxialMaterial" or "Linear"
     */
    public String getType() {
        return type;
    }

    @Override
    public String toString() {
        return kind().displayName() + "[" + type + ", tag=" + getTag() + (getName() != null ? ", name=" + getName()
                                                                                            : "") + "]";
    }
}
