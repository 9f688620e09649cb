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

import com.hellblazer.meshtags.registry.TagRegistry;

import java.util.Objects;

/**
 * Base of all geometric transformations (Linear, PDelta, Corotational) used by beam-column elements.
 *
 * @author hal.hildebrand
 */
public abstract class GeometricTransformation extends ModelEntity {
    private final TagRegistry<GeometricTransformation> registry;
    private final int dimension;

    /**
     * Create a transformation
     *
     * @param registry   the transformation registry of the owning model
     * @param transfType the transformation type
     * @param dimension  2 or 3
     * @throws IllegalArgumentException if the dimension is not 2 or 3
     */
    protected GeometricTransformation(TagRegistry<GeometricTransformation> registry, String transfType,
                                      int dimension) {
        super(transfType, null);
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        if (dimension != 2 && dimension != 3) {
            throw new IllegalArgumentException("Dimension must be 2 or 3: " + dimension);
        }
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }

    /**
     * Register with the owning registry; call last in the concrete constructor
     */
    protected final int register() {
        return registry.register(this);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.TRANSFORMATION;
    }
}
