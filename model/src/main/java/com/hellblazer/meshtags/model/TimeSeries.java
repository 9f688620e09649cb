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
 * Base of all time series referenced by load patterns.
 *
 * @author hal.hildebrand
 */
public abstract class TimeSeries extends ModelEntity {
    private final TagRegistry<TimeSeries> registry;

    protected TimeSeries(TagRegistry<TimeSeries> registry, String seriesType) {
        super(seriesType, null);
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    /**
     * Register with the owning registry; call last in the concrete constructor
     */
    protected final int register() {
        return registry.register(this);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.TIME_SERIES;
    }
}
