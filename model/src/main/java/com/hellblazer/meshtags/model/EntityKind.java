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

/**
 * The entity categories of a model. Each kind owns an independent tag space.
 *
 * @author hal.hildebrand
 */
public enum EntityKind {
    MATERIAL("material", true),
    DAMPING("damping", false),
    PATTERN("pattern", false),
    SECTION("section", true),
    TIME_SERIES("time series", false),
    TRANSFORMATION("transformation", false);

    private final String  displayName;
    private final boolean uniqueNames;

    EntityKind(String displayName, boolean uniqueNames) {
        this.displayName = displayName;
        this.uniqueNames = uniqueNames;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Whether live entities of this kind must carry distinct user names
     */
    public boolean uniqueNames() {
        return uniqueNames;
    }
}
