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
 * Base of all cross sections. Sections carry a user name that is unique among the live sections of a model.
 *
 * @author hal.hildebrand
 */
public abstract class Section extends ModelEntity {
    private final TagRegistry<Section> registry;
    private final String sectionName;

    /**
     * Create a section
     *
     * @param registry    the section registry of the owning model
     * @param sectionType the section family, e.g. "Elastic" or "Fiber"
     * @param sectionName the section model name
     * @param userName    unique user name
     */
    protected Section(TagRegistry<Section> registry, String sectionType, String sectionName, String userName) {
        super(sectionType, Objects.requireNonNull(userName, "User name cannot be null"));
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.sectionName = Objects.requireNonNull(sectionName, "Section name cannot be null");
    }

    public String getSectionName() {
        return sectionName;
    }

    /**
     * Register with the owning registry; call last in the concrete constructor
     */
    protected final int register() {
        return registry.register(this);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SECTION;
    }
}
