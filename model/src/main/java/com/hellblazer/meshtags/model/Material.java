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
 * Base of all materials. Materials carry a user name that is unique among the live materials of a model.
 *
 * @author hal.hildebrand
 */
public abstract class Material extends ModelEntity {
    private final TagRegistry<Material> registry;
    private final String materialName;

    /**
     * Create a material
     *
     * @param registry     the material registry of the owning model
     * @param materialType the material family, e.g. "uniaxialMaterial" or "nDMaterial"
     * @param materialName the material model, e.g. "Elastic"
     * @param userName     unique user name
     */
    protected Material(TagRegistry<Material> registry, String materialType, String materialName, String userName) {
        super(materialType, Objects.requireNonNull(userName, "User name cannot be null"));
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.materialName = Objects.requireNonNull(materialName, "Material name cannot be null");
    }

    public String getMaterialName() {
        return materialName;
    }

    /**
     * Register with the material registry. Concrete classes call this as the last statement of their constructor,
     * so an instance whose construction fails is never registered and never holds a tag or a name.
     *
     * @return the assigned tag
     */
    protected final int register() {
        return registry.register(this);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MATERIAL;
    }
}
