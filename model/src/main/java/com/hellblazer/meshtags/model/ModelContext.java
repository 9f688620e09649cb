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

import com.hellblazer.meshtags.registry.TagEventListener;
import com.hellblazer.meshtags.registry.TagRegistry;
import com.hellblazer.meshtags.registry.TagRegistryConfiguration;
import com.hellblazer.meshtags.registry.TagRegistryException.InvalidStartTagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The tag registries of one model, one per {@link EntityKind}. Entity constructors take the registry of their kind
 * from here; nothing is shared between contexts, so independent models can be built side by side.
 *
 * @author hal.hildebrand
 */
public class ModelContext {
    private static final Logger log = LoggerFactory.getLogger(ModelContext.class);

    private final TagRegistry<Material>                              materials;
    private final TagRegistry<Damping>                               dampings;
    private final TagRegistry<Pattern>                               patterns;
    private final TagRegistry<Section>                               sections;
    private final TagRegistry<TimeSeries>                            timeSeries;
    private final TagRegistry<GeometricTransformation>               transformations;
    private final Map<EntityKind, TagRegistry<? extends ModelEntity>> byKind;

    /**
     * Create a context with the default registry configuration
     */
    public ModelContext() {
        this(TagRegistryConfiguration.defaultConfig());
    }

    /**
     * Create a context whose registries share a base configuration. Name uniqueness is decided per kind.
     */
    public ModelContext(TagRegistryConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.materials = create(EntityKind.MATERIAL, configuration);
        this.dampings = create(EntityKind.DAMPING, configuration);
        this.patterns = create(EntityKind.PATTERN, configuration);
        this.sections = create(EntityKind.SECTION, configuration);
        this.timeSeries = create(EntityKind.TIME_SERIES, configuration);
        this.transformations = create(EntityKind.TRANSFORMATION, configuration);

        this.byKind = new EnumMap<>(EntityKind.class);
        byKind.put(EntityKind.MATERIAL, materials);
        byKind.put(EntityKind.DAMPING, dampings);
        byKind.put(EntityKind.PATTERN, patterns);
        byKind.put(EntityKind.SECTION, sections);
        byKind.put(EntityKind.TIME_SERIES, timeSeries);
        byKind.put(EntityKind.TRANSFORMATION, transformations);
    }

    private static <E extends ModelEntity> TagRegistry<E> create(EntityKind kind,
                                                                 TagRegistryConfiguration configuration) {
        return new TagRegistry<>(kind.displayName(), configuration.withUniqueNames(kind.uniqueNames()));
    }

    /**
     * Subscribe a listener to the registries of every kind
     */
    public void addListener(TagEventListener listener) {
        byKind.values().forEach(registry -> registry.addListener(listener));
    }

    public TagRegistry<Damping> dampings() {
        return dampings;
    }

    public TagRegistry<Material> materials() {
        return materials;
    }

    public TagRegistry<Pattern> patterns() {
        return patterns;
    }

    /**
     * Get the registry of a kind
     */
    public TagRegistry<? extends ModelEntity> registry(EntityKind kind) {
        return byKind.get(Objects.requireNonNull(kind, "Kind cannot be null"));
    }

    public void removeListener(TagEventListener listener) {
        byKind.values().forEach(registry -> registry.removeListener(listener));
    }

    /**
     * Reset the registries of every kind, detaching all entities
     */
    public void resetAll() {
        byKind.values().forEach(TagRegistry::reset);
        log.info("Reset all registries");
    }

    public TagRegistry<Section> sections() {
        return sections;
    }

    /**
     * Re-base every kind at the same start tag. The start tag is checked against every registry before any of them is
     * renumbered.
     *
     * @throws InvalidStartTagException if the start tag is not positive or too large for one of the kinds
     */
    public void setStartAll(int newStart) {
        byKind.values().forEach(registry -> registry.checkStart(newStart));
        byKind.values().forEach(registry -> registry.setStart(newStart));
    }

    public TagRegistry<TimeSeries> timeSeries() {
        return timeSeries;
    }

    public TagRegistry<GeometricTransformation> transformations() {
        return transformations;
    }

    /**
     * Get the number of live entities of every kind
     */
    public int totalSize() {
        return byKind.values().stream().mapToInt(TagRegistry::size).sum();
    }

    /**
     * Validate the numbering invariant of every registry
     */
    public void validateAll() {
        byKind.values().forEach(TagRegistry::validate);
    }
}
