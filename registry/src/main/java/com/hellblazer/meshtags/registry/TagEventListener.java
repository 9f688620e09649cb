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
 * Functional interface for receiving registry events.
 * <p>
 * Events are dispatched synchronously on the thread that mutated the registry, after the mutation is complete.
 * Exceptions thrown by listeners are caught and logged by the registry, so one failing listener doesn't impact others.
 * <p>
 * Example usage:
 * <pre>
 * TagEventListener listener = event -> {
 *     if (event instanceof TagEvent.Retagged e) {
 *         refreshRow(e.entity());
 *     }
 * };
 * registry.addListener(listener);
 * </pre>
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TagEventListener {

    /**
     * Called when a registry event occurs.
     *
     * @param event the registry event
     */
    void onEvent(TagEvent event);
}
