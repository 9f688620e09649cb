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
 * Monotonic source of creation order values for a single registry. Values are never handed out twice, even after the
 * entity holding one is removed; only {@link #reset()} rewinds the sequence.
 * <p>
 * Not thread-safe. The owning registry is externally serialized.
 *
 * @author hal.hildebrand
 */
public class CreationCounter {
    private long next;

    public CreationCounter() {
        this(0L);
    }

    CreationCounter(long startValue) {
        if (startValue < 0) {
            throw new IllegalArgumentException("Creation order cannot be negative: " + startValue);
        }
        this.next = startValue;
    }

    /**
     * Hand out the next creation order
     */
    public long next() {
        if (next == Long.MAX_VALUE) {
            throw new IllegalStateException("Creation order space exhausted");
        }
        return next++;
    }

    /**
     * Get the value the next call to {@link #next()} will return, without consuming it
     */
    public long peek() {
        return next;
    }

    public void reset() {
        next = 0L;
    }
}
