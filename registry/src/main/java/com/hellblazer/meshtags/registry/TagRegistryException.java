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
 * Sealed exception hierarchy for tag registry operations.
 * <p>
 * A registry operation that throws leaves the registry exactly as it was before the call.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link TagNotFoundException} - no live entity holds the requested tag</li>
 * <li>{@link InvalidStartTagException} - a start tag that is not positive</li>
 * <li>{@link AlreadyRegisteredException} - registering an entity that is already live</li>
 * <li>{@link DuplicateNameException} - a name already taken in a unique-name registry</li>
 * <li>{@link CorruptedRegistryException} - registry validation found a broken numbering invariant</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class TagRegistryException extends RuntimeException
permits TagRegistryException.TagNotFoundException, TagRegistryException.InvalidStartTagException,
        TagRegistryException.AlreadyRegisteredException, TagRegistryException.DuplicateNameException,
        TagRegistryException.CorruptedRegistryException {

    private final String kind;

    /**
     * Constructs a new registry exception.
     *
     * @param kind    the entity kind of the registry that failed
     * @param message the detail message
     */
    public TagRegistryException(String kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Gets the entity kind of the registry that raised this exception.
     *
     * @return the kind name
     */
    public String getKind() {
        return kind;
    }

    /**
     * Thrown when a tag (or an entity) is not live in the registry.
     */
    public static final class TagNotFoundException extends TagRegistryException {
        private final int tag;

        public TagNotFoundException(String kind, int tag) {
            super(kind, String.format("No %s with tag %d", kind, tag));
            this.tag = tag;
        }

        public TagNotFoundException(String kind, TaggedEntity entity) {
            super(kind, String.format("%s is not registered as a %s", entity, kind));
            this.tag = entity.getTag();
        }

        /**
         * Gets the tag that was looked up.
         *
         * @return the missing tag
         */
        public int getTag() {
            return tag;
        }
    }

    /**
     * Thrown when a start tag is zero or negative. Tags are solver handles and must be positive.
     */
    public static final class InvalidStartTagException extends TagRegistryException {
        private final int startTag;

        public InvalidStartTagException(String kind, int startTag) {
            super(kind, String.format("Start tag for %s must be positive: %d", kind, startTag));
            this.startTag = startTag;
        }

        public InvalidStartTagException(String kind, String message) {
            super(kind, message);
            this.startTag = 0;
        }

        /**
         * Gets the rejected start tag.
         *
         * @return the rejected value, 0 if it could not be parsed
         */
        public int getStartTag() {
            return startTag;
        }
    }

    /**
     * Thrown when registering an entity that is already live, in this or any other registry.
     */
    public static final class AlreadyRegisteredException extends TagRegistryException {

        public AlreadyRegisteredException(String kind, TaggedEntity entity) {
            super(kind, String.format("%s is already registered with tag %d", entity, entity.getTag()));
        }
    }

    /**
     * Thrown when a unique-name registry already holds a live entity with the same name.
     */
    public static final class DuplicateNameException extends TagRegistryException {
        private final String name;

        public DuplicateNameException(String kind, String name) {
            super(kind, String.format("A %s named '%s' already exists", kind, name));
            this.name = name;
        }

        /**
         * Gets the clashing name.
         *
         * @return the name
         */
        public String getName() {
            return name;
        }
    }

    /**
     * Thrown by {@link TagRegistry#validate()} when the dense numbering invariant does not hold.
     */
    public static final class CorruptedRegistryException extends TagRegistryException {

        public CorruptedRegistryException(String kind, String message) {
            super(kind, message);
        }
    }
}
