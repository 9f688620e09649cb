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

import com.hellblazer.meshtags.registry.TagRegistryException.AlreadyRegisteredException;
import com.hellblazer.meshtags.registry.TagRegistryException.CorruptedRegistryException;
import com.hellblazer.meshtags.registry.TagRegistryException.DuplicateNameException;
import com.hellblazer.meshtags.registry.TagRegistryException.InvalidStartTagException;
import com.hellblazer.meshtags.registry.TagRegistryException.TagNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Allocator of dense sequential tags for one entity kind.
 * <p>
 * The registry keeps its live entities in creation order. At every observation point the entity at position
 * {@code i} holds tag {@code startTag + i}: removals shift later entities down by one, and changing the start tag
 * renumbers every live entity. Creation order values come from a {@link CreationCounter} and are never reused.
 * <p>
 * Because tags are dense, lookup by tag is a direct index into the live sequence.
 * <p>
 * Not thread-safe. Callers serialize access, typically on a single UI thread. Listeners are notified after a change
 * completes and must not mutate the registry while handling an event; such calls fail with
 * {@link IllegalStateException}.
 *
 * @param <E> The entity type numbered by this registry
 * @author hal.hildebrand
 */
public class TagRegistry<E extends TaggedEntity> {
    private static final Logger log = LoggerFactory.getLogger(TagRegistry.class);

    private final String                   kind;
    private final TagRegistryConfiguration configuration;
    private final CreationCounter          counter;
    // Live entities ordered by creation order
    private final List<E>                  live;
    // Name → entity, maintained only for unique-name registries
    private final Map<String, E>           names;
    private final List<TagEventListener>   listeners;
    private       int                      startTag;
    private       boolean                  dispatching;

    /**
     * Create a registry with the default configuration
     *
     * @param kind the entity kind, used in messages and logs
     */
    public TagRegistry(String kind) {
        this(kind, TagRegistryConfiguration.defaultConfig());
    }

    /**
     * Create a registry with a custom configuration
     *
     * @param kind          the entity kind, used in messages and logs
     * @param configuration registry configuration
     */
    public TagRegistry(String kind, TagRegistryConfiguration configuration) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.counter = new CreationCounter();
        this.live = new ArrayList<>();
        this.names = new HashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
        this.startTag = configuration.defaultStartTag();
    }

    // ===== Listeners =====

    public void addListener(TagEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(TagEventListener listener) {
        listeners.remove(listener);
    }

    // ===== Mutation =====

    /**
     * Register a new entity. It receives the next creation order and the tag following the current live range.
     *
     * @param entity an entity that is not live in any registry
     * @return the assigned tag
     * @throws AlreadyRegisteredException if the entity is already live
     * @throws DuplicateNameException     if names are unique and the name is taken
     * @throws IllegalStateException      if called from a listener of this registry
     */
    public int register(E entity) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        checkNotDispatching();
        if (entity.isLive()) {
            throw new AlreadyRegisteredException(kind, entity);
        }
        var name = entity.getName();
        if (configuration.uniqueNames() && name != null && names.containsKey(name)) {
            throw new DuplicateNameException(kind, name);
        }
        checkTagSpace(startTag, live.size() + 1);

        var tag = startTag + live.size();
        entity.attach(this, counter.next(), tag);
        live.add(entity);
        if (configuration.uniqueNames() && name != null) {
            names.put(name, entity);
        }
        log.debug("Registered {} {} with tag {}", kind, entity, tag);
        dispatch(List.of(new TagEvent.Registered(kind, entity, tag)));
        return tag;
    }

    /**
     * Remove the entity currently holding a tag. Every entity created after it shifts down by one tag.
     *
     * @param tag a live tag
     * @return the removed, now detached, entity
     * @throws TagNotFoundException if no live entity holds the tag
     */
    public E remove(int tag) {
        checkNotDispatching();
        var index = indexOf(tag);
        if (index < 0) {
            throw new TagNotFoundException(kind, tag);
        }
        return removeAt(index);
    }

    /**
     * Remove a live entity by identity
     *
     * @param entity an entity live in this registry
     * @return the removed entity
     * @throws TagNotFoundException if the entity is not live in this registry
     */
    public E remove(E entity) {
        return removeEntity(Objects.requireNonNull(entity, "Entity cannot be null"));
    }

    /**
     * Change the start tag and renumber every live entity so that the entity at position {@code i} holds
     * {@code newStart + i}. The renumbering happens whether the new start is above, below or equal to the old one.
     *
     * @param newStart the new start tag
     * @throws InvalidStartTagException if the start tag is not positive, or the live range would overflow
     * @throws IllegalStateException    if called from a listener of this registry
     */
    public void setStart(int newStart) {
        checkNotDispatching();
        checkStart(newStart);
        var previous = startTag;
        startTag = newStart;
        var events = renumberFrom(0);
        log.info("{} start tag {} -> {}, renumbered {} of {}", kind, previous, newStart, events.size(), live.size());
        dispatch(events);
    }

    /**
     * Check that a start tag would be accepted by {@link #setStart(int)} without changing anything
     *
     * @param newStart the candidate start tag
     * @throws InvalidStartTagException if the start tag is not positive, or the live range would overflow
     */
    public void checkStart(int newStart) {
        if (newStart <= 0) {
            throw new InvalidStartTagException(kind, newStart);
        }
        if ((long) newStart + live.size() - 1 > Integer.MAX_VALUE) {
            throw new InvalidStartTagException(kind, String.format("Start tag %d leaves no room for %d %s entities",
                                                                   newStart, live.size(), kind));
        }
    }

    /**
     * Detach every live entity and return the registry to its initial state: empty, start tag at the configured
     * default, creation counter at zero. Listeners stay registered.
     */
    public void reset() {
        checkNotDispatching();
        var detached = live.size();
        for (var entity : live) {
            entity.detach();
        }
        live.clear();
        names.clear();
        startTag = configuration.defaultStartTag();
        counter.reset();
        log.info("Reset {} registry, detached {}", kind, detached);
        dispatch(List.of(new TagEvent.Reset(kind, detached)));
    }

    /**
     * Synonym for {@link #reset()}
     */
    public void clearAll() {
        reset();
    }

    // ===== Queries =====

    /**
     * Get the live tags keyed to their entities, in tag order
     */
    public SortedMap<Integer, E> asTagMap() {
        var result = new TreeMap<Integer, E>();
        for (var entity : live) {
            result.put(entity.getTag(), entity);
        }
        return Collections.unmodifiableSortedMap(result);
    }

    /**
     * Check if a tag is held by a live entity
     */
    public boolean contains(int tag) {
        return indexOf(tag) >= 0;
    }

    /**
     * Get a snapshot of the live entities in creation order
     */
    public List<E> entities() {
        return List.copyOf(live);
    }

    /**
     * Get the entity holding a tag
     *
     * @return the entity, or null if the tag is not live
     */
    public E get(int tag) {
        var index = indexOf(tag);
        return index < 0 ? null : live.get(index);
    }

    /**
     * Get a live entity by name
     *
     * @return the first live entity with that name in creation order, or null
     */
    public E getByName(String name) {
        if (name == null) {
            return null;
        }
        if (configuration.uniqueNames()) {
            return names.get(name);
        }
        for (var entity : live) {
            if (name.equals(entity.getName())) {
                return entity;
            }
        }
        return null;
    }

    public TagRegistryConfiguration getConfiguration() {
        return configuration;
    }

    public String getKind() {
        return kind;
    }

    /**
     * Get the creation order the next registration will receive
     */
    public long getNextCreationOrder() {
        return counter.peek();
    }

    /**
     * Get the tag the next registration will receive
     */
    public int getNextTag() {
        return startTag + live.size();
    }

    public int getStartTag() {
        return startTag;
    }

    public boolean isEmpty() {
        return live.isEmpty();
    }

    /**
     * Get the entity holding a tag
     *
     * @throws TagNotFoundException if the tag is not live
     */
    public E require(int tag) {
        var entity = get(tag);
        if (entity == null) {
            throw new TagNotFoundException(kind, tag);
        }
        return entity;
    }

    public int size() {
        return live.size();
    }

    /**
     * Get a snapshot of the live tags in creation order
     */
    public List<Integer> tags() {
        var result = new ArrayList<Integer>(live.size());
        for (var entity : live) {
            result.add(entity.getTag());
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "TagRegistry[" + kind + ", start=" + startTag + ", size=" + live.size() + "]";
    }

    /**
     * Check the numbering invariant: each live entity is owned by this registry, holds {@code startTag + position},
     * and creation orders strictly increase and lie below the counter.
     *
     * @throws CorruptedRegistryException describing the first violation found
     */
    public void validate() {
        var previousOrder = TaggedEntity.NO_CREATION_ORDER;
        for (int i = 0; i < live.size(); i++) {
            var entity = live.get(i);
            if (entity.getRegistry() != this) {
                throw new CorruptedRegistryException(kind, "Position " + i + " holds foreign entity " + entity);
            }
            if (entity.getTag() != startTag + i) {
                throw new CorruptedRegistryException(kind,
                                                     String.format("Position %d holds tag %d, expected %d", i,
                                                                   entity.getTag(), startTag + i));
            }
            var order = entity.getCreationOrder();
            if (order <= previousOrder || order >= counter.peek()) {
                throw new CorruptedRegistryException(kind,
                                                     String.format("Creation order %d out of sequence at position %d",
                                                                   order, i));
            }
            previousOrder = order;
        }
        for (var entry : names.entrySet()) {
            if (entry.getValue().getRegistry() != this || !entry.getKey().equals(entry.getValue().getName())) {
                throw new CorruptedRegistryException(kind, "Stale name index entry " + entry.getKey());
            }
        }
    }

    // ===== Internals =====

    E removeEntity(TaggedEntity entity) {
        checkNotDispatching();
        if (entity.getRegistry() != this) {
            throw new TagNotFoundException(kind, entity);
        }
        var index = indexOf(entity.getTag());
        if (index < 0 || live.get(index) != entity) {
            throw new CorruptedRegistryException(kind, entity + " is owned but not at its tag position");
        }
        return removeAt(index);
    }

    private void checkTagSpace(int start, int count) {
        if ((long) start + count - 1 > Integer.MAX_VALUE) {
            throw new IllegalStateException(kind + " tag space exhausted above start tag " + start);
        }
    }

    private void checkNotDispatching() {
        if (dispatching) {
            throw new IllegalStateException("Cannot modify the " + kind + " registry from one of its listeners");
        }
    }

    private void dispatch(List<? extends TagEvent> events) {
        if (listeners.isEmpty() || events.isEmpty()) {
            return;
        }
        dispatching = true;
        try {
            for (var event : events) {
                for (var listener : listeners) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        log.warn("{} listener {} failed on {}", kind, listener, event, e);
                    }
                }
            }
        } finally {
            dispatching = false;
        }
    }

    private int indexOf(int tag) {
        var index = (long) tag - startTag;
        return index >= 0 && index < live.size() ? (int) index : -1;
    }

    private E removeAt(int index) {
        var removed = live.remove(index);
        var tag = removed.getTag();
        var name = removed.getName();
        if (name != null && names.get(name) == removed) {
            names.remove(name);
        }
        removed.detach();
        var events = renumberFrom(index);
        log.debug("Removed {} tag {}, shifted {} later entities", kind, tag, events.size());
        var all = new ArrayList<TagEvent>(events.size() + 1);
        all.add(new TagEvent.Removed(kind, removed, tag));
        all.addAll(events);
        dispatch(all);
        return removed;
    }

    private List<TagEvent.Retagged> renumberFrom(int from) {
        var events = new ArrayList<TagEvent.Retagged>();
        for (int i = from; i < live.size(); i++) {
            var entity = live.get(i);
            var newTag = startTag + i;
            var oldTag = entity.getTag();
            if (oldTag != newTag) {
                entity.retag(newTag);
                events.add(new TagEvent.Retagged(kind, entity, oldTag, newTag));
            }
        }
        return events;
    }
}
