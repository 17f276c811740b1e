package com.plcexport.l5k.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;

/**
 * Keys added and removed between two models, per entity kind. Entities present
 * in both are unchanged and not listed, even when their contents differ.
 */
public class ChangeSet {
    private final Map<EntityKind, Set<EntityKey>> added = new EnumMap<>(EntityKind.class);
    private final Map<EntityKind, Set<EntityKey>> removed = new EnumMap<>(EntityKind.class);
    private final List<EntityKey> skipped = new ArrayList<>();

    ChangeSet() {
        for (EntityKind kind : EntityKind.values()) {
            if (kind.isFilterable()) {
                added.put(kind, new LinkedHashSet<>());
                removed.put(kind, new LinkedHashSet<>());
            }
        }
    }

    void addAdded(EntityKey key) {
        added.get(key.getKind()).add(key);
    }

    void addRemoved(EntityKey key) {
        removed.get(key.getKind()).add(key);
    }

    void addSkipped(EntityKey key) {
        skipped.add(key);
    }

    public Set<EntityKey> getAdded(EntityKind kind) {
        return Collections.unmodifiableSet(added.getOrDefault(kind, Set.of()));
    }

    public Set<EntityKey> getRemoved(EntityKind kind) {
        return Collections.unmodifiableSet(removed.getOrDefault(kind, Set.of()));
    }

    public List<EntityKey> allAdded() {
        List<EntityKey> keys = new ArrayList<>();
        added.values().forEach(keys::addAll);
        return keys;
    }

    public List<EntityKey> allRemoved() {
        List<EntityKey> keys = new ArrayList<>();
        removed.values().forEach(keys::addAll);
        return keys;
    }

    /**
     * Keys left out of the comparison because they could not identify anything.
     */
    public List<EntityKey> getSkipped() {
        return Collections.unmodifiableList(skipped);
    }

    public boolean isAdded(EntityKey key) {
        return getAdded(key.getKind()).contains(key);
    }

    public boolean isRemoved(EntityKey key) {
        return getRemoved(key.getKind()).contains(key);
    }

    public boolean isEmpty() {
        return added.values().stream().allMatch(Set::isEmpty)
                && removed.values().stream().allMatch(Set::isEmpty);
    }

    @Override
    public String toString() {
        return "ChangeSet(added=" + allAdded().size() + ", removed=" + allRemoved().size() + ")";
    }
}
