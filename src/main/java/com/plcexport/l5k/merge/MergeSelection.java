package com.plcexport.l5k.merge;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.plcexport.l5k.model.EntityKey;

/**
 * The part of a {@link ChangeSet} the caller accepted.
 */
public class MergeSelection {
    private final Set<EntityKey> acceptedAdded = new LinkedHashSet<>();
    private final Set<EntityKey> acceptedRemoved = new LinkedHashSet<>();

    public static MergeSelection none() {
        return new MergeSelection();
    }

    public static MergeSelection all(ChangeSet changes) {
        return none().acceptAdded(changes.allAdded()).acceptRemoved(changes.allRemoved());
    }

    public MergeSelection acceptAdded(EntityKey key) {
        acceptedAdded.add(key);
        return this;
    }

    public MergeSelection acceptAdded(Collection<EntityKey> keys) {
        acceptedAdded.addAll(keys);
        return this;
    }

    public MergeSelection acceptRemoved(EntityKey key) {
        acceptedRemoved.add(key);
        return this;
    }

    public MergeSelection acceptRemoved(Collection<EntityKey> keys) {
        acceptedRemoved.addAll(keys);
        return this;
    }

    public Set<EntityKey> getAcceptedAdded() {
        return Collections.unmodifiableSet(acceptedAdded);
    }

    public Set<EntityKey> getAcceptedRemoved() {
        return Collections.unmodifiableSet(acceptedRemoved);
    }
}
