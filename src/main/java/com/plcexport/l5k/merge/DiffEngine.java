package com.plcexport.l5k.merge;

import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;

import lombok.NoArgsConstructor;

/**
 * Structural comparison of two parsed models by entity key.
 *
 * <p>Each kind is compared on its own. Neither model is modified. An entity whose
 * key cannot identify anything is left out with a warning.</p>
 */
@NoArgsConstructor
public class DiffEngine {
    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    public ChangeSet diff(L5kProject current, L5kProject updated) {
        ChangeSet changes = new ChangeSet();
        for (EntityKind kind : EntityKind.values()) {
            if (!kind.isFilterable()) {
                continue;
            }
            Set<EntityKey> before = readableKeys(current, kind, changes);
            Set<EntityKey> after = readableKeys(updated, kind, changes);

            for (EntityKey key : after) {
                if (!before.contains(key)) {
                    changes.addAdded(key);
                }
            }
            for (EntityKey key : before) {
                if (!after.contains(key)) {
                    changes.addRemoved(key);
                }
            }
        }
        log.info("Diff: {} added, {} removed", changes.allAdded().size(), changes.allRemoved().size());
        return changes;
    }

    private Set<EntityKey> readableKeys(L5kProject project, EntityKind kind, ChangeSet changes) {
        Set<EntityKey> keys = new LinkedHashSet<>();
        for (EntityKey key : project.keys(kind)) {
            if (key.isReadable()) {
                keys.add(key);
            } else {
                log.warn("Leaving {} out of the comparison: key is not readable", key);
                changes.addSkipped(key);
            }
        }
        return keys;
    }
}
