package com.plcexport.l5k.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.Entity;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.state.TreeState;

import lombok.NoArgsConstructor;

/**
 * Applies an accepted selection of a {@link ChangeSet} to the current project.
 *
 * <p>Added entities are taken from the updated model by reference; programs are
 * added without tags, which come with their own keys. Removing a program removes
 * its tags. Inclusion state and descriptions of entities the merge did not touch
 * are kept as they were.</p>
 */
@NoArgsConstructor
public class MergeApplier {
    private static final Logger log = LoggerFactory.getLogger(MergeApplier.class);

    /** Programs go in before their tags and come out after them. */
    private static final Comparator<EntityKey> BY_KIND = Comparator.comparing(EntityKey::getKind);

    public MergeResult apply(TreeState state, L5kProject updated, ChangeSet changes, MergeSelection selection) {
        L5kProject current = state.getProject();
        int added = 0;
        int removed = 0;
        int shells = 0;
        int ignored = 0;

        for (EntityKey key : sorted(selection.getAcceptedAdded(), false)) {
            if (!changes.isAdded(key)) {
                log.warn("Ignoring {}: not an addition in this change set", key);
                ignored++;
                continue;
            }
            Entity entity = updated.find(key).orElse(null);
            if (entity == null) {
                log.warn("Ignoring {}: not present in the updated export", key);
                ignored++;
                continue;
            }
            if (entity instanceof Program program) {
                current.insert(program.emptyCopy());
            } else if (entity instanceof Tag tag && tag.isProgramTag()) {
                if (current.findProgram(tag.getProgram()).isEmpty()) {
                    Program shell = updated.findProgram(tag.getProgram())
                            .map(Program::emptyCopy)
                            .orElseGet(() -> new Program(tag.getProgram()));
                    current.insert(shell);
                    shells++;
                    log.warn("Program {} was not accepted; created it to hold tag {}", tag.getProgram(), tag.getName());
                }
                current.insert(tag);
            } else {
                current.insert(entity);
            }
            added++;
            log.debug("Merged in {}", key);
        }

        for (EntityKey key : sorted(selection.getAcceptedRemoved(), true)) {
            if (!changes.isRemoved(key)) {
                log.warn("Ignoring {}: not a removal in this change set", key);
                ignored++;
                continue;
            }
            if (current.remove(key)) {
                removed++;
                log.debug("Merged out {}", key);
            }
        }

        state.sync();
        log.info("Merge applied: {} added, {} removed, {} program shells, {} ignored", added, removed, shells, ignored);
        return MergeResult.builder()
                .added(added)
                .removed(removed)
                .programShellsCreated(shells)
                .ignored(ignored)
                .build();
    }

    private static List<EntityKey> sorted(Set<EntityKey> keys, boolean reverse) {
        List<EntityKey> list = new ArrayList<>(keys);
        list.sort(reverse ? BY_KIND.reversed() : BY_KIND);
        return list;
    }
}
