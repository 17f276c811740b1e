package com.plcexport.l5k.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.Entity;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;

/**
 * Inclusion flags and description overrides for every filterable entity of a
 * project, held in a side table keyed by {@link EntityKey}.
 *
 * <p>Flags are independent: excluding a program does not touch its tags and
 * vice versa. Members, parameters and local tags have no flag of their own. The
 * header is always included.</p>
 *
 * <p>Keys never carry array dimensions, so a lookup by a display label such as
 * {@code DATA[20]} finds nothing.</p>
 */
public class TreeState {
    private static final Logger log = LoggerFactory.getLogger(TreeState.class);

    private final L5kProject project;
    private final Map<EntityKey, EntityState> states = new LinkedHashMap<>();

    public TreeState(L5kProject project) {
        this.project = Objects.requireNonNull(project, "project");
        sync();
    }

    public L5kProject getProject() {
        return project;
    }

    public boolean isIncluded(EntityKey key) {
        if (key.getKind() == EntityKind.HEADER) {
            return true;
        }
        EntityState state = states.get(key);
        return state != null && state.isIncluded();
    }

    public boolean isIncluded(Entity entity) {
        return isIncluded(entity.getKey());
    }

    /**
     * @throws IllegalArgumentException for the header or a key the project does not have
     */
    public void setIncluded(EntityKey key, boolean included) {
        stateOf(key).setIncluded(included);
    }

    public void selectAll() {
        states.values().forEach(s -> s.setIncluded(true));
    }

    public void deselectAll() {
        states.values().forEach(s -> s.setIncluded(false));
    }

    /**
     * Sets a description override; null restores the parsed description.
     */
    public void setDescription(EntityKey key, String description) {
        stateOf(key).setDescriptionOverride(description);
    }

    public Optional<String> getDescriptionOverride(EntityKey key) {
        EntityState state = states.get(key);
        return state == null ? Optional.empty() : Optional.ofNullable(state.getDescriptionOverride());
    }

    /**
     * Override if one is set, otherwise the parsed description (possibly null).
     */
    public String effectiveDescription(Entity entity) {
        return getDescriptionOverride(entity.getKey()).orElse(entity.getDescription());
    }

    public boolean hasState(EntityKey key) {
        return states.containsKey(key);
    }

    /**
     * Keys passing the filter, in emission order.
     */
    public List<EntityKey> keys(FilterMode mode) {
        List<EntityKey> keys = new ArrayList<>();
        for (Map.Entry<EntityKey, EntityState> e : states.entrySet()) {
            if (mode.matches(e.getValue().isIncluded())) {
                keys.add(e.getKey());
            }
        }
        return keys;
    }

    public List<EntityKey> keys(EntityKind kind, FilterMode mode) {
        List<EntityKey> keys = new ArrayList<>();
        for (EntityKey key : keys(mode)) {
            if (key.getKind() == kind) {
                keys.add(key);
            }
        }
        return keys;
    }

    /**
     * Brings the side table in line with the project: new keys get default state,
     * keys that are gone lose theirs, and everything else is left untouched.
     * Called after construction and after a merge changed the project.
     */
    public void sync() {
        List<EntityKey> current = project.allKeys();
        Map<EntityKey, EntityState> previous = new LinkedHashMap<>(states);
        states.clear();
        int added = 0;
        for (EntityKey key : current) {
            EntityState state = previous.remove(key);
            if (state == null) {
                state = EntityState.defaults();
                added++;
            }
            states.put(key, state);
        }
        if (added > 0 || !previous.isEmpty()) {
            log.debug("Tree state synced: {} keys added, {} dropped", added, previous.size());
        }
    }

    public ProjectSnapshot extractSnapshot(String sourceName) {
        List<SnapshotEntry> entries = new ArrayList<>();
        states.forEach((key, state) -> entries.add(SnapshotEntry.of(key, state)));
        return ProjectSnapshot.builder()
                .sourceName(sourceName)
                .controllerName(project.getHeader().getControllerName())
                .entries(entries)
                .build();
    }

    /**
     * Reattaches saved state by key. Entries whose key is not in this project are
     * skipped with a notice; keys missing from the snapshot keep their current state.
     *
     * @return number of entries reattached
     */
    public int applySnapshot(ProjectSnapshot snapshot) {
        String controller = project.getHeader().getControllerName();
        if (snapshot.getControllerName() != null && !snapshot.getControllerName().equals(controller)) {
            log.warn("Snapshot was taken from controller {}, applying to {}", snapshot.getControllerName(), controller);
        }
        int applied = 0;
        int unknown = 0;
        for (SnapshotEntry entry : snapshot.getEntries()) {
            EntityKey key = entry.toKey();
            EntityState state = key.isReadable() ? states.get(key) : null;
            if (state == null) {
                log.info("Ignoring saved state for unknown entity {}", key);
                unknown++;
                continue;
            }
            state.setIncluded(entry.isIncluded());
            state.setDescriptionOverride(entry.getDescription());
            applied++;
        }
        log.info("Reattached state for {} entities ({} unknown)", applied, unknown);
        return applied;
    }

    private EntityState stateOf(EntityKey key) {
        if (key.getKind() == EntityKind.HEADER) {
            throw new IllegalArgumentException("The header is not filterable");
        }
        EntityState state = states.get(key);
        if (state == null) {
            throw new IllegalArgumentException("Unknown entity " + key);
        }
        return state;
    }
}
