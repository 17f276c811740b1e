package com.plcexport.l5k.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.plcexport.l5k.exception.KeyCollisionException;

import lombok.Getter;
import lombok.Setter;

/**
 * The whole parsed export. Each kind namespace is an insertion-ordered table
 * keyed by entity name, so definitions have a single owning location and
 * everything else refers to them by name.
 */
@Getter
public class L5kProject {
    @Setter
    private L5kHeader header = new L5kHeader();
    private final Map<String, UserDefinedType> udts = new LinkedHashMap<>();
    private final Map<String, AddOnInstruction> aois = new LinkedHashMap<>();
    private final Map<String, Tag> controllerTags = new LinkedHashMap<>();
    private final Map<String, Program> programs = new LinkedHashMap<>();

    public void addUdt(UserDefinedType udt) {
        putUnique(udts, udt.getName(), udt);
    }

    public void addAoi(AddOnInstruction aoi) {
        putUnique(aois, aoi.getName(), aoi);
    }

    public void addControllerTag(Tag tag) {
        tag.setProgram(null);
        putUnique(controllerTags, tag.getName(), tag);
    }

    public void addProgram(Program program) {
        putUnique(programs, program.getName(), program);
    }

    public Optional<UserDefinedType> findUdt(String name) {
        return Optional.ofNullable(udts.get(name));
    }

    public Optional<AddOnInstruction> findAoi(String name) {
        return Optional.ofNullable(aois.get(name));
    }

    public Optional<Program> findProgram(String name) {
        return Optional.ofNullable(programs.get(name));
    }

    public Optional<Entity> find(EntityKey key) {
        if (key == null || key.getKind() == null) {
            return Optional.empty();
        }
        return switch (key.getKind()) {
            case HEADER -> Optional.of(header);
            case UDT -> Optional.ofNullable(udts.get(key.getName()));
            case AOI -> Optional.ofNullable(aois.get(key.getName()));
            case CONTROLLER_TAG -> Optional.ofNullable(controllerTags.get(key.getName()));
            case PROGRAM -> Optional.ofNullable(programs.get(key.getName()));
            case PROGRAM_TAG -> Optional.ofNullable(programs.get(key.getParent()))
                    .flatMap(p -> p.findTag(key.getName()));
        };
    }

    public boolean contains(EntityKey key) {
        return find(key).isPresent();
    }

    /**
     * Keys of one namespace in file order. Program tags are listed program by program.
     */
    public List<EntityKey> keys(EntityKind kind) {
        List<EntityKey> keys = new ArrayList<>();
        switch (kind) {
            case HEADER -> keys.add(header.getKey());
            case UDT -> udts.values().forEach(u -> keys.add(u.getKey()));
            case AOI -> aois.values().forEach(a -> keys.add(a.getKey()));
            case CONTROLLER_TAG -> controllerTags.values().forEach(t -> keys.add(t.getKey()));
            case PROGRAM -> programs.values().forEach(p -> keys.add(p.getKey()));
            case PROGRAM_TAG -> programs.values().forEach(p -> p.getTags().values().forEach(t -> keys.add(t.getKey())));
        }
        return keys;
    }

    /**
     * Every filterable key, in emission order.
     */
    public List<EntityKey> allKeys() {
        List<EntityKey> keys = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            if (kind.isFilterable()) {
                keys.addAll(keys(kind));
            }
        }
        return keys;
    }

    /**
     * Removes the entity with the given key. Removing a program removes its tags.
     *
     * @return true if something was removed
     */
    public boolean remove(EntityKey key) {
        return switch (key.getKind()) {
            case UDT -> udts.remove(key.getName()) != null;
            case AOI -> aois.remove(key.getName()) != null;
            case CONTROLLER_TAG -> controllerTags.remove(key.getName()) != null;
            case PROGRAM -> programs.remove(key.getName()) != null;
            case PROGRAM_TAG -> {
                Program program = programs.get(key.getParent());
                yield program != null && program.removeTag(key.getName());
            }
            case HEADER -> false;
        };
    }

    /**
     * Inserts or replaces an entity by key. A program tag needs its program to exist.
     *
     * @throws IllegalStateException when a program tag's program is missing
     */
    public void insert(Entity entity) {
        if (entity instanceof UserDefinedType udt) {
            udts.put(udt.getName(), udt);
        } else if (entity instanceof AddOnInstruction aoi) {
            aois.put(aoi.getName(), aoi);
        } else if (entity instanceof Program program) {
            programs.put(program.getName(), program);
        } else if (entity instanceof Tag tag) {
            if (tag.isProgramTag()) {
                Program program = programs.get(tag.getProgram());
                if (program == null) {
                    throw new IllegalStateException("Program '" + tag.getProgram() + "' not present for tag " + tag.getKey());
                }
                program.getTags().put(tag.getName(), tag);
            } else {
                controllerTags.put(tag.getName(), tag);
            }
        } else {
            throw new IllegalArgumentException("Cannot insert " + entity.getKind());
        }
    }

    private <T extends Entity> void putUnique(Map<String, T> table, String name, T entity) {
        if (table.containsKey(name)) {
            throw new KeyCollisionException(entity.getKey(), entity.getSourceLine());
        }
        table.put(name, entity);
    }
}
