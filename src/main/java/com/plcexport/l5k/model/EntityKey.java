package com.plcexport.l5k.model;

import java.util.Locale;
import java.util.Objects;

import lombok.Value;

/**
 * Stable identity of an entity across re-parses and merges.
 *
 * <p>Only program tags carry a parent (their program name). Array members are
 * never keyed with their bracketed dimension.</p>
 */
@Value
public class EntityKey {
    EntityKind kind;
    String name;
    String parent;

    public static EntityKey of(EntityKind kind, String name) {
        return new EntityKey(kind, name, null);
    }

    public static EntityKey udt(String name) {
        return of(EntityKind.UDT, name);
    }

    public static EntityKey aoi(String name) {
        return of(EntityKind.AOI, name);
    }

    public static EntityKey controllerTag(String name) {
        return of(EntityKind.CONTROLLER_TAG, name);
    }

    public static EntityKey program(String name) {
        return of(EntityKind.PROGRAM, name);
    }

    public static EntityKey programTag(String program, String name) {
        return new EntityKey(EntityKind.PROGRAM_TAG, name, Objects.requireNonNull(program, "program"));
    }

    /**
     * A key whose name is blank cannot identify anything.
     */
    public boolean isReadable() {
        return kind != null && name != null && !name.isBlank()
                && (kind != EntityKind.PROGRAM_TAG || (parent != null && !parent.isBlank()));
    }

    /**
     * Parses the textual form produced by {@link #toString()}: {@code KIND:name}
     * or {@code PROGRAM_TAG:program/name}.
     */
    public static EntityKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Entity key is null");
        }
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("Entity key must look like KIND:name, got '" + text + "'");
        }
        EntityKind kind;
        try {
            kind = EntityKind.valueOf(text.substring(0, colon).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity kind in key '" + text + "'", e);
        }
        String rest = text.substring(colon + 1).trim();
        if (kind == EntityKind.PROGRAM_TAG) {
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                throw new IllegalArgumentException("Program tag key must look like PROGRAM_TAG:program/name, got '" + text + "'");
            }
            return programTag(rest.substring(0, slash), rest.substring(slash + 1));
        }
        return of(kind, rest);
    }

    @Override
    public String toString() {
        if (parent != null) {
            return kind + ":" + parent + "/" + name;
        }
        return kind + ":" + name;
    }
}
