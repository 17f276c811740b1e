package com.plcexport.l5k.exception;

import com.plcexport.l5k.model.EntityKey;

import lombok.Getter;

/**
 * Two entities of one kind resolved to the same key. Inclusion state is tracked
 * by key, so this is never recovered from.
 */
@Getter
public class KeyCollisionException extends L5kException {

    private static final long serialVersionUID = 1L;

    private final transient EntityKey key;

    public KeyCollisionException(EntityKey key, int line) {
        super("Duplicate " + key.getKind() + " '" + key.getName() + "'"
                + (line > 0 ? " at line " + line : ""));
        this.key = key;
    }
}
