package com.plcexport.l5k.exception;

import com.plcexport.l5k.model.EntityKey;

import lombok.Getter;

/**
 * An entity cannot be written because a field the dialect requires is absent.
 * Only the offending entity is dropped from the export.
 */
@Getter
public class MissingRequiredFieldException extends L5kException {

    private static final long serialVersionUID = 1L;

    private final transient EntityKey key;
    private final String field;

    public MissingRequiredFieldException(EntityKey key, String field, String detail) {
        super(key + " is missing " + field + (detail != null ? ": " + detail : ""));
        this.key = key;
        this.field = field;
    }
}
