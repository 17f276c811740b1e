package com.plcexport.l5k.export;

import com.plcexport.l5k.exception.MissingRequiredFieldException;
import com.plcexport.l5k.model.EntityKey;

import lombok.Value;

/**
 * An entity left out of the export, and why.
 */
@Value
public class ExportError {
    EntityKey key;
    String field;
    String message;

    public static ExportError of(MissingRequiredFieldException e) {
        return new ExportError(e.getKey(), e.getField(), e.getMessage());
    }
}
