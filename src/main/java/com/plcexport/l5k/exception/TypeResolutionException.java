package com.plcexport.l5k.exception;

/**
 * A declared type names a user-defined type that has no base type to offer.
 */
public class TypeResolutionException extends L5kException {

    private static final long serialVersionUID = 1L;

    public TypeResolutionException(String message) {
        super(message);
    }
}
