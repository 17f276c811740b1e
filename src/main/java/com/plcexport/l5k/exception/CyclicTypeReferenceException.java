package com.plcexport.l5k.exception;

import java.util.List;

/**
 * A user-defined type (or add-on instruction parameter path) refers back to itself.
 */
public class CyclicTypeReferenceException extends L5kException {

    private static final long serialVersionUID = 1L;

    private final List<String> path;

    public CyclicTypeReferenceException(List<String> path) {
        super("Cyclic type reference: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> getPath() {
        return path;
    }
}
