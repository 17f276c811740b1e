package com.plcexport.l5k.model;

/**
 * Entity namespaces. Keys are unique within one kind only.
 */
public enum EntityKind {
    HEADER(false),
    UDT(true),
    AOI(true),
    CONTROLLER_TAG(true),
    PROGRAM(true),
    PROGRAM_TAG(true);

    private final boolean filterable;

    EntityKind(boolean filterable) {
        this.filterable = filterable;
    }

    public boolean isFilterable() {
        return filterable;
    }
}
