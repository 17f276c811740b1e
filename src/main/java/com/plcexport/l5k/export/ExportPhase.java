package com.plcexport.l5k.export;

/**
 * States of the exporter, in emission order.
 */
public enum ExportPhase {
    HEADER,
    UDTS,
    AOIS,
    CONTROLLER_TAGS,
    PROGRAMS,
    FOOTER,
    DONE;

    public ExportPhase next() {
        return this == DONE ? DONE : values()[ordinal() + 1];
    }
}
