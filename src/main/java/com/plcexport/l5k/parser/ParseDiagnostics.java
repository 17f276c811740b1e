package com.plcexport.l5k.parser;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Notices accumulated while parsing and normalizing one export.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ParseDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    /** AOI parameter cross-references rewritten to the type they alias. */
    private final List<String> corrections = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
