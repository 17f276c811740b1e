package com.plcexport.l5k.export;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one export: the text plus the entities that could not be written.
 */
@Data
@Builder
public class ExportResult {
    private String text;
    private int entitiesEmitted;
    @Builder.Default
    private List<ExportError> errors = new ArrayList<>();

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
