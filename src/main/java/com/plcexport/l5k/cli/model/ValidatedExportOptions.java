package com.plcexport.l5k.cli.model;

import java.nio.charset.Charset;
import java.util.List;

import com.plcexport.l5k.model.EntityKey;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ExportCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExportOptions {
    Charset charset;
    List<EntityKey> excluded;
    List<EntityKey> includeOnly;
}
