package com.plcexport.l5k.parser.extract;

import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.ParseDiagnostics;

/**
 * Turns the body of one recognised block into model entities.
 */
public interface BlockExtractor {

    void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics);
}
