package com.plcexport.l5k.service;

import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.ParseDiagnostics;

import lombok.Builder;
import lombok.Value;

/**
 * A freshly parsed and normalized project together with what was noticed on the way.
 */
@Value
@Builder
public class ParseResult {
    String sourceName;
    L5kProject project;
    ParseDiagnostics diagnostics;
}
