package com.plcexport.l5k.parser.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.AttributeList;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.parser.Segment;

import lombok.RequiredArgsConstructor;

/**
 * Extracts a {@code PROGRAM} block: its description and its TAG lists.
 * Routines and child program lists are skipped.
 */
@RequiredArgsConstructor
public class ProgramExtractor extends AbstractBlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(ProgramExtractor.class);

    private final TagListExtractor tagListExtractor;

    @Override
    public void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics) {
        Program program = new Program(block.getHeader().getName());
        program.setSourceLine(block.getLine());
        AttributeList attributes = block.getHeader().getAttributes().copy();
        L5kSyntax.takeDescription(attributes).ifPresent(program::setDescription);

        for (Segment segment : block.bodySegments()) {
            if (segment.isBlock()) {
                if ("TAG".equals(segment.getBlock().getKeyword())) {
                    tagListExtractor.extractInto(block.nested(segment), program, diagnostics);
                } else {
                    log.debug("Skipping {} in program {} at line {}", segment.getBlock().getKeyword(),
                            program.getName(), block.lineOf(segment));
                }
            } else if (segment.isStatement()) {
                unrecognizedLine(block, segment, diagnostics);
            }
        }

        project.addProgram(program);
        log.debug("Parsed PROGRAM {} with {} tags", program.getName(), program.getTags().size());
    }
}
