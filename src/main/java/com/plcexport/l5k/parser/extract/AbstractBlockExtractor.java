package com.plcexport.l5k.parser.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.parser.Segment;

/**
 * Shared skip-and-continue reporting for the kind-specific extractors.
 */
public abstract class AbstractBlockExtractor implements BlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(AbstractBlockExtractor.class);

    private static final int SNIPPET_LENGTH = 60;

    /**
     * Records a body line no pattern matched. The line is lost; parsing continues.
     */
    protected void unrecognizedLine(BlockContext block, Segment segment, ParseDiagnostics diagnostics) {
        int line = block.lineOf(segment);
        String snippet = snippet(block.text(segment));
        log.warn("Skipping unrecognized line {} in {} {}: {}", line, block.getHeader().getKeyword(),
                block.getHeader().getName(), snippet);
        diagnostics.getWarnings().add("Unrecognized line " + line + ": " + snippet);
    }

    protected void unrecognizedBlock(BlockContext block, Segment segment, ParseDiagnostics diagnostics) {
        int line = block.lineOf(segment);
        String keyword = segment.getBlock().getKeyword();
        log.warn("Skipping unrecognized {} block at line {}", keyword, line);
        diagnostics.getWarnings().add("Unrecognized block " + keyword + " at line " + line);
    }

    /**
     * Statement text without comments, trailing {@code ;}, or assigned value.
     */
    protected String declaration(BlockContext block, Segment segment) {
        return L5kSyntax.stripValue(L5kSyntax.stripComments(block.text(segment)));
    }

    protected static String normalizeDimensions(String dims) {
        return dims == null ? "" : dims.replaceAll("\\s+", "");
    }

    private static String snippet(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() > SNIPPET_LENGTH ? flat.substring(0, SNIPPET_LENGTH) + "..." : flat;
    }
}
