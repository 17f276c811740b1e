package com.plcexport.l5k.parser.extract;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.L5kHeader;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.L5kScanner;
import com.plcexport.l5k.parser.ParseDiagnostics;

/**
 * Captures everything ahead of the CONTROLLER block verbatim, plus the
 * controller's own header lines. The controller body is parsed by the caller.
 */
public class HeaderExtractor implements BlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(HeaderExtractor.class);

    @Override
    public void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics) {
        L5kScanner scanner = block.getScanner();
        int lineStart = scanner.getSource().lastIndexOf('\n', block.getSpan().getStart() - 1) + 1;

        String preamble = scanner.text(0, lineStart).stripTrailing();
        String headerText = scanner.text(lineStart, block.getSpan().getHeaderEnd()).stripTrailing();
        List<String> headerLines = Arrays.asList(headerText.split("\n", -1));

        project.setHeader(new L5kHeader(preamble, block.getHeader().getName(), headerLines));
        project.getHeader().setSourceLine(block.getLine());
        log.debug("Controller {}: {} preamble characters, {} header lines",
                block.getHeader().getName(), preamble.length(), headerLines.size());
    }
}
