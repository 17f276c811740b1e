package com.plcexport.l5k.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.L5kParser;
import com.plcexport.l5k.parser.ParseDiagnostics;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class L5kParserService {
    private static final Logger log = LoggerFactory.getLogger(L5kParserService.class);

    private static final char BOM = '\uFEFF';

    /**
     * Parses L5K text. A leading byte order mark is dropped and line endings
     * are normalized to {@code \n} first.
     */
    public L5kProject parse(String content, String sourceName, ParseDiagnostics diagnostics) {
        log.info("Parsing L5K export: {}", sourceName);
        return new L5kParser(normalize(content), sourceName).parse(diagnostics);
    }

    static String normalize(String content) {
        String text = content;
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
