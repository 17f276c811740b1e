package com.plcexport.l5k.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.types.TypeNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Reads an export from disk, parses it and resolves base types. Every call
 * produces a fresh model; nothing is cached between calls.
 */
@RequiredArgsConstructor
public class L5kLoadingService {
    private static final Logger log = LoggerFactory.getLogger(L5kLoadingService.class);

    private final TunerConfig config;
    private final L5kParserService parserService;
    private final TypeNormalizer typeNormalizer;

    public L5kLoadingService(TunerConfig config) {
        this(config, new L5kParserService(), new TypeNormalizer());
    }

    public ParseResult load(Path path) throws IOException {
        String content = Files.readString(path, config.getCharset());
        return load(content, path.getFileName().toString());
    }

    public ParseResult load(String content, String sourceName) {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        L5kProject project = parserService.parse(content, sourceName, diagnostics);
        typeNormalizer.normalize(project, diagnostics);

        log.debug("{}: {} warnings, {} errors, {} corrections", sourceName,
                diagnostics.getWarnings().size(), diagnostics.getErrors().size(),
                diagnostics.getCorrections().size());
        return ParseResult.builder()
                .sourceName(sourceName)
                .project(project)
                .diagnostics(diagnostics)
                .build();
    }
}
