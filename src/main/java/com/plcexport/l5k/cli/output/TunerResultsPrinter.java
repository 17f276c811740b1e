package com.plcexport.l5k.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.export.ExportError;
import com.plcexport.l5k.export.ExportResult;
import com.plcexport.l5k.merge.ChangeSet;
import com.plcexport.l5k.merge.MergeResult;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.service.ParseResult;

/**
 * Responsible only for printing CLI output. No validation, no execution.
 */
public class TunerResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TunerResultsPrinter.class);
    private static final String RULE = "=================================================";

    public void printBanner(String title, Path... inputs) {
        log.info(RULE);
        log.info("L5K Tuner: {}", title);
        log.info(RULE);
        for (Path input : inputs) {
            log.info("Input: {}", input.toAbsolutePath());
        }
        log.info(RULE);
    }

    public void printParse(ParseResult result) {
        L5kProject project = result.getProject();
        ParseDiagnostics d = result.getDiagnostics();

        log.info("");
        log.info("Parsed {} (controller {})", result.getSourceName(), project.getHeader().getControllerName());
        log.info("  Data types: {}", project.getUdts().size());
        log.info("  Add-on instructions: {}", project.getAois().size());
        log.info("  Controller tags: {}", project.getControllerTags().size());
        log.info("  Programs: {}", project.getPrograms().size());
        log.info("  Program tags: {}", project.keys(EntityKind.PROGRAM_TAG).size());

        printList("Corrections", d.getCorrections());
        printList("Warnings", d.getWarnings());
        printList("Errors", d.getErrors());
    }

    public void printExport(ExportResult result, Path output) {
        log.info("");
        log.info(RULE);
        log.info(result.hasErrors() ? "EXPORT COMPLETED WITH ERRORS" : "EXPORT SUCCESSFUL");
        log.info(RULE);
        log.info("Output: {}", output != null ? output.toAbsolutePath() : "standard output");
        log.info("Entities emitted: {}", result.getEntitiesEmitted());
        if (result.hasErrors()) {
            log.info("Entities left out: {}", result.getErrors().size());
            for (ExportError error : result.getErrors()) {
                log.error("  {}", error.getMessage());
            }
        }
        log.info(RULE);
    }

    public void printChangeSet(ChangeSet changes) {
        log.info("");
        log.info(RULE);
        log.info("CHANGES");
        log.info(RULE);
        if (changes.isEmpty()) {
            log.info("No entities added or removed.");
        }
        for (EntityKind kind : EntityKind.values()) {
            if (!kind.isFilterable()) {
                continue;
            }
            printKeys("+", kind, changes.getAdded(kind).stream().toList());
            printKeys("-", kind, changes.getRemoved(kind).stream().toList());
        }
        if (!changes.getSkipped().isEmpty()) {
            log.warn("Skipped {} entities without a readable key", changes.getSkipped().size());
        }
        log.info(RULE);
    }

    public void printMerge(MergeResult result) {
        log.info("");
        log.info("Merge applied:");
        log.info("  Added: {}", result.getAdded());
        log.info("  Removed: {}", result.getRemoved());
        if (result.getProgramShellsCreated() > 0) {
            log.info("  Programs created to hold accepted tags: {}", result.getProgramShellsCreated());
        }
        if (result.getIgnored() > 0) {
            log.warn("  Ignored selections: {}", result.getIgnored());
        }
    }

    public void printStateSaved(Path path) {
        log.info("Tree state saved to {}", path.toAbsolutePath());
    }

    private void printKeys(String sign, EntityKind kind, List<EntityKey> keys) {
        if (keys.isEmpty()) {
            return;
        }
        log.info("{} {} ({})", sign, kind, keys.size());
        for (EntityKey key : keys) {
            log.info("    {} {}", sign, key);
        }
    }

    private void printList(String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        log.info("  {}: {}", title, lines.size());
        for (String line : lines) {
            log.info("    {}", line);
        }
    }
}
