package com.plcexport.l5k.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.ExportOptions;
import com.plcexport.l5k.cli.model.ValidatedExportOptions;
import com.plcexport.l5k.cli.output.TunerResultsPrinter;
import com.plcexport.l5k.cli.validation.ExportOptionsValidator;
import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.exception.L5kException;
import com.plcexport.l5k.export.ExportResult;
import com.plcexport.l5k.export.L5kExporter;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.service.L5kLoadingService;
import com.plcexport.l5k.service.ParseResult;
import com.plcexport.l5k.state.SnapshotStore;
import com.plcexport.l5k.state.TreeState;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Parses an export, applies saved and command-line selections, and writes the
 * filtered export.
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        description = "Writes an L5K export containing only the selected entities."
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Mixin
    private ExportOptions options = new ExportOptions();

    private final ExportOptionsValidator validator = new ExportOptionsValidator();
    private final TunerResultsPrinter printer = new TunerResultsPrinter();
    private final SnapshotStore snapshotStore = new SnapshotStore();

    @Override
    public Integer call() {
        try {
            ValidatedExportOptions v = validator.validate(options);
            Verbosity.apply(options.isVerbose());

            TunerConfig config = TunerConfig.builder()
                    .charset(v.getCharset())
                    .build();

            printer.printBanner("export", options.getInput());

            ParseResult parsed = new L5kLoadingService(config).load(options.getInput());
            printer.printParse(parsed);

            TreeState state = new TreeState(parsed.getProject());
            if (options.getStatePath() != null) {
                state.applySnapshot(snapshotStore.read(options.getStatePath()));
            }
            if (!v.getIncludeOnly().isEmpty()) {
                state.deselectAll();
                v.getIncludeOnly().forEach(key -> select(state, key, true));
            }
            v.getExcluded().forEach(key -> select(state, key, false));

            ExportResult result = new L5kExporter(config).export(state);
            write(result.getText(), options.getOutput(), config);

            if (options.getSaveStatePath() != null) {
                snapshotStore.write(options.getSaveStatePath(), state.extractSnapshot(parsed.getSourceName()));
                printer.printStateSaved(options.getSaveStatePath());
            }

            printer.printExport(result, options.getOutput());
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid {} options ({} problems):", e.getCommand(), e.getErrors().size());
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        } catch (L5kException e) {
            log.error("Export failed: {}", e.getMessage());
            log.debug("Failure detail", e);
            return 1;
        } catch (IOException e) {
            log.error("Export failed", e);
            return 1;
        }
    }

    static void select(TreeState state, EntityKey key, boolean included) {
        try {
            state.setIncluded(key, included);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring selection of {}: {}", key, e.getMessage());
        }
    }

    static void write(String text, Path output, TunerConfig config) throws IOException {
        if (output == null) {
            System.out.print(text);
            System.out.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text, config.getCharset());
    }
}
