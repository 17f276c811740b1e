package com.plcexport.l5k.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.DiffOptions;
import com.plcexport.l5k.cli.model.ValidatedDiffOptions;
import com.plcexport.l5k.cli.output.TunerResultsPrinter;
import com.plcexport.l5k.cli.validation.DiffOptionsValidator;
import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.exception.L5kException;
import com.plcexport.l5k.export.ExportResult;
import com.plcexport.l5k.export.L5kExporter;
import com.plcexport.l5k.merge.ChangeSet;
import com.plcexport.l5k.merge.DiffEngine;
import com.plcexport.l5k.merge.MergeApplier;
import com.plcexport.l5k.merge.MergeResult;
import com.plcexport.l5k.merge.MergeSelection;
import com.plcexport.l5k.service.L5kLoadingService;
import com.plcexport.l5k.service.ParseResult;
import com.plcexport.l5k.state.SnapshotStore;
import com.plcexport.l5k.state.TreeState;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Compares two exports of the same controller and optionally merges the
 * accepted changes into the current one.
 */
@Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "Lists entities added and removed between two L5K exports, and can merge them."
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Mixin
    private DiffOptions options = new DiffOptions();

    private final DiffOptionsValidator validator = new DiffOptionsValidator();
    private final TunerResultsPrinter printer = new TunerResultsPrinter();
    private final SnapshotStore snapshotStore = new SnapshotStore();
    private final DiffEngine diffEngine = new DiffEngine();
    private final MergeApplier mergeApplier = new MergeApplier();

    @Override
    public Integer call() {
        try {
            ValidatedDiffOptions v = validator.validate(options);
            Verbosity.apply(options.isVerbose());

            TunerConfig config = TunerConfig.builder()
                    .charset(v.getCharset())
                    .build();
            L5kLoadingService loader = new L5kLoadingService(config);

            printer.printBanner("diff", options.getCurrent(), options.getUpdated());

            ParseResult current = loader.load(options.getCurrent());
            printer.printParse(current);
            ParseResult updated = loader.load(options.getUpdated());
            printer.printParse(updated);

            ChangeSet changes = diffEngine.diff(current.getProject(), updated.getProject());
            printer.printChangeSet(changes);

            if (!options.isApply()) {
                return 0;
            }

            TreeState state = new TreeState(current.getProject());
            if (options.getStatePath() != null) {
                state.applySnapshot(snapshotStore.read(options.getStatePath()));
            }

            MergeSelection selection = options.hasExplicitSelection()
                    ? MergeSelection.none().acceptAdded(v.getAcceptAdded()).acceptRemoved(v.getAcceptRemoved())
                    : MergeSelection.all(changes);
            MergeResult merged = mergeApplier.apply(state, updated.getProject(), changes, selection);
            printer.printMerge(merged);

            ExportResult result = new L5kExporter(config).export(state);
            ExportCommand.write(result.getText(), options.getOutput(), config);
            printer.printExport(result, options.getOutput());

            if (options.getSaveStatePath() != null) {
                snapshotStore.write(options.getSaveStatePath(), state.extractSnapshot(current.getSourceName()));
                printer.printStateSaved(options.getSaveStatePath());
            }
            return 0;

        } catch (OptionsValidationException e) {
            log.error("Invalid {} options ({} problems):", e.getCommand(), e.getErrors().size());
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        } catch (L5kException e) {
            log.error("Diff failed: {}", e.getMessage());
            log.debug("Failure detail", e);
            return 1;
        } catch (IOException e) {
            log.error("Diff failed", e);
            return 1;
        }
    }
}
