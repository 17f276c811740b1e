package com.plcexport.l5k.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "l5k-tuner",
        mixinStandardHelpOptions = true,
        version = "l5k-tuner 1.0.0",
        description = "Filters, re-exports and merges L5K controller exports.",
        subcommands = { ExportCommand.class, DiffCommand.class }
)
public class TunerCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        // No subcommand given
        spec.commandLine().usage(System.err);
        return CommandLine.ExitCode.USAGE;
    }
}
