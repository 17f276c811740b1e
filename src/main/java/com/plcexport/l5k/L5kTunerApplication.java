package com.plcexport.l5k;

import com.plcexport.l5k.cli.TunerCommand;

import picocli.CommandLine;

/**
 * Main entry point for the L5K tuner.
 * Filters, re-exports and merges controller exports in the L5K text dialect.
 */
public class L5kTunerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TunerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
