package com.plcexport.l5k.cli.exception;

import java.util.List;

/**
 * Every problem found in one subcommand's options, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String command;
    private final List<String> errors;

    public OptionsValidationException(String command, List<String> errors) {
        super("Invalid " + command + " options:" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.command = command;
        this.errors = List.copyOf(errors);
    }

    public String getCommand() {
        return command;
    }

    public List<String> getErrors() {
        return errors;
    }
}
