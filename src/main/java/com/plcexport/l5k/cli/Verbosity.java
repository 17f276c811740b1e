package com.plcexport.l5k.cli;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Verbosity {

    static final String ROOT_PACKAGE = "com.plcexport.l5k";

    /**
     * Raises the tool's own loggers to DEBUG. A no-op unless Logback is the bound backend.
     */
    public static void apply(boolean verbose) {
        if (!verbose) {
            return;
        }
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(ROOT_PACKAGE).setLevel(Level.DEBUG);
        }
    }
}
