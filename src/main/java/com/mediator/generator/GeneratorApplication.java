package com.mediator.generator;

import com.mediator.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the mediator handler registration generator.
 * Scans Java source trees for request handlers and writes the class that
 * registers them with a handler registry.
 */
public class GeneratorApplication {

    static final String LOGBACK_CONFIGURATION_PROPERTY = "logback.configurationFile";
    static final String CLI_LOGGING_CONFIGURATION = "mediator-cli-logback.xml";

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Points Logback at the console configuration of the command line tool unless the
     * caller chose one. Must run before the first logger is created.
     */
    static void configureLogging() {
        if (System.getProperty(LOGBACK_CONFIGURATION_PROPERTY) == null) {
            System.setProperty(LOGBACK_CONFIGURATION_PROPERTY, CLI_LOGGING_CONFIGURATION);
        }
    }
}
