package com.pyformat;

import com.pyformat.cli.BlankLinesCommand;
import picocli.CommandLine;

/**
 * Main entry point for the blank-line calculator.
 * Reads a dumped syntax tree, decides the blank lines around definitions,
 * comments, decorators and statements, and prints the decisions.
 */
public class FormatterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BlankLinesCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
