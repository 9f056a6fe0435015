package com.pyformat.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command grouping the blank-line tools.
 */
@Command(
        name = "blank-lines",
        mixinStandardHelpOptions = true,
        version = "pyformat-blank-lines 1.0.0",
        description = "Decides the blank lines around definitions, comments and decorators of a parsed Python tree.",
        subcommands = { AnnotateCommand.class, StyleCommand.class }
)
public class BlankLinesCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
