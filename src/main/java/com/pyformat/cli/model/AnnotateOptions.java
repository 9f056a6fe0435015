package com.pyformat.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "annotate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnnotateOptions {

    @Parameters(index = "0", arity = "0..1", paramLabel = "TREE_FILE", description = "Syntax tree dump to annotate")
    private Path treeFile;

    @Option(names = { "--style", "-s" }, defaultValue = "pep8",
            description = "Preset name (pep8, google, facebook, yapf), inline {option: value, ...} overrides, or a style file")
    private String style;

    @Option(names = { "--dump", "-d" }, description = "Print the annotated tree after the decisions")
    private boolean dump;

    @Option(names = { "--verbose", "-v" }, description = "Log every decision while walking the tree")
    private boolean verbose;
}
