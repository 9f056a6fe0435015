package com.pyformat.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pyformat.blanklines.BlankLineCalculator;
import com.pyformat.blanklines.BlankLineReport;
import com.pyformat.cli.exception.OptionsValidationException;
import com.pyformat.cli.model.AnnotateOptions;
import com.pyformat.cli.model.ValidatedAnnotateOptions;
import com.pyformat.cli.output.AnnotateResultsPrinter;
import com.pyformat.cli.validation.AnnotateOptionsValidator;
import com.pyformat.model.SyntaxNode;
import com.pyformat.parser.SyntaxTreeReader;
import com.pyformat.parser.TreeFormatException;
import com.pyformat.tree.MalformedTreeException;
import com.pyformat.tree.SyntaxTreeDumper;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Annotates a dumped syntax tree with blank-line decisions and prints them.
 */
@Command(
        name = "annotate",
        mixinStandardHelpOptions = true,
        description = "Calculates the blank lines required before definitions, comments, decorators and statements."
)
public class AnnotateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnnotateCommand.class);

    @Mixin
    private AnnotateOptions options = new AnnotateOptions();

    private final AnnotateOptionsValidator validator = new AnnotateOptionsValidator();
    private final AnnotateResultsPrinter printer = new AnnotateResultsPrinter();
    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedAnnotateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        }

        printer.printBanner(validated);

        try {
            SyntaxNode tree = reader.read(validated.getTreeFile());
            new BlankLineCalculator(validated.getStyle()).calculate(tree);

            printer.printReport(BlankLineReport.of(tree));
            if (options.isDump()) {
                printer.printDump(new SyntaxTreeDumper().dump(tree));
            }
            return 0;
        } catch (IOException e) {
            printer.printFailure("cannot read " + validated.getTreeFile() + ": " + e.getMessage());
            return 1;
        } catch (TreeFormatException | MalformedTreeException e) {
            printer.printFailure(e.getMessage());
            log.debug("Failure details", e);
            return 1;
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("com.pyformat");
        if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
